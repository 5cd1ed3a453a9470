package com.mainframe.hlasm.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StatementFields.
 */
class StatementFieldsTest {

    @Test
    void testLabelledStatement() {
        StatementFields fields = StatementFields.of("HELLO    greet =C'HI'   REMARK");

        assertThat(fields.getLabel()).isEqualTo("HELLO");
        assertThat(fields.getMnemonic()).isEqualTo("GREET");
        assertThat(fields.getOperandText()).isEqualTo("=C'HI'   REMARK");
        assertThat(fields.hasLabel()).isTrue();
    }

    @Test
    void testUnlabelledStatement() {
        StatementFields fields = StatementFields.of("         PRINTMSG FIELDA,4");

        assertThat(fields.hasLabel()).isFalse();
        assertThat(fields.getMnemonic()).isEqualTo("PRINTMSG");
        assertThat(fields.getOperandText()).isEqualTo("FIELDA,4");
    }

    @Test
    void testLabelOnly() {
        StatementFields fields = StatementFields.of("ENTRY2");

        assertThat(fields.getLabel()).isEqualTo("ENTRY2");
        assertThat(fields.getMnemonic()).isEmpty();
        assertThat(fields.getOperandText()).isEmpty();
    }
}
