package com.mainframe.hlasm.parser;

import com.mainframe.hlasm.model.InstructionType;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MnemonicTable.
 */
class MnemonicTableTest {

    @ParameterizedTest
    @CsvSource({
            "CALL,  CALL",
            "link,  CALL",
            "XCTL,  CALL",
            "BAL,   CALL",
            "BASR,  CALL",
            "BNE,   BRANCH",
            "J,     BRANCH",
            "BR,    BRANCH",
            "CSECT, SECTION",
            "DSECT, SECTION",
            "DC,    DATA",
            "EQU,   DATA",
            "USING, DATA",
            "MACRO, MACRO_CTRL",
            "AIF,   MACRO_CTRL",
            "MVC,   INSTRUCTION",
            "GO,    INSTRUCTION",
            "FOO,   INSTRUCTION"
    })
    void testClassify(String mnemonic, InstructionType expected) {
        assertThat(MnemonicTable.classify(mnemonic)).isEqualTo(expected);
    }
}
