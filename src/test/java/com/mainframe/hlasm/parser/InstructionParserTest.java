package com.mainframe.hlasm.parser;

import com.mainframe.hlasm.model.InstructionType;
import com.mainframe.hlasm.model.LogicalLine;
import com.mainframe.hlasm.model.ParsedInstruction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for InstructionParser.
 */
class InstructionParserTest {

    private final InstructionParser parser = new InstructionParser();

    @Test
    void testParseCall() {
        ParseOutcome outcome = parser.parse("         CALL  SUBPROG,(A,B,C),VL").orElseThrow();

        assertThat(outcome.isDegraded()).isFalse();
        ParsedInstruction instruction = outcome.getInstruction();
        assertThat(instruction.getOpcode()).isEqualTo("CALL");
        assertThat(instruction.getOperands()).containsExactly("SUBPROG", "(A,B,C)", "VL");
        assertThat(instruction.getInstructionType()).isEqualTo(InstructionType.CALL);
        assertThat(instruction.getComment()).isEmpty();
    }

    @Test
    void testParseLabelledStatementWithRemarks() {
        ParsedInstruction instruction = parser.parse("LOOP     LA    R1,WORK       POINT AT WORK").orElseThrow()
                .getInstruction();

        assertThat(instruction.getOpcode()).isEqualTo("LA");
        assertThat(instruction.getOperands()).containsExactly("R1", "WORK");
        assertThat(instruction.getComment()).isEqualTo("POINT AT WORK");
        assertThat(instruction.getInstructionType()).isEqualTo(InstructionType.INSTRUCTION);
    }

    @Test
    void testAddressConstantStaysOneOperand() {
        ParsedInstruction instruction = parser.parse("         DC    V(NAME,OFFSET)").orElseThrow().getInstruction();

        assertThat(instruction.getOperands()).containsExactly("V(NAME,OFFSET)");
        assertThat(instruction.getInstructionType()).isEqualTo(InstructionType.DATA);
    }

    @Test
    void testQuotedLiteralStaysOneOperand() {
        ParsedInstruction instruction = parser.parse("         MVC   OUT,=C'A,B'").orElseThrow().getInstruction();

        assertThat(instruction.getOperands()).containsExactly("OUT", "=C'A,B'");
    }

    @Test
    void testLowerCaseMnemonicIsUpperCased() {
        ParsedInstruction instruction = parser.parse("         bal   r14,sub1").orElseThrow().getInstruction();

        assertThat(instruction.getOpcode()).isEqualTo("BAL");
        assertThat(instruction.getInstructionType()).isEqualTo(InstructionType.CALL);
        assertThat(instruction.getOperands()).containsExactly("r14", "sub1");
    }

    @Test
    void testUnbalancedParenthesesDegrade() {
        String raw = "         MVC   OUT(3,IN";
        ParseOutcome outcome = parser.parse(raw).orElseThrow();

        assertThat(outcome.isDegraded()).isTrue();
        assertThat(outcome.getDegradationReason()).contains("unbalanced");
        assertThat(outcome.getInstruction().getInstructionType()).isEqualTo(InstructionType.INSTRUCTION);
        assertThat(outcome.getInstruction().getOpcode()).isEqualTo("MVC");
        assertThat(outcome.getInstruction().getRawText()).isEqualTo(raw);
    }

    @Test
    void testUnterminatedQuoteDegrades() {
        ParseOutcome outcome = parser.parse("         MVC   OUT,=C'ABC").orElseThrow();

        assertThat(outcome.isDegraded()).isTrue();
        assertThat(outcome.getInstruction().getOperands()).isNotEmpty();
    }

    @Test
    void testDegradedCallIsNotClassifiedAsCall() {
        ParseOutcome outcome = parser.parse("         CALL  SUBPROG,(A,B").orElseThrow();

        assertThat(outcome.isDegraded()).isTrue();
        assertThat(outcome.getInstruction().isCall()).isFalse();
    }

    @Test
    void testLabelPastColumnEightDegrades() {
        ParseOutcome outcome = parser.parse("TOOLONGLABEL DS F").orElseThrow();

        assertThat(outcome.isDegraded()).isTrue();
        assertThat(outcome.getDegradationReason()).contains("column 8");
    }

    @Test
    void testMnemonicBeforeColumnNineDegrades() {
        ParseOutcome outcome = parser.parse("A DS F").orElseThrow();

        assertThat(outcome.isDegraded()).isTrue();
        assertThat(outcome.getInstruction().getOpcode()).isEqualTo("DS");
    }

    @Test
    void testInvalidMnemonicDegrades() {
        ParseOutcome outcome = parser.parse("         =F'1'").orElseThrow();

        assertThat(outcome.isDegraded()).isTrue();
        assertThat(outcome.getDegradationReason()).contains("invalid mnemonic");
    }

    @Test
    void testNoInstructionForCommentsBlankAndLabelOnlyLines() {
        assertThat(parser.parse("* COMMENT LINE")).isEmpty();
        assertThat(parser.parse(".* MACRO COMMENT")).isEmpty();
        assertThat(parser.parse("      ")).isEmpty();
        assertThat(parser.parse("ENTRYPT")).isEmpty();
        assertThat(parser.parse(new LogicalLine("* X", "T.asm", List.of(1)))).isEmpty();
    }
}
