package com.mainframe.hlasm.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A single logical instruction broken into its fields.
 */
@Value
@Builder
public class ParsedInstruction {
    /** Upper-cased mnemonic. */
    String opcode;
    @Singular
    List<String> operands;
    /** Remarks after the operand field, empty when there are none. */
    @Builder.Default
    String comment = "";
    InstructionType instructionType;
    String rawText;

    public boolean isCall() {
        return instructionType == InstructionType.CALL;
    }

    public String getOperand(int index) {
        return index < operands.size() ? operands.get(index) : null;
    }
}
