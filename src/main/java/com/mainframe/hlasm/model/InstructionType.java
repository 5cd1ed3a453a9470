package com.mainframe.hlasm.model;

/**
 * Classification of a parsed instruction by its mnemonic.
 */
public enum InstructionType {
    BRANCH,
    CALL,
    SECTION,
    DATA,
    MACRO_CTRL,
    INSTRUCTION
}
