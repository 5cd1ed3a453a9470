package com.mainframe.hlasm.parser;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.mainframe.hlasm.model.InstructionType;

/**
 * Static mnemonic-to-classification lookup. Anything not listed is a plain {@link InstructionType#INSTRUCTION}.
 */
public final class MnemonicTable {

    private static final Set<String> BRANCH = Set.of(
            "B", "BC", "BCR", "BCT", "BCTR",
            "BE", "BNE", "BH", "BL", "BNH", "BNL",
            "BZ", "BNZ", "BO", "BNO", "BM", "BNM", "BP", "BNP",
            "BR", "BXH", "BXLE",
            "J", "JC", "JE", "JNE", "JH", "JL", "JNH", "JNL",
            "JZ", "JNZ", "JO", "JNO", "JM", "JNM", "JP", "JNP",
            "NOP", "NOPR"
    );

    // BALR/BASR are register forms: classified as calls, never yield a symbol.
    private static final Set<String> CALL = Set.of(
            "CALL", "LINK", "XCTL",
            "BAL", "BAS", "BALR", "BASR"
    );

    private static final Set<String> SECTION = Set.of(
            "CSECT", "DSECT", "RSECT", "COM", "LOCTR", "START"
    );

    private static final Set<String> DATA = Set.of(
            "DC", "DS", "DXD", "EQU",
            "ORG", "LTORG", "USING", "DROP", "END",
            "ENTRY", "EXTRN", "WXTRN",
            "PRINT", "PUNCH", "TITLE", "SPACE", "EJECT",
            "PUSH", "POP", "REPRO"
    );

    private static final Set<String> MACRO_CTRL = Set.of(
            "MACRO", "MEND", "MEXIT", "MNOTE",
            "COPY", "AREAD", "ACTR", "ANOP",
            "AGO", "AIF", "AINSERT",
            "GBLA", "GBLB", "GBLC",
            "LCLA", "LCLB", "LCLC",
            "SETA", "SETB", "SETC"
    );

    private static final Map<String, InstructionType> TABLE = new HashMap<>();

    static {
        BRANCH.forEach(m -> TABLE.put(m, InstructionType.BRANCH));
        CALL.forEach(m -> TABLE.put(m, InstructionType.CALL));
        SECTION.forEach(m -> TABLE.put(m, InstructionType.SECTION));
        DATA.forEach(m -> TABLE.put(m, InstructionType.DATA));
        MACRO_CTRL.forEach(m -> TABLE.put(m, InstructionType.MACRO_CTRL));
    }

    private MnemonicTable() {
    }

    public static InstructionType classify(String mnemonic) {
        if (mnemonic == null || mnemonic.isEmpty()) {
            return InstructionType.INSTRUCTION;
        }
        return TABLE.getOrDefault(mnemonic.toUpperCase(Locale.ROOT), InstructionType.INSTRUCTION);
    }
}
