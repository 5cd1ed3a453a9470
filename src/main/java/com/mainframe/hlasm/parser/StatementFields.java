package com.mainframe.hlasm.parser;

import java.util.Locale;

import lombok.Value;

/**
 * Whitespace-level split of a source statement into name, operation and the rest.
 * No column validation: used where only the shape of a statement matters.
 */
@Value
public class StatementFields {
    /** Column-1 name, empty when column 1 is blank. */
    String label;
    /** Upper-cased operation, empty when the statement has none. */
    String mnemonic;
    /** Everything after the operation, leading blanks removed. */
    String operandText;

    public static StatementFields of(String text) {
        if (text == null || text.isEmpty()) {
            return new StatementFields("", "", "");
        }
        int pos = 0;
        String label = "";
        if (!Character.isWhitespace(text.charAt(0))) {
            pos = tokenEnd(text, 0);
            label = text.substring(0, pos);
        }
        int opStart = skipBlanks(text, pos);
        int opEnd = tokenEnd(text, opStart);
        String mnemonic = text.substring(opStart, opEnd).toUpperCase(Locale.ROOT);
        String rest = text.substring(skipBlanks(text, opEnd));
        return new StatementFields(label, mnemonic, rest);
    }

    public boolean hasLabel() {
        return !label.isEmpty();
    }

    private static int skipBlanks(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int tokenEnd(String text, int from) {
        int i = from;
        while (i < text.length() && !Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
