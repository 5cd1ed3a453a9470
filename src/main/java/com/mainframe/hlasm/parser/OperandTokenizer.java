package com.mainframe.hlasm.parser;

import java.util.ArrayList;
import java.util.List;

import lombok.Value;

/**
 * Splits the text that follows a mnemonic into the operand list and the trailing remarks.
 *
 * Commas split operands only at parenthesis depth zero and outside quoted literals, so
 * {@code V(NAME,OFFSET)} and {@code C'A,B'} stay whole. The first blank at depth zero outside
 * a literal ends the operand field; what follows is the remarks.
 */
public class OperandTokenizer {

    private static final String ATTRIBUTE_LETTERS = "LTKNDISO";

    /**
     * Result of tokenizing one operand field.
     */
    @Value
    public static class Tokens {
        List<String> operands;
        String remarks;
        /** Length of the operand field, counted from its first non-blank character. */
        int fieldLength;
        /** Null when the field is well formed. */
        String problem;

        public boolean isWellFormed() {
            return problem == null;
        }

        public boolean hasOpenLiteral() {
            return problem != null && problem.startsWith("unterminated");
        }

        /**
         * True when the operand field stops right after a top-level comma.
         */
        public boolean endsWithComma() {
            return isWellFormed() && !operands.isEmpty() && operands.get(operands.size() - 1).isEmpty();
        }
    }

    public Tokens tokenize(String text) {
        if (text == null || text.isBlank()) {
            return new Tokens(List.of(), "", 0, null);
        }
        String field = text.stripLeading();

        Tokens strict = scan(field, false);
        if (!strict.hasOpenLiteral()) {
            return strict;
        }
        // L'FIELD style attribute references carry a lone quote; retry treating them as plain text.
        Tokens lenient = scan(field, true);
        return lenient.isWellFormed() ? lenient : strict;
    }

    /**
     * Splits only on top-level commas; no remarks handling. Used for macro call operands.
     */
    public List<String> splitOperands(String operandField) {
        return tokenize(operandField).getOperands();
    }

    private Tokens scan(String field, boolean attributeAware) {
        List<String> operands = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean inQuote = false;
        boolean unbalanced = false;
        int end = field.length();

        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);

            if (inQuote) {
                current.append(c);
                if (c == '\'') {
                    inQuote = false;
                }
                continue;
            }

            if (c == '\'') {
                if (!(attributeAware && isAttributeQuote(field, i))) {
                    inQuote = true;
                }
                current.append(c);
            } else if (c == '(') {
                depth++;
                current.append(c);
            } else if (c == ')') {
                if (depth == 0) {
                    unbalanced = true;
                } else {
                    depth--;
                }
                current.append(c);
            } else if (c == ',' && depth == 0) {
                operands.add(current.toString().trim());
                current.setLength(0);
            } else if (Character.isWhitespace(c) && depth == 0) {
                end = i;
                break;
            } else {
                current.append(c);
            }
        }

        String last = current.toString().trim();
        if (!last.isEmpty() || !operands.isEmpty()) {
            operands.add(last);
        }

        String remarks = end < field.length() ? field.substring(end).strip() : "";

        String problem = null;
        if (inQuote) {
            problem = "unterminated quoted literal";
        } else if (depth > 0 || unbalanced) {
            problem = "unbalanced parentheses";
        }
        return new Tokens(List.copyOf(operands), remarks, end, problem);
    }

    private boolean isAttributeQuote(String field, int quoteIndex) {
        if (quoteIndex == 0 || quoteIndex + 1 >= field.length()) {
            return false;
        }
        char letter = Character.toUpperCase(field.charAt(quoteIndex - 1));
        if (ATTRIBUTE_LETTERS.indexOf(letter) < 0) {
            return false;
        }
        if (quoteIndex >= 2 && Character.isLetterOrDigit(field.charAt(quoteIndex - 2))) {
            return false;
        }
        char next = field.charAt(quoteIndex + 1);
        return Character.isLetter(next) || next == '@' || next == '#' || next == '$' || next == '&';
    }
}
