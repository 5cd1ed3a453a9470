package com.mainframe.hlasm.chunker;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import com.mainframe.hlasm.model.ParsedInstruction;

/**
 * Finds the statically known target symbol of a CALL-class instruction.
 *
 * Target operand by mnemonic:
 * - CALL: first operand
 * - LINK, XCTL: {@code EP=} or {@code DE=} keyword of the first operand ({@code EPLOC=} is indirect)
 * - BAL, BAS: branch address, the second operand
 * - BALR, BASR: register form, never a symbol
 *
 * Register notation like {@code (15)}, address expressions like {@code 0(15)} and register
 * equates R0-R15 are not symbols and produce no target.
 */
public class DependencyExtractor {

    private static final Pattern SYMBOL = Pattern.compile("[A-Za-z@#$][A-Za-z0-9@#$_]*");
    private static final Pattern REGISTER_EQUATE = Pattern.compile("R(1[0-5]|[0-9])", Pattern.CASE_INSENSITIVE);

    public Optional<String> callTarget(ParsedInstruction instruction) {
        if (!instruction.isCall()) {
            return Optional.empty();
        }
        String candidate = switch (instruction.getOpcode()) {
            case "CALL" -> instruction.getOperand(0);
            case "LINK", "XCTL" -> keywordTarget(instruction.getOperand(0));
            case "BAL", "BAS" -> instruction.getOperand(1);
            default -> null;
        };
        return isSymbol(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    public static boolean isSymbol(String token) {
        return token != null
                && SYMBOL.matcher(token).matches()
                && !REGISTER_EQUATE.matcher(token).matches();
    }

    private static String keywordTarget(String operand) {
        if (operand == null) {
            return null;
        }
        int eq = operand.indexOf('=');
        if (eq < 0) {
            return operand;
        }
        String keyword = operand.substring(0, eq).trim().toUpperCase(Locale.ROOT);
        if (keyword.equals("EP") || keyword.equals("DE")) {
            return operand.substring(eq + 1).trim();
        }
        return null;
    }
}
