package com.mainframe.hlasm.parser;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.hlasm.model.InstructionType;
import com.mainframe.hlasm.model.LogicalLine;
import com.mainframe.hlasm.model.ParsedInstruction;

/**
 * Parses one normalized line into a {@link ParsedInstruction}.
 *
 * Fixed-column layout:
 * - Columns 1-8: name field (label), empty when column 1 is blank
 * - Column 9 onward: mnemonic, operand field, remarks
 *
 * A malformed line never fails: it comes back as a degraded {@link InstructionType#INSTRUCTION}
 * entry with a best-effort operand split and its raw text untouched.
 */
public class InstructionParser {
    private static final Logger log = LoggerFactory.getLogger(InstructionParser.class);

    static final int MNEMONIC_COLUMN = 9;

    private static final Pattern MNEMONIC = Pattern.compile("[A-Za-z@#$][A-Za-z0-9@#$_]*");

    private final OperandTokenizer tokenizer;

    public InstructionParser() {
        this(new OperandTokenizer());
    }

    public InstructionParser(OperandTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * Parse a logical line. Blank lines, full-line comments and label-only lines carry no
     * instruction and yield an empty result.
     */
    public Optional<ParseOutcome> parse(LogicalLine line) {
        if (line.isBlank() || line.isComment()) {
            return Optional.empty();
        }
        return parse(line.getText());
    }

    public Optional<ParseOutcome> parse(String text) {
        if (text == null || text.isBlank() || text.startsWith("*") || text.startsWith(".*")) {
            return Optional.empty();
        }

        int labelEnd = 0;
        if (!Character.isWhitespace(text.charAt(0))) {
            while (labelEnd < text.length() && !Character.isWhitespace(text.charAt(labelEnd))) {
                labelEnd++;
            }
        }

        int mnemonicStart = labelEnd;
        while (mnemonicStart < text.length() && Character.isWhitespace(text.charAt(mnemonicStart))) {
            mnemonicStart++;
        }
        if (mnemonicStart >= text.length()) {
            return Optional.empty();
        }

        int mnemonicEnd = mnemonicStart;
        while (mnemonicEnd < text.length() && !Character.isWhitespace(text.charAt(mnemonicEnd))) {
            mnemonicEnd++;
        }

        String opcode = text.substring(mnemonicStart, mnemonicEnd).toUpperCase(Locale.ROOT);
        OperandTokenizer.Tokens tokens = tokenizer.tokenize(text.substring(mnemonicEnd));

        ParsedInstruction.ParsedInstructionBuilder builder = ParsedInstruction.builder()
                .opcode(opcode)
                .operands(tokens.getOperands())
                .comment(tokens.getRemarks())
                .rawText(text);

        String problem = null;
        if (labelEnd > MNEMONIC_COLUMN - 1) {
            problem = "name field runs past column 8";
        } else if (mnemonicStart + 1 < MNEMONIC_COLUMN) {
            problem = "mnemonic starts before column " + MNEMONIC_COLUMN;
        } else if (!MNEMONIC.matcher(opcode).matches()) {
            problem = "invalid mnemonic '" + opcode + "'";
        } else if (!tokens.isWellFormed()) {
            problem = tokens.getProblem();
        }

        if (problem != null) {
            log.debug("Degraded line '{}': {}", text, problem);
            return Optional.of(ParseOutcome.degraded(
                    builder.instructionType(InstructionType.INSTRUCTION).build(), problem));
        }

        return Optional.of(ParseOutcome.parsed(
                builder.instructionType(MnemonicTable.classify(opcode)).build()));
    }
}
