package com.mainframe.hlasm.normalize;

import java.util.ArrayList;
import java.util.List;

import com.mainframe.hlasm.model.LogicalLine;
import com.mainframe.hlasm.parser.OperandTokenizer;
import com.mainframe.hlasm.parser.StatementFields;

/**
 * Folds continuation lines into the logical line they continue.
 *
 * A continuation line has columns 1-15 blank and a non-blank column 16. Its content from
 * column 16 on is appended to the previous statement. Where the continued text resumes:
 * <ul>
 *   <li>operand field ending in a top-level comma: right after the comma, dropping any remarks</li>
 *   <li>open quoted literal: after column 71, keeping the blanks inside the literal</li>
 *   <li>otherwise: after the last non-blank character</li>
 * </ul>
 * The continuation indicator in column 72 of a continued line is dropped.
 * Blank and comment lines are never continued.
 */
public class ContinuationCollapsePass implements NormalizationPass {

    public static final int CONTINUATION_COLUMN = 16;

    private final OperandTokenizer tokenizer = new OperandTokenizer();

    @Override
    public List<LogicalLine> apply(List<LogicalLine> lines) {
        List<LogicalLine> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            LogicalLine line = lines.get(i);
            String text = line.getText();
            if (i + 1 < lines.size() && isContinuation(lines.get(i + 1).getText()) && canBeContinued(line)) {
                text = dropIndicator(text);
            }

            int last = result.size() - 1;
            if (last >= 0 && isContinuation(text) && canBeContinued(result.get(last))) {
                String content = text.substring(CONTINUATION_COLUMN - 1);
                LogicalLine previous = result.get(last);
                result.set(last, previous.withText(continuedText(previous.getText()))
                        .join(content, line.getLineNumbers()));
            } else {
                result.add(text.equals(line.getText()) ? line : line.withText(text));
            }
        }
        return result;
    }

    private String continuedText(String text) {
        String field = StatementFields.of(text).getOperandText();
        OperandTokenizer.Tokens tokens = tokenizer.tokenize(field);
        if (tokens.hasOpenLiteral()) {
            return text;
        }
        if (tokens.endsWithComma()) {
            return text.substring(0, text.length() - field.length() + tokens.getFieldLength());
        }
        return text.stripTrailing();
    }

    private static String dropIndicator(String text) {
        int indicator = ColumnTruncationPass.COLUMN_LIMIT - 1;
        if (text.length() == ColumnTruncationPass.COLUMN_LIMIT && !Character.isWhitespace(text.charAt(indicator))) {
            return text.substring(0, indicator);
        }
        return text;
    }

    static boolean isContinuation(String text) {
        if (text.length() < CONTINUATION_COLUMN) {
            return false;
        }
        if (Character.isWhitespace(text.charAt(CONTINUATION_COLUMN - 1))) {
            return false;
        }
        return text.substring(0, CONTINUATION_COLUMN - 1).isBlank();
    }

    private static boolean canBeContinued(LogicalLine previous) {
        return !previous.isBlank() && !previous.isComment();
    }
}
