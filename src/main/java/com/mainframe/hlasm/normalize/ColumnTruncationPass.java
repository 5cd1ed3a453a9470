package com.mainframe.hlasm.normalize;

import java.util.ArrayList;
import java.util.List;

import com.mainframe.hlasm.model.LogicalLine;

/**
 * Cuts every physical line to columns 1-72. Columns 73-80 hold sequence numbers and are
 * discarded unconditionally.
 */
public class ColumnTruncationPass implements NormalizationPass {

    public static final int COLUMN_LIMIT = 72;

    @Override
    public List<LogicalLine> apply(List<LogicalLine> lines) {
        List<LogicalLine> result = new ArrayList<>(lines.size());
        for (LogicalLine line : lines) {
            // Lines already joined from continuations are logical, not physical.
            if (line.getLineNumbers().size() > 1 || line.getText().length() <= COLUMN_LIMIT) {
                result.add(line);
            } else {
                result.add(line.withText(truncate(line.getText())));
            }
        }
        return result;
    }

    public static String truncate(String text) {
        return text.length() <= COLUMN_LIMIT ? text : text.substring(0, COLUMN_LIMIT);
    }
}
