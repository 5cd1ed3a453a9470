package com.mainframe.hlasm.normalize;

import java.util.ArrayList;
import java.util.List;

import com.mainframe.hlasm.model.LogicalLine;

/**
 * Removes trailing whitespace. Leading whitespace is column-significant and kept.
 */
public class SanitizePass implements NormalizationPass {

    @Override
    public List<LogicalLine> apply(List<LogicalLine> lines) {
        List<LogicalLine> result = new ArrayList<>(lines.size());
        for (LogicalLine line : lines) {
            String stripped = line.getText().stripTrailing();
            result.add(stripped.length() == line.getText().length() ? line : line.withText(stripped));
        }
        return result;
    }
}
