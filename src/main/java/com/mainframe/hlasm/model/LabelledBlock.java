package com.mainframe.hlasm.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A maximal contiguous run of normalized lines owned by one label.
 * The first line is the one that opened the block.
 */
@Value
@Builder
public class LabelledBlock {
    String label;
    ChunkType blockType;
    String sourceFile;
    @Singular
    List<LogicalLine> lines;

    public int getFirstLineNumber() {
        return lines.isEmpty() ? 0 : lines.get(0).getFirstLineNumber();
    }

    public int getLastLineNumber() {
        if (lines.isEmpty()) {
            return 0;
        }
        List<Integer> last = lines.get(lines.size() - 1).getLineNumbers();
        return last.isEmpty() ? 0 : last.get(last.size() - 1);
    }
}
