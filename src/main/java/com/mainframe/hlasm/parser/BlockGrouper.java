package com.mainframe.hlasm.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.hlasm.model.ChunkType;
import com.mainframe.hlasm.model.LabelledBlock;
import com.mainframe.hlasm.model.LogicalLine;

/**
 * Partitions a normalized line stream into contiguous labelled blocks.
 *
 * Grouping rules:
 * - A column-1 name opens a new block, typed by the statement's operation
 * - Names starting with '&' or '.' are local and stay in the current block
 * - An unlabelled MACRO opens a MACRO_DEF block named after its prototype; names inside the
 *   definition (up to the matching MEND) do not open blocks
 * - Everything else joins the open block; the last block closes at end of stream
 * - Non-comment lines before the first name form the {@value #ROOT_LABEL} block; a prologue of
 *   comments only opens the first named block instead
 */
public class BlockGrouper {
    private static final Logger log = LoggerFactory.getLogger(BlockGrouper.class);

    public static final String ROOT_LABEL = "HLASM_ROOT";

    public List<LabelledBlock> group(List<LogicalLine> lines, String sourceFile) {
        List<LabelledBlock> blocks = new ArrayList<>();

        String currentLabel = ROOT_LABEL;
        ChunkType currentType = ChunkType.SUBROUTINE;
        List<LogicalLine> current = new ArrayList<>();
        boolean rootOpen = true;
        int macroDepth = 0;

        for (int i = 0; i < lines.size(); i++) {
            LogicalLine line = lines.get(i);
            if (line.isBlank() || line.isComment()) {
                current.add(line);
                continue;
            }

            StatementFields fields = StatementFields.of(line.getText());
            String opener = null;
            ChunkType openerType = null;

            if (macroDepth == 0) {
                if (isBlockLabel(fields.getLabel())) {
                    opener = fields.getLabel();
                    openerType = blockTypeFor(fields.getMnemonic());
                } else if (!fields.hasLabel() && "MACRO".equals(fields.getMnemonic())) {
                    opener = prototypeName(lines, i + 1);
                    openerType = ChunkType.MACRO_DEF;
                }
            }

            if ("MACRO".equals(fields.getMnemonic())) {
                macroDepth++;
            } else if ("MEND".equals(fields.getMnemonic()) && macroDepth > 0) {
                macroDepth--;
            }

            if (opener != null) {
                boolean carried = rootOpen && onlyComments(current);
                if (!carried) {
                    close(blocks, currentLabel, currentType, current, sourceFile);
                    current = new ArrayList<>();
                }
                currentLabel = opener;
                currentType = openerType;
                rootOpen = false;
            }
            current.add(line);
        }
        if (!(rootOpen && onlyComments(current))) {
            close(blocks, currentLabel, currentType, current, sourceFile);
        }

        log.debug("Grouped {} lines of {} into {} blocks", lines.size(), sourceFile, blocks.size());
        return blocks;
    }

    /**
     * Block type implied by the operation on a block's opening line.
     */
    public static ChunkType blockTypeFor(String mnemonic) {
        return switch (mnemonic) {
            case "CSECT", "RSECT", "START", "COM" -> ChunkType.SECTION;
            case "DSECT" -> ChunkType.DATA_SECTION;
            case "MACRO" -> ChunkType.MACRO_DEF;
            default -> ChunkType.SUBROUTINE;
        };
    }

    private static boolean isBlockLabel(String label) {
        return !label.isEmpty() && !label.startsWith("&") && !label.startsWith(".");
    }

    private static String prototypeName(List<LogicalLine> lines, int from) {
        for (int j = from; j < lines.size(); j++) {
            LogicalLine candidate = lines.get(j);
            if (candidate.isBlank() || candidate.isComment()) {
                continue;
            }
            String name = StatementFields.of(candidate.getText()).getMnemonic();
            return name.isEmpty() ? "MACRO" : name;
        }
        return "MACRO";
    }

    private static boolean onlyComments(List<LogicalLine> lines) {
        return lines.stream().allMatch(l -> l.isBlank() || l.isComment());
    }

    private static void close(List<LabelledBlock> blocks, String label, ChunkType type,
                              List<LogicalLine> lines, String sourceFile) {
        if (lines.isEmpty()) {
            return;
        }
        blocks.add(LabelledBlock.builder()
                .label(label)
                .blockType(type)
                .sourceFile(sourceFile)
                .lines(lines)
                .build());
    }
}
