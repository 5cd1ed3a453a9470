package com.mainframe.hlasm.chunker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.hlasm.core.context.AnalysisDiagnostics;
import com.mainframe.hlasm.model.Chunk;
import com.mainframe.hlasm.model.LabelledBlock;
import com.mainframe.hlasm.model.LogicalLine;
import com.mainframe.hlasm.model.ParsedInstruction;
import com.mainframe.hlasm.parser.InstructionParser;
import com.mainframe.hlasm.parser.ParseOutcome;

/**
 * Builds one {@link Chunk} per labelled block: parses its lines and collects the targets of its
 * CALL-class instructions as dependencies (unique, first-occurrence order, no self reference).
 * Symbols compare without regard to case; the first spelling seen is the one kept.
 */
public class Chunker {
    private static final Logger log = LoggerFactory.getLogger(Chunker.class);

    private final InstructionParser parser;
    private final DependencyExtractor extractor;

    public Chunker() {
        this(new InstructionParser(), new DependencyExtractor());
    }

    public Chunker(InstructionParser parser, DependencyExtractor extractor) {
        this.parser = parser;
        this.extractor = extractor;
    }

    public List<Chunk> chunk(List<LabelledBlock> blocks, AnalysisDiagnostics diagnostics) {
        List<Chunk> chunks = new ArrayList<>(blocks.size());
        for (LabelledBlock block : blocks) {
            chunks.add(chunk(block, diagnostics));
        }
        return chunks;
    }

    public Chunk chunk(LabelledBlock block, AnalysisDiagnostics diagnostics) {
        List<ParsedInstruction> instructions = new ArrayList<>();
        Map<String, String> dependencies = new LinkedHashMap<>();

        for (LogicalLine line : block.getLines()) {
            Optional<ParseOutcome> outcome = parser.parse(line);
            if (outcome.isEmpty()) {
                continue;
            }
            if (outcome.get().isDegraded()) {
                diagnostics.warning(String.format("%s line %d: %s; kept as raw instruction",
                        line.getSourceFile(), line.getFirstLineNumber(), outcome.get().getDegradationReason()));
            }

            ParsedInstruction instruction = outcome.get().getInstruction();
            instructions.add(instruction);

            extractor.callTarget(instruction)
                    .filter(target -> !target.equalsIgnoreCase(block.getLabel()))
                    .ifPresent(target -> dependencies.putIfAbsent(target.toUpperCase(Locale.ROOT), target));
        }

        log.debug("Chunk {} ({}): {} instructions, dependencies {}",
                block.getLabel(), block.getBlockType(), instructions.size(), dependencies.values());

        return Chunk.builder()
                .label(block.getLabel())
                .chunkType(block.getBlockType())
                .sourceFile(block.getSourceFile())
                .instructions(instructions)
                .dependencies(dependencies.values())
                .build();
    }
}
