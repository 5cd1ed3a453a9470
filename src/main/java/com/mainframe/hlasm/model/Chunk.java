package com.mainframe.hlasm.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A named, typed unit of parsed source with its instructions and outgoing dependencies.
 * Dependencies are unique, in first-occurrence order, and never contain the chunk's own label.
 */
@Value
@Builder
public class Chunk {
    String label;
    ChunkType chunkType;
    String sourceFile;
    @Singular
    List<ParsedInstruction> instructions;
    @Singular
    List<String> dependencies;

    public boolean dependsOn(String symbol) {
        return dependencies.stream().anyMatch(symbol::equalsIgnoreCase);
    }
}
