package com.mainframe.hlasm.resolver;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.mainframe.hlasm.model.Chunk;

/**
 * Runs the full single-file pipeline on a file discovered during resolution.
 */
@FunctionalInterface
public interface FileAnalyzer {

    List<Chunk> analyze(Path file) throws IOException;
}
