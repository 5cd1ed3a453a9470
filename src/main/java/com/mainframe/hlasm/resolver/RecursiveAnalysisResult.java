package com.mainframe.hlasm.resolver;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.mainframe.hlasm.core.context.AnalysisDiagnostics;
import com.mainframe.hlasm.model.Chunk;
import com.mainframe.hlasm.model.MissingDependency;

import lombok.Value;

/**
 * Outcome of a recursive analysis: chunks of every file that could be read (entry file first,
 * then in discovery order) and every reference that could not be resolved.
 */
@Value
public class RecursiveAnalysisResult {
    Map<Path, List<Chunk>> chunksByFile;
    List<MissingDependency> missingDependencies;
    DependencyMap dependencyMap;
    AnalysisDiagnostics diagnostics;

    public List<Chunk> getAllChunks() {
        List<Chunk> all = new ArrayList<>();
        chunksByFile.values().forEach(all::addAll);
        return all;
    }

    public boolean hasMissingDependencies() {
        return !missingDependencies.isEmpty();
    }
}
