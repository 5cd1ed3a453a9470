package com.mainframe.hlasm.resolver;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.hlasm.core.context.AnalysisDiagnostics;
import com.mainframe.hlasm.model.Chunk;
import com.mainframe.hlasm.model.MissingDependency;

import lombok.Value;

/**
 * Follows CALL-class dependencies across files, breadth first.
 *
 * A queued symbol counts as resolved when it names a chunk of a file already analysed or was
 * already matched to a file. Every file is analysed at most once, so cyclic references
 * terminate. An unresolved symbol produces one {@link MissingDependency} per reference site and
 * never stops the walk; an unreadable file stops only its own branch.
 */
public class DependencyResolver {
    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    @Value
    private static class PendingReference {
        String symbol;
        String referencingFile;
        String referencingChunk;
    }

    private final SourceFileLocator locator;
    private final FileAnalyzer analyzer;
    private final AnalysisDiagnostics diagnostics;

    public DependencyResolver(SourceFileLocator locator, FileAnalyzer analyzer, AnalysisDiagnostics diagnostics) {
        this.locator = locator;
        this.analyzer = analyzer;
        this.diagnostics = diagnostics;
    }

    public RecursiveAnalysisResult resolve(Path entryFile, List<Chunk> entryChunks) {
        Map<Path, List<Chunk>> chunksByFile = new LinkedHashMap<>();
        List<MissingDependency> missing = new ArrayList<>();
        DependencyMap dependencyMap = new DependencyMap();

        Set<Path> visited = new HashSet<>();
        Map<String, Path> resolvedSymbols = new HashMap<>();
        Deque<PendingReference> queue = new ArrayDeque<>();

        register(entryFile, entryChunks, chunksByFile, visited, resolvedSymbols, queue, dependencyMap);

        while (!queue.isEmpty()) {
            PendingReference ref = queue.poll();
            String key = ref.getSymbol().toUpperCase(Locale.ROOT);
            if (resolvedSymbols.containsKey(key)) {
                continue;
            }

            Optional<Path> located = locator.locate(ref.getSymbol());
            if (located.isEmpty()) {
                MissingDependency dep = new MissingDependency(ref.getSymbol(), ref.getReferencingFile(),
                        ref.getReferencingChunk(), locator.describeSearchPath());
                missing.add(dep);
                log.warn("Unresolved dependency {} referenced from {} in {}",
                        ref.getSymbol(), ref.getReferencingChunk(), ref.getReferencingFile());
                continue;
            }

            Path file = located.get();
            resolvedSymbols.put(key, file);
            if (visited.contains(canonical(file))) {
                continue;
            }

            log.info("Resolved {} -> {}", ref.getSymbol(), file);
            try {
                List<Chunk> chunks = analyzer.analyze(file);
                register(file, chunks, chunksByFile, visited, resolvedSymbols, queue, dependencyMap);
            } catch (IOException e) {
                visited.add(canonical(file));
                String msg = "Failed to analyse " + file + " (referenced as " + ref.getSymbol() + " from "
                        + ref.getReferencingFile() + "): " + e.getMessage();
                diagnostics.error(msg);
                log.error("Failed to analyse {}", file, e);
            }
        }

        log.info("Recursive analysis of {}: {} files, {} missing dependencies",
                entryFile, chunksByFile.size(), missing.size());

        return new RecursiveAnalysisResult(
                Collections.unmodifiableMap(chunksByFile),
                List.copyOf(missing),
                dependencyMap,
                diagnostics);
    }

    private static void register(Path file, List<Chunk> chunks,
                                 Map<Path, List<Chunk>> chunksByFile,
                                 Set<Path> visited,
                                 Map<String, Path> resolvedSymbols,
                                 Deque<PendingReference> queue,
                                 DependencyMap dependencyMap) {
        visited.add(canonical(file));
        chunksByFile.put(file, chunks);
        dependencyMap.addChunks(chunks);

        for (Chunk chunk : chunks) {
            resolvedSymbols.putIfAbsent(chunk.getLabel().toUpperCase(Locale.ROOT), file);
        }
        for (Chunk chunk : chunks) {
            for (String dep : chunk.getDependencies()) {
                queue.add(new PendingReference(dep, file.toString(), chunk.getLabel()));
            }
        }
    }

    private static Path canonical(Path file) {
        return file.toAbsolutePath().normalize();
    }
}
