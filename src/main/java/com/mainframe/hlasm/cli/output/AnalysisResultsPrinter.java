package com.mainframe.hlasm.cli.output;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.hlasm.analysis.FileAnalysis;
import com.mainframe.hlasm.cli.model.ValidatedAnalyzeOptions;
import com.mainframe.hlasm.core.context.AnalysisDiagnostics;
import com.mainframe.hlasm.model.Chunk;
import com.mainframe.hlasm.model.MissingDependency;
import com.mainframe.hlasm.resolver.RecursiveAnalysisResult;

/**
 * Responsible only for printing CLI output for the chunker command.
 * No validation, no execution.
 */
public class AnalysisResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(AnalysisResultsPrinter.class);

    public void printBanner(ValidatedAnalyzeOptions v) {
        log.info("=================================================");
        log.info("HLASM Chunker");
        log.info("=================================================");
        log.info("Source: {}", v.getSource());
        log.info("Copybook Directory: {}", v.getCopybookDir() != null ? v.getCopybookDir().toAbsolutePath() : "None");
        log.info("Mode: {}", v.getSearchDir() != null ? "recursive" : "single file");
        if (v.getSearchDir() != null) {
            log.info("Search Directory: {}", v.getSearchDir().toAbsolutePath());
        }
        log.info("Encoding: {}", v.getCharset());
        log.info("=================================================");
    }

    public void printFile(FileAnalysis analysis) {
        printChunks(analysis.getSourceFile(), analysis.getChunks());
        printDiagnostics(analysis.getDiagnostics());
    }

    public void printRecursive(RecursiveAnalysisResult result) {
        for (Map.Entry<Path, List<Chunk>> entry : result.getChunksByFile().entrySet()) {
            printChunks(entry.getKey().toString(), entry.getValue());
        }

        log.info("");
        log.info("Files Analysed: {}", result.getChunksByFile().size());
        log.info("Total Chunks: {}", result.getAllChunks().size());
        log.info("Dependency Edges: {}", result.getDependencyMap().edges().size());

        if (result.hasMissingDependencies()) {
            log.info("");
            log.warn("Missing Dependencies ({}):", result.getMissingDependencies().size());
            for (MissingDependency dep : result.getMissingDependencies()) {
                log.warn("  {}", dep);
            }
        }
        printDiagnostics(result.getDiagnostics());
    }

    private void printChunks(String file, List<Chunk> chunks) {
        log.info("");
        log.info("{} ({} chunks)", file, chunks.size());
        log.info("-------------------------------------------------");
        for (Chunk chunk : chunks) {
            String deps = chunk.getDependencies().isEmpty() ? "-" : String.join(", ", chunk.getDependencies());
            log.info("  {} [{}] {} instructions, depends on: {}",
                    chunk.getLabel(), chunk.getChunkType(), chunk.getInstructions().size(), deps);
        }
    }

    private void printDiagnostics(AnalysisDiagnostics diagnostics) {
        if (diagnostics.hasWarnings()) {
            log.info("");
            log.info("Warnings: {}", diagnostics.getWarnings().size());
            diagnostics.getWarnings().forEach(w -> log.debug("  {}", w));
        }
        if (diagnostics.hasErrors()) {
            log.info("");
            log.error("Errors: {}", diagnostics.getErrors().size());
            diagnostics.getErrors().forEach(e -> log.error("  {}", e));
        }
        log.info("=================================================");
    }
}
