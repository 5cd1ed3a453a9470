package com.mainframe.hlasm.analysis;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.hlasm.chunker.Chunker;
import com.mainframe.hlasm.copybook.MacroCatalogLoadingService;
import com.mainframe.hlasm.core.context.AnalysisDiagnostics;
import com.mainframe.hlasm.core.context.AnalyzerConfig;
import com.mainframe.hlasm.model.Chunk;
import com.mainframe.hlasm.model.LabelledBlock;
import com.mainframe.hlasm.model.LogicalLine;
import com.mainframe.hlasm.model.MacroCatalog;
import com.mainframe.hlasm.model.SourceLine;
import com.mainframe.hlasm.normalize.SourceNormalizer;
import com.mainframe.hlasm.parser.BlockGrouper;
import com.mainframe.hlasm.resolver.DependencyResolver;
import com.mainframe.hlasm.resolver.RecursiveAnalysisResult;
import com.mainframe.hlasm.resolver.SourceFileLocator;

/**
 * Entry points for analysing HLASM source.
 *
 * Each call loads its own macro catalog from the copybook directory it is given (or the configured
 * one), so a reused instance never sees macros from an earlier call.
 */
public class HlasmAnalysis {
    private static final Logger log = LoggerFactory.getLogger(HlasmAnalysis.class);

    private final AnalyzerConfig config;
    private final MacroCatalogLoadingService catalogLoader;
    private final BlockGrouper blockGrouper;
    private final Chunker chunker;

    public HlasmAnalysis() {
        this(AnalyzerConfig.defaults());
    }

    public HlasmAnalysis(AnalyzerConfig config) {
        this(config, new MacroCatalogLoadingService(), new BlockGrouper(), new Chunker());
    }

    public HlasmAnalysis(AnalyzerConfig config, MacroCatalogLoadingService catalogLoader,
                         BlockGrouper blockGrouper, Chunker chunker) {
        this.config = config;
        this.catalogLoader = catalogLoader;
        this.blockGrouper = blockGrouper;
        this.chunker = chunker;
    }

    public List<Chunk> analyze(Path file) throws IOException {
        return analyze(file, config.getCopybookDir());
    }

    public List<Chunk> analyze(Path file, Path copybookDir) throws IOException {
        return analyzeWithDiagnostics(file, copybookDir).getChunks();
    }

    public FileAnalysis analyzeWithDiagnostics(Path file) throws IOException {
        return analyzeWithDiagnostics(file, config.getCopybookDir());
    }

    public FileAnalysis analyzeWithDiagnostics(Path file, Path copybookDir) throws IOException {
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();
        SourceNormalizer normalizer = newNormalizer(copybookDir, diagnostics);
        List<Chunk> chunks = analyzeFile(file, normalizer, diagnostics);
        return new FileAnalysis(file.toString(), chunks, diagnostics);
    }

    /**
     * Analyses in-memory source. Chunks report {@code sourceName} as their file.
     */
    public List<Chunk> analyzeText(String source, String sourceName) throws IOException {
        return analyzeText(source, sourceName, config.getCopybookDir());
    }

    public List<Chunk> analyzeText(String source, String sourceName, Path copybookDir) throws IOException {
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();
        SourceNormalizer normalizer = newNormalizer(copybookDir, diagnostics);
        return runPipeline(SourceReader.toSourceLines(source, sourceName), sourceName, normalizer, diagnostics);
    }

    public RecursiveAnalysisResult analyzeRecursive(Path entryFile) throws IOException {
        return analyzeRecursive(entryFile, config.getCopybookDir(), config.getExternalSearchDir());
    }

    /**
     * Analyses {@code entryFile} and every file reachable through CALL-class dependencies found in
     * {@code externalSearchDir}. Only an unreadable entry file fails the call.
     */
    public RecursiveAnalysisResult analyzeRecursive(Path entryFile, Path copybookDir, Path externalSearchDir)
            throws IOException {
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();
        SourceNormalizer normalizer = newNormalizer(copybookDir, diagnostics);

        List<Chunk> entryChunks = analyzeFile(entryFile, normalizer, diagnostics);

        SourceFileLocator locator = new SourceFileLocator(externalSearchDir, config.getSourceExtensions());
        DependencyResolver resolver = new DependencyResolver(locator,
                file -> analyzeFile(file, normalizer, diagnostics), diagnostics);
        return resolver.resolve(entryFile, entryChunks);
    }

    private SourceNormalizer newNormalizer(Path copybookDir, AnalysisDiagnostics diagnostics) throws IOException {
        MacroCatalog catalog = catalogLoader.load(copybookDir, config.getCharset(), diagnostics);
        return new SourceNormalizer(catalog, config.getMaxMacroDepth(), diagnostics);
    }

    private List<Chunk> analyzeFile(Path file, SourceNormalizer normalizer, AnalysisDiagnostics diagnostics)
            throws IOException {
        List<SourceLine> lines = SourceReader.readSource(file, config.getCharset());
        List<Chunk> chunks = runPipeline(lines, file.toString(), normalizer, diagnostics);
        log.info("Analysed {}: {} lines, {} chunks", file, lines.size(), chunks.size());
        return chunks;
    }

    private List<Chunk> runPipeline(List<SourceLine> lines, String sourceName,
                                    SourceNormalizer normalizer, AnalysisDiagnostics diagnostics) {
        List<LogicalLine> normalized = normalizer.normalizeSource(lines);
        List<LabelledBlock> blocks = blockGrouper.group(normalized, sourceName);
        return chunker.chunk(blocks, diagnostics);
    }
}
