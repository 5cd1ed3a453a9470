package com.mainframe.hlasm.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.hlasm.analysis.HlasmAnalysis;
import com.mainframe.hlasm.cli.exception.InvalidAnalyzeOptionsException;
import com.mainframe.hlasm.cli.model.AnalyzeOptions;
import com.mainframe.hlasm.cli.model.ValidatedAnalyzeOptions;
import com.mainframe.hlasm.cli.output.AnalysisResultsPrinter;
import com.mainframe.hlasm.cli.validation.AnalyzeOptionsValidator;
import com.mainframe.hlasm.core.context.AnalyzerConfig;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that chunks an HLASM source file, optionally following its dependencies.
 */
@Command(
        name = "hlasm-chunker",
        mixinStandardHelpOptions = true,
        version = "hlasm-chunker 1.0.0",
        description = "Splits HLASM source into labelled chunks and reports CALL-class dependencies."
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    static final String BASE_LOGGER = "com.mainframe.hlasm";

    @Mixin
    private AnalyzeOptions options = new AnalyzeOptions();

    private final AnalyzeOptionsValidator validator = new AnalyzeOptionsValidator();
    private final AnalysisResultsPrinter printer = new AnalysisResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedAnalyzeOptions validated;
        try {
            validated = validator.validate(options);
        } catch (InvalidAnalyzeOptionsException e) {
            e.getProblems().forEach(log::error);
            return 1;
        }

        AnalyzerConfig config = AnalyzerConfig.builder()
                .copybookDir(validated.getCopybookDir())
                .externalSearchDir(validated.getSearchDir())
                .maxMacroDepth(options.getMaxMacroDepth())
                .charset(validated.getCharset())
                .build();
        HlasmAnalysis analysis = new HlasmAnalysis(config);

        printer.printBanner(validated);
        try {
            if (validated.getSearchDir() != null) {
                printer.printRecursive(analysis.analyzeRecursive(validated.getSource()));
            } else {
                printer.printFile(analysis.analyzeWithDiagnostics(validated.getSource()));
            }
            return 0;
        } catch (Exception e) {
            log.error("Analysis failed with exception", e);
            return 1;
        }
    }

    AnalyzeOptions getOptions() {
        return options;
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger logger = LoggerFactory.getLogger(BASE_LOGGER);
        if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }
}
