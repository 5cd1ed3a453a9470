package com.mainframe.hlasm;

import com.mainframe.hlasm.cli.AnalyzeCommand;
import picocli.CommandLine;

/**
 * Main entry point for the HLASM chunker.
 * Splits assembler source into labelled chunks and reports their CALL-class dependencies.
 */
public class HlasmChunkerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AnalyzeCommand()).execute(args);
        System.exit(exitCode);
    }
}
