package com.mainframe.hlasm.core.context;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Settings for one {@link com.mainframe.hlasm.analysis.HlasmAnalysis}.
 */
@Data
@Builder
public class AnalyzerConfig {

    public static final int DEFAULT_MAX_MACRO_DEPTH = 16;

    public static final List<String> DEFAULT_SOURCE_EXTENSIONS = List.of(
            ".asm", ".hlasm", ".mlc", ".s", ".txt", ""
    );

    /**
     * Directory containing {@code <NAME>_Assembler_Copybook.txt} files.
     * Null disables macro expansion.
     */
    private Path copybookDir;

    /**
     * Directory searched for the source files of CALL-class targets in recursive mode.
     */
    private Path externalSearchDir;

    /**
     * Nesting ceiling for macro expansion. An invocation that needs more levels is left unexpanded.
     */
    @Builder.Default
    private int maxMacroDepth = DEFAULT_MAX_MACRO_DEPTH;

    /**
     * Extensions tried, in order, when matching a dependency symbol to a file.
     */
    @Builder.Default
    private List<String> sourceExtensions = DEFAULT_SOURCE_EXTENSIONS;

    @Builder.Default
    private Charset charset = StandardCharsets.UTF_8;

    public static AnalyzerConfig defaults() {
        return AnalyzerConfig.builder().build();
    }
}
