package com.mainframe.hlasm.cli.model;

import java.nio.charset.Charset;
import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps AnalyzeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedAnalyzeOptions {
    Path source;
    Path copybookDir;
    /** Null unless recursive. */
    Path searchDir;
    Charset charset;
}
