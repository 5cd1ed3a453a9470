package com.mainframe.hlasm.analysis;

import java.util.List;

import com.mainframe.hlasm.core.context.AnalysisDiagnostics;
import com.mainframe.hlasm.model.Chunk;

import lombok.Value;

/**
 * Chunks of one source plus the non-fatal problems met while producing them.
 */
@Value
public class FileAnalysis {
    String sourceFile;
    List<Chunk> chunks;
    AnalysisDiagnostics diagnostics;
}
