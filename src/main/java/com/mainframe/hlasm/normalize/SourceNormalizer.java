package com.mainframe.hlasm.normalize;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.hlasm.core.context.AnalysisDiagnostics;
import com.mainframe.hlasm.model.LogicalLine;
import com.mainframe.hlasm.model.MacroCatalog;
import com.mainframe.hlasm.model.SourceLine;

/**
 * Runs the normalization stages in order: column truncation, macro expansion, continuation
 * collapse, sanitize. Macro expansion is skipped when the catalog is empty.
 *
 * One instance serves one analysis call; the catalog it holds is not shared.
 * Re-normalizing its own output yields the same lines.
 */
public class SourceNormalizer {
    private static final Logger log = LoggerFactory.getLogger(SourceNormalizer.class);

    private final List<NormalizationPass> passes = new ArrayList<>();

    public SourceNormalizer(MacroCatalog catalog, int maxMacroDepth, AnalysisDiagnostics diagnostics) {
        passes.add(new ColumnTruncationPass());
        if (catalog != null && !catalog.isEmpty()) {
            passes.add(new MacroExpansionPass(catalog, maxMacroDepth, diagnostics));
        }
        passes.add(new ContinuationCollapsePass());
        passes.add(new SanitizePass());
    }

    public List<LogicalLine> normalizeSource(List<SourceLine> lines) {
        return normalize(LogicalLine.ofAll(lines));
    }

    public List<LogicalLine> normalize(List<LogicalLine> lines) {
        List<LogicalLine> current = lines;
        for (NormalizationPass pass : passes) {
            current = pass.apply(current);
        }
        log.debug("Normalized {} lines into {}", lines.size(), current.size());
        return current;
    }
}
