package com.mainframe.hlasm.normalize;

import java.util.List;

import com.mainframe.hlasm.model.LogicalLine;

/**
 * One line-rewriting stage of the normalizer.
 */
public interface NormalizationPass {

    List<LogicalLine> apply(List<LogicalLine> lines);
}
