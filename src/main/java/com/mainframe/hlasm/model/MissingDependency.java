package com.mainframe.hlasm.model;

import java.nio.file.Path;

import lombok.Value;

/**
 * A dependency symbol that could not be matched to any source file during recursive analysis.
 * One record per reference site.
 */
@Value
public class MissingDependency {
    String depName;
    String referencedFromFile;
    String referencedInChunk;
    /** Directory that was searched, empty when no search directory was configured. */
    String searchPath;

    @Override
    public String toString() {
        String from = Path.of(referencedFromFile).getFileName().toString();
        String hint = searchPath.isEmpty() ? "" : " (searched: " + searchPath + ")";
        return String.format("%-20s referenced from %s in %s%s", depName, referencedInChunk, from, hint);
    }
}
