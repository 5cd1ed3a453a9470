package com.mainframe.hlasm.model;

import lombok.Value;

/**
 * One physical line as read from a source file.
 */
@Value
public class SourceLine {
    String text;
    /** 1-based. */
    int lineNumber;
    String sourceFile;
}
