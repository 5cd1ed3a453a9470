package com.mainframe.hlasm.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Value;

/**
 * A normalized line: one logical instruction (or comment) after continuation lines
 * have been folded in. Keeps the numbers of every physical line that contributed to it.
 */
@Value
public class LogicalLine {
    String text;
    String sourceFile;
    List<Integer> lineNumbers;

    public LogicalLine(String text, String sourceFile, List<Integer> lineNumbers) {
        this.text = text;
        this.sourceFile = sourceFile;
        this.lineNumbers = List.copyOf(lineNumbers);
    }

    public static LogicalLine of(SourceLine line) {
        return new LogicalLine(line.getText(), line.getSourceFile(), List.of(line.getLineNumber()));
    }

    public static List<LogicalLine> ofAll(List<SourceLine> lines) {
        List<LogicalLine> result = new ArrayList<>(lines.size());
        for (SourceLine line : lines) {
            result.add(of(line));
        }
        return result;
    }

    public LogicalLine withText(String newText) {
        return new LogicalLine(newText, sourceFile, lineNumbers);
    }

    /**
     * Appends a continuation line's content and its line numbers to the text as it stands.
     */
    public LogicalLine join(String continuation, List<Integer> continuationLines) {
        List<Integer> merged = new ArrayList<>(lineNumbers);
        merged.addAll(continuationLines);
        return new LogicalLine(text + continuation, sourceFile, merged);
    }

    public int getFirstLineNumber() {
        return lineNumbers.isEmpty() ? 0 : lineNumbers.get(0);
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    /**
     * Full-line comment: '*' in column 1 or a macro comment starting with ".*".
     */
    public boolean isComment() {
        return text.startsWith("*") || text.startsWith(".*");
    }
}
