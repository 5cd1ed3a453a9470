package com.mainframe.hlasm.analysis;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.mainframe.hlasm.model.SourceLine;

/**
 * Reads source text into lines. Undecodable bytes are replaced rather than rejected.
 */
public final class SourceReader {

    private SourceReader() {
    }

    public static List<String> readLines(Path path, Charset charset) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        return new String(bytes, charset).lines().toList();
    }

    public static List<SourceLine> readSource(Path path, Charset charset) throws IOException {
        return toSourceLines(readLines(path, charset), path.toString());
    }

    public static List<SourceLine> toSourceLines(String text, String sourceName) {
        return toSourceLines(text.lines().toList(), sourceName);
    }

    private static List<SourceLine> toSourceLines(List<String> lines, String sourceName) {
        List<SourceLine> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            result.add(new SourceLine(lines.get(i), i + 1, sourceName));
        }
        return result;
    }
}
