package com.mainframe.hlasm.analysis;

import com.mainframe.hlasm.model.SourceLine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SourceReader.
 */
class SourceReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testLinesAreNumberedFromOne() {
        List<SourceLine> lines = SourceReader.toSourceLines("A\r\nB\nC", "T.asm");

        assertThat(lines).extracting(SourceLine::getText).containsExactly("A", "B", "C");
        assertThat(lines).extracting(SourceLine::getLineNumber).containsExactly(1, 2, 3);
        assertThat(lines).allSatisfy(l -> assertThat(l.getSourceFile()).isEqualTo("T.asm"));
    }

    @Test
    void testUndecodableBytesAreReplaced() throws IOException {
        Path file = tempDir.resolve("BIN.asm");
        Files.write(file, new byte[] { 'M', 'V', 'C', (byte) 0xC1, (byte) 0xFF, '\n', 'B', 'R' });

        List<SourceLine> lines = SourceReader.readSource(file, StandardCharsets.UTF_8);

        assertThat(lines).hasSize(2);
        assertThat(lines.get(0).getText()).startsWith("MVC").contains("�");
        assertThat(lines.get(0).getSourceFile()).isEqualTo(file.toString());
    }
}
