package com.mainframe.hlasm.copybook;

import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.file.*;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@NoArgsConstructor
public class MacroCopybookDiscoveryService {

    public static final String COPYBOOK_SUFFIX = "_Assembler_Copybook.txt";

    public List<Path> discoverCopybookFiles(Path copybookDir) throws IOException {
        try (Stream<Path> stream = Files.walk(copybookDir, 1)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isCopybookFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Macro name encoded in a copybook file name, upper-cased.
     */
    public String macroName(Path path) {
        String file = path.getFileName().toString();
        return file.substring(0, file.length() - COPYBOOK_SUFFIX.length()).toUpperCase(Locale.ROOT);
    }

    private boolean isCopybookFile(Path path) {
        String name = path.getFileName().toString();
        return name.length() > COPYBOOK_SUFFIX.length()
                && name.toLowerCase(Locale.ROOT).endsWith(COPYBOOK_SUFFIX.toLowerCase(Locale.ROOT));
    }
}
