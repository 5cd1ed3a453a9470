package com.mainframe.hlasm.resolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the source file for a symbol in a search directory (non-recursive).
 *
 * Matching ignores case and extension; when several files share the symbol's name the
 * configured extension order decides, then file-name order.
 */
public class SourceFileLocator {
    private static final Logger log = LoggerFactory.getLogger(SourceFileLocator.class);

    private final Path searchDir;
    private final List<String> extensions;

    /** Upper-cased file stem to the files carrying it. Built on first lookup. */
    private Map<String, List<Path>> index;

    public SourceFileLocator(Path searchDir, List<String> extensions) {
        this.searchDir = searchDir;
        this.extensions = extensions != null ? extensions : List.of();
    }

    public Optional<Path> locate(String symbol) {
        if (symbol == null || symbol.isBlank() || searchDir == null) {
            return Optional.empty();
        }
        List<Path> candidates = index().getOrDefault(symbol.trim().toUpperCase(Locale.ROOT), List.of());
        if (candidates.isEmpty()) {
            log.debug("No file for {} in {}", symbol, searchDir);
            return Optional.empty();
        }

        for (String ext : extensions) {
            for (Path candidate : candidates) {
                if (extensionOf(candidate).equalsIgnoreCase(ext)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.of(candidates.get(0));
    }

    public String describeSearchPath() {
        return searchDir == null ? "" : searchDir.toString();
    }

    private Map<String, List<Path>> index() {
        if (index != null) {
            return index;
        }
        index = new HashMap<>();
        if (!Files.isDirectory(searchDir)) {
            log.warn("Dependency search directory does not exist or is not a directory: {}", searchDir);
            return index;
        }
        try (Stream<Path> stream = Files.list(searchDir)) {
            stream.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .forEach(p -> index.computeIfAbsent(stemOf(p).toUpperCase(Locale.ROOT), k -> new ArrayList<>()).add(p));
        } catch (IOException e) {
            log.error("Failed to list dependency search directory: {}", searchDir, e);
        }
        return index;
    }

    private static String stemOf(Path path) {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return (dot > 0) ? file.substring(0, dot) : file;
    }

    private static String extensionOf(Path path) {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return (dot > 0) ? file.substring(dot) : "";
    }
}
