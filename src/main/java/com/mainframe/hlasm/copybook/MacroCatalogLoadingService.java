package com.mainframe.hlasm.copybook;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.hlasm.analysis.SourceReader;
import com.mainframe.hlasm.core.context.AnalysisDiagnostics;
import com.mainframe.hlasm.model.MacroCatalog;
import com.mainframe.hlasm.model.MacroDefinition;

import lombok.RequiredArgsConstructor;

/**
 * Builds the macro catalog for one analysis call from a copybook directory.
 *
 * Diagnostics are written to AnalysisDiagnostics (not to the catalog).
 */
@RequiredArgsConstructor
public class MacroCatalogLoadingService {
    private static final Logger log = LoggerFactory.getLogger(MacroCatalogLoadingService.class);

    private final MacroCopybookDiscoveryService discoveryService;
    private final MacroCopybookParser parser;

    public MacroCatalogLoadingService() {
        this(new MacroCopybookDiscoveryService(), new MacroCopybookParser());
    }

    public MacroCatalog load(Path copybookDir, Charset charset, AnalysisDiagnostics diagnostics) throws IOException {
        if (copybookDir == null) {
            return MacroCatalog.empty();
        }
        if (!Files.isDirectory(copybookDir)) {
            String msg = "Copybook directory does not exist or is not a directory: " + copybookDir;
            diagnostics.warning(msg);
            log.warn(msg);
            return MacroCatalog.empty();
        }

        Map<String, MacroDefinition> macros = new LinkedHashMap<>();
        for (Path path : discoveryService.discoverCopybookFiles(copybookDir)) {
            String name = discoveryService.macroName(path);
            try {
                List<String> lines = SourceReader.readLines(path, charset);
                macros.put(name, parser.parse(lines, name, path.toString()));
            } catch (IOException e) {
                String msg = "Failed to read macro copybook: " + path + " (" + e.getMessage() + ")";
                diagnostics.error(msg);
                log.error("Failed to read macro copybook: {}", path, e);
            }
        }

        log.info("Loaded {} macro copybooks from {}", macros.size(), copybookDir);
        return new MacroCatalog(macros);
    }
}
