package com.mainframe.hlasm.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only set of macros available to one analysis call, keyed by upper-cased name.
 */
public final class MacroCatalog {

    private static final MacroCatalog EMPTY = new MacroCatalog(Map.of());

    private final Map<String, MacroDefinition> macros;

    public MacroCatalog(Map<String, MacroDefinition> macros) {
        Map<String, MacroDefinition> copy = new LinkedHashMap<>();
        macros.forEach((name, def) -> copy.put(name.toUpperCase(Locale.ROOT), def));
        this.macros = Collections.unmodifiableMap(copy);
    }

    public static MacroCatalog empty() {
        return EMPTY;
    }

    public Optional<MacroDefinition> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(macros.get(name.toUpperCase(Locale.ROOT)));
    }

    public boolean isEmpty() {
        return macros.isEmpty();
    }

    public int size() {
        return macros.size();
    }

    public Set<String> names() {
        return macros.keySet();
    }
}
