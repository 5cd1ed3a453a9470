package com.mainframe.hlasm.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A macro loaded from a copybook: its name, formal parameters and body template.
 */
@Value
@Builder
public class MacroDefinition {
    String name;
    /** Name-field formal of the prototype (e.g. {@code &LABEL}), null when the prototype has none. */
    String labelParameter;
    @Singular
    List<String> parameters;
    /** Keyword formals ({@code &MODE=INPUT}) mapped to their default value, empty when none is given. */
    @Singular
    Map<String, String> keywordParameters;
    @Singular("bodyLine")
    List<String> body;
    String sourcePath;

    public boolean hasLabelParameter() {
        return labelParameter != null;
    }
}
