package com.mainframe.hlasm.normalize;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.hlasm.core.context.AnalysisDiagnostics;
import com.mainframe.hlasm.model.LogicalLine;
import com.mainframe.hlasm.model.MacroCatalog;
import com.mainframe.hlasm.model.MacroDefinition;
import com.mainframe.hlasm.parser.OperandTokenizer;
import com.mainframe.hlasm.parser.StatementFields;

/**
 * Inlines calls to cataloged macros.
 *
 * A {@code KEY=value} operand binds to the keyword formal {@code &KEY}; the other operands bind
 * positionally to the positional formals. Keyword formals not named in the call take their
 * prototype default. Every bound formal token in the body is replaced by its value. Unbound
 * formals and surplus operands stay as literal text. Body lines that call other cataloged macros are expanded in turn, down to the nesting
 * ceiling; a call that needs more levels is left unexpanded and its siblings are unaffected.
 * Calls to unknown macros pass through untouched.
 */
public class MacroExpansionPass implements NormalizationPass {
    private static final Logger log = LoggerFactory.getLogger(MacroExpansionPass.class);

    public static final String MARKER_START = "* MACRO_EXPANSION_START:";
    public static final String MARKER_END = "* MACRO_EXPANSION_END:";

    private static final Pattern VARIABLE_SYMBOL = Pattern.compile("&[A-Za-z0-9@#$_]+");

    private final MacroCatalog catalog;
    private final int maxDepth;
    private final AnalysisDiagnostics diagnostics;
    private final OperandTokenizer tokenizer = new OperandTokenizer();

    public MacroExpansionPass(MacroCatalog catalog, int maxDepth, AnalysisDiagnostics diagnostics) {
        this.catalog = catalog;
        this.maxDepth = maxDepth;
        this.diagnostics = diagnostics;
    }

    @Override
    public List<LogicalLine> apply(List<LogicalLine> lines) {
        if (catalog.isEmpty()) {
            return lines;
        }
        List<LogicalLine> result = new ArrayList<>(lines.size());
        for (LogicalLine line : lines) {
            result.addAll(expandLine(line));
        }
        return result;
    }

    private List<LogicalLine> expandLine(LogicalLine line) {
        if (line.isBlank() || line.isComment()) {
            return List.of(line);
        }

        StatementFields fields = StatementFields.of(line.getText());
        Optional<MacroDefinition> macro = catalog.find(fields.getMnemonic());
        if (macro.isEmpty()) {
            return List.of(line);
        }

        MacroDefinition definition = macro.get();
        List<String> expanded;
        try {
            expanded = expand(definition, fields, 1);
        } catch (MacroRecursionLimitException e) {
            String msg = String.format("%s at %s line %d; left unexpanded",
                    e.getMessage(), line.getSourceFile(), line.getFirstLineNumber());
            diagnostics.warning(msg);
            log.warn(msg);
            return List.of(line);
        }

        log.info("Expanded macro {} at {} line {} ({} lines)",
                definition.getName(), line.getSourceFile(), line.getFirstLineNumber(), expanded.size());

        List<LogicalLine> result = new ArrayList<>(expanded.size() + 2);
        result.add(line.withText(MARKER_START + " " + definition.getName()));
        for (String text : expanded) {
            result.add(line.withText(text));
        }
        result.add(line.withText(MARKER_END + " " + definition.getName()));
        return result;
    }

    private List<String> expand(MacroDefinition definition, StatementFields call, int depth) {
        if (depth > maxDepth) {
            throw new MacroRecursionLimitException(definition.getName(), maxDepth);
        }

        List<String> out = new ArrayList<>();
        Map<String, String> bindings = bind(definition, call, out);

        for (String bodyLine : definition.getBody()) {
            String text = ColumnTruncationPass.truncate(substitute(bodyLine, bindings));
            if (text.startsWith("*") || text.startsWith(".*") || text.isBlank()) {
                out.add(text);
                continue;
            }
            StatementFields nested = StatementFields.of(text);
            Optional<MacroDefinition> inner = catalog.find(nested.getMnemonic());
            if (inner.isPresent()) {
                out.addAll(expand(inner.get(), nested, depth + 1));
            } else {
                out.add(text);
            }
        }
        return out;
    }

    private Map<String, String> bind(MacroDefinition definition, StatementFields call, List<String> out) {
        Map<String, String> bindings = new HashMap<>();
        definition.getKeywordParameters().forEach((formal, defaultValue) -> {
            if (!defaultValue.isEmpty()) {
                bindings.put(formal.toUpperCase(Locale.ROOT), defaultValue);
            }
        });

        List<String> positional = new ArrayList<>();
        for (String actual : tokenizer.splitOperands(call.getOperandText())) {
            Optional<String> keyword = keywordFormal(definition, actual);
            if (keyword.isPresent()) {
                bindings.put(keyword.get(), actual.substring(actual.indexOf('=') + 1));
            } else {
                positional.add(actual);
            }
        }
        List<String> formals = definition.getParameters();
        for (int i = 0; i < formals.size() && i < positional.size(); i++) {
            bindings.put(formals.get(i).toUpperCase(Locale.ROOT), positional.get(i));
        }

        if (call.hasLabel()) {
            if (definition.hasLabelParameter()) {
                bindings.put(definition.getLabelParameter().toUpperCase(Locale.ROOT), call.getLabel());
            } else {
                // keep the name so the block structure survives expansion
                out.add(call.getLabel());
            }
        }
        return bindings;
    }

    private static Optional<String> keywordFormal(MacroDefinition definition, String actual) {
        int eq = actual.indexOf('=');
        if (eq <= 0) {
            return Optional.empty();
        }
        String formal = "&" + actual.substring(0, eq).trim();
        return definition.getKeywordParameters().keySet().stream()
                .filter(formal::equalsIgnoreCase)
                .map(name -> name.toUpperCase(Locale.ROOT))
                .findFirst();
    }

    static String substitute(String text, Map<String, String> bindings) {
        if (bindings.isEmpty() || text.indexOf('&') < 0) {
            return text;
        }
        Matcher m = VARIABLE_SYMBOL.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = bindings.get(m.group().toUpperCase(Locale.ROOT));
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
