package com.mainframe.hlasm.copybook;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.hlasm.model.MacroDefinition;
import com.mainframe.hlasm.parser.OperandTokenizer;
import com.mainframe.hlasm.parser.StatementFields;

/**
 * Parses the text of one macro copybook into a {@link MacroDefinition}.
 *
 * Expected layout:
 * <pre>
 *          MACRO
 * &amp;LABEL   PRINTMSG &amp;MSG,&amp;LEN
 *          ...body...
 *          MEND
 * </pre>
 * Formals written {@code &NAME=default} are keyword formals; the rest are positional.
 * The prototype is the first statement after MACRO (or the first statement when the MACRO
 * boundary is missing). The body runs up to the last MEND, or to end of file without one.
 */
public class MacroCopybookParser {
    private static final Logger log = LoggerFactory.getLogger(MacroCopybookParser.class);

    private final OperandTokenizer tokenizer = new OperandTokenizer();

    public MacroDefinition parse(List<String> lines, String macroName, String sourcePath) {
        MacroDefinition.MacroDefinitionBuilder builder = MacroDefinition.builder()
                .name(macroName)
                .sourcePath(sourcePath);

        int macroLine = nextStatement(lines, 0);
        if (macroLine >= 0 && !"MACRO".equals(StatementFields.of(lines.get(macroLine)).getMnemonic())) {
            log.debug("Copybook {} has no MACRO boundary; first statement is the prototype", sourcePath);
            macroLine = -1;
        }

        int prototypeLine = nextStatement(lines, macroLine + 1);
        if (prototypeLine < 0) {
            log.debug("Copybook {} has no prototype statement", sourcePath);
            return builder.build();
        }

        StatementFields prototype = StatementFields.of(lines.get(prototypeLine));
        if (!prototype.getMnemonic().isEmpty() && !prototype.getMnemonic().equals(macroName)) {
            log.debug("Prototype of {} names {}; cataloged under the file name", sourcePath, prototype.getMnemonic());
        }
        if (prototype.getLabel().startsWith("&")) {
            builder.labelParameter(prototype.getLabel());
        }
        for (String operand : tokenizer.splitOperands(prototype.getOperandText())) {
            int eq = operand.indexOf('=');
            String formal = (eq >= 0 ? operand.substring(0, eq) : operand).trim();
            if (!formal.startsWith("&") || formal.length() == 1) {
                continue;
            }
            if (eq >= 0) {
                builder.keywordParameter(formal, operand.substring(eq + 1).trim());
            } else {
                builder.parameter(formal);
            }
        }

        int end = lines.size();
        for (int i = lines.size() - 1; i > prototypeLine; i--) {
            if ("MEND".equals(StatementFields.of(lines.get(i)).getMnemonic())) {
                end = i;
                break;
            }
        }
        for (int i = prototypeLine + 1; i < end; i++) {
            builder.bodyLine(lines.get(i).stripTrailing());
        }
        return builder.build();
    }

    private static int nextStatement(List<String> lines, int from) {
        for (int i = Math.max(from, 0); i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank() || line.startsWith("*") || line.startsWith(".*")) {
                continue;
            }
            return i;
        }
        return -1;
    }
}
