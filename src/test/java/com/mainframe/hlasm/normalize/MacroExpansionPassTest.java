package com.mainframe.hlasm.normalize;

import com.mainframe.hlasm.core.context.AnalysisDiagnostics;
import com.mainframe.hlasm.model.LogicalLine;
import com.mainframe.hlasm.model.MacroCatalog;
import com.mainframe.hlasm.model.MacroDefinition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MacroExpansionPass.
 */
class MacroExpansionPassTest {

    private static final MacroDefinition PRINTMSG = MacroDefinition.builder()
            .name("PRINTMSG")
            .parameter("&MSG")
            .parameter("&LEN")
            .bodyLine("         MVC   OUTAREA(&LEN),&MSG")
            .bodyLine("         PUT   SYSPRINT,OUTAREA")
            .sourcePath("PRINTMSG_Assembler_Copybook.txt")
            .build();

    private final AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();

    @Test
    void testFormalParametersAreReplacedByActuals() {
        List<String> result = expand(catalog(PRINTMSG), "         PRINTMSG FIELDA,4");

        assertThat(result).containsExactly(
                "* MACRO_EXPANSION_START: PRINTMSG",
                "         MVC   OUTAREA(4),FIELDA",
                "         PUT   SYSPRINT,OUTAREA",
                "* MACRO_EXPANSION_END: PRINTMSG");
        assertThat(String.join("\n", result)).doesNotContain("&MSG", "&LEN");
    }

    @Test
    void testUnboundFormalStaysLiteral() {
        List<String> result = expand(catalog(PRINTMSG), "         PRINTMSG FIELDA");

        assertThat(result).contains("         MVC   OUTAREA(&LEN),FIELDA");
    }

    @Test
    void testParenthesisedActualBindsAsOneValue() {
        List<String> result = expand(catalog(PRINTMSG), "         PRINTMSG TAB(3,4),8");

        assertThat(result).contains("         MVC   OUTAREA(8),TAB(3,4)");
    }

    @Test
    void testKeywordActualBindsByName() {
        MacroDefinition fill = MacroDefinition.builder()
                .name("FILL")
                .parameter("&FLD")
                .keywordParameter("&LEN", "80")
                .bodyLine("         MVC   &FLD(&LEN),BLANKS")
                .build();

        assertThat(expand(catalog(fill), "         FILL  OUTREC,LEN=4"))
                .contains("         MVC   OUTREC(4),BLANKS");
        assertThat(expand(catalog(fill), "         FILL  LEN=4,OUTREC"))
                .contains("         MVC   OUTREC(4),BLANKS");
    }

    @Test
    void testKeywordFormalTakesDefaultAndIsNeverBoundPositionally() {
        MacroDefinition fill = MacroDefinition.builder()
                .name("FILL")
                .parameter("&FLD")
                .keywordParameter("&LEN", "80")
                .bodyLine("         MVC   &FLD(&LEN),BLANKS")
                .build();

        assertThat(expand(catalog(fill), "         FILL  OUTREC,12"))
                .contains("         MVC   OUTREC(80),BLANKS");
    }

    @Test
    void testUnknownMacroPassesThrough() {
        List<String> result = expand(catalog(PRINTMSG), "         SAVEREGS (14,12)");

        assertThat(result).containsExactly("         SAVEREGS (14,12)");
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testNestedInvocationIsExpanded() {
        MacroDefinition outer = MacroDefinition.builder()
                .name("REPORT")
                .parameter("&FLD")
                .bodyLine("         LA    R1,&FLD")
                .bodyLine("         PRINTMSG &FLD,12")
                .build();

        List<String> result = expand(catalog(PRINTMSG, outer), "         REPORT TOTAL");

        assertThat(result).containsExactly(
                "* MACRO_EXPANSION_START: REPORT",
                "         LA    R1,TOTAL",
                "         MVC   OUTAREA(12),TOTAL",
                "         PUT   SYSPRINT,OUTAREA",
                "* MACRO_EXPANSION_END: REPORT");
    }

    @Test
    void testRecursionLimitLeavesOnlyThatInvocationUnexpanded() {
        MacroDefinition loop = MacroDefinition.builder()
                .name("LOOPM")
                .bodyLine("         LOOPM")
                .build();
        MacroExpansionPass pass = new MacroExpansionPass(catalog(PRINTMSG, loop), 4, diagnostics);

        List<LogicalLine> result = pass.apply(lines(
                "         LOOPM",
                "         PRINTMSG FIELDA,4"));

        assertThat(result).extracting(LogicalLine::getText).containsExactly(
                "         LOOPM",
                "* MACRO_EXPANSION_START: PRINTMSG",
                "         MVC   OUTAREA(4),FIELDA",
                "         PUT   SYSPRINT,OUTAREA",
                "* MACRO_EXPANSION_END: PRINTMSG");
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0)).contains("LOOPM");
    }

    @Test
    void testLabelBindsToLabelParameter() {
        MacroDefinition greet = MacroDefinition.builder()
                .name("GREET")
                .labelParameter("&NAME")
                .parameter("&TXT")
                .bodyLine("&NAME    DS    0H")
                .bodyLine("         MVC   LINE,&TXT")
                .build();

        List<String> result = expand(catalog(greet), "HELLO    GREET =C'HI'");

        assertThat(result).contains("HELLO    DS    0H", "         MVC   LINE,=C'HI'");
    }

    @Test
    void testLabelWithoutLabelParameterIsKeptOnItsOwnLine() {
        List<String> result = expand(catalog(PRINTMSG), "SHOWIT   PRINTMSG FIELDA,4");

        assertThat(result.get(0)).isEqualTo("* MACRO_EXPANSION_START: PRINTMSG");
        assertThat(result.get(1)).isEqualTo("SHOWIT");
        assertThat(result.get(2)).isEqualTo("         MVC   OUTAREA(4),FIELDA");
    }

    @Test
    void testExpandedLinesKeepInvocationLineNumber() {
        MacroExpansionPass pass = new MacroExpansionPass(catalog(PRINTMSG), 16, diagnostics);

        List<LogicalLine> result = pass.apply(List.of(
                new LogicalLine("         PRINTMSG FIELDA,4", "T.asm", List.of(12))));

        assertThat(result).allSatisfy(line -> assertThat(line.getLineNumbers()).containsExactly(12));
    }

    @Test
    void testSubstituteIgnoresCaseOfFormal() {
        String text = MacroExpansionPass.substitute("         LA    R1,&fld", Map.of("&FLD", "WORK"));

        assertThat(text).isEqualTo("         LA    R1,WORK");
    }

    private List<String> expand(MacroCatalog catalog, String line) {
        MacroExpansionPass pass = new MacroExpansionPass(catalog, 16, diagnostics);
        return pass.apply(lines(line)).stream().map(LogicalLine::getText).toList();
    }

    private static MacroCatalog catalog(MacroDefinition... definitions) {
        Map<String, MacroDefinition> map = new java.util.LinkedHashMap<>();
        for (MacroDefinition def : definitions) {
            map.put(def.getName(), def);
        }
        return new MacroCatalog(map);
    }

    private static List<LogicalLine> lines(String... texts) {
        List<LogicalLine> result = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            result.add(new LogicalLine(texts[i], "T.asm", List.of(i + 1)));
        }
        return result;
    }
}
