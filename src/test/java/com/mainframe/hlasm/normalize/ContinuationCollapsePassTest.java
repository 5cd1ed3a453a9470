package com.mainframe.hlasm.normalize;

import com.mainframe.hlasm.model.LogicalLine;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ContinuationCollapsePass.
 */
class ContinuationCollapsePassTest {

    private static final String INDENT = " ".repeat(15);

    private final ContinuationCollapsePass pass = new ContinuationCollapsePass();

    @Test
    void testContinuationIsAppendedToPreviousLine() {
        List<LogicalLine> lines = lines(
                "         CALL  SUBPROG,(ALPHA,BETA,",
                INDENT + "GAMMA)");

        List<LogicalLine> result = pass.apply(lines);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getText()).isEqualTo("         CALL  SUBPROG,(ALPHA,BETA,GAMMA)");
        assertThat(result.get(0).getLineNumbers()).containsExactly(1, 2);
    }

    @Test
    void testChainOfContinuationsCollapsesIntoOneLine() {
        List<LogicalLine> lines = lines(
                "         CALL  SUBPROG,(A,",
                INDENT + "B,",
                INDENT + "C)",
                "         BR    R14");

        List<LogicalLine> result = pass.apply(lines);

        assertThat(result).extracting(LogicalLine::getText)
                .containsExactly("         CALL  SUBPROG,(A,B,C)", "         BR    R14");
        assertThat(result.get(0).getLineNumbers()).containsExactly(1, 2, 3);
        assertThat(result.get(1).getLineNumbers()).containsExactly(4);
    }

    @Test
    void testColumn72IndicatorIsDropped() {
        String continued = String.format("%-71s", "         CALL  SUBPROG,(ALPHA,") + "X";
        List<LogicalLine> lines = lines(continued, INDENT + "BETA)");

        List<LogicalLine> result = pass.apply(lines);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getText()).isEqualTo("         CALL  SUBPROG,(ALPHA,BETA)");
    }

    @Test
    void testRemarksAfterTrailingCommaAreDroppedFromJoin() {
        String continued = String.format("%-71s", "         CALL  SUBPROG,         first line remark") + "X";
        List<LogicalLine> lines = lines(continued, INDENT + "(PARMA,PARMB)");

        List<LogicalLine> result = pass.apply(lines);

        assertThat(result).extracting(LogicalLine::getText)
                .containsExactly("         CALL  SUBPROG,(PARMA,PARMB)");
    }

    @Test
    void testKeywordOperandResumesAfterRemarks() {
        List<LogicalLine> lines = lines(
                "         LINK  SF=(E,L),   list form",
                INDENT + "EP=PROG");

        assertThat(pass.apply(lines)).extracting(LogicalLine::getText)
                .containsExactly("         LINK  SF=(E,L),EP=PROG");
    }

    @Test
    void testOpenLiteralKeepsBlanksThroughColumn71() {
        String first = "MSG      DC    C'HELLO";
        List<LogicalLine> lines = lines(String.format("%-71s", first) + "X", INDENT + "WORLD'");

        List<LogicalLine> result = pass.apply(lines);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getText())
                .isEqualTo(first + " ".repeat(71 - first.length()) + "WORLD'");
    }

    @Test
    void testCommentIsNeverContinued() {
        List<LogicalLine> lines = lines(
                "* A COMMENT",
                INDENT + "NOT_A_CONTINUATION");

        assertThat(pass.apply(lines)).hasSize(2);
    }

    @Test
    void testOrdinaryStatementIsNotAContinuation() {
        assertThat(ContinuationCollapsePass.isContinuation("         MVC   A,B")).isFalse();
        assertThat(ContinuationCollapsePass.isContinuation(INDENT + " X")).isFalse();
        assertThat(ContinuationCollapsePass.isContinuation(INDENT + "X")).isTrue();
        assertThat(ContinuationCollapsePass.isContinuation("LABEL" + " ".repeat(10) + "X")).isFalse();
    }

    private static List<LogicalLine> lines(String... texts) {
        List<LogicalLine> result = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            result.add(new LogicalLine(texts[i], "T.asm", List.of(i + 1)));
        }
        return result;
    }
}
