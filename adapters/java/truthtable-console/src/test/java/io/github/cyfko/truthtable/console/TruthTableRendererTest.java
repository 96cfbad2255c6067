package io.github.cyfko.truthtable.console;

import io.github.cyfko.truthtable.core.api.TruthTable;
import io.github.cyfko.truthtable.core.api.Variable;
import io.github.cyfko.truthtable.core.impl.BasicTruthTableGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TruthTableRenderer Tests")
class TruthTableRendererTest {

    private final TruthTableRenderer renderer = new TruthTableRenderer();

    @Test
    @DisplayName("Should center every cell to a common width")
    void shouldRenderExcludedMiddle() {
        TruthTable table = new TruthTable(
                "P or ~P",
                List.of(Variable.P),
                List.of("P", "~P", "P v ~P"),
                List.of(List.of(false, true, true), List.of(true, false, true)),
                true
        );

        List<String> lines = renderer.renderLines(table);

        assertEquals(List.of(
                "─".repeat(24),
                "  P    |   ~P   | P v ~P",
                "─".repeat(24),
                "FALSE  |  TRUE  |  TRUE ",
                " TRUE  | FALSE  |  TRUE ",
                TruthTableRenderer.TAUTOLOGY
        ), lines);
    }

    @Test
    @DisplayName("Should size columns on the longest header")
    void shouldUseLongestHeader() {
        TruthTable table = new BasicTruthTableGenerator()
                .buildTable("(P -> Q) <-> (~Q -> ~P)")
                .table().orElseThrow();

        List<String> lines = renderer.renderLines(table);

        // 7 columns of width 19 plus 6 separators
        int expectedWidth = 19 * 7 + 3 * 6;
        assertEquals(expectedWidth, lines.get(0).length());
        for (String line : lines.subList(1, lines.size() - 1)) {
            assertEquals(expectedWidth, line.length(), () -> "Misaligned line: '" + line + "'");
        }
        assertEquals(4 + 4, lines.size());
    }

    @Test
    @DisplayName("Should report a non-tautology")
    void shouldReportNonTautology() {
        TruthTable table = new BasicTruthTableGenerator().buildTable("P -> Q").table().orElseThrow();

        List<String> lines = renderer.renderLines(table);

        assertEquals(TruthTableRenderer.NOT_TAUTOLOGY, lines.get(lines.size() - 1));
        assertTrue(renderer.render(table).startsWith("─"));
    }

    @Test
    @DisplayName("Should put the odd padding space on the right")
    void shouldCenter() {
        assertEquals(" ab  ", TruthTableRenderer.center("ab", 5));
        assertEquals(" ab ", TruthTableRenderer.center("ab", 4));
        assertEquals("toolong", TruthTableRenderer.center("toolong", 3));
    }
}
