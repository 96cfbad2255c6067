package io.github.cyfko.truthtable.console;

import io.github.cyfko.truthtable.core.api.TruthTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Formats a {@link TruthTable} as fixed-width text.
 * <p>
 * Every column has the same width: the longest header, or the width of {@code FALSE} if that is
 * wider. Headers and cells are centered within it and columns are separated by {@code " | "}.
 * The header line is framed above and below by a horizontal rule spanning the whole table.
 * </p>
 *
 * <pre>{@code
 * ────────────────────────
 *   P    |   ~P   | P v ~P
 * ────────────────────────
 * FALSE  |  TRUE  |  TRUE
 *  TRUE  | FALSE  |  TRUE
 * The statement is a tautology.
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TruthTableRenderer {

    static final String SEPARATOR = " | ";
    static final char RULE = '─';
    static final String TAUTOLOGY = "The statement is a tautology.";
    static final String NOT_TAUTOLOGY = "The statement is not a tautology.";

    private static final int MIN_WIDTH = "FALSE".length();

    /**
     * Renders the table, one line per element of the returned list.
     *
     * @param table the table to render
     * @return the rule, header, rule, data rows and verdict lines
     */
    public List<String> renderLines(TruthTable table) {
        Objects.requireNonNull(table, "table cannot be null");

        List<String> headers = table.headers();
        int width = headers.stream().mapToInt(String::length).max().orElse(0);
        width = Math.max(width, MIN_WIDTH);
        int columns = headers.size();
        String rule = String.valueOf(RULE).repeat(width * columns + SEPARATOR.length() * (columns - 1));

        List<String> lines = new ArrayList<>(table.rowCount() + 4);
        lines.add(rule);
        lines.add(joinCentered(headers, width));
        lines.add(rule);
        for (List<Boolean> row : table.rows()) {
            lines.add(joinCentered(row.stream().map(value -> value ? "TRUE" : "FALSE").toList(), width));
        }
        lines.add(table.tautology() ? TAUTOLOGY : NOT_TAUTOLOGY);
        return lines;
    }

    public String render(TruthTable table) {
        return String.join(System.lineSeparator(), renderLines(table));
    }

    private static String joinCentered(List<String> cells, int width) {
        return cells.stream()
                .map(cell -> center(cell, width))
                .collect(Collectors.joining(SEPARATOR));
    }

    /**
     * Pads {@code text} on both sides to {@code width}; the odd space goes to the right.
     * Text longer than {@code width} is returned unchanged.
     */
    static String center(String text, int width) {
        int padding = width - text.length();
        if (padding <= 0) {
            return text;
        }
        int left = padding / 2;
        return " ".repeat(left) + text + " ".repeat(padding - left);
    }
}
