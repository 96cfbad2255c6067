package io.github.cyfko.truthtable.core.api;

import java.util.List;
import java.util.Objects;

/**
 * Structured truth table: ordered column headers, one row of booleans per assignment, and
 * the tautology verdict.
 * <p>
 * Headers start with the referenced variables in alphabetical order, followed by the distinct
 * sub-expression labels in order of first appearance. Every row has exactly one value per
 * header. Rendering (column widths, centering) is left to the caller.
 * </p>
 *
 * @param expression the expression the table was built from, as supplied
 * @param variables  the variables referenced by the expression, in column order
 * @param headers    all column headers
 * @param rows       row values aligned to {@code headers}
 * @param tautology  true iff the expression is true in every row
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTable(
        String expression,
        List<Variable> variables,
        List<String> headers,
        List<List<Boolean>> rows,
        boolean tautology
) {

    public TruthTable {
        Objects.requireNonNull(expression, "expression cannot be null");
        variables = List.copyOf(Objects.requireNonNull(variables, "variables cannot be null"));
        headers = List.copyOf(Objects.requireNonNull(headers, "headers cannot be null"));
        rows = Objects.requireNonNull(rows, "rows cannot be null").stream()
                .map(List::copyOf)
                .toList();

        for (List<Boolean> row : rows) {
            if (row.size() != headers.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row has %d values but table has %d headers", row.size(), headers.size()));
            }
        }
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * Returns the values of one column, top to bottom.
     *
     * @param header the column header
     * @return the column values
     * @throws IllegalArgumentException if no column has this header
     */
    public List<Boolean> column(String header) {
        int index = headers.indexOf(header);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column '" + header + "'. Available columns: " + headers);
        }
        return rows.stream().map(row -> row.get(index)).toList();
    }

    /**
     * Returns the values of the last column, which holds the whole expression.
     *
     * @return the final value of every row
     */
    public List<Boolean> finalColumn() {
        return column(headers.get(headers.size() - 1));
    }
}
