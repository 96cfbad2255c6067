package io.github.cyfko.truthtable.core.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Tagged result of building a truth table.
 * <p>
 * Either a fully formed {@link TruthTable} ({@link Status#TABLE}) or a status describing why no
 * table was produced, together with a message. Partial tables are never returned.
 * </p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * TruthTableOutcome outcome = generator.buildTable("P -> Q");
 * if (outcome.isTable()) {
 *     render(outcome.table().orElseThrow());
 * } else {
 *     System.out.println("Error: " + outcome.message());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTableOutcome {

    /**
     * Reason an outcome does or does not carry a table.
     */
    public enum Status {
        /** A table was built. */
        TABLE,
        /** The expression references none of the variables; not an error. */
        NO_VARIABLES,
        /** The expression contains an illegal character. */
        LEX_ERROR,
        /** The expression has unbalanced parentheses or is otherwise rejected before evaluation. */
        SYNTAX_ERROR,
        /** The postfix form could not be evaluated. */
        EVAL_ERROR
    }

    public static final String NO_VARIABLES_MESSAGE = "No valid variables (P, Q, R) found in the statement.";

    private final Status status;
    private final TruthTable table;
    private final String message;

    private TruthTableOutcome(Status status, TruthTable table, String message) {
        this.status = status;
        this.table = table;
        this.message = message;
    }

    public static TruthTableOutcome table(TruthTable table) {
        return new TruthTableOutcome(Status.TABLE, Objects.requireNonNull(table, "table cannot be null"), null);
    }

    public static TruthTableOutcome noVariables() {
        return new TruthTableOutcome(Status.NO_VARIABLES, null, NO_VARIABLES_MESSAGE);
    }

    /**
     * Creates an outcome for a failed build.
     *
     * @param status  the failure status, anything but {@link Status#TABLE}
     * @param message description of the failure
     * @return the failed outcome
     * @throws IllegalArgumentException if {@code status} is {@link Status#TABLE}
     */
    public static TruthTableOutcome failure(Status status, String message) {
        Objects.requireNonNull(status, "status cannot be null");
        if (status == Status.TABLE) {
            throw new IllegalArgumentException("A failure outcome cannot carry the TABLE status");
        }
        return new TruthTableOutcome(status, null, message);
    }

    public Status status() {
        return status;
    }

    public boolean isTable() {
        return status == Status.TABLE;
    }

    /**
     * Indicates whether the outcome is an error, as opposed to a table or the
     * {@link Status#NO_VARIABLES} condition.
     *
     * @return true for LEX_ERROR, SYNTAX_ERROR and EVAL_ERROR
     */
    public boolean isError() {
        return status != Status.TABLE && status != Status.NO_VARIABLES;
    }

    public Optional<TruthTable> table() {
        return Optional.ofNullable(table);
    }

    /**
     * Returns the message associated with a non-table outcome.
     *
     * @return the message, or null for a table outcome
     */
    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return isTable()
                ? "TruthTableOutcome[status=TABLE, rows=" + table.rowCount() + ", tautology=" + table.tautology() + "]"
                : "TruthTableOutcome[status=" + status + ", message=" + message + "]";
    }
}
