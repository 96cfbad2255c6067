package io.github.cyfko.truthtable.core.api;

import java.util.Objects;

/**
 * One (label, value) pair recorded by the postfix evaluator.
 * <p>
 * Operand steps ({@code reduction == false}) record a variable or constant as it is pushed;
 * reduction steps record the result of applying an operator and become truth table columns.
 * </p>
 *
 * @param label     structural label of the sub-expression, e.g. "~P" or "P ^ Q"
 * @param value     the value computed for the current assignment
 * @param reduction whether this step applied an operator
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TraceStep(String label, boolean value, boolean reduction) {

    public TraceStep {
        Objects.requireNonNull(label, "label cannot be null");
    }

    public static TraceStep operand(String label, boolean value) {
        return new TraceStep(label, value, false);
    }

    public static TraceStep reduction(String label, boolean value) {
        return new TraceStep(label, value, true);
    }
}
