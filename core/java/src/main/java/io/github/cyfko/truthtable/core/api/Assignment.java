package io.github.cyfko.truthtable.core.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from variables to boolean values, one per truth table row.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * List<Assignment> rows = Assignment.enumerate(List.of(Variable.P, Variable.Q));
 * // P=false,Q=false / P=false,Q=true / P=true,Q=false / P=true,Q=true
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Assignment {

    private final Map<Variable, Boolean> values;

    private Assignment(Map<Variable, Boolean> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Creates an assignment from the given values.
     *
     * @param values variable values, copied
     * @return the assignment
     * @throws NullPointerException if {@code values} or any of its entries is {@code null}
     */
    public static Assignment of(Map<Variable, Boolean> values) {
        Objects.requireNonNull(values, "values cannot be null");
        EnumMap<Variable, Boolean> copy = new EnumMap<>(Variable.class);
        values.forEach((variable, value) -> copy.put(
                Objects.requireNonNull(variable, "variable cannot be null"),
                Objects.requireNonNull(value, "value cannot be null")));
        return new Assignment(copy);
    }

    /**
     * Enumerates all {@code 2^k} assignments over {@code variables}, counting from all-false
     * to all-true with the last variable varying fastest.
     *
     * @param variables the variables in column order
     * @return the assignments in row order; a single empty assignment when {@code variables} is empty
     */
    public static List<Assignment> enumerate(List<Variable> variables) {
        Objects.requireNonNull(variables, "variables cannot be null");
        int k = variables.size();
        int rowCount = 1 << k;
        List<Assignment> rows = new ArrayList<>(rowCount);

        for (int row = 0; row < rowCount; row++) {
            EnumMap<Variable, Boolean> values = new EnumMap<>(Variable.class);
            for (int column = 0; column < k; column++) {
                int bit = k - 1 - column;
                values.put(variables.get(column), ((row >> bit) & 1) == 1);
            }
            rows.add(new Assignment(values));
        }
        return rows;
    }

    /**
     * Returns the value bound to {@code variable}.
     *
     * @param variable the variable to look up
     * @return the value, or empty if the variable is not bound
     */
    public Optional<Boolean> valueOf(Variable variable) {
        return Optional.ofNullable(values.get(variable));
    }

    public Set<Variable> variables() {
        return values.keySet();
    }

    public Map<Variable, Boolean> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Assignment" + values;
    }
}
