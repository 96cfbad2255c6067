package io.github.cyfko.truthtable.core.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentTest {

    @Test
    @DisplayName("Should enumerate in counting order with the last variable fastest")
    void shouldEnumerateInCountingOrder() {
        List<Assignment> rows = Assignment.enumerate(List.of(Variable.P, Variable.Q, Variable.R));

        assertEquals(8, rows.size());
        assertEquals(Map.of(Variable.P, false, Variable.Q, false, Variable.R, false), rows.get(0).asMap());
        assertEquals(Map.of(Variable.P, false, Variable.Q, false, Variable.R, true), rows.get(1).asMap());
        assertEquals(Map.of(Variable.P, false, Variable.Q, true, Variable.R, false), rows.get(2).asMap());
        assertEquals(Map.of(Variable.P, true, Variable.Q, false, Variable.R, false), rows.get(4).asMap());
        assertEquals(Map.of(Variable.P, true, Variable.Q, true, Variable.R, true), rows.get(7).asMap());
    }

    @Test
    @DisplayName("Should follow the given column order, not the enum order")
    void shouldFollowColumnOrder() {
        List<Assignment> rows = Assignment.enumerate(List.of(Variable.R, Variable.P));
        assertEquals(Optional.of(true), rows.get(1).valueOf(Variable.P));
        assertEquals(Optional.of(false), rows.get(1).valueOf(Variable.R));
    }

    @Test
    @DisplayName("Should produce a single empty assignment for no variables")
    void shouldHandleNoVariables() {
        List<Assignment> rows = Assignment.enumerate(List.of());
        assertEquals(1, rows.size());
        assertTrue(rows.get(0).variables().isEmpty());
    }

    @Test
    @DisplayName("Should copy its input and stay immutable")
    void shouldBeImmutable() {
        Map<Variable, Boolean> source = new HashMap<>();
        source.put(Variable.P, true);
        Assignment assignment = Assignment.of(source);

        source.put(Variable.Q, false);

        assertEquals(Optional.empty(), assignment.valueOf(Variable.Q));
        assertThrows(UnsupportedOperationException.class, () -> assignment.asMap().put(Variable.R, true));
    }

    @Test
    @DisplayName("Should reject null values")
    void shouldRejectNullValues() {
        Map<Variable, Boolean> source = new HashMap<>();
        source.put(Variable.P, null);
        assertThrows(NullPointerException.class, () -> Assignment.of(source));
    }

    @Test
    @DisplayName("Should compare by value")
    void shouldCompareByValue() {
        Assignment first = Assignment.of(Map.of(Variable.P, true));
        Assignment second = Assignment.enumerate(List.of(Variable.P)).get(1);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }
}
