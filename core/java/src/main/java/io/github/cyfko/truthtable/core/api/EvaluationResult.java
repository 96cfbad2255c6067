package io.github.cyfko.truthtable.core.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of evaluating a postfix sequence under one {@link Assignment}.
 *
 * @param value the final value of the whole expression
 * @param trace every step in evaluation order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EvaluationResult(boolean value, List<TraceStep> trace) {

    public EvaluationResult {
        trace = List.copyOf(Objects.requireNonNull(trace, "trace cannot be null"));
    }

    /**
     * Returns the reduction steps only, keyed by label. When a label occurs more than once
     * the first occurrence wins and keeps its position.
     *
     * @return label to value, in order of first appearance
     */
    public Map<String, Boolean> reductions() {
        Map<String, Boolean> byLabel = new LinkedHashMap<>();
        for (TraceStep step : trace) {
            if (step.reduction()) {
                byLabel.putIfAbsent(step.label(), step.value());
            }
        }
        return byLabel;
    }
}
