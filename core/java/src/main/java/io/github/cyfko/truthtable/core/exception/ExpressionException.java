package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.TruthTableOutcome;

/**
 * Base class of every failure raised while processing a propositional expression.
 * <p>
 * Each subclass maps to one failure status of {@link TruthTableOutcome}, which lets callers
 * of the low-level pipeline catch a single type and still tell the stages apart.
 * </p>
 *
 * <p><strong>Hierarchy:</strong></p>
 * <ul>
 *   <li>{@link LexicalException}: illegal character, raised by the tokenizer</li>
 *   <li>{@link ExpressionSyntaxException}: unbalanced parentheses or rejected input, raised by the converter</li>
 *   <li>{@link EvaluationException}: malformed postfix or unbound variable, raised by the evaluator</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class ExpressionException extends RuntimeException {

    protected ExpressionException(String message) {
        super(message);
    }

    protected ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the outcome status a table build reports for this failure.
     *
     * @return the matching failure status
     */
    public abstract TruthTableOutcome.Status status();
}
