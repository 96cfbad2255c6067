package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.TruthTableOutcome;

/**
 * Exception thrown when a postfix sequence cannot be evaluated.
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Missing operands:</strong> an operator finds fewer values on the stack than its arity ({@code P ^})</li>
 *   <li><strong>Missing operators:</strong> more than one value remains at the end ({@code P Q})</li>
 *   <li><strong>Empty expression:</strong> nothing to evaluate ({@code ()})</li>
 *   <li><strong>Unbound variable:</strong> the assignment has no value for a referenced variable</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EvaluationException extends ExpressionException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public TruthTableOutcome.Status status() {
        return TruthTableOutcome.Status.EVAL_ERROR;
    }
}
