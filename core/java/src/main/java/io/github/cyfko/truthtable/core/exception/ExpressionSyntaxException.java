package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.TruthTableOutcome;

/**
 * Exception thrown when an expression is structurally rejected before evaluation.
 * <p>
 * Raised for unbalanced parentheses, and for input the active
 * {@link io.github.cyfko.truthtable.core.config.TablePolicy} refuses as too long.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * converter.toPostfix(tokenize("(P ^ Q"));
 * // → "Mismatched parentheses: unmatched '('"
 *
 * converter.toPostfix(tokenize("P ^ Q)"));
 * // → "Mismatched parentheses: unmatched ')'"
 *
 * tokenize("P ^ Q ^ R ^ P", TablePolicy.builder().maxExpressionLength(5).build());
 * // → "Expression too long (13 characters, max: 5). Policy applied: CUSTOM_POLICY"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ExpressionSyntaxException extends ExpressionException {

    /**
     * @param message the message describing the structural problem
     */
    public ExpressionSyntaxException(String message) {
        super(message);
    }

    /**
     * @param message the message describing the structural problem
     * @param cause   the original cause of this exception
     */
    public ExpressionSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public TruthTableOutcome.Status status() {
        return TruthTableOutcome.Status.SYNTAX_ERROR;
    }
}
