package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.EvaluationResult;
import io.github.cyfko.truthtable.core.api.Operator;
import io.github.cyfko.truthtable.core.api.Token;
import io.github.cyfko.truthtable.core.api.TraceStep;
import io.github.cyfko.truthtable.core.api.Variable;
import io.github.cyfko.truthtable.core.exception.EvaluationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates a postfix token sequence under an {@link Assignment} in a single pass, recording
 * a label and a value for every step.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * For each token in postfix order:
 *   - VARIABLE / CONSTANT: push (name, value)
 *   - NOT: pop a, push ("~" + a.label, !a.value)
 *   - binary op: pop b, pop a, push (a.label + " " + glyph + " " + b.label, a op b)
 *
 * Stack must contain exactly ONE entry at the end.
 * </pre>
 * <p>
 * Labels are structural: the same sub-expression always yields the same label, which is what
 * lets the table generator use them as column identifiers. Labels carry no parentheses, so
 * {@code (P or Q) ^ R} and {@code P or (Q ^ R)} share the label {@code P v Q ^ R}.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is stateless and thread-safe. All methods are static and reentrant.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see InfixToPostfixConverter
 */
public final class PostfixEvaluator {

    private PostfixEvaluator() {
        // Utility class - prevent instantiation
    }

    /**
     * Evaluates a postfix sequence.
     *
     * @param postfixTokens tokens in postfix order, as produced by {@link InfixToPostfixConverter}
     * @param assignment    values for every variable referenced by {@code postfixTokens}
     * @return the final value and the ordered trace of operand and reduction steps
     * @throws EvaluationException  if an operator lacks operands, the final stack does not hold
     *                              exactly one value, or a variable is unbound
     * @throws NullPointerException if any argument is null
     */
    public static EvaluationResult evaluate(List<Token> postfixTokens, Assignment assignment) {
        Objects.requireNonNull(postfixTokens, "postfixTokens cannot be null");
        Objects.requireNonNull(assignment, "assignment cannot be null");

        Deque<TraceStep> stack = new ArrayDeque<>();
        List<TraceStep> trace = new ArrayList<>(postfixTokens.size());

        for (Token token : postfixTokens) {
            TraceStep step = switch (token.type()) {
                case VARIABLE -> {
                    Variable variable = token.variable();
                    boolean value = assignment.valueOf(variable).orElseThrow(() -> new EvaluationException(String.format(
                            "Expression references variable '%s' which is not bound by %s", variable, assignment
                    )));
                    yield TraceStep.operand(variable.name(), value);
                }

                case CONSTANT -> TraceStep.operand(token.text(), token.constantValue());

                case OPERATOR -> reduce(token.operator(), stack);

                case LEFT_PAREN, RIGHT_PAREN -> throw new EvaluationException(
                        "Malformed postfix expression: unexpected parenthesis '" + token.text() + "'");
            };

            stack.push(step);
            trace.add(step);
        }

        if (stack.isEmpty()) {
            throw new EvaluationException(
                "Malformed postfix expression: evaluation resulted in empty stack. " +
                "Expression may contain no operands."
            );
        }

        if (stack.size() > 1) {
            throw new EvaluationException(String.format(
                "Malformed postfix expression: evaluation resulted in %d values on stack (expected 1). " +
                "Expression may have too many operands or missing operators.",
                stack.size()
            ));
        }

        return new EvaluationResult(stack.pop().value(), trace);
    }

    private static TraceStep reduce(Operator operator, Deque<TraceStep> stack) {
        if (stack.size() < operator.getArity()) {
            throw new EvaluationException(String.format(
                "Malformed postfix expression: %s operator (%s) requires %d operand(s). " +
                "Stack contains only %d value(s).",
                operator, operator.getGlyph(), operator.getArity(), stack.size()
            ));
        }

        if (operator.isUnary()) {
            TraceStep operand = stack.pop();
            return TraceStep.reduction(operator.getGlyph() + operand.label(), operator.apply(operand.value()));
        }

        TraceStep right = stack.pop();
        TraceStep left = stack.pop();
        return TraceStep.reduction(
                left.label() + " " + operator.getGlyph() + " " + right.label(),
                operator.apply(left.value(), right.value())
        );
    }
}
