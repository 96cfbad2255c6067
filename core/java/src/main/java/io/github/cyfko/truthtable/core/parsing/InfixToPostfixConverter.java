package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Associativity;
import io.github.cyfko.truthtable.core.api.Operator;
import io.github.cyfko.truthtable.core.api.Token;
import io.github.cyfko.truthtable.core.api.TokenType;
import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Infix to postfix (Reverse Polish) converter based on the shunting-yard algorithm.
 * <p>
 * Precedence and associativity come from {@link Operator}:
 * </p>
 * <ul>
 *   <li>NOT: precedence 3, right associative, so {@code ~~P} stacks both negations</li>
 *   <li>AND, OR: precedence 2, left associative</li>
 *   <li>IMPLIES, IFF: precedence 1, left associative</li>
 * </ul>
 * <p>
 * Only parenthesis balance is validated. Operand/operator mismatches such as {@code P ^} pass
 * through unchanged and are reported by {@link PostfixEvaluator}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> postfix = InfixToPostfixConverter.toPostfix(Tokenizer.tokenize("(P or Q) ^ ~R"));
 * // [P, Q, OR, R, NOT, AND]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class InfixToPostfixConverter {

    private InfixToPostfixConverter() {}

    /**
     * Converts an infix token sequence to postfix order.
     *
     * @param tokens tokens in infix order, as produced by {@link Tokenizer}
     * @return the postfix sequence, without parentheses
     * @throws ExpressionSyntaxException if the parentheses are unbalanced
     * @throws NullPointerException      if {@code tokens} is null
     */
    public static List<Token> toPostfix(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens cannot be null");

        List<Token> output = new ArrayList<>(tokens.size());
        Deque<Token> operators = new ArrayDeque<>();

        for (Token token : tokens) {
            switch (token.type()) {
                case VARIABLE, CONSTANT -> output.add(token);

                case OPERATOR -> {
                    Operator op = token.operator();
                    while (!operators.isEmpty() && shouldPopBefore(op, operators.peek())) {
                        output.add(operators.pop());
                    }
                    operators.push(token);
                }

                case LEFT_PAREN -> operators.push(token);

                case RIGHT_PAREN -> {
                    while (!operators.isEmpty() && operators.peek().type() != TokenType.LEFT_PAREN) {
                        output.add(operators.pop());
                    }
                    if (operators.isEmpty()) {
                        throw new ExpressionSyntaxException("Mismatched parentheses: unmatched ')'");
                    }
                    operators.pop();
                }
            }
        }

        while (!operators.isEmpty()) {
            Token top = operators.pop();
            if (top.type() == TokenType.LEFT_PAREN) {
                throw new ExpressionSyntaxException("Mismatched parentheses: unmatched '('");
            }
            output.add(top);
        }

        return output;
    }

    private static boolean shouldPopBefore(Operator incoming, Token stackTop) {
        if (stackTop.type() != TokenType.OPERATOR) return false;
        int stackPrecedence = stackTop.operator().getPrecedence();

        return incoming.getAssociativity() == Associativity.LEFT
                ? incoming.getPrecedence() <= stackPrecedence
                : incoming.getPrecedence() < stackPrecedence;
    }
}
