package io.github.cyfko.truthtable.core.api;

import java.util.Objects;

/**
 * Immutable lexical token produced by the tokenizer and consumed by the postfix converter
 * and evaluator.
 * <p>
 * The {@code text} is always the canonical uppercase form: a variable name ("P"), a constant
 * ("TRUE"/"FALSE"), an operator name ("IMPLIES") or a parenthesis. Instances are created
 * through the static factories, which keep {@code type} and {@code text} consistent.
 * </p>
 *
 * @param type the lexical category
 * @param text the canonical text of the token
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String text) {

    public static final String TRUE = "TRUE";
    public static final String FALSE = "FALSE";

    private static final Token LEFT_PAREN = new Token(TokenType.LEFT_PAREN, "(");
    private static final Token RIGHT_PAREN = new Token(TokenType.RIGHT_PAREN, ")");

    public Token {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
    }

    public static Token variable(Variable variable) {
        return new Token(TokenType.VARIABLE, variable.name());
    }

    public static Token constant(boolean value) {
        return new Token(TokenType.CONSTANT, value ? TRUE : FALSE);
    }

    public static Token operator(Operator operator) {
        return new Token(TokenType.OPERATOR, operator.name());
    }

    public static Token leftParen() {
        return LEFT_PAREN;
    }

    public static Token rightParen() {
        return RIGHT_PAREN;
    }

    /**
     * Returns the operator this token stands for.
     *
     * @return the operator
     * @throws IllegalStateException if this token is not an operator
     */
    public Operator operator() {
        requireType(TokenType.OPERATOR);
        return Operator.valueOf(text);
    }

    /**
     * Returns the variable this token references.
     *
     * @return the variable
     * @throws IllegalStateException if this token is not a variable
     */
    public Variable variable() {
        requireType(TokenType.VARIABLE);
        return Variable.valueOf(text);
    }

    /**
     * Returns the literal value of a constant token.
     *
     * @return true for TRUE, false for FALSE
     * @throws IllegalStateException if this token is not a constant
     */
    public boolean constantValue() {
        requireType(TokenType.CONSTANT);
        return TRUE.equals(text);
    }

    private void requireType(TokenType expected) {
        if (type != expected) {
            throw new IllegalStateException("Token '" + text + "' is a " + type + ", not a " + expected);
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
