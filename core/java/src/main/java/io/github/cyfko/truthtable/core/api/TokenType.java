package io.github.cyfko.truthtable.core.api;

/**
 * Lexical category of a {@link Token}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    VARIABLE,
    CONSTANT,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN
}
