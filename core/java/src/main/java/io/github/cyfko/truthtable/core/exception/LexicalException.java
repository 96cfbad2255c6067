package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.TruthTableOutcome;

/**
 * Exception thrown when an expression contains a character that is not part of the
 * expression language.
 * <p>
 * Legal input consists of parentheses, operator glyphs and words, the variables P, Q and R,
 * the constants TRUE and FALSE, and whitespace. Anything else is rejected with the offending
 * character and its zero-based position:
 * </p>
 * <pre>{@code
 * tokenizer.tokenize("P & Q");
 * // → "Unexpected character '&' at position 2"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LexicalException extends ExpressionException {

    private final char character;
    private final int position;

    /**
     * Creates an exception for an illegal character.
     *
     * @param character the rejected character
     * @param position  zero-based index of the character in the input
     */
    public LexicalException(char character, int position) {
        super(String.format("Unexpected character '%s' at position %d", character, position));
        this.character = character;
        this.position = position;
    }

    public char getCharacter() {
        return character;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public TruthTableOutcome.Status status() {
        return TruthTableOutcome.Status.LEX_ERROR;
    }
}
