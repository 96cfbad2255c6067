package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.config.OperatorAliases;

import java.util.Optional;

/**
 * Enumeration of the propositional connectives understood by the truth table generator.
 * <p>
 * Each operator carries everything the pipeline needs to know about it: its arity, its
 * precedence and associativity (consumed by the postfix converter), the glyph used when
 * building sub-expression labels, and its boolean function (consumed by the evaluator).
 * </p>
 *
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Input aliases</th><th>Glyph</th><th>Precedence</th><th>Associativity</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>NOT</td><td>~, NOT</td><td>~</td><td>3</td><td>Right</td></tr>
 * <tr><td>AND</td><td>^, AND</td><td>^</td><td>2</td><td>Left</td></tr>
 * <tr><td>OR</td><td>or, OR</td><td>v</td><td>2</td><td>Left</td></tr>
 * <tr><td>IMPLIES</td><td>-&gt;, IMPLIES</td><td>-&gt;</td><td>1</td><td>Left</td></tr>
 * <tr><td>IFF</td><td>&lt;-&gt;, IFF</td><td>&lt;-&gt;</td><td>1</td><td>Left</td></tr>
 * </tbody>
 * </table>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * Operator op = Operator.fromSymbol("->").orElseThrow();
 * boolean result = op.apply(true, false);   // false
 * String label = "P " + op.getGlyph() + " Q"; // "P -> Q"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Operator {

    /** Negation: "~" */
    NOT(1, 3, Associativity.RIGHT, "~"),

    /** Conjunction: "^" */
    AND(2, 2, Associativity.LEFT, "^"),

    /** Disjunction: displayed as "v" */
    OR(2, 2, Associativity.LEFT, "v"),

    /** Material implication: "->" */
    IMPLIES(2, 1, Associativity.LEFT, "->"),

    /** Biconditional: "<->" */
    IFF(2, 1, Associativity.LEFT, "<->");

    private final int arity;
    private final int precedence;
    private final Associativity associativity;
    private final String glyph;

    Operator(int arity, int precedence, Associativity associativity, String glyph) {
        this.arity = arity;
        this.precedence = precedence;
        this.associativity = associativity;
        this.glyph = glyph;
    }

    /**
     * Returns the number of operands this operator consumes (1 for NOT, 2 otherwise).
     *
     * @return the operator arity
     */
    public int getArity() {
        return arity;
    }

    /**
     * Returns the binding strength; higher values bind first.
     *
     * @return the precedence level
     */
    public int getPrecedence() {
        return precedence;
    }

    public Associativity getAssociativity() {
        return associativity;
    }

    /**
     * Returns the display glyph used when composing sub-expression labels.
     *
     * @return the glyph, e.g. "^" for AND or "v" for OR
     */
    public String getGlyph() {
        return glyph;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    /**
     * Applies this operator to a single operand.
     *
     * @param operand the operand value
     * @return the negated value
     * @throws UnsupportedOperationException if this operator is binary
     */
    public boolean apply(boolean operand) {
        if (this != NOT) {
            throw new UnsupportedOperationException(name() + " is a binary operator");
        }
        return !operand;
    }

    /**
     * Applies this operator to two operands.
     *
     * @param left  the left operand value
     * @param right the right operand value
     * @return the result of {@code left op right}
     * @throws UnsupportedOperationException if this operator is unary
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case AND -> left && right;
            case OR -> left || right;
            case IMPLIES -> !left || right;
            case IFF -> left == right;
            case NOT -> throw new UnsupportedOperationException("NOT is a unary operator");
        };
    }

    /**
     * Finds an {@code Operator} by one of its input aliases, ignoring case.
     *
     * @param symbol surface syntax such as "~", "or", "IMPLIES" or "&lt;-&gt;"
     * @return the matching operator, or empty if the symbol is not an operator alias
     * @throws NullPointerException if {@code symbol} is {@code null}
     */
    public static Optional<Operator> fromSymbol(String symbol) {
        return OperatorAliases.lookup(symbol);
    }
}
