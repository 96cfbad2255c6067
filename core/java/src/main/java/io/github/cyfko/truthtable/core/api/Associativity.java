package io.github.cyfko.truthtable.core.api;

/**
 * Tie-break rule applied by the postfix converter when two operators of equal
 * precedence appear consecutively.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Associativity {
    LEFT,
    RIGHT
}
