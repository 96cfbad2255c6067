package io.github.cyfko.truthtable.core.api;

/**
 * The fixed set of propositional variables an expression may reference.
 * <p>
 * Declaration order is alphabetical and is relied upon for deterministic column order:
 * an {@link java.util.EnumSet} of variables iterates P, Q, R.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Variable {
    P,
    Q,
    R
}
