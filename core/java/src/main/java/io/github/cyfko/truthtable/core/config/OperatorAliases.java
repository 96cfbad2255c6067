package io.github.cyfko.truthtable.core.config;

import io.github.cyfko.truthtable.core.api.Operator;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Immutable, case-insensitive table of the surface syntax accepted for each {@link Operator}.
 * <p>
 * Both the symbolic forms ({@code ~ ^ or -> <->}) and the operator names
 * ({@code NOT AND OR IMPLIES IFF}) are recognized. Keys are stored in lowercase.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperatorAliases {

    private static final Map<String, Operator> ALIASES;

    static {
        Map<String, Operator> aliases = new LinkedHashMap<>();
        aliases.put("~", Operator.NOT);
        aliases.put("^", Operator.AND);
        aliases.put("or", Operator.OR);
        aliases.put("->", Operator.IMPLIES);
        aliases.put("<->", Operator.IFF);
        for (Operator operator : Operator.values()) {
            aliases.put(operator.name().toLowerCase(Locale.ROOT), operator);
        }
        ALIASES = Map.copyOf(aliases);
    }

    /**
     * Regex alternation of every alias, longest first, so that {@code <->} is never read as
     * {@code <} followed by {@code ->}.
     */
    public static final String ALTERNATION = ALIASES.keySet().stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));

    private OperatorAliases() {}

    /**
     * Resolves an alias to its operator, ignoring case.
     *
     * @param symbol the surface syntax
     * @return the operator, or empty if {@code symbol} is not an alias
     * @throws NullPointerException if {@code symbol} is null
     */
    public static Optional<Operator> lookup(String symbol) {
        return Optional.ofNullable(ALIASES.get(symbol.trim().toLowerCase(Locale.ROOT)));
    }

    public static Map<String, Operator> asMap() {
        return ALIASES;
    }
}
