package io.github.cyfko.truthtable.core.config;

/**
 * Configuration for the postfix cache of a truth table generator.
 * <p>
 * When enabled, the postfix form of each distinct expression is kept in a bounded LRU cache,
 * so that tabulating the same statement twice skips tokenization and conversion.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CachePolicy policy = CachePolicy.defaults();   // enabled, 256 entries
 * CachePolicy policy = CachePolicy.none();       // disabled
 * CachePolicy policy = CachePolicy.custom(32);   // enabled, 32 entries
 * }</pre>
 *
 * @param cacheEnabled whether postfix sequences are cached
 * @param cacheSize    maximum number of cached expressions
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    /**
     * Canonical constructor with validation.
     */
    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    /**
     * Default configuration: cache enabled with 256 entries.
     *
     * @return default configuration
     */
    public static CachePolicy defaults() {
        return new CachePolicy(
                true,   // cacheEnabled
                256     // cacheSize
        );
    }

    /**
     * No cache configuration: every build tokenizes and converts its expression.
     *
     * @return a CachePolicy with caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
