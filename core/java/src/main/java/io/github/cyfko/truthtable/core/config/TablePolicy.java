package io.github.cyfko.truthtable.core.config;

/**
 * Configuration for truth table generation.
 *
 * <h2>Configurable Settings</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of an expression (default: 1000)</li>
 *   <li><strong>reconvertPerRow</strong>: Re-run infix-to-postfix conversion for every row instead of
 *       converting once per expression (default: false)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default
 * TablePolicy policy = TablePolicy.defaults();
 *
 * // Strict (short expressions, e.g. interactive input)
 * TablePolicy policy = TablePolicy.strict();
 *
 * // Relaxed (statement files from trusted sources)
 * TablePolicy policy = TablePolicy.relaxed();
 *
 * // Custom
 * TablePolicy policy = TablePolicy.builder()
 *     .maxExpressionLength(200)
 *     .reconvertPerRow(true)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in rejection messages
 * @param maxExpressionLength maximum character length of an expression
 * @param reconvertPerRow     whether postfix conversion is repeated for every row
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TablePolicy(
    String policyName,
    int maxExpressionLength,
    boolean reconvertPerRow
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or the length limit is not positive
     */
    public TablePolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Reconvert Per Row: false</li>
     * </ul>
     *
     * @return default configuration
     */
    public static TablePolicy defaults() {
        return new TablePolicy(PolicyName.DEFAULT_POLICY.name(), 1000, false);
    }

    /**
     * Strict configuration for interactive input.
     * <ul>
     *   <li>Max Expression Length: 200 characters</li>
     *   <li>Reconvert Per Row: false</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static TablePolicy strict() {
        return new TablePolicy(PolicyName.STRICT_POLICY.name(), 200, false);
    }

    /**
     * Relaxed configuration for trusted statement files.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Reconvert Per Row: false</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static TablePolicy relaxed() {
        return new TablePolicy(PolicyName.RELAXED_POLICY.name(), 10000, false);
    }

    /**
     * Creates a custom configuration. Builder parameters start from the default values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 1000;
        private boolean _reconvertPerRow = false;

        private Builder() {}

        public TablePolicy build() {
            return new TablePolicy(_policyName, _maxExpressionLength, _reconvertPerRow);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder reconvertPerRow(boolean reconvertPerRow) { this._reconvertPerRow = reconvertPerRow; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
