package io.github.cyfko.tgrep.core.config;

/**
 * Configuration of the query compiler's complexity limits.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxQueryLength</strong>: maximum character length of the query text (default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: maximum depth of nested parentheses and brackets (default: 64).
 *       The grammar is recursive, so this bounds the parser's stack usage.</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * QueryPolicy policy = QueryPolicy.defaults();
 *
 * // Strict (for queries typed by untrusted users)
 * QueryPolicy policy = QueryPolicy.strict();
 *
 * // Relaxed (for generated or curated query sets)
 * QueryPolicy policy = QueryPolicy.relaxed();
 *
 * // Custom
 * QueryPolicy policy = QueryPolicy.builder()
 *     .maxQueryLength(20000)
 *     .build();
 * }</pre>
 *
 * @param policyName      name reported in limit violations
 * @param maxQueryLength  maximum character length of the query text
 * @param maxNestingDepth maximum nesting of {@code ( )} and {@code [ ]}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record QueryPolicy(
    String policyName,
    int maxQueryLength,
    int maxNestingDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or a limit is not positive
     */
    public QueryPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxQueryLength <= 0) {
            throw new IllegalArgumentException("maxQueryLength must be positive, got: " + maxQueryLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Query Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 64</li>
     * </ul>
     *
     * @return default configuration
     */
    public static QueryPolicy defaults() {
        return new QueryPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 64);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Query Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 16</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static QueryPolicy strict() {
        return new QueryPolicy(PolicyName.STRICT_POLICY.name(), 1000, 16);
    }

    /**
     * Relaxed configuration for trusted, possibly generated, queries.
     * <ul>
     *   <li>Max Query Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 256</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static QueryPolicy relaxed() {
        return new QueryPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 256);
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
        private int _maxQueryLength = 5000;
        private int _maxNestingDepth = 64;

        private Builder() {}

        public QueryPolicy build() {
            return new QueryPolicy(_policyName, _maxQueryLength, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxQueryLength(int maxQueryLength) { this._maxQueryLength = maxQueryLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
