package io.github.cyfko.logicql.core.config;

import java.util.regex.Pattern;

/**
 * Configuration for the statement parser.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the expression (default: unbounded)</li>
 *   <li><strong>variablePattern</strong>: Pattern every variable name must match
 *       (default: {@link PatternConfig#VARIABLE_NAME_PATTERN})</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (no length limit)
 * LogicPolicy policy = LogicPolicy.defaults();
 *
 * // Strict (for untrusted input)
 * LogicPolicy policy = LogicPolicy.strict();
 *
 * // Relaxed (for generated or trusted input)
 * LogicPolicy policy = LogicPolicy.relaxed();
 *
 * // Custom
 * LogicPolicy policy = LogicPolicy.builder()
 *     .maxExpressionLength(20000)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in error messages
 * @param maxExpressionLength maximum character length of expression string
 * @param variablePattern     pattern a variable name candidate must fully match
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record LogicPolicy(
    String policyName,
    int maxExpressionLength,
    Pattern variablePattern
) {

    /**
     * Length limit meaning "no limit".
     */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public LogicPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (variablePattern == null) {
            throw new IllegalArgumentException("variablePattern is required");
        }
    }

    /**
     * Default configuration: any expression length is accepted, so parsing only ever fails on
     * invalid variable names or malformed structure.
     *
     * @return default configuration
     */
    public static LogicPolicy defaults() {
        return new LogicPolicy(PolicyName.DEFAULT_POLICY.name(), UNBOUNDED, PatternConfig.VARIABLE_NAME_PATTERN);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static LogicPolicy strict() {
        return new LogicPolicy(PolicyName.STRICT_POLICY.name(), 1000, PatternConfig.VARIABLE_NAME_PATTERN);
    }

    /**
     * Relaxed configuration for trusted input.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static LogicPolicy relaxed() {
        return new LogicPolicy(PolicyName.RELAXED_POLICY.name(), 10000, PatternConfig.VARIABLE_NAME_PATTERN);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as in {@link #defaults()}.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = UNBOUNDED;
        private Pattern _variablePattern = PatternConfig.VARIABLE_NAME_PATTERN;

        private Builder() {}

        public LogicPolicy build() {
            return new LogicPolicy(_policyName, _maxExpressionLength, _variablePattern);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder variablePattern(Pattern variablePattern) { this._variablePattern = variablePattern; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
