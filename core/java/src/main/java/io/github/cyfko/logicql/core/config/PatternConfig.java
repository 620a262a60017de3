package io.github.cyfko.logicql.core.config;

import java.util.regex.Pattern;

/**
 * Patterns used to validate variable names.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class PatternConfig {
    private PatternConfig () {}

    private static final String VARIABLE_FORM = "[a-zA-Z][a-zA-Z0-9_]*";

    /**
     * Pattern for variable names.
     * <p>
     * Matches names that start with an ASCII letter, followed by ASCII letters, digits or underscores.
     * Example valid: "a", "p1", "is_open", "Q_2"
     * Example invalid: "3x", "_tmp", "a.b", "é"
     * </p>
     */
    public static final Pattern VARIABLE_NAME_PATTERN = Pattern.compile("^" + VARIABLE_FORM + "$");
}
