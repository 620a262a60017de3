package io.github.cyfko.logicql.core.exception;

import java.util.List;

/**
 * Exception thrown when an expression contains variable names that break the naming rule.
 * <p>
 * A name must start with an ASCII letter and contain only ASCII letters, digits and
 * underscores. Tokenization does not stop at the first bad name: every offending name of the
 * expression is collected, in order of appearance, and reported by {@link #getInvalidNames()}.
 * </p>
 *
 * <pre>{@code
 * parser.parse("3x & y | @q");
 * // → "Invalid variable names: [3x, @q]"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InvalidVariableNameException extends LogicSyntaxException {

    private final List<String> invalidNames;

    /**
     * @param invalidNames every invalid name found, in order of appearance; must not be empty
     * @throws IllegalArgumentException if {@code invalidNames} is null or empty
     */
    public InvalidVariableNameException(List<String> invalidNames) {
        super("Invalid variable names: " + invalidNames);
        if (invalidNames == null || invalidNames.isEmpty()) {
            throw new IllegalArgumentException("At least one invalid name is required");
        }
        this.invalidNames = List.copyOf(invalidNames);
    }

    /**
     * @return the rejected names, in order of appearance
     */
    public List<String> getInvalidNames() {
        return invalidNames;
    }
}
