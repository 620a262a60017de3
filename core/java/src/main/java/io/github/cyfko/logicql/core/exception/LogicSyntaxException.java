package io.github.cyfko.logicql.core.exception;

import io.github.cyfko.logicql.core.api.LogicParser;

/**
 * Base exception for logic expressions that cannot be turned into a statement.
 * <p>
 * Thrown directly for input rejected before tokenization (null text, text longer than the
 * configured policy allows). The two structural failure kinds have their own subclasses so
 * that callers can tell them apart:
 * </p>
 * <ul>
 *   <li>{@link InvalidVariableNameException}: one or more names break the naming rule</li>
 *   <li>{@link MalformedStatementException}: unbalanced parentheses, missing operands or leftover values</li>
 * </ul>
 *
 * <pre>{@code
 * try {
 *     Statement statement = parser.parse(userInput);
 * } catch (InvalidVariableNameException e) {
 *     show("Bad names: " + e.getInvalidNames());
 * } catch (LogicSyntaxException e) {
 *     show("Invalid expression: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see LogicParser
 */
public class LogicSyntaxException extends RuntimeException {

    /**
     * @param message the message describing the cause of the exception
     */
    public LogicSyntaxException(String message) {
        super(message);
    }

    /**
     * @param message the message describing the cause of the exception
     * @param cause   the underlying cause of this exception
     */
    public LogicSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
