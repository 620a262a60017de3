package io.github.cyfko.logicql.core.exception;

/**
 * Exception thrown when a token sequence does not reduce to exactly one boolean value.
 * <p>
 * Raised during structural verification at parse time, and by the evaluator for token
 * sequences that bypassed verification.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Unbalanced parentheses:</strong> {@code a&((b)}, {@code a)}</li>
 *   <li><strong>Missing operand:</strong> {@code a&}, {@code |b}, {@code !}</li>
 *   <li><strong>Leftover values:</strong> {@code a b}, {@code a(b)}, {@code ()}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MalformedStatementException extends LogicSyntaxException {

    public MalformedStatementException(String message) {
        super(message);
    }

    public MalformedStatementException(String message, Throwable cause) {
        super(message, cause);
    }
}
