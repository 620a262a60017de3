package io.github.cyfko.logicql.core.exception;

/**
 * Exception thrown when statements are combined from arguments that are neither expression
 * strings nor parsed {@link io.github.cyfko.logicql.core.api.Statement} instances.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.logicql.core.SymbolicLogic#combine(Object, Object)
 */
public class StatementTypeMismatchException extends RuntimeException {

    public StatementTypeMismatchException(String message) {
        super(message);
    }
}
