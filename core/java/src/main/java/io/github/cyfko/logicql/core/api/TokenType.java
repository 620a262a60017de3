package io.github.cyfko.logicql.core.api;

import io.github.cyfko.logicql.core.config.LogicSymbol;

/**
 * Kinds of lexical units of a logic expression.
 *
 * <table border="1">
 * <caption>Operators</caption>
 * <thead>
 * <tr><th>Type</th><th>Symbol</th><th>Arity</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>NOT</td><td>!</td><td>1</td></tr>
 * <tr><td>AND</td><td>&amp;</td><td>2</td></tr>
 * <tr><td>OR</td><td>|</td><td>2</td></tr>
 * <tr><td>IF_THEN</td><td>-&gt;</td><td>2</td></tr>
 * <tr><td>IFF</td><td>&lt;-&gt;</td><td>2</td></tr>
 * </tbody>
 * </table>
 *
 * <p>All binary operators share a single precedence level and associate from left to right.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    OPEN_PAREN(String.valueOf(LogicSymbol.OPEN_PAREN)),
    CLOSE_PAREN(String.valueOf(LogicSymbol.CLOSE_PAREN)),
    AND(String.valueOf(LogicSymbol.AND)),
    OR(String.valueOf(LogicSymbol.OR)),
    NOT(String.valueOf(LogicSymbol.NOT)),
    IF_THEN(LogicSymbol.IF_THEN),
    IFF(LogicSymbol.IFF),
    VARIABLE(null);

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the textual spelling of the operator, or {@code null} for {@link #VARIABLE}
     */
    public String symbol() {
        return symbol;
    }

    public boolean isBinaryOperator() {
        return this == AND || this == OR || this == IF_THEN || this == IFF;
    }

    /**
     * Applies this binary operator to two operands.
     *
     * @param left  the operand preceding the operator
     * @param right the operand following the operator
     * @return the operator's truth value for the given operands
     * @throws IllegalStateException if this type is not a binary operator
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case AND -> left && right;
            case OR -> left || right;
            case IF_THEN -> !left || right;
            case IFF -> left == right;
            default -> throw new IllegalStateException(name() + " is not a binary operator");
        };
    }
}
