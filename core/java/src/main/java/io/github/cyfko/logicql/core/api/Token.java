package io.github.cyfko.logicql.core.api;

import java.util.Objects;

/**
 * An immutable lexical unit: an operator, a parenthesis, or a variable reference.
 * <p>
 * Operator and parenthesis tokens carry no name and are shared through the constants of this
 * class. Variable tokens are created with {@link #variable(String)}.
 * </p>
 *
 * @param type the kind of token
 * @param name the variable name for {@link TokenType#VARIABLE}, {@code null} otherwise
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String name) {

    public static final Token OPEN_PAREN = new Token(TokenType.OPEN_PAREN, null);
    public static final Token CLOSE_PAREN = new Token(TokenType.CLOSE_PAREN, null);
    public static final Token AND = new Token(TokenType.AND, null);
    public static final Token OR = new Token(TokenType.OR, null);
    public static final Token NOT = new Token(TokenType.NOT, null);
    public static final Token IF_THEN = new Token(TokenType.IF_THEN, null);
    public static final Token IFF = new Token(TokenType.IFF, null);

    public Token {
        Objects.requireNonNull(type, "Token type cannot be null");
        if (type == TokenType.VARIABLE && (name == null || name.isEmpty())) {
            throw new IllegalArgumentException("Variable token requires a name");
        }
        if (type != TokenType.VARIABLE && name != null) {
            throw new IllegalArgumentException("Only variable tokens carry a name, got " + type + " with '" + name + "'");
        }
    }

    /**
     * Creates a variable reference token.
     *
     * @param name the variable name
     * @return a new {@link TokenType#VARIABLE} token
     */
    public static Token variable(String name) {
        return new Token(TokenType.VARIABLE, name);
    }

    public boolean isVariable() {
        return type == TokenType.VARIABLE;
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    /**
     * @return the text this token stands for in an expression
     */
    public String text() {
        return isVariable() ? name : type.symbol();
    }

    @Override
    public String toString() {
        return isVariable() ? name : type.name();
    }
}
