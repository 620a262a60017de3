package io.github.cyfko.logicql.core.api;

import io.github.cyfko.logicql.core.model.VariableRegistry;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A parsed logic expression: its token sequence together with the variables it references.
 * <p>
 * The token sequence is always wrapped in an outer pair of parentheses, so that the whole
 * expression forms a single group. Statements are immutable: evaluation and truth table
 * generation work on copies of the registry returned by {@link #registry()}, which makes a
 * statement safe to share between threads.
 * </p>
 *
 * <p>Statements are obtained from a {@link LogicParser} or by combining existing statements with
 * {@link #or(Statement)}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Statement {

    private final List<Token> tokens;
    private final VariableRegistry registry;

    /**
     * Creates a statement from an already verified token sequence.
     * <p>
     * The registry must declare exactly the variables referenced by the tokens. Well-formedness of
     * the sequence itself is not checked here.
     * </p>
     *
     * @param tokens   the token sequence, starting with {@link Token#OPEN_PAREN} and ending with {@link Token#CLOSE_PAREN}
     * @param registry the variables referenced by the tokens
     * @throws IllegalArgumentException if the sequence is not wrapped or the registry does not match the tokens
     */
    public Statement(List<Token> tokens, VariableRegistry registry) {
        Objects.requireNonNull(tokens, "Tokens cannot be null");
        Objects.requireNonNull(registry, "Registry cannot be null");

        if (tokens.size() < 2 || !tokens.get(0).is(TokenType.OPEN_PAREN) || !tokens.get(tokens.size() - 1).is(TokenType.CLOSE_PAREN)) {
            throw new IllegalArgumentException("Statement tokens must be wrapped in parentheses: " + tokens);
        }

        Set<String> referenced = tokens.stream()
                .filter(Token::isVariable)
                .map(Token::name)
                .collect(Collectors.toSet());
        if (!referenced.equals(new HashSet<>(registry.names()))) {
            throw new IllegalArgumentException(String.format(
                    "Registry %s does not match the variables referenced by the tokens %s",
                    registry.names(), referenced
            ));
        }

        this.tokens = List.copyOf(tokens);
        this.registry = registry.copy();
    }

    /**
     * @return the token sequence, outer parentheses included
     */
    public List<Token> tokens() {
        return tokens;
    }

    /**
     * @return a private copy of this statement's registry
     */
    public VariableRegistry registry() {
        return registry.copy();
    }

    /**
     * @return the variable names in declaration order
     */
    public List<String> variables() {
        return registry.names();
    }

    public int variableCount() {
        return registry.size();
    }

    /**
     * Builds the statement {@code this OR other} by splicing both token sequences.
     * <p>
     * The result is {@code ( <this tokens> | <other tokens> )}. Registries are merged with
     * {@code other} winning on shared names, and the variable order of the result is the sorted
     * union of both statements' variables. Both operands are already verified, so the spliced
     * sequence is not verified again.
     * </p>
     *
     * @param other the right operand
     * @return the combined statement
     */
    public Statement or(Statement other) {
        Objects.requireNonNull(other, "Statement cannot be null");

        List<Token> combined = new ArrayList<>(tokens.size() + other.tokens.size() + 3);
        combined.add(Token.OPEN_PAREN);
        combined.addAll(tokens);
        combined.add(Token.OR);
        combined.addAll(other.tokens);
        combined.add(Token.CLOSE_PAREN);

        return new Statement(combined, VariableRegistry.merge(registry, other.registry));
    }

    /**
     * @return the statement rendered back to expression text, outer parentheses included
     */
    public String expression() {
        return tokens.stream().map(Token::text).collect(Collectors.joining());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Statement that)) return false;
        return tokens.equals(that.tokens) && variables().equals(that.variables());
    }

    @Override
    public int hashCode() {
        return Objects.hash(tokens, variables());
    }

    @Override
    public String toString() {
        return "Statement[" + expression() + ", variables=" + variables() + "]";
    }
}
