package io.github.cyfko.logicql.core.parsing;

import io.github.cyfko.logicql.core.api.Statement;
import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.model.VariableRegistry;

import java.util.List;

/**
 * Output of {@link Tokenizer}: the wrapped token sequence and the variable names in order of
 * first occurrence.
 * <p>
 * Instances are immutable and can be cached; {@link #newRegistry()} and {@link #toStatement()}
 * hand out fresh registries on every call.
 * </p>
 *
 * @param tokens    token sequence, wrapped in an outer pair of parentheses
 * @param variables distinct variable names in order of first occurrence
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TokenizedExpression(List<Token> tokens, List<String> variables) {

    public TokenizedExpression {
        tokens = List.copyOf(tokens);
        variables = List.copyOf(variables);
    }

    /**
     * @return a registry holding every variable set to {@code false}
     */
    public VariableRegistry newRegistry() {
        return VariableRegistry.of(variables);
    }

    public Statement toStatement() {
        return new Statement(tokens, newRegistry());
    }
}
