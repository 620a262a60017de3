package io.github.cyfko.logicql.core.parsing;

import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.config.LogicPolicy;
import io.github.cyfko.logicql.core.config.LogicSymbol;
import io.github.cyfko.logicql.core.exception.InvalidVariableNameException;
import io.github.cyfko.logicql.core.exception.LogicSyntaxException;

import java.util.*;
import java.util.logging.Logger;

/**
 * Single-pass scanner turning an expression into {@link Token}s.
 *
 * <h2>Scanning rules</h2>
 * <ul>
 *   <li>ASCII spaces are skipped</li>
 *   <li>{@code ( ) & | !} are single-character tokens</li>
 *   <li>{@code <->} is matched before {@code ->}</li>
 *   <li>any other maximal run of characters is a variable name candidate, checked against
 *       {@link LogicPolicy#variablePattern()}</li>
 *   <li>a {@code <} or {@code -} that starts neither arrow is reported like an invalid name</li>
 * </ul>
 *
 * <p>
 * Scanning does not stop at the first invalid name: all of them are collected and reported
 * together by a single {@link InvalidVariableNameException}. The returned sequence is wrapped in
 * an outer pair of parentheses. Well-formedness is not checked here; see {@link StatementEvaluator}.
 * </p>
 *
 * <pre>{@code
 * TokenizedExpression result = Tokenizer.tokenize("(a&b)|!c", LogicPolicy.defaults());
 * // tokens:    [OPEN_PAREN, OPEN_PAREN, a, AND, b, CLOSE_PAREN, OR, NOT, c, CLOSE_PAREN]
 * // variables: [a, b, c]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Tokenizer {

    private static final Logger logger = Logger.getLogger(Tokenizer.class.getName());

    private Tokenizer() {}

    /**
     * Tokenizes an expression.
     *
     * @param expression the expression text
     * @param policy     limits and naming rule to apply
     * @return the wrapped tokens and the discovered variables
     * @throws InvalidVariableNameException if any variable name candidate is invalid
     * @throws LogicSyntaxException         if the expression is null or longer than the policy allows
     */
    public static TokenizedExpression tokenize(String expression, LogicPolicy policy) {
        Objects.requireNonNull(policy, "Logic policy cannot be null");

        if (expression == null) {
            throw new LogicSyntaxException("Logic expression cannot be null");
        }
        if (expression.length() > policy.maxExpressionLength()) {
            throw new LogicSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    expression.length(), policy.maxExpressionLength(), policy.policyName()
            ));
        }

        List<Token> tokens = new ArrayList<>(expression.length() + 2);
        Set<String> variables = new LinkedHashSet<>();
        List<String> invalidNames = new ArrayList<>();

        tokens.add(Token.OPEN_PAREN);

        int i = 0;
        final int length = expression.length();
        while (i < length) {
            char c = expression.charAt(i);

            if (c == ' ') {
                i++;
                continue;
            }

            if (expression.startsWith(LogicSymbol.IFF, i)) {
                tokens.add(Token.IFF);
                i += LogicSymbol.IFF.length();
                continue;
            }

            if (expression.startsWith(LogicSymbol.IF_THEN, i)) {
                tokens.add(Token.IF_THEN);
                i += LogicSymbol.IF_THEN.length();
                continue;
            }

            Token single = singleCharToken(c);
            if (single != null) {
                tokens.add(single);
                i++;
                continue;
            }

            if (LogicSymbol.isOperatorChar(c)) {
                // lone '<' or '-'
                invalidNames.add(String.valueOf(c));
                i++;
                continue;
            }

            int end = i;
            while (end < length && expression.charAt(end) != ' ' && !LogicSymbol.isOperatorChar(expression.charAt(end))) {
                end++;
            }
            String name = expression.substring(i, end);
            i = end;

            if (policy.variablePattern().matcher(name).matches()) {
                variables.add(name);
                tokens.add(Token.variable(name));
            } else {
                invalidNames.add(name);
            }
        }

        tokens.add(Token.CLOSE_PAREN);

        if (!invalidNames.isEmpty()) {
            logger.warning(() -> "Invalid variable names " + invalidNames + " in expression: " + expression);
            throw new InvalidVariableNameException(invalidNames);
        }

        return new TokenizedExpression(tokens, new ArrayList<>(variables));
    }

    private static Token singleCharToken(char c) {
        return switch (c) {
            case LogicSymbol.OPEN_PAREN -> Token.OPEN_PAREN;
            case LogicSymbol.CLOSE_PAREN -> Token.CLOSE_PAREN;
            case LogicSymbol.AND -> Token.AND;
            case LogicSymbol.OR -> Token.OR;
            case LogicSymbol.NOT -> Token.NOT;
            default -> null;
        };
    }
}
