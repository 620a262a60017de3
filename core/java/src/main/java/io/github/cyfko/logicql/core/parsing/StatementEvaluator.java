package io.github.cyfko.logicql.core.parsing;

import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.api.TokenType;
import io.github.cyfko.logicql.core.exception.MalformedStatementException;
import io.github.cyfko.logicql.core.model.VariableRegistry;

import java.util.*;

/**
 * Reduces a wrapped token sequence to a single boolean value.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * For each token:
 *   - push it on the stack
 *   - on CLOSE_PAREN: pop back to the matching OPEN_PAREN, reduce the enclosed run
 *     (which holds no parenthesis) and push the resulting value
 *
 * Reducing a run:
 *   1. left to right, replace each NOT and its operand by the negated operand
 *   2. replace the first binary operator and its two neighbours by its value,
 *      then rescan from the start, until no binary operator is left
 *
 * The stack must hold exactly ONE value at the end.
 * </pre>
 *
 * <p>
 * Binary operators all share one precedence level: {@code a | b & c} is {@code (a | b) & c}.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is stateless. The registry passed in is only read, but it must not be mutated by
 * another thread during the call.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class StatementEvaluator {

    private StatementEvaluator() {}

    /**
     * Evaluates a token sequence against the current values of a registry.
     *
     * @param tokens   the wrapped token sequence
     * @param registry values of the referenced variables
     * @return the value of the expression
     * @throws MalformedStatementException if the sequence does not reduce to exactly one value
     * @throws IllegalStateException       if a referenced variable is missing from the registry
     */
    public static boolean evaluate(List<Token> tokens, VariableRegistry registry) {
        Objects.requireNonNull(tokens, "Tokens cannot be null");
        Objects.requireNonNull(registry, "Registry cannot be null");

        Deque<Element> stack = new ArrayDeque<>(tokens.size());

        for (Token token : tokens) {
            if (!token.is(TokenType.CLOSE_PAREN)) {
                stack.push(Element.of(token));
                continue;
            }

            LinkedList<Element> group = new LinkedList<>();
            while (true) {
                if (stack.isEmpty()) {
                    throw new MalformedStatementException("Mismatched parentheses: unmatched ')'");
                }
                Element element = stack.pop();
                if (element.is(TokenType.OPEN_PAREN)) {
                    break;
                }
                group.addFirst(element);
            }
            stack.push(Element.of(reduce(group, registry)));
        }

        if (stack.size() != 1) {
            throw new MalformedStatementException(String.format(
                    "Malformed statement: %d elements left after reduction, expected 1 (unmatched '(' or missing outer group)",
                    stack.size()
            ));
        }

        Element result = stack.pop();
        if (!result.isValue()) {
            throw new MalformedStatementException("Malformed statement: '" + result + "' is not enclosed in a group");
        }
        return result.value();
    }

    /**
     * Reduces a run of elements containing no parenthesis.
     */
    private static boolean reduce(List<Element> group, VariableRegistry registry) {
        List<Element> run = new ArrayList<>(group);

        if (run.isEmpty()) {
            throw new MalformedStatementException("Malformed statement: empty parentheses");
        }

        // NOT elimination
        for (int i = 0; i < run.size(); i++) {
            if (!run.get(i).is(TokenType.NOT)) {
                continue;
            }
            int operandIndex = i;
            boolean negate = false;
            while (operandIndex < run.size() && run.get(operandIndex).is(TokenType.NOT)) {
                negate = !negate;
                operandIndex++;
            }
            if (operandIndex == run.size()) {
                throw new MalformedStatementException("Malformed statement: NOT operator (!) without operand");
            }
            boolean operand = operandValue(run.get(operandIndex), registry);
            run.subList(i, operandIndex + 1).clear();
            run.add(i, Element.of(negate != operand));
        }

        // Binary operators, strictly left to right
        int index;
        while ((index = firstBinaryOperator(run)) >= 0) {
            Element operator = run.get(index);
            if (index == 0 || index == run.size() - 1) {
                throw new MalformedStatementException(String.format(
                        "Malformed statement: operator (%s) requires two operands",
                        operator.token().text()
                ));
            }
            boolean left = operandValue(run.get(index - 1), registry);
            boolean right = operandValue(run.get(index + 1), registry);
            boolean value = operator.token().type().apply(left, right);

            run.subList(index - 1, index + 2).clear();
            run.add(index - 1, Element.of(value));
        }

        if (run.size() > 1) {
            throw new MalformedStatementException(String.format(
                    "Malformed statement: %d operands without operator between them: %s",
                    run.size(), run
            ));
        }
        return operandValue(run.get(0), registry);
    }

    private static int firstBinaryOperator(List<Element> run) {
        for (int i = 0; i < run.size(); i++) {
            Element element = run.get(i);
            if (!element.isValue() && element.token().type().isBinaryOperator()) {
                return i;
            }
        }
        return -1;
    }

    private static boolean operandValue(Element element, VariableRegistry registry) {
        if (element.isValue()) {
            return element.value();
        }
        Token token = element.token();
        if (!token.isVariable()) {
            throw new MalformedStatementException("Malformed statement: operand expected, found operator (" + token.text() + ")");
        }
        return registry.get(token.name());
    }

    /**
     * Stack element: either a token not consumed yet, or the value of an already reduced group.
     */
    private record Element(Token token, Boolean value) {

        static Element of(Token token) {
            return new Element(token, null);
        }

        static Element of(boolean value) {
            return new Element(null, value);
        }

        boolean isValue() {
            return value != null;
        }

        boolean is(TokenType type) {
            return token != null && token.is(type);
        }

        @Override
        public String toString() {
            return isValue() ? value.toString() : token.text();
        }
    }
}
