package io.github.cyfko.logicql.core;

import io.github.cyfko.logicql.core.api.LogicParser;
import io.github.cyfko.logicql.core.api.Statement;
import io.github.cyfko.logicql.core.exception.LogicSyntaxException;
import io.github.cyfko.logicql.core.exception.StatementTypeMismatchException;
import io.github.cyfko.logicql.core.impl.BasicLogicParser;
import io.github.cyfko.logicql.core.model.TruthTable;
import io.github.cyfko.logicql.core.model.VariableRegistry;
import io.github.cyfko.logicql.core.parsing.StatementEvaluator;
import io.github.cyfko.logicql.core.table.TruthTableFormatter;
import io.github.cyfko.logicql.core.table.TruthTableGenerator;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point for manipulating propositional logic statements.
 *
 * <pre>{@code
 * SymbolicLogic logic = new SymbolicLogic();
 *
 * Statement s = logic.statement("a&b|!(c|a)");
 * boolean value = logic.evaluate(s, Map.of("a", true, "b", true));
 *
 * TruthTable table = logic.truthTable(s);
 * System.out.print(logic.formatTable(table));
 * // a     | b     | c     | value |
 * // --------------------------------
 * // False | False | False | True  |
 * // ...
 *
 * Statement either = logic.combine("a&b", "c&d");   // (a&b)|(c&d)
 * }</pre>
 *
 * <p>Instances are thread-safe as long as the supplied {@link LogicParser} is.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SymbolicLogic {

    private static final Logger logger = Logger.getLogger(SymbolicLogic.class.getName());

    private final LogicParser parser;

    public SymbolicLogic() {
        this(new BasicLogicParser());
    }

    public SymbolicLogic(LogicParser parser) {
        this.parser = Objects.requireNonNull(parser, "Logic parser cannot be null");
    }

    /**
     * Parses an expression into a statement.
     *
     * @param expression the expression text
     * @return the verified statement
     * @throws LogicSyntaxException if the expression has invalid names or is malformed
     */
    public Statement statement(String expression) {
        return parser.parse(expression);
    }

    /**
     * Evaluates a statement under an assignment.
     * <p>
     * Assigned values override the statement's current values on a private registry copy; the
     * statement is left untouched. Names the statement does not reference are ignored.
     * </p>
     *
     * @param statement  the statement
     * @param assignment variable values
     * @return the statement's value
     */
    public boolean evaluate(Statement statement, Map<String, Boolean> assignment) {
        Objects.requireNonNull(statement, "Statement cannot be null");
        Objects.requireNonNull(assignment, "Assignment cannot be null");

        VariableRegistry registry = statement.registry();
        assignment.forEach((name, value) -> {
            if (registry.contains(name)) {
                registry.set(name, Objects.requireNonNull(value, "Value of '" + name + "' cannot be null"));
            } else {
                logger.fine(() -> "Ignoring assignment of '" + name + "', not referenced by " + statement.expression());
            }
        });
        return StatementEvaluator.evaluate(statement.tokens(), registry);
    }

    /**
     * Parses and evaluates an expression.
     *
     * @param expression the expression text
     * @param assignment variable values
     * @return the expression's value
     */
    public boolean evaluate(String expression, Map<String, Boolean> assignment) {
        return evaluate(statement(expression), assignment);
    }

    public TruthTable truthTable(Statement statement) {
        return TruthTableGenerator.generate(statement);
    }

    public TruthTable truthTable(Statement statement, long start) {
        return TruthTableGenerator.generate(statement, start);
    }

    /**
     * @param statement the statement to enumerate
     * @param start     first assignment index (inclusive)
     * @param end       last assignment index (exclusive)
     * @return the rows of {@code [start, end)}
     * @see TruthTableGenerator
     */
    public TruthTable truthTable(Statement statement, long start, long end) {
        return TruthTableGenerator.generate(statement, start, end);
    }

    public String formatTable(TruthTable table) {
        return TruthTableFormatter.format(table);
    }

    /**
     * Combines two statements or expressions with OR.
     * <ul>
     *   <li>two strings: parses {@code "(" + first + ")|(" + second + ")"}</li>
     *   <li>a string and a statement: parses the string, then splices both statements</li>
     *   <li>two statements: splices them with {@link Statement#or(Statement)}</li>
     * </ul>
     *
     * @param first  a {@link String} expression or a {@link Statement}
     * @param second a {@link String} expression or a {@link Statement}
     * @return the combined statement
     * @throws StatementTypeMismatchException if an argument is neither a string nor a statement
     * @throws LogicSyntaxException           if a string argument cannot be parsed
     */
    public Statement combine(Object first, Object second) {
        if (first instanceof String a && second instanceof String b) {
            return combine(a, b);
        }
        if (first instanceof Statement a && second instanceof Statement b) {
            return combine(a, b);
        }
        if (first instanceof Statement a && second instanceof String b) {
            return combine(a, b);
        }
        if (first instanceof String a && second instanceof Statement b) {
            return combine(a, b);
        }
        throw new StatementTypeMismatchException(String.format(
                "Malformed inputs, combine accepts only strings and statements, got %s and %s",
                typeName(first), typeName(second)
        ));
    }

    public Statement combine(String first, String second) {
        Objects.requireNonNull(first, "Expression cannot be null");
        Objects.requireNonNull(second, "Expression cannot be null");
        return statement("(" + first + ")|(" + second + ")");
    }

    public Statement combine(Statement first, Statement second) {
        Statement combined = first.or(second);
        logger.fine(() -> "Combined statement: " + combined.expression());
        return combined;
    }

    public Statement combine(Statement first, String second) {
        return combine(first, statement(second));
    }

    public Statement combine(String first, Statement second) {
        return combine(statement(first), second);
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
