package io.github.cyfko.logicql.core.api;

import io.github.cyfko.logicql.core.exception.InvalidVariableNameException;
import io.github.cyfko.logicql.core.exception.LogicSyntaxException;
import io.github.cyfko.logicql.core.exception.MalformedStatementException;

/**
 * Parser transforming propositional logic expressions into {@link Statement} instances.
 *
 * <h2>Grammar</h2>
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>a &amp; (b | c)</td></tr>
 * <tr><td>NOT</td><td>!</td><td>!a</td></tr>
 * <tr><td>AND</td><td>&amp;</td><td>a &amp; b</td></tr>
 * <tr><td>OR</td><td>|</td><td>a | b</td></tr>
 * <tr><td>IF THEN</td><td>-&gt;</td><td>a -&gt; b</td></tr>
 * <tr><td>IF AND ONLY IF</td><td>&lt;-&gt;</td><td>a &lt;-&gt; b</td></tr>
 * </tbody>
 * </table>
 *
 * <p>
 * Binary operators have no relative precedence: they are applied strictly from left to right
 * inside each parenthesized group. {@code a & b | c} reads as {@code (a & b) | c} and
 * {@code a | b & c} reads as {@code (a | b) & c}. Only explicit parentheses change the grouping.
 * </p>
 *
 * <p>Spaces are ignored. Variable names start with an ASCII letter and continue with ASCII
 * letters, digits or underscores.</p>
 *
 * <pre>{@code
 * parser.parse("a & b | !(c | a)");  // ok
 * parser.parse("p -> q <-> r");      // ok
 * parser.parse("3x & y");            // InvalidVariableNameException [3x]
 * parser.parse("a & ((b)");          // MalformedStatementException
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface LogicParser {

    /**
     * Parses the given expression into a verified statement.
     *
     * @param expression the expression to parse
     * @return the parsed statement
     * @throws InvalidVariableNameException if the expression contains invalid variable names
     * @throws MalformedStatementException  if the expression is not well formed
     * @throws LogicSyntaxException         if the expression is null or exceeds the configured limits
     */
    Statement parse(String expression) throws LogicSyntaxException;
}
