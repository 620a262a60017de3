package io.github.cyfko.logicql.core.impl;

import io.github.cyfko.logicql.core.api.LogicParser;
import io.github.cyfko.logicql.core.api.Statement;
import io.github.cyfko.logicql.core.cache.BoundedLRUCache;
import io.github.cyfko.logicql.core.config.CachePolicy;
import io.github.cyfko.logicql.core.config.LogicPolicy;
import io.github.cyfko.logicql.core.exception.LogicSyntaxException;
import io.github.cyfko.logicql.core.parsing.StatementEvaluator;
import io.github.cyfko.logicql.core.parsing.TokenizedExpression;
import io.github.cyfko.logicql.core.parsing.Tokenizer;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Default {@link LogicParser}.
 *
 * <h2>Two-Phase Parsing</h2>
 * <ol>
 *   <li><strong>Phase 1</strong>: {@link Tokenizer#tokenize(String, LogicPolicy)} - lexical scan,
 *       variable name validation, outer group wrapping</li>
 *   <li><strong>Phase 2</strong>: {@link StatementEvaluator#evaluate} - one dry-run evaluation with
 *       every variable {@code false}; the value is discarded, only well-formedness matters</li>
 * </ol>
 *
 * <h2>Caching</h2>
 * <p>
 * When enabled by the {@link CachePolicy}, verified token sequences are kept in a
 * {@link BoundedLRUCache} keyed by the raw expression text. A cache hit skips both phases. Every
 * returned {@link Statement} gets its own registry, so cached entries are never shared mutable
 * state. Failed parses are not cached.
 * </p>
 *
 * <pre>{@code
 * LogicParser parser = new BasicLogicParser();
 * Statement statement = parser.parse("a & b | !(c | a)");
 *
 * LogicParser strict = new BasicLogicParser(LogicPolicy.strict(), CachePolicy.none());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicLogicParser implements LogicParser {

    private static final Logger logger = Logger.getLogger(BasicLogicParser.class.getName());

    private final LogicPolicy logicPolicy;
    private final CachePolicy cachePolicy;
    protected final BoundedLRUCache<String, TokenizedExpression> cache;

    /**
     * Default constructor using {@link LogicPolicy#defaults()} and {@link CachePolicy#defaults()}.
     */
    public BasicLogicParser() {
        this(LogicPolicy.defaults(), CachePolicy.defaults());
    }

    /**
     * @param logicPolicy the parser limits
     * @throws IllegalArgumentException if the policy is null
     */
    public BasicLogicParser(LogicPolicy logicPolicy) {
        this(logicPolicy, CachePolicy.defaults());
    }

    /**
     * @param logicPolicy the parser limits
     * @param cachePolicy the cache settings
     * @throws IllegalArgumentException if a policy is null
     */
    public BasicLogicParser(LogicPolicy logicPolicy, CachePolicy cachePolicy) {
        if (logicPolicy == null) {
            throw new IllegalArgumentException("Logic policy is required");
        }

        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.logicPolicy = logicPolicy;
        this.cachePolicy = cachePolicy;
        this.cache = cachePolicy.cacheEnabled()
            ? new BoundedLRUCache<>(cachePolicy.cacheSize())
            : null;
    }

    /**
     * Parses and verifies an expression.
     *
     * @param expression the expression to parse
     * @return a new statement with all variables set to {@code false}
     * @throws LogicSyntaxException if the expression is rejected
     */
    @Override
    public Statement parse(String expression) throws LogicSyntaxException {
        TokenizedExpression tokenized = cache != null
                ? cache.computeIfAbsent(expression, this::tokenizeAndVerify)
                : tokenizeAndVerify(expression);

        return tokenized.toStatement();
    }

    private TokenizedExpression tokenizeAndVerify(String expression) {
        TokenizedExpression tokenized = Tokenizer.tokenize(expression, logicPolicy);

        StatementEvaluator.evaluate(tokenized.tokens(), tokenized.newRegistry());

        logger.fine(() -> String.format(
                "Parsed expression '%s': %d tokens, variables %s",
                expression, tokenized.tokens().size(), tokenized.variables()
        ));
        return tokenized;
    }

    public LogicPolicy getLogicPolicy() {
        return logicPolicy;
    }

    /**
     * Clears the parser cache (if enabled).
     */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Returns cache statistics (if caching is enabled).
     *
     * @return map containing cache statistics or {@code enabled=false} if the cache is disabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }

        return Map.of(
            "enabled", true,
            "size", cache.size(),
            "maxSize", cachePolicy.cacheSize()
        );
    }
}
