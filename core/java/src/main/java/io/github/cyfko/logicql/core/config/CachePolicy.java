package io.github.cyfko.logicql.core.config;

/**
 * Caching configuration of the statement parser.
 * <p>
 * When enabled, the parser keeps the tokenized form of recently parsed expressions so that
 * parsing the same text again skips tokenization and structural verification. Each returned
 * {@link io.github.cyfko.logicql.core.api.Statement} still receives its own variable registry.
 * </p>
 *
 * <pre>{@code
 * CachePolicy.defaults();    // enabled, 1000 entries
 * CachePolicy.none();        // disabled
 * CachePolicy.custom(50);    // enabled, 50 entries
 * }</pre>
 *
 * @param cacheEnabled whether parsed expressions are cached
 * @param cacheSize    maximum number of cached expressions
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    /**
     * Caches the tokens of the 1000 most recently parsed expressions. Enough for applications
     * that re-parse a working set of rule expressions.
     *
     * @return default configuration
     */
    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    /**
     * Disables the cache: every parse tokenizes and verifies its input again.
     * {@code cacheSize} is ignored.
     *
     * @return caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    /**
     * @param cacheSize maximum number of tokenized expressions kept
     * @return caching enabled with the given capacity
     */
    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
