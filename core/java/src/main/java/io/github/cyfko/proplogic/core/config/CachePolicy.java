package io.github.cyfko.proplogic.core.config;

/**
 * Configuration of the parsed-expression cache.
 * <p>
 * Parsing is pure, so an AST can be reused for every later request carrying the same expression
 * text. Entries are immutable and never need invalidation; the bound only limits memory.
 * </p>
 *
 * <pre>{@code
 * CachePolicy.defaults();    // enabled, 1000 entries
 * CachePolicy.strict();      // enabled, 500 entries
 * CachePolicy.relaxed();     // enabled, 2000 entries
 * CachePolicy.none();        // disabled
 * CachePolicy.custom(5000);  // enabled, 5000 entries
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

    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    public static CachePolicy strict() {
        return new CachePolicy(true, 500);
    }

    public static CachePolicy relaxed() {
        return new CachePolicy(true, 2000);
    }

    /**
     * Caching completely disabled. The size is kept at 1 to satisfy validation and is never used.
     *
     * @return a CachePolicy with caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
