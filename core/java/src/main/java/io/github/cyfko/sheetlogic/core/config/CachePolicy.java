package io.github.cyfko.sheetlogic.core.config;

/**
 * Settings of the parse cache shared by all formula cells of a compilation.
 * <p>
 * Formulas filled down a column repeat the same text, and the parser keeps one outcome per
 * sheet and text. {@code cacheSize} bounds the number of distinct formulas remembered.
 * </p>
 *
 * <pre>{@code
 * CachePolicy.defaults();     // enabled, 1000 distinct formulas
 * CachePolicy.custom(20_000); // very large workbooks
 * CachePolicy.none();         // parse every cell
 * }</pre>
 *
 * @param cacheEnabled whether parse outcomes are cached
 * @param cacheSize    maximum number of cached outcomes, ignored when disabled
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(boolean cacheEnabled, int cacheSize) {

    public static final int DEFAULT_CACHE_SIZE = 1000;

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    public static CachePolicy defaults() {
        return new CachePolicy(true, DEFAULT_CACHE_SIZE);
    }

    /**
     * @param cacheSize maximum number of cached outcomes
     * @return an enabled cache of the given size
     */
    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }

    /**
     * @return a policy that disables caching
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }
}
