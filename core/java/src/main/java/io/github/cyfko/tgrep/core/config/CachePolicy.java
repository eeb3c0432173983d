package io.github.cyfko.tgrep.core.config;

/**
 * Configuration of the compiled query cache.
 * <p>
 * Compiled queries are immutable and depend only on their text, so a parser may hand out the same
 * {@link io.github.cyfko.tgrep.core.api.CompiledQuery} for repeated text instead of parsing again.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CachePolicy policy = CachePolicy.defaults();  // enabled, 1000 entries
 * CachePolicy policy = CachePolicy.strict();    // enabled, 500 entries
 * CachePolicy policy = CachePolicy.relaxed();   // enabled, 2000 entries
 * CachePolicy policy = CachePolicy.none();      // disabled
 * CachePolicy policy = CachePolicy.custom(50);  // enabled, 50 entries
 * }</pre>
 *
 * @param cacheEnabled whether compiled queries are cached
 * @param cacheSize    maximum number of cached queries
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    /**
     * Canonical constructor with validation.
     */
    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    /**
     * @return enabled cache of 1000 queries
     */
    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    /**
     * @return enabled cache of 500 queries
     */
    public static CachePolicy strict() {
        return new CachePolicy(true, 500);
    }

    /**
     * @return enabled cache of 2000 queries
     */
    public static CachePolicy relaxed() {
        return new CachePolicy(true, 2000);
    }

    /**
     * No cache: every compilation parses the text again.
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
