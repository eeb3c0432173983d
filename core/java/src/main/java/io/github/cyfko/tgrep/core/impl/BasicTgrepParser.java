package io.github.cyfko.tgrep.core.impl;

import io.github.cyfko.tgrep.core.api.CompiledQuery;
import io.github.cyfko.tgrep.core.api.TgrepParser;
import io.github.cyfko.tgrep.core.cache.BoundedLRUCache;
import io.github.cyfko.tgrep.core.config.CachePolicy;
import io.github.cyfko.tgrep.core.config.QueryPolicy;
import io.github.cyfko.tgrep.core.exception.TgrepSyntaxException;
import io.github.cyfko.tgrep.core.parsing.ParsedQuery;
import io.github.cyfko.tgrep.core.parsing.TgrepGrammar;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link TgrepParser}: compiles query text with {@link TgrepGrammar} and keeps the results
 * in a bounded LRU cache keyed by the exact query text.
 *
 * <h2>Compilation</h2>
 * <ol>
 *   <li>Null text is rejected with {@link NullPointerException}, blank text with
 *       {@link TgrepSyntaxException};</li>
 *   <li>the grammar enforces the {@link QueryPolicy} limits and builds one predicate per search
 *       statement plus the macro environment;</li>
 *   <li>the search predicates are OR'd together and closed over the environment in a
 *       {@link CompiledQuery}.</li>
 * </ol>
 *
 * <h2>Caching</h2>
 * <ul>
 *   <li><strong>Cache Key</strong>: the query text, unchanged</li>
 *   <li><strong>Cache Value</strong>: the immutable {@link CompiledQuery}</li>
 *   <li><strong>Failures</strong>: never cached; a malformed query fails on every call</li>
 *   <li><strong>Configurable</strong>: size or disabling via {@link CachePolicy}</li>
 * </ul>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * TgrepParser parser = new BasicTgrepParser();
 * CompiledQuery query = parser.compile("NP < DT");
 *
 * // Tight limits for queries coming from untrusted input
 * TgrepParser strictParser = new BasicTgrepParser(QueryPolicy.strict(), CachePolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicTgrepParser implements TgrepParser {

    private static final Logger log = Logger.getLogger(BasicTgrepParser.class.getName());

    private final QueryPolicy queryPolicy;
    private final CachePolicy cachePolicy;
    protected final BoundedLRUCache<String, CompiledQuery> cache;

    /**
     * Default constructor using {@link QueryPolicy#defaults()} and {@link CachePolicy#defaults()}.
     */
    public BasicTgrepParser() {
        this(QueryPolicy.defaults(), CachePolicy.defaults());
    }

    /**
     * @param queryPolicy the limits applied to query text
     * @throws IllegalArgumentException if queryPolicy is null
     */
    public BasicTgrepParser(QueryPolicy queryPolicy) {
        this(queryPolicy, CachePolicy.defaults());
    }

    /**
     * @param queryPolicy the limits applied to query text
     * @param cachePolicy the compiled query cache settings
     * @throws IllegalArgumentException if a policy is null
     */
    public BasicTgrepParser(QueryPolicy queryPolicy, CachePolicy cachePolicy) {
        if (queryPolicy == null) {
            throw new IllegalArgumentException("Query policy is required");
        }
        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.queryPolicy = queryPolicy;
        this.cachePolicy = cachePolicy;
        this.cache = cachePolicy.cacheEnabled()
            ? new BoundedLRUCache<>(cachePolicy.cacheSize())
            : null;
    }

    /**
     * Clears the compiled query cache (if enabled).
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
            "maxSize", cachePolicy.cacheSize(),
            "hits", cache.getHitCount(),
            "misses", cache.getMissCount()
        );
    }

    /**
     * @return the limits this parser enforces
     */
    public QueryPolicy getQueryPolicy() {
        return queryPolicy;
    }

    @Override
    public CompiledQuery compile(String query) throws TgrepSyntaxException {
        Objects.requireNonNull(query, "query");
        if (query.isBlank()) {
            throw new TgrepSyntaxException("Query cannot be empty");
        }

        if (cache == null) {
            return doCompile(query);
        }
        boolean[] compiledNow = new boolean[1];
        CompiledQuery compiled = cache.computeIfAbsent(query, text -> {
            compiledNow[0] = true;
            return doCompile(text);
        });
        if (!compiledNow[0]) {
            log.fine(() -> String.format("Compiled query cache hit for '%s'", query));
        }
        return compiled;
    }

    @Override
    public List<String> tokenize(String query) throws TgrepSyntaxException {
        Objects.requireNonNull(query, "query");
        if (query.isBlank()) {
            throw new TgrepSyntaxException("Query cannot be empty");
        }
        return TgrepGrammar.tokenize(query, queryPolicy);
    }

    private CompiledQuery doCompile(String query) {
        long start = System.nanoTime();
        ParsedQuery parsed = TgrepGrammar.parse(query, queryPolicy);
        CompiledQuery compiled = new CompiledQuery(query, parsed.predicate(), parsed.macros());
        log.fine(() -> String.format("Compiled query '%s' in %d µs (%d expression(s), %d macro(s))",
                query, (System.nanoTime() - start) / 1000, parsed.expressions().size(), parsed.macros().size()));
        return compiled;
    }
}
