package io.github.cyfko.tgrep.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A bounded LRU (Least Recently Used) cache.
 * <p>
 * Entries live in an access-ordered {@link LinkedHashMap}; once the cache holds more than
 * {@code maxSize} entries the least recently read or written one is evicted. Every operation runs
 * under a single {@link ReentrantLock}, since in an access-ordered map a read reorders entries too.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BoundedLRUCache<String, CompiledQuery> cache = new BoundedLRUCache<>(1000);
 *
 * CompiledQuery query = cache.computeIfAbsent("NP < DT", grammar::compile);
 * int size = cache.size();
 * String stats = cache.getStats();   // size, capacity, hit rate
 * cache.clear();
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final Map<K, V> entries;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Creates a bounded LRU cache with the specified maximum size.
     *
     * @param maxSize the maximum number of entries to store
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLRUCache.this.maxSize;
            }
        };
    }

    /**
     * Retrieves a value and marks it as most recently used.
     *
     * @param key the key to look up
     * @return the cached value, or null if not present
     */
    public V get(K key) {
        lock.lock();
        try {
            V value = entries.get(key);
            (value != null ? hits : misses).incrementAndGet();
            return value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a value, evicting the least recently used entry if the cache is full.
     *
     * @param key the key to store
     * @param value the value to store
     */
    public void put(K key, V value) {
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value for {@code key}, computing and caching it first if absent.
     * <p>
     * The mapping function runs under the cache lock, so concurrent callers for the same key
     * compute it once. Exceptions thrown by the function propagate and nothing is cached.
     * </p>
     *
     * @param key the key to compute for
     * @param mappingFunction the function to compute the value
     * @return the cached or newly computed value
     */
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        lock.lock();
        try {
            V value = entries.get(key);
            if (value != null) {
                hits.incrementAndGet();
                return value;
            }
            misses.incrementAndGet();
            value = mappingFunction.apply(key);
            if (value != null) {
                entries.put(key, value);
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the number of cached entries
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all entries and resets the hit and miss counters.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits.set(0);
            misses.set(0);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param key the key to check
     * @return true if the key is present; does not count as an access
     */
    public boolean containsKey(K key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the maximum capacity of this cache
     */
    public int getMaxSize() {
        return maxSize;
    }

    public long getHitCount() {
        return hits.get();
    }

    public long getMissCount() {
        return misses.get();
    }

    /**
     * @return statistics as a formatted string
     */
    public String getStats() {
        long h = hits.get();
        long total = h + misses.get();
        return String.format("BoundedLRUCache[size=%d, maxSize=%d, hitRate=%.1f%%]",
            size(),
            maxSize,
            total == 0 ? 0.0 : (h * 100.0) / total
        );
    }
}
