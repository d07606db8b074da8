package io.github.cyfko.sheetlogic.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Bounded least-recently-used cache holding parse outcomes keyed by sheet and formula text.
 * <p>
 * A formula filled down a column has the same text on every row, so one parse serves the whole
 * column. Reads reorder the entries, hence a single exclusive lock guards every access. The
 * mapping function of {@link #computeIfAbsent(Object, Function)} runs outside the lock; when two
 * threads race on one key the first stored value is kept.
 * </p>
 *
 * <pre>{@code
 * BoundedLRUCache<String, ParseOutcome> cache = new BoundedLRUCache<>(1000);
 * ParseOutcome outcome = cache.computeIfAbsent(sheet + '\u0000' + formula, key -> parse(formula));
 * }</pre>
 *
 * @param <K> key type
 * @param <V> value type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final Map<K, V> entries;
    private final ReentrantLock lock = new ReentrantLock();
    private long hits;
    private long misses;

    /**
     * @param maxSize entry limit
     * @throws IllegalArgumentException if {@code maxSize} is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(Math.min(maxSize, 64), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLRUCache.this.maxSize;
            }
        };
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param key the key
     * @return the cached value, now most recently used, or null
     */
    public V get(K key) {
        return locked(() -> entries.get(key));
    }

    public void put(K key, V value) {
        locked(() -> entries.put(key, value));
    }

    /**
     * Returns the cached value for {@code key}, computing and storing it on a miss.
     * A null result is returned but not stored.
     *
     * @param key             the key
     * @param mappingFunction computes the value on a miss
     * @return the cached or computed value
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        V cached = locked(() -> {
            V value = entries.get(key);
            if (value != null) hits++;
            else misses++;
            return value;
        });
        if (cached != null) {
            return cached;
        }
        V computed = mappingFunction.apply(key);
        if (computed == null) {
            return null;
        }
        return locked(() -> {
            V raced = entries.putIfAbsent(key, computed);
            return raced != null ? raced : computed;
        });
    }

    public boolean containsKey(K key) {
        return locked(() -> entries.containsKey(key));
    }

    public int size() {
        return locked(entries::size);
    }

    public void clear() {
        locked(() -> {
            entries.clear();
            hits = 0;
            misses = 0;
            return null;
        });
    }

    public int getMaxSize() {
        return maxSize;
    }

    public long getHits() {
        return locked(() -> hits);
    }

    public long getMisses() {
        return locked(() -> misses);
    }

    /**
     * @return size, bound and hit ratio of {@link #computeIfAbsent} lookups
     */
    public String getStats() {
        return locked(() -> {
            long lookups = hits + misses;
            return String.format("BoundedLRUCache[size=%d, maxSize=%d, hits=%d, misses=%d, hitRatio=%.1f%%]",
                    entries.size(), maxSize, hits, misses, lookups == 0 ? 0.0 : hits * 100.0 / lookups);
        });
    }
}
