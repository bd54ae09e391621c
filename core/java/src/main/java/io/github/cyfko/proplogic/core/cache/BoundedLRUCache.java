package io.github.cyfko.proplogic.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A bounded LRU (Least Recently Used) cache.
 * <p>
 * Entries live in an access-ordered {@link LinkedHashMap}; when an insertion exceeds the capacity the
 * least recently used entry is evicted. A single {@link ReentrantLock} guards the map because every
 * read of an access-ordered map reorders it.
 * </p>
 *
 * <h2>Computation Outside the Lock</h2>
 * <p>
 * {@link #computeIfAbsent(Object, Function)} runs the mapping function without holding the lock, so a
 * slow computation never blocks unrelated lookups. Two threads missing on the same key may both
 * compute; the first stored value wins and is returned to both. This is only correct for pure
 * mapping functions, which is what the parser cache stores.
 * </p>
 *
 * <pre>{@code
 * BoundedLRUCache<String, Expression> cache = new BoundedLRUCache<>(1000);
 * Expression ast = cache.computeIfAbsent("P AND Q", this::doParse);
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
     * @param key the key to look up
     * @return the cached value, or {@code null} if absent
     */
    public V get(K key) {
        lock.lock();
        try {
            V value = entries.get(key);
            (value == null ? misses : hits).incrementAndGet();
            return value;
        } finally {
            lock.unlock();
        }
    }

    public void put(K key, V value) {
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value for {@code key}, computing and storing it on a miss.
     * <p>
     * Exceptions thrown by {@code mappingFunction} propagate and nothing is stored.
     * </p>
     *
     * @param key             the key to compute for
     * @param mappingFunction pure function producing a non-null value
     * @return the cached or newly computed value
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        V cached = get(key);
        if (cached != null) {
            return cached;
        }

        V computed = Objects.requireNonNull(mappingFunction.apply(key), "mapping function returned null");

        lock.lock();
        try {
            V raced = entries.putIfAbsent(key, computed);
            return raced != null ? raced : computed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean containsKey(K key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all entries and resets the hit/miss counters.
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

    public int getMaxSize() {
        return maxSize;
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public String getStats() {
        lock.lock();
        try {
            return String.format("BoundedLRUCache[size=%d, maxSize=%d, hits=%d, misses=%d]",
                    entries.size(), maxSize, hits.get(), misses.get());
        } finally {
            lock.unlock();
        }
    }
}
