package io.github.cyfko.logicql.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * A bounded LRU (Least Recently Used) cache guarded by a {@link ReadWriteLock}.
 * <p>
 * Entries are kept in an access-ordered {@link LinkedHashMap}; once {@code maxSize} is exceeded
 * the least recently used entry is evicted. Because a lookup reorders the map, reads take the
 * write lock; only {@link #size()}, {@link #containsKey(Object)} and {@link #getStats()} share
 * the read lock.
 * </p>
 *
 * <pre>{@code
 * BoundedLRUCache<String, TokenizedExpression> cache = new BoundedLRUCache<>(1000);
 * TokenizedExpression tokens = cache.computeIfAbsent(expression, this::tokenizeAndVerify);
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final Map<K, V> cache;
    private final ReadWriteLock lock;

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
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLRUCache.this.maxSize;
            }
        };
        this.lock = new ReentrantReadWriteLock();
    }

    /**
     * @param key the key to look up
     * @return the cached value, or null if not present
     */
    public V get(K key) {
        lock.writeLock().lock();
        try {
            return cache.get(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores a key-value pair, evicting the least recently used entry when full.
     *
     * @param key the key to store
     * @param value the value to store
     */
    public void put(K key, V value) {
        lock.writeLock().lock();
        try {
            cache.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Computes and caches a value if the key is not already present.
     * <p>
     * The mapping function runs under the write lock, so concurrent callers with the same key
     * compute the value only once. Exceptions thrown by the function propagate and nothing is
     * cached.
     * </p>
     *
     * @param key the key to compute for
     * @param mappingFunction the function to compute the value
     * @return the cached or newly computed value
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        lock.writeLock().lock();
        try {
            V value = cache.get(key);
            if (value == null) {
                value = mappingFunction.apply(key);
                if (value != null) {
                    cache.put(key, value);
                }
            }
            return value;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return cache.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsKey(K key) {
        lock.readLock().lock();
        try {
            return cache.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            cache.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * @return statistics string
     */
    public String getStats() {
        lock.readLock().lock();
        try {
            return String.format("BoundedLRUCache[size=%d, maxSize=%d, utilization=%.1f%%]",
                cache.size(),
                maxSize,
                (cache.size() * 100.0) / maxSize
            );
        } finally {
            lock.readLock().unlock();
        }
    }
}
