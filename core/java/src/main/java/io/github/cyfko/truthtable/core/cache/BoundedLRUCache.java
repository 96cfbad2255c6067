package io.github.cyfko.truthtable.core.cache;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A bounded LRU (Least Recently Used) cache backed by an access-ordered {@link LinkedHashMap}.
 * <p>
 * Once {@code maxSize} entries are stored, inserting a new key evicts the entry that was read
 * or written least recently. Every read reorders the map, so all operations share one lock.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BoundedLRUCache<String, List<Token>> cache = new BoundedLRUCache<>(256);
 * List<Token> postfix = cache.computeIfAbsent("P ^ Q", key -> convert(key));
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
    private final Lock lock = new ReentrantLock();

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
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a key-value pair, evicting the least recently used entry if the cache is full.
     *
     * @param key   the key to store
     * @param value the value to store, not null
     */
    public void put(K key, V value) {
        Objects.requireNonNull(value, "value cannot be null");
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value for {@code key}, computing and storing it first if absent.
     * <p>
     * The mapping function runs under the cache lock, so it is invoked at most once per key
     * even under concurrent calls. Exceptions thrown by the function propagate and nothing is
     * cached.
     * </p>
     *
     * @param key             the key to compute for
     * @param mappingFunction the function computing the value
     * @return the cached or newly computed value
     */
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        lock.lock();
        try {
            V value = entries.get(key);
            if (value == null) {
                value = mappingFunction.apply(key);
                if (value != null) {
                    entries.put(key, value);
                }
            }
            return value;
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

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all entries from the cache.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Returns cache statistics as a formatted string.
     *
     * @return statistics string
     */
    public String getStats() {
        int size = size();
        return String.format(Locale.ROOT, "BoundedLRUCache[size=%d, maxSize=%d, utilization=%.1f%%]",
            size,
            maxSize,
            (size * 100.0) / maxSize
        );
    }
}
