package com.phillippitts.resiliencecore.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Thread-safe key/value store with per-entry time-to-live and a bounded size.
 *
 * <p>A miss is a normal result ({@link Optional#empty()}), never an exception. Expired entries
 * are never returned.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface ExpiringCache<K, V> {

    /**
     * Returns the live value for the key and marks it most recently used.
     * An expired entry is removed and reported as absent.
     */
    Optional<V> get(K key);

    /**
     * Returns the live value for the key and marks it most recently used, without counting
     * a hit or a miss.
     */
    Optional<V> peek(K key);

    /**
     * Stores a value with the given time-to-live.
     *
     * @param ttl positive time-to-live, or null for the cache default
     */
    void set(K key, V value, Duration ttl);

    /** Stores a value with the cache's default time-to-live. */
    default void set(K key, V value) {
        set(key, value, null);
    }

    /** @return true if an entry was removed */
    boolean invalidate(K key);

    /**
     * Removes every entry whose key, rendered as a string, starts with the prefix.
     *
     * @return number of entries removed
     */
    int invalidatePrefix(String prefix);

    void clear();

    CacheStats stats();
}
