package com.phillippitts.resiliencecore.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ExpiringCache} backed by an access-ordered {@link LinkedHashMap}.
 *
 * <p>Every operation runs under a single {@link ReentrantLock}. Writes first purge expired
 * entries, then evict least-recently-used entries until the store is strictly below capacity,
 * then insert the new entry as most recently used.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class LruExpiringCache<K, V> implements ExpiringCache<K, V> {

    private static final Logger LOG = LogManager.getLogger(LruExpiringCache.class);

    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // accessOrder=true: iteration starts at the least recently used entry
    private final LinkedHashMap<K, CacheEntry<V>> entries;

    private long hits;
    private long misses;

    public LruExpiringCache(int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.defaultTtl = requirePositive(Objects.requireNonNull(defaultTtl, "defaultTtl"));
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    @Override
    public Optional<V> get(K key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                misses++;
                LOG.debug("Cache entry expired on read: key={}", key);
                return Optional.empty();
            }
            hits++;
            return Optional.ofNullable(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<V> peek(K key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null || entry.isExpired(now)) {
                return Optional.empty();
            }
            return Optional.ofNullable(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Duration effectiveTtl = ttl == null ? defaultTtl : requirePositive(ttl);
        Instant now = clock.instant();
        lock.lock();
        try {
            purgeExpired(now);
            // Overwrites do not grow the map, so only evict for new keys
            if (!entries.containsKey(key)) {
                evictUntilBelowCapacity();
            }
            entries.remove(key);
            entries.put(key, new CacheEntry<>(value, now, now.plus(effectiveTtl)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean invalidate(K key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int invalidatePrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        lock.lock();
        try {
            int removed = 0;
            Iterator<K> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (String.valueOf(it.next()).startsWith(prefix)) {
                    it.remove();
                    removed++;
                }
            }
            LOG.debug("Invalidated {} cache entries with prefix '{}'", removed, prefix);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits = 0;
            misses = 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return CacheStats.of(entries.size(), maxSize, hits, misses);
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    private void purgeExpired(Instant now) {
        Iterator<Map.Entry<K, CacheEntry<V>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isExpired(now)) {
                it.remove();
            }
        }
    }

    private void evictUntilBelowCapacity() {
        Iterator<K> it = entries.keySet().iterator();
        while (entries.size() >= maxSize && it.hasNext()) {
            K eldest = it.next();
            it.remove();
            LOG.debug("Evicted least recently used cache entry: key={}", eldest);
        }
    }

    private static Duration requirePositive(Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        return ttl;
    }
}
