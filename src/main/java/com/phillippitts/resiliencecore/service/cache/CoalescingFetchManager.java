package com.phillippitts.resiliencecore.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Read-through cache front that runs at most one computation per key at a time.
 *
 * <p>Concurrent callers that miss the cache for the same key attach to a single pending
 * {@link CompletableFuture}. The first caller (the leader) runs the computation on its own
 * thread outside any lock; every waiter then receives the leader's value, or the exact
 * exception instance the computation raised. Failures are never cached and the pending
 * entry is always removed when the computation finishes.
 */
@Component
public class CoalescingFetchManager {

    private static final Logger LOG = LogManager.getLogger(CoalescingFetchManager.class);

    /** Stands in for a cached null so it can be told apart from a miss. */
    private static final Object NULL_VALUE = new Object();

    private final ExpiringCache<String, Object> cache;
    private final ReentrantLock inFlightLock = new ReentrantLock();
    private final Map<String, CompletableFuture<Object>> inFlight = new HashMap<>();

    public CoalescingFetchManager(ExpiringCache<String, Object> cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public <T> T getOrFetch(String key, Supplier<? extends T> compute, Duration ttl) {
        return getOrFetch(key, compute, FetchOptions.ttl(ttl));
    }

    /**
     * Returns the cached value for the key, or computes it once for all concurrent callers.
     *
     * @param key     cache key (combined with the options prefix)
     * @param compute computation to run on a miss; may block
     * @param options caching policy
     * @return cached or freshly computed value
     * @throws CancellationException if the calling waiter is interrupted while awaiting the leader
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrFetch(String key, Supplier<? extends T> compute, FetchOptions options) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(compute, "compute");
        FetchOptions opts = options == null ? FetchOptions.defaults() : options;
        String fullKey = opts.fullKey(key);

        Optional<Object> cached = cache.get(fullKey);
        if (cached.isPresent()) {
            return (T) unmask(cached.get());
        }

        CompletableFuture<Object> pending;
        boolean leader = false;
        inFlightLock.lock();
        try {
            pending = inFlight.get(fullKey);
            if (pending == null) {
                // A leader may have cached the value and left since the miss above
                Optional<Object> completed = cache.peek(fullKey);
                if (completed.isPresent()) {
                    return (T) unmask(completed.get());
                }
                pending = new CompletableFuture<>();
                inFlight.put(fullKey, pending);
                leader = true;
            }
        } finally {
            inFlightLock.unlock();
        }

        if (leader) {
            return (T) lead(fullKey, compute, opts, pending);
        }
        LOG.debug("Coalescing onto in-flight computation: key={}", fullKey);
        return (T) await(fullKey, pending);
    }

    /**
     * Removes cached results whose full key starts with the prefix.
     *
     * @return number of entries removed
     */
    public int invalidate(String prefix) {
        return cache.invalidatePrefix(prefix);
    }

    public int inFlightCount() {
        inFlightLock.lock();
        try {
            return inFlight.size();
        } finally {
            inFlightLock.unlock();
        }
    }

    public CacheStats stats() {
        return cache.stats();
    }

    private Object lead(String fullKey, Supplier<?> compute, FetchOptions opts, CompletableFuture<Object> pending) {
        try {
            Object value = compute.get();
            if (value != null) {
                cache.set(fullKey, value, opts.ttl());
            } else if (!opts.skipNull()) {
                cache.set(fullKey, NULL_VALUE, opts.ttl());
            }
            pending.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            pending.completeExceptionally(e);
            LOG.debug("Computation failed for key={}: {}", fullKey, e.toString());
            throw e;
        } finally {
            inFlightLock.lock();
            try {
                inFlight.remove(fullKey, pending);
            } finally {
                inFlightLock.unlock();
            }
        }
    }

    private static Object await(String fullKey, CompletableFuture<Object> pending) {
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while awaiting computation for key " + fullKey);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Computation failed for key " + fullKey, cause);
        }
    }

    private static Object unmask(Object stored) {
        return stored == NULL_VALUE ? null : stored;
    }
}
