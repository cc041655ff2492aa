package com.phillippitts.resiliencecore.service.cache;

import java.time.Instant;

/** Stored value with its creation and expiry instants. Owned by the cache. */
record CacheEntry<V>(V value, Instant createdAt, Instant expiresAt) {

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
