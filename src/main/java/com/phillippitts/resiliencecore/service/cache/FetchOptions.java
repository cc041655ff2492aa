package com.phillippitts.resiliencecore.service.cache;

import java.time.Duration;

/**
 * Per-call caching policy for {@link CoalescingFetchManager}.
 *
 * @param ttl       time-to-live for the stored result, or null for the cache default
 * @param prefix    namespace prepended to the key as {@code prefix:key}; blank for none
 * @param skipNull  when true a null result is returned to callers but not cached
 */
public record FetchOptions(Duration ttl, String prefix, boolean skipNull) {

    public static FetchOptions defaults() {
        return new FetchOptions(null, "", true);
    }

    public static FetchOptions ttl(Duration ttl) {
        return new FetchOptions(ttl, "", true);
    }

    public FetchOptions withPrefix(String newPrefix) {
        return new FetchOptions(ttl, newPrefix, skipNull);
    }

    public FetchOptions cachingNulls() {
        return new FetchOptions(ttl, prefix, false);
    }

    String fullKey(String key) {
        return prefix == null || prefix.isBlank() ? key : prefix + ":" + key;
    }
}
