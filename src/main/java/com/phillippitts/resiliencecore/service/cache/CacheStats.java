package com.phillippitts.resiliencecore.service.cache;

/**
 * Point-in-time cache statistics.
 *
 * @param size    live entry count (may include not-yet-purged expired entries)
 * @param maxSize configured capacity
 * @param hits    successful lookups since start or last clear
 * @param misses  failed lookups since start or last clear
 * @param hitRate hits as a percentage of lookups, rounded to two decimals
 */
public record CacheStats(int size, int maxSize, long hits, long misses, double hitRate) {

    static CacheStats of(int size, int maxSize, long hits, long misses) {
        long total = hits + misses;
        double rate = total == 0 ? 0.0 : Math.round(hits * 10_000.0 / total) / 100.0;
        return new CacheStats(size, maxSize, hits, misses, rate);
    }
}
