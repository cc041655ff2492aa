package com.phillippitts.resiliencecore.service.metrics;

import com.phillippitts.resiliencecore.service.cache.ExpiringCache;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Exposes the shared response cache's statistics as Micrometer meters.
 */
@Component
public class CacheMetrics {

    private static final String METRIC_PREFIX = "assistant.cache";

    public CacheMetrics(MeterRegistry registry, ExpiringCache<String, Object> cache) {
        Gauge.builder(METRIC_PREFIX + ".size", cache, c -> c.stats().size())
                .description("Entries currently held by the cache")
                .register(registry);
        FunctionCounter.builder(METRIC_PREFIX + ".hits", cache, c -> c.stats().hits())
                .description("Cache lookups that found a live entry")
                .register(registry);
        FunctionCounter.builder(METRIC_PREFIX + ".misses", cache, c -> c.stats().misses())
                .description("Cache lookups that found nothing or an expired entry")
                .register(registry);
    }
}
