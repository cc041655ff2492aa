package com.phillippitts.resiliencecore.service.metrics;

import com.phillippitts.resiliencecore.service.cache.LruExpiringCache;
import com.phillippitts.resiliencecore.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CacheMetricsTest {

    @Test
    void shouldExposeLiveCacheStatistics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        LruExpiringCache<String, Object> cache = new LruExpiringCache<>(10, Duration.ofMinutes(5), new MutableClock());
        new CacheMetrics(registry, cache);

        cache.set("a", 1);
        cache.set("b", 2);
        cache.get("a");
        cache.get("missing");

        assertThat(registry.get("assistant.cache.size").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("assistant.cache.hits").functionCounter().count()).isEqualTo(1.0);
        assertThat(registry.get("assistant.cache.misses").functionCounter().count()).isEqualTo(1.0);
    }
}
