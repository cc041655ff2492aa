package com.phillippitts.resiliencecore.config;

import com.phillippitts.resiliencecore.config.properties.CacheProperties;
import com.phillippitts.resiliencecore.service.cache.LruExpiringCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared singletons of the resilience core that are not components themselves.
 */
@Configuration
public class ResilienceConfig {

    /** Time source for TTLs, breaker cool-downs and rate windows. Tests substitute their own. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Process-wide expiring cache behind the coalescing fetch manager. */
    @Bean
    public LruExpiringCache<String, Object> responseCache(CacheProperties properties, Clock clock) {
        return new LruExpiringCache<>(properties.getMaxSize(), properties.getDefaultTtl(), clock);
    }
}
