package com.phillippitts.resiliencecore.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs final cache statistics and releases cached values when the application stops.
 */
@Component
class CacheShutdownReporter {

    private static final Logger LOG = LogManager.getLogger(CacheShutdownReporter.class);

    private final ExpiringCache<String, Object> cache;

    CacheShutdownReporter(ExpiringCache<String, Object> cache) {
        this.cache = cache;
    }

    @EventListener(ContextClosedEvent.class)
    void onShutdown() {
        CacheStats stats = cache.stats();
        LOG.info("Clearing cache on shutdown: size={}, hits={}, misses={}, hitRate={}%",
                stats.size(), stats.hits(), stats.misses(), stats.hitRate());
        cache.clear();
    }
}
