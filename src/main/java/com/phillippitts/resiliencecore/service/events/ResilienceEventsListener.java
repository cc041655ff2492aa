package com.phillippitts.resiliencecore.service.events;

import com.phillippitts.resiliencecore.service.circuit.CircuitState;
import com.phillippitts.resiliencecore.service.circuit.event.CircuitStateChangedEvent;
import com.phillippitts.resiliencecore.service.routing.event.AllModelsFailedEvent;
import com.phillippitts.resiliencecore.service.routing.event.ModelFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing summaries of degradation events. Throttled per key to avoid log spam
 * while a dependency is down.
 */
@Component
class ResilienceEventsListener {
    private static final Logger LOG = LogManager.getLogger(ResilienceEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ResilienceEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onCircuitOpened(CircuitStateChangedEvent e) {
        if (e.to() == CircuitState.OPEN && shouldLog("circuit-open-" + e.circuit())) {
            LOG.warn("Dependency '{}' is failing; calls are short-circuited until it recovers", e.circuit());
        }
    }

    @EventListener
    void onModelFallback(ModelFallbackEvent e) {
        if (shouldLog("fallback-" + e.model() + '-' + e.reason())) {
            LOG.warn("Falling back past model {} (reason={})", e.model(), e.reason());
        }
    }

    @EventListener
    void onAllModelsFailed(AllModelsFailedEvent e) {
        if (shouldLog("all-failed-" + e.capability())) {
            LOG.error("No model could serve capability={} (attempted={}). Check provider credentials and health.",
                    e.capability(), e.attempted());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        boolean[] log = new boolean[1];
        lastLog.compute(key, (k, prev) -> {
            log[0] = prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0;
            return log[0] ? now : prev;
        });
        return log[0];
    }
}
