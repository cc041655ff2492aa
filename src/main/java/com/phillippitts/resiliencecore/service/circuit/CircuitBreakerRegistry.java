package com.phillippitts.resiliencecore.service.circuit;

import com.phillippitts.resiliencecore.config.properties.CircuitBreakerProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide owner of circuit breakers, one per logical dependency name.
 *
 * <p>Breakers are created lazily on first use and live for the lifetime of the process.
 * Config precedence for a new breaker: per-name override from properties, then the config
 * supplied by the caller, then the configured defaults.
 */
@Component
public class CircuitBreakerRegistry {

    private static final Logger LOG = LogManager.getLogger(CircuitBreakerRegistry.class);

    private final CircuitBreakerProperties properties;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerProperties properties, Clock clock,
                                  ApplicationEventPublisher publisher) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = publisher;
    }

    public CircuitBreaker getOrCreate(String name) {
        return getOrCreate(name, null);
    }

    /**
     * Returns the breaker for the name, creating it on first use. A config passed for an
     * existing breaker is ignored.
     *
     * @param config thresholds to use when no per-name override exists; null for defaults
     */
    public CircuitBreaker getOrCreate(String name, CircuitBreakerConfig config) {
        Objects.requireNonNull(name, "name");
        return breakers.computeIfAbsent(name, n -> {
            CircuitBreakerConfig resolved = resolveConfig(n, config);
            LOG.info("Created circuit breaker '{}' with {}", n, resolved);
            return new CircuitBreaker(n, resolved, clock, publisher);
        });
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    /** Status of every breaker, sorted by name. */
    public List<CircuitStatus> getAllStatus() {
        return breakers.values().stream()
                .map(CircuitBreaker::status)
                .sorted(Comparator.comparing(CircuitStatus::name))
                .toList();
    }

    /**
     * Operator action: resets one breaker.
     *
     * @return false if no breaker with that name exists
     */
    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    /** Operator action: resets every breaker. */
    public int resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        LOG.info("Reset {} circuit breakers", breakers.size());
        return breakers.size();
    }

    CircuitBreakerConfig resolveConfig(String name, CircuitBreakerConfig callerConfig) {
        CircuitBreakerConfig base = callerConfig != null ? callerConfig : properties.defaultConfig();
        CircuitBreakerProperties.Settings override = properties.getInstances().get(name);
        return override != null ? override.mergeOver(base) : base;
    }
}
