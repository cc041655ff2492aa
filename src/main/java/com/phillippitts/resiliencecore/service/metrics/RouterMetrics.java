package com.phillippitts.resiliencecore.service.metrics;

import com.phillippitts.resiliencecore.service.circuit.event.CircuitStateChangedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for model routing and circuit breakers.
 *
 * <p>Provides:
 * <ul>
 *   <li>Provider call latency per model</li>
 *   <li>Success and failure counts per model, failures tagged with a reason</li>
 *   <li>Fallback and exhaustion counts</li>
 *   <li>Circuit state transitions per circuit</li>
 * </ul>
 *
 * <p>Exposed at /actuator/prometheus.
 */
@Component
public class RouterMetrics {

    private static final String ROUTER_PREFIX = "assistant.router";
    private static final String CIRCUIT_PREFIX = "assistant.circuit";

    private final MeterRegistry registry;

    public RouterMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records latency of a successful provider call.
     *
     * @param model model name
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String model, long durationNanos) {
        Timer.builder(ROUTER_PREFIX + ".latency")
                .description("Time taken by a successful provider call")
                .tag("model", model)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String model) {
        Counter.builder(ROUTER_PREFIX + ".success")
                .description("Number of successful provider calls")
                .tag("model", model)
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason (timeout, error, circuit_open, no_handler, rejected)
     */
    public void incrementFailure(String model, String reason) {
        Counter.builder(ROUTER_PREFIX + ".failure")
                .description("Number of failed or skipped provider calls")
                .tag("model", model)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /** Counts requests that were served by a model other than the first candidate. */
    public void incrementFallback(String servedBy) {
        Counter.builder(ROUTER_PREFIX + ".fallback")
                .description("Number of requests served after falling back past a failed tier")
                .tag("model", servedBy)
                .register(registry)
                .increment();
    }

    public void incrementExhausted() {
        Counter.builder(ROUTER_PREFIX + ".exhausted")
                .description("Number of requests for which every candidate failed")
                .register(registry)
                .increment();
    }

    @EventListener
    public void onCircuitStateChanged(CircuitStateChangedEvent event) {
        Counter.builder(CIRCUIT_PREFIX + ".transition")
                .description("Number of circuit breaker state transitions")
                .tag("circuit", event.circuit())
                .tag("to", event.to().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
