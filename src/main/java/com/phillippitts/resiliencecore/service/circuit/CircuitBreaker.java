package com.phillippitts.resiliencecore.service.circuit;

import com.phillippitts.resiliencecore.exception.CircuitOpenException;
import com.phillippitts.resiliencecore.service.circuit.event.CircuitStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-dependency failure isolation state machine.
 *
 * <p>State transitions:
 * <ul>
 *   <li>CLOSED: every call admitted; {@code failureThreshold} consecutive failures open the circuit</li>
 *   <li>OPEN: calls rejected without invoking the handler until {@code timeout} has elapsed since
 *       the last failure; the first call after that moves to HALF_OPEN and is admitted as a probe</li>
 *   <li>HALF_OPEN: at most {@code halfOpenMaxCalls} probes in flight; any failure reopens the
 *       circuit, {@code successThreshold} consecutive successes close it</li>
 * </ul>
 *
 * <p>{@link #call(Supplier)} is the only path that records outcomes. Admission is decided by
 * {@link #tryAcquire()}, which returns a tagged {@link Admission} rather than throwing; only
 * {@code call} turns a rejection into a {@link CircuitOpenException}.
 *
 * <p>Thread-safe: all state lives behind one lock held only for bookkeeping. The protected
 * action and event publication run outside the lock.
 */
public class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private CircuitStats stats = new CircuitStats();
    private int halfOpenInFlight;
    private long probeGeneration;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), null);
    }

    /**
     * @param publisher receives {@link CircuitStateChangedEvent}s; may be null
     */
    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock,
                          ApplicationEventPublisher publisher) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = publisher;
    }

    /**
     * Runs the action through the breaker.
     *
     * <p>A {@link CancellationException} from the action is neither a success nor a failure;
     * it only gives back the probe slot. Any other {@link RuntimeException} counts as a failure
     * and is rethrown unchanged.
     *
     * @throws CircuitOpenException if the breaker refuses the call
     */
    public <T> T call(Supplier<? extends T> action) {
        Objects.requireNonNull(action, "action");
        Admission admission = tryAcquire();
        if (!admission.admitted()) {
            throw new CircuitOpenException(name, admission.state(), admission.reason());
        }

        T result;
        try {
            result = action.get();
        } catch (CancellationException e) {
            release(admission);
            throw e;
        } catch (RuntimeException e) {
            onFailure(admission, e);
            throw e;
        } catch (Error e) {
            release(admission);
            throw e;
        }
        onSuccess(admission);
        return result;
    }

    /**
     * Decides whether a call may proceed, moving OPEN to HALF_OPEN when the cool-down is over.
     */
    Admission tryAcquire() {
        CircuitStateChangedEvent event = null;
        Admission admission;
        lock.lock();
        try {
            Instant now = clock.instant();
            admission = switch (state) {
                case CLOSED -> Admission.admitted(CircuitState.CLOSED);
                case OPEN -> {
                    if (!coolDownElapsed(now)) {
                        yield Admission.rejected(CircuitState.OPEN,
                                "cooling down until " + stats.lastFailureTime.plus(config.timeout()));
                    }
                    event = transitionTo(CircuitState.HALF_OPEN, now);
                    halfOpenInFlight = 1;
                    yield Admission.probe(probeGeneration);
                }
                case HALF_OPEN -> {
                    if (halfOpenInFlight >= config.halfOpenMaxCalls()) {
                        yield Admission.rejected(CircuitState.HALF_OPEN,
                                "half-open probe limit of " + config.halfOpenMaxCalls() + " reached");
                    }
                    halfOpenInFlight++;
                    yield Admission.probe(probeGeneration);
                }
            };
        } finally {
            lock.unlock();
        }
        publish(event, null);
        return admission;
    }

    /**
     * Operator action: forces CLOSED and clears all statistics.
     */
    public void reset() {
        CircuitStateChangedEvent event = null;
        lock.lock();
        try {
            CircuitState from = state;
            state = CircuitState.CLOSED;
            stats = new CircuitStats();
            halfOpenInFlight = 0;
            probeGeneration++;
            if (from != CircuitState.CLOSED) {
                event = new CircuitStateChangedEvent(name, from, CircuitState.CLOSED, clock.instant());
            }
        } finally {
            lock.unlock();
        }
        LOG.info("Circuit '{}' manually reset", name);
        publish(event, null);
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns true unless the circuit is OPEN and still cooling down. An OPEN circuit whose
     * cool-down has elapsed is available because its next call will be admitted as a probe.
     */
    public boolean isAvailable() {
        lock.lock();
        try {
            return state != CircuitState.OPEN || coolDownElapsed(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public CircuitStatus status() {
        lock.lock();
        try {
            return new CircuitStatus(name, state, stats.totalCalls, stats.successfulCalls,
                    stats.failedCalls, stats.consecutiveFailures, stats.failureRate());
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(Admission admission) {
        CircuitStateChangedEvent event = null;
        lock.lock();
        try {
            stats.totalCalls++;
            stats.successfulCalls++;
            stats.consecutiveFailures = 0;
            // While HALF_OPEN only probes of the current episode count toward closing
            boolean halfOpen = state == CircuitState.HALF_OPEN;
            if (!halfOpen || isCurrentProbe(admission)) {
                stats.consecutiveSuccesses++;
            }
            releaseProbe(admission);
            if (halfOpen && stats.consecutiveSuccesses >= config.successThreshold()) {
                event = transitionTo(CircuitState.CLOSED, clock.instant());
            }
        } finally {
            lock.unlock();
        }
        publish(event, null);
    }

    private void onFailure(Admission admission, RuntimeException error) {
        CircuitStateChangedEvent event = null;
        lock.lock();
        try {
            Instant now = clock.instant();
            stats.totalCalls++;
            stats.failedCalls++;
            stats.consecutiveFailures++;
            stats.consecutiveSuccesses = 0;
            stats.lastFailureTime = now;
            releaseProbe(admission);
            if (state == CircuitState.HALF_OPEN) {
                event = transitionTo(CircuitState.OPEN, now);
            } else if (state == CircuitState.CLOSED
                    && stats.consecutiveFailures >= config.failureThreshold()) {
                event = transitionTo(CircuitState.OPEN, now);
            }
        } finally {
            lock.unlock();
        }
        publish(event, error);
    }

    private void release(Admission admission) {
        lock.lock();
        try {
            releaseProbe(admission);
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock. Probes admitted by an earlier HALF_OPEN episode are ignored.
    private void releaseProbe(Admission admission) {
        if (isCurrentProbe(admission) && state == CircuitState.HALF_OPEN && halfOpenInFlight > 0) {
            halfOpenInFlight--;
        }
    }

    // Caller holds the lock.
    private boolean isCurrentProbe(Admission admission) {
        return admission.probe() && admission.generation() == probeGeneration;
    }

    // Caller holds the lock.
    private CircuitStateChangedEvent transitionTo(CircuitState target, Instant now) {
        CircuitState from = state;
        state = target;
        switch (target) {
            case HALF_OPEN -> {
                probeGeneration++;
                halfOpenInFlight = 0;
                stats.consecutiveSuccesses = 0;
            }
            case OPEN -> halfOpenInFlight = 0;
            case CLOSED -> {
                stats.consecutiveFailures = 0;
                stats.consecutiveSuccesses = 0;
                halfOpenInFlight = 0;
            }
        }
        return new CircuitStateChangedEvent(name, from, target, now);
    }

    private boolean coolDownElapsed(Instant now) {
        Instant lastFailure = stats.lastFailureTime;
        return lastFailure == null || !now.isBefore(lastFailure.plus(config.timeout()));
    }

    private void publish(CircuitStateChangedEvent event, RuntimeException error) {
        if (event == null) {
            return;
        }
        if (event.to() == CircuitState.OPEN) {
            LOG.warn("Circuit '{}' {} -> OPEN: {}", name, event.from(),
                    error == null ? "threshold reached" : error.toString());
        } else if (event.to() == CircuitState.CLOSED) {
            LOG.info("Circuit '{}' CLOSED - dependency recovered", name);
        } else {
            LOG.info("Circuit '{}' transitioning to HALF_OPEN", name);
        }
        if (publisher != null) {
            publisher.publishEvent(event);
        }
    }
}
