package com.phillippitts.resiliencecore.service.events;

import com.phillippitts.resiliencecore.service.circuit.CircuitState;
import com.phillippitts.resiliencecore.service.circuit.event.CircuitStateChangedEvent;
import com.phillippitts.resiliencecore.service.routing.event.AllModelsFailedEvent;
import com.phillippitts.resiliencecore.service.routing.event.ModelFallbackEvent;
import com.phillippitts.resiliencecore.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ResilienceEventsListenerTest {

    private final MutableClock clock = new MutableClock();
    private final ResilienceEventsListener listener = new ResilienceEventsListener(clock);

    @Test
    void shouldThrottleRepeatedKeysForOneMinute() {
        assertThat(listener.shouldLog("fallback-gemini-pro-timeout")).isTrue();
        assertThat(listener.shouldLog("fallback-gemini-pro-timeout")).isFalse();
        assertThat(listener.shouldLog("fallback-gemini-flash-timeout")).isTrue();

        clock.advance(Duration.ofSeconds(60));
        assertThat(listener.shouldLog("fallback-gemini-pro-timeout")).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(listener.shouldLog("fallback-gemini-pro-timeout")).isTrue();
    }

    @Test
    void shouldHandleEveryEventType() {
        Instant now = clock.instant();

        assertThatCode(() -> {
            listener.onCircuitOpened(new CircuitStateChangedEvent("model:a", CircuitState.CLOSED, CircuitState.OPEN, now));
            listener.onCircuitOpened(new CircuitStateChangedEvent("model:a", CircuitState.OPEN, CircuitState.HALF_OPEN, now));
            listener.onModelFallback(new ModelFallbackEvent("a", "timeout", now));
            listener.onAllModelsFailed(new AllModelsFailedEvent(null, List.of("a", "b"), now));
        }).doesNotThrowAnyException();

        assertThat(listener.shouldLog("circuit-open-model:a")).isFalse();
    }
}
