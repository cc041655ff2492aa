package com.phillippitts.resiliencecore.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(2_500_000L)).isEqualTo(2);
        assertThat(TimeUtils.nanosToMillis(999_999L)).isZero();
    }

    @Test
    void shouldRoundPartialSecondsUp() {
        assertThat(TimeUtils.ceilSeconds(Duration.ofMillis(200))).isEqualTo(1);
        assertThat(TimeUtils.ceilSeconds(Duration.ofSeconds(30))).isEqualTo(30);
        assertThat(TimeUtils.ceilSeconds(Duration.ofMillis(30_001))).isEqualTo(31);
        assertThat(TimeUtils.ceilSeconds(Duration.ZERO)).isZero();
        assertThat(TimeUtils.ceilSeconds(Duration.ofSeconds(-5))).isZero();
    }

    @Test
    void shouldMeasureElapsedMillis() {
        long start = System.nanoTime() - 5_000_000L;

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(5);
    }
}
