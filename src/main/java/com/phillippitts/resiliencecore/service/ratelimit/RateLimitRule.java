package com.phillippitts.resiliencecore.service.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * At most {@code limit} requests in any trailing {@code window}.
 */
public record RateLimitRule(int limit, Duration window) {

    public RateLimitRule {
        Objects.requireNonNull(window, "window");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
    }

    public long windowSeconds() {
        return window.toSeconds();
    }
}
