package com.phillippitts.resiliencecore.service.ratelimit;

/**
 * Outcome of an admission check.
 *
 * @param allowed       whether the request may proceed
 * @param limit         requests allowed per window
 * @param remaining     requests still allowed in the current window
 * @param resetSeconds  seconds until the oldest counted request leaves the window
 * @param windowSeconds window length
 */
public record RateLimitDecision(boolean allowed, int limit, int remaining, long resetSeconds, long windowSeconds) {

    static RateLimitDecision allowed(RateLimitRule rule, int remaining, long resetSeconds) {
        return new RateLimitDecision(true, rule.limit(), remaining, resetSeconds, rule.windowSeconds());
    }

    static RateLimitDecision rejected(RateLimitRule rule, long resetSeconds) {
        return new RateLimitDecision(false, rule.limit(), 0, resetSeconds, rule.windowSeconds());
    }
}
