package com.phillippitts.resiliencecore.presentation.ratelimit;

import jakarta.servlet.http.HttpServletResponse;

/** Response header names and writer for admission-control state. */
public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";

    private RateLimitHeaders() {
    }

    public static void write(HttpServletResponse response, int limit, int remaining, long resetSeconds) {
        response.setHeader(LIMIT, String.valueOf(limit));
        response.setHeader(REMAINING, String.valueOf(remaining));
        response.setHeader(RESET, String.valueOf(resetSeconds));
    }
}
