package com.phillippitts.resiliencecore.exception;

/**
 * Thrown when admission control rejects a request for the current window.
 */
public class RateLimitExceededException extends AssistantCoreException {

    private final int limit;
    private final long resetSeconds;
    private final long windowSeconds;

    public RateLimitExceededException(int limit, long resetSeconds, long windowSeconds) {
        super("Rate limit exceeded: " + limit + " requests per " + windowSeconds
                + "s, retry after " + resetSeconds + "s");
        this.limit = limit;
        this.resetSeconds = resetSeconds;
        this.windowSeconds = windowSeconds;
    }

    public int getLimit() {
        return limit;
    }

    public long getResetSeconds() {
        return resetSeconds;
    }

    public long getWindowSeconds() {
        return windowSeconds;
    }
}
