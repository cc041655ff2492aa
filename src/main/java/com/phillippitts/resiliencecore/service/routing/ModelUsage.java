package com.phillippitts.resiliencecore.service.routing;

/**
 * Running usage totals for one model. Tokens are estimated at four characters per token.
 * Only the router mutates it.
 */
public final class ModelUsage {

    static final int CHARS_PER_TOKEN = 4;

    private long calls;
    private long tokensIn;
    private long tokensOut;
    private double estimatedCost;

    synchronized void record(int inputChars, int outputChars, double costPer1kTokens) {
        long in = inputChars / CHARS_PER_TOKEN;
        long out = outputChars / CHARS_PER_TOKEN;
        calls++;
        tokensIn += in;
        tokensOut += out;
        estimatedCost += (in + out) / 1000.0 * costPer1kTokens;
    }

    synchronized Snapshot snapshot() {
        return new Snapshot(calls, tokensIn, tokensOut, Math.round(estimatedCost * 1_000_000.0) / 1_000_000.0);
    }

    /** Reported usage for one model; cost rounded to six decimals. */
    public record Snapshot(long calls, long tokensIn, long tokensOut, double estimatedCost) { }
}
