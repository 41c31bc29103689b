package com.propertychain.throttling.model;

/**
 * Result returned by the rate limiter for a single request.
 */
public class RateLimitDecision {

    private final boolean admitted;
    private final int limit;
    private final long remaining;
    private final long resetAtMillis;
    private final long observedCount;

    public RateLimitDecision(boolean admitted, int limit, long observedCount, long resetAtMillis) {
        this.admitted = admitted;
        this.limit = limit;
        this.observedCount = observedCount;
        this.remaining = Math.max(0L, limit - observedCount);
        this.resetAtMillis = resetAtMillis;
    }

    public static RateLimitDecision admit(int limit, long observedCount, long resetAtMillis) {
        return new RateLimitDecision(true, limit, observedCount, resetAtMillis);
    }

    public static RateLimitDecision deny(int limit, long observedCount, long resetAtMillis) {
        return new RateLimitDecision(false, limit, observedCount, resetAtMillis);
    }

    public boolean isAdmitted() {
        return admitted;
    }

    /**
     * @return the effective limit for this evaluation, after any penalty was applied.
     */
    public int getLimit() {
        return limit;
    }

    public long getRemaining() {
        return remaining;
    }

    /**
     * @return epoch millis of the next window boundary.
     */
    public long getResetAtMillis() {
        return resetAtMillis;
    }

    public long getObservedCount() {
        return observedCount;
    }

    @Override
    public String toString() {
        return "RateLimitDecision{admitted=" + admitted
                + ", limit=" + limit
                + ", remaining=" + remaining
                + ", resetAtMillis=" + resetAtMillis
                + ", observedCount=" + observedCount + '}';
    }
}
