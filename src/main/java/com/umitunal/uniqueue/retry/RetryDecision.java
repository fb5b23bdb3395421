package com.umitunal.uniqueue.retry;

/**
 * What to do with a job after a recoverable failure.
 */
public final class RetryDecision {
    private static final RetryDecision GIVE_UP = new RetryDecision(false, 0);

    private final boolean retry;
    private final long retryAt;

    private RetryDecision(boolean retry, long retryAt) {
        this.retry = retry;
        this.retryAt = retryAt;
    }

    public static RetryDecision retryAt(long retryAt) {
        return new RetryDecision(true, retryAt);
    }

    public static RetryDecision giveUp() {
        return GIVE_UP;
    }

    public boolean shouldRetry() { return retry; }

    /**
     * Earliest time (millis since epoch) of the next attempt. Only meaningful when retrying.
     */
    public long getRetryAt() { return retryAt; }

    @Override
    public String toString() {
        return retry ? "RetryDecision{retryAt=" + retryAt + "}" : "RetryDecision{giveUp}";
    }
}
