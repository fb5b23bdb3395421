package com.umitunal.uniqueue.retry;

import java.time.Duration;

/**
 * Retry options for a job type: attempt ceiling plus the shape of the backoff curve.
 */
public class RetryPolicy {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(5);
    public static final double DEFAULT_JITTER_FRACTION = 0.2;

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFraction;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.jitterFraction = builder.jitterFraction;
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getBaseDelay() { return baseDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public double getJitterFraction() { return jitterFraction; }

    public static RetryPolicy defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("RetryPolicy{maxAttempts=%d, baseDelay=%s, maxDelay=%s, jitter=%.2f}",
                maxAttempts, baseDelay, maxDelay, jitterFraction);
    }

    public static class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double jitterFraction = DEFAULT_JITTER_FRACTION;

        private Builder() {
        }

        /**
         * Total executions allowed before the job fails for good.
         * Default: 3
         */
        public Builder withMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Delay after the first failure. Doubles with every further failure.
         * Default: 1 second
         */
        public Builder withBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        /**
         * Upper bound for any single backoff.
         * Default: 5 minutes
         */
        public Builder withMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * Share (0..1) of the gap to the next backoff step that may be added at random.
         * Default: 0.2
         */
        public Builder withJitterFraction(double jitterFraction) {
            this.jitterFraction = jitterFraction;
            return this;
        }

        public RetryPolicy build() {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
                throw new IllegalArgumentException("baseDelay must be positive");
            }
            if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
            }
            if (jitterFraction < 0.0 || jitterFraction > 1.0) {
                throw new IllegalArgumentException("jitterFraction must be within [0, 1]");
            }
            return new RetryPolicy(this);
        }
    }
}
