package com.umitunal.uniqueue.config;

import com.umitunal.uniqueue.retry.RetryPolicy;

import java.time.Duration;

/**
 * Per job type tuning: fair-share weight, concurrency ceiling, submission defaults and
 * the retry policy / execution timeout applied to jobs of that type.
 */
public class TypeOptions {
    private final double weight;
    private final int maxConcurrent;
    private final int defaultPriority;
    private final RetryPolicy retryPolicy;
    private final Duration executionTimeout;

    private TypeOptions(Builder builder) {
        this.weight = builder.weight;
        this.maxConcurrent = builder.maxConcurrent;
        this.defaultPriority = builder.defaultPriority;
        this.retryPolicy = builder.retryPolicy;
        this.executionTimeout = builder.executionTimeout;
    }

    public double getWeight() { return weight; }
    public int getMaxConcurrent() { return maxConcurrent; }
    public int getDefaultPriority() { return defaultPriority; }

    /**
     * The type specific retry policy, or null to fall back to the queue default.
     */
    public RetryPolicy getRetryPolicy() { return retryPolicy; }

    /**
     * Execution time budget for one attempt, or null when unbounded.
     */
    public Duration getExecutionTimeout() { return executionTimeout; }

    public static TypeOptions defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private double weight = 1.0;
        private int maxConcurrent = Integer.MAX_VALUE;
        private int defaultPriority = 0;
        private RetryPolicy retryPolicy;
        private Duration executionTimeout;

        private Builder() {
        }

        /**
         * Relative share of worker slots when several types compete.
         * Default: 1.0
         */
        public Builder withWeight(double weight) {
            this.weight = weight;
            return this;
        }

        /**
         * Hard ceiling on concurrently leased jobs of this type.
         * Default: unbounded
         */
        public Builder withMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        /**
         * Priority used when a submission does not carry one.
         * Default: 0
         */
        public Builder withDefaultPriority(int priority) {
            this.defaultPriority = priority;
            return this;
        }

        public Builder withRetryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder withExecutionTimeout(Duration timeout) {
            this.executionTimeout = timeout;
            return this;
        }

        public TypeOptions build() {
            if (!(weight > 0.0) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("weight must be a positive finite number");
            }
            if (maxConcurrent < 1) {
                throw new IllegalArgumentException("maxConcurrent must be at least 1");
            }
            if (executionTimeout != null && (executionTimeout.isNegative() || executionTimeout.isZero())) {
                throw new IllegalArgumentException("executionTimeout must be positive");
            }
            return new TypeOptions(this);
        }
    }
}
