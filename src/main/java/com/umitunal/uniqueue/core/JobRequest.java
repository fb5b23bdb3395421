package com.umitunal.uniqueue.core;

import com.umitunal.uniqueue.serialization.PayloadCodec;

import java.time.Duration;
import java.time.Instant;

/**
 * A job submission. Priority, max attempts and execution timeout fall back to the type's
 * configured defaults when not set.
 */
public class JobRequest {
    private final String type;
    private final String name;
    private final byte[] payload;
    private final Integer priority;
    private final Integer maxAttempts;
    private final Instant notBefore;
    private final Duration delay;
    private final Duration timeout;

    private JobRequest(Builder builder) {
        this.type = builder.type;
        this.name = builder.name;
        this.payload = builder.payload;
        this.priority = builder.priority;
        this.maxAttempts = builder.maxAttempts;
        this.notBefore = builder.notBefore;
        this.delay = builder.delay;
        this.timeout = builder.timeout;
    }

    public String getType() { return type; }
    public String getName() { return name; }
    public byte[] getPayload() { return payload; }

    /**
     * Requested priority, or null for the type default.
     */
    public Integer getPriority() { return priority; }

    /**
     * Requested attempt ceiling, or null for the type's retry policy.
     */
    public Integer getMaxAttempts() { return maxAttempts; }

    public Instant getNotBefore() { return notBefore; }
    public Duration getDelay() { return delay; }

    /**
     * Requested execution timeout, or null for the type's.
     */
    public Duration getTimeout() { return timeout; }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public static class Builder {
        private final String type;
        private String name;
        private byte[] payload = new byte[0];
        private Integer priority;
        private Integer maxAttempts;
        private Instant notBefore;
        private Duration delay;
        private Duration timeout;

        private Builder(String type) {
            this.type = type;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        /**
         * Encode a typed payload with the codec the handler will decode it with.
         */
        public <T> Builder payload(T value, PayloadCodec<T> codec) {
            this.payload = codec.encode(value);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Do not schedule the job before this instant.
         */
        public Builder notBefore(Instant notBefore) {
            this.notBefore = notBefore;
            return this;
        }

        /**
         * Do not schedule the job before the given delay has passed after submission.
         */
        public Builder delay(Duration delay) {
            this.delay = delay;
            return this;
        }

        /**
         * Stop an attempt that runs longer than this and count it as a recoverable failure.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public JobRequest build() {
            return new JobRequest(this);
        }
    }
}
