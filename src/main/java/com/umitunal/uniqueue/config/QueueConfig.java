package com.umitunal.uniqueue.config;

import com.umitunal.uniqueue.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Runtime configuration of the queue engine: worker pool size, lease timing, loop intervals
 * and per type options.
 */
public class QueueConfig {
    private static final Logger log = LoggerFactory.getLogger(QueueConfig.class);

    private final int poolSize;
    private final Duration leaseDuration;
    private final Duration leaseRenewInterval;
    private final Duration schedulerInterval;
    private final Duration reclaimInterval;
    private final String workerIdPrefix;
    private final int maxPayloadBytes;
    private final RetryPolicy defaultRetryPolicy;
    private final Map<String, TypeOptions> typeOptions;

    private QueueConfig(Builder builder) {
        this.poolSize = builder.poolSize;
        this.leaseDuration = builder.leaseDuration;
        this.leaseRenewInterval = builder.leaseRenewInterval;
        this.schedulerInterval = builder.schedulerInterval;
        this.reclaimInterval = builder.reclaimInterval;
        this.workerIdPrefix = builder.workerIdPrefix != null && !builder.workerIdPrefix.isBlank()
                ? builder.workerIdPrefix
                : generateWorkerIdPrefix();
        this.maxPayloadBytes = builder.maxPayloadBytes;
        this.defaultRetryPolicy = builder.defaultRetryPolicy;
        this.typeOptions = Collections.unmodifiableMap(new HashMap<>(builder.typeOptions));
    }

    public int getPoolSize() { return poolSize; }
    public Duration getLeaseDuration() { return leaseDuration; }
    public Duration getLeaseRenewInterval() { return leaseRenewInterval; }
    public Duration getSchedulerInterval() { return schedulerInterval; }
    public Duration getReclaimInterval() { return reclaimInterval; }
    public String getWorkerIdPrefix() { return workerIdPrefix; }
    public int getMaxPayloadBytes() { return maxPayloadBytes; }
    public RetryPolicy getDefaultRetryPolicy() { return defaultRetryPolicy; }
    public Map<String, TypeOptions> getTypeOptions() { return typeOptions; }

    /**
     * Options for the given type, falling back to {@link TypeOptions#defaults()}.
     */
    public TypeOptions typeOptions(String type) {
        TypeOptions options = typeOptions.get(type);
        return options != null ? options : TypeOptions.defaults();
    }

    /**
     * Retry policy for the given type, falling back to the queue default.
     */
    public RetryPolicy retryPolicy(String type) {
        RetryPolicy policy = typeOptions(type).getRetryPolicy();
        return policy != null ? policy : defaultRetryPolicy;
    }

    public static QueueConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    private static String generateWorkerIdPrefix() {
        String host = "uniqueue";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Local host name unavailable, using '{}' in worker ids", host, e);
        }
        String pid = String.valueOf(ManagementFactory.getRuntimeMXBean().getPid());
        String generated = host + "-" + pid + "-" + UUID.randomUUID().toString().substring(0, 8);
        return generated.length() > 96 ? generated.substring(0, 96) : generated;
    }

    public static class Builder {
        private int poolSize = 4;
        private Duration leaseDuration = Duration.ofSeconds(30);
        private Duration leaseRenewInterval = Duration.ofSeconds(10);
        private Duration schedulerInterval = Duration.ofSeconds(1);
        private Duration reclaimInterval = Duration.ofSeconds(5);
        private String workerIdPrefix;
        private int maxPayloadBytes = 1024 * 1024;
        private RetryPolicy defaultRetryPolicy = RetryPolicy.defaults();
        private final Map<String, TypeOptions> typeOptions = new HashMap<>();

        private Builder() {
        }

        /**
         * Number of concurrent execution slots.
         * Default: 4
         */
        public Builder withPoolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        /**
         * How long a lease stays valid without renewal.
         * Default: 30 seconds
         */
        public Builder withLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
            return this;
        }

        /**
         * How often a running slot extends its lease. Must be shorter than the lease duration.
         * Default: 10 seconds
         */
        public Builder withLeaseRenewInterval(Duration interval) {
            this.leaseRenewInterval = interval;
            return this;
        }

        /**
         * Period of the scheduler tick that runs on top of event-driven cycles.
         * Default: 1 second
         */
        public Builder withSchedulerInterval(Duration interval) {
            this.schedulerInterval = interval;
            return this;
        }

        /**
         * Period of the expired-lease scan.
         * Default: 5 seconds
         */
        public Builder withReclaimInterval(Duration interval) {
            this.reclaimInterval = interval;
            return this;
        }

        /**
         * Prefix of the lease owner ids of this process. Generated from host and pid when unset.
         */
        public Builder withWorkerIdPrefix(String prefix) {
            this.workerIdPrefix = prefix;
            return this;
        }

        /**
         * Largest payload accepted at submission. Large content belongs outside the queue.
         * Default: 1 MiB
         */
        public Builder withMaxPayloadBytes(int maxPayloadBytes) {
            this.maxPayloadBytes = maxPayloadBytes;
            return this;
        }

        public Builder withDefaultRetryPolicy(RetryPolicy policy) {
            this.defaultRetryPolicy = policy;
            return this;
        }

        public Builder withTypeOptions(String type, TypeOptions options) {
            this.typeOptions.put(type, options);
            return this;
        }

        public QueueConfig build() {
            if (poolSize < 1) {
                throw new IllegalArgumentException("poolSize must be at least 1");
            }
            requirePositive(leaseDuration, "leaseDuration");
            requirePositive(leaseRenewInterval, "leaseRenewInterval");
            requirePositive(schedulerInterval, "schedulerInterval");
            requirePositive(reclaimInterval, "reclaimInterval");
            if (leaseRenewInterval.compareTo(leaseDuration) >= 0) {
                throw new IllegalArgumentException("leaseRenewInterval must be shorter than leaseDuration");
            }
            if (maxPayloadBytes < 1) {
                throw new IllegalArgumentException("maxPayloadBytes must be positive");
            }
            if (defaultRetryPolicy == null) {
                throw new IllegalArgumentException("defaultRetryPolicy must not be null");
            }
            for (Map.Entry<String, TypeOptions> entry : typeOptions.entrySet()) {
                if (entry.getKey() == null || entry.getKey().isBlank() || entry.getValue() == null) {
                    throw new IllegalArgumentException("type options need a type name and a value");
                }
            }
            return new QueueConfig(this);
        }

        private static void requirePositive(Duration duration, String name) {
            if (duration == null || duration.isNegative() || duration.isZero()) {
                throw new IllegalArgumentException(name + " must be a positive duration");
            }
        }
    }
}
