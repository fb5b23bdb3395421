package com.umitunal.uniqueue.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Metrics and statistics for queue monitoring, overall and per job type.
 *
 * <p>Counts per state come from the store. Recent activity counts jobs that succeeded or
 * failed since {@link #getRecentSince()}. {@link Performance} covers the attempts finished by
 * this process since the queue started.
 */
public class QueueMetrics {
    private final Map<JobState, Long> byState;
    private final Map<String, Map<JobState, Long>> byType;
    private final long recentSince;
    private final long recentSucceeded;
    private final long recentFailed;
    private final Performance performance;

    public QueueMetrics(Map<JobState, Long> byState, Map<String, Map<JobState, Long>> byType,
                        long recentSince, long recentSucceeded, long recentFailed) {
        this(byState, byType, recentSince, recentSucceeded, recentFailed, Performance.NONE);
    }

    private QueueMetrics(Map<JobState, Long> byState, Map<String, Map<JobState, Long>> byType,
                         long recentSince, long recentSucceeded, long recentFailed, Performance performance) {
        EnumMap<JobState, Long> states = new EnumMap<>(JobState.class);
        for (JobState state : JobState.values()) {
            states.put(state, byState.getOrDefault(state, 0L));
        }
        this.byState = Collections.unmodifiableMap(states);

        Map<String, Map<JobState, Long>> types = new TreeMap<>();
        byType.forEach((type, counts) -> types.put(type, Collections.unmodifiableMap(new EnumMap<>(counts))));
        this.byType = Collections.unmodifiableMap(types);

        this.recentSince = recentSince;
        this.recentSucceeded = recentSucceeded;
        this.recentFailed = recentFailed;
        this.performance = performance;
    }

    /**
     * Copy of these metrics carrying the given runtime performance.
     */
    public QueueMetrics withPerformance(Performance performance) {
        return new QueueMetrics(byState, byType, recentSince, recentSucceeded, recentFailed, performance);
    }

    public long getTotalJobs() {
        return byState.values().stream().mapToLong(Long::longValue).sum();
    }

    public long count(JobState state) {
        return byState.get(state);
    }

    public long getPendingJobs() { return count(JobState.PENDING); }
    public long getLeasedJobs() { return count(JobState.LEASED); }
    public long getRetryingJobs() { return count(JobState.RETRYING); }
    public long getSucceededJobs() { return count(JobState.SUCCEEDED); }
    public long getFailedJobs() { return count(JobState.FAILED); }
    public long getCancelledJobs() { return count(JobState.CANCELLED); }

    public Map<JobState, Long> getByState() { return byState; }

    /**
     * Counts per state for each job type that has at least one record.
     */
    public Map<String, Map<JobState, Long>> getByType() { return byType; }

    public long count(String type, JobState state) {
        Map<JobState, Long> counts = byType.get(type);
        return counts == null ? 0 : counts.getOrDefault(state, 0L);
    }

    /**
     * Start of the recent activity window (millis since epoch).
     */
    public long getRecentSince() { return recentSince; }

    /**
     * Jobs that succeeded within the recent activity window.
     */
    public long getRecentSucceeded() { return recentSucceeded; }

    /**
     * Jobs that failed permanently within the recent activity window.
     */
    public long getRecentFailed() { return recentFailed; }

    public Performance getPerformance() { return performance; }

    @Override
    public String toString() {
        return String.format(
            "QueueMetrics{total=%d, pending=%d, leased=%d, retrying=%d, succeeded=%d, failed=%d, cancelled=%d, " +
                    "recentSucceeded=%d, recentFailed=%d, types=%s, %s}",
            getTotalJobs(), getPendingJobs(), getLeasedJobs(), getRetryingJobs(),
            getSucceededJobs(), getFailedJobs(), getCancelledJobs(),
            recentSucceeded, recentFailed, byType.keySet(), performance
        );
    }

    /**
     * Attempts finished by the worker slots of a running queue.
     */
    public static final class Performance {
        public static final Performance NONE = new Performance(0, 0, 0);

        private final long uptimeMillis;
        private final long succeeded;
        private final long failed;

        public Performance(long uptimeMillis, long succeeded, long failed) {
            this.uptimeMillis = uptimeMillis;
            this.succeeded = succeeded;
            this.failed = failed;
        }

        public long getUptimeMillis() { return uptimeMillis; }
        public long getSucceeded() { return succeeded; }
        public long getFailed() { return failed; }

        public long getProcessed() {
            return succeeded + failed;
        }

        /**
         * Share of finished attempts that succeeded, in percent. 0 before the first attempt.
         */
        public double getSuccessRate() {
            return getProcessed() == 0 ? 0.0 : succeeded * 100.0 / getProcessed();
        }

        /**
         * Finished attempts per hour of uptime. Uptimes under an hour count as one hour.
         */
        public double getThroughputPerHour() {
            double hours = Math.max(1.0, uptimeMillis / 3_600_000.0);
            return getProcessed() / hours;
        }

        @Override
        public String toString() {
            return String.format("Performance{uptime=%dms, processed=%d, succeeded=%d, failed=%d, successRate=%.1f%%}",
                    uptimeMillis, getProcessed(), succeeded, failed, getSuccessRate());
        }
    }
}
