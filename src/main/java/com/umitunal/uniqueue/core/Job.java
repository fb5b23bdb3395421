package com.umitunal.uniqueue.core;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a job as persisted by the job store.
 * Instances handed out by the queue are snapshots; they do not follow later changes.
 */
public interface Job {

    /**
     * Gets the unique identifier assigned at submission.
     */
    String getId();

    /**
     * Gets the type tag that selects the handler.
     */
    String getType();

    /**
     * Gets the human readable name, the type unless one was given.
     */
    String getName();

    /**
     * Gets the opaque payload handed to the handler.
     */
    byte[] getPayload();

    int getPriority();

    JobState getState();

    /**
     * Gets the number of reported execution attempts.
     */
    int getAttemptCount();

    int getMaxAttempts();

    long getCreatedAt();

    long getUpdatedAt();

    /**
     * Gets the earliest time (millis since epoch) this job may be scheduled.
     */
    long getNotBefore();

    /**
     * Gets when the latest attempt was leased (millis since epoch), or 0 if it never ran.
     */
    long getStartedAt();

    /**
     * Gets when the job reached a terminal state, or 0 while it is still live.
     */
    long getCompletedAt();

    /**
     * Gets the execution timeout set on this job in millis, 0 when the type's timeout applies.
     */
    long getExecutionTimeoutMs();

    /**
     * Gets the worker holding the lease, or null when not leased.
     */
    String getLeaseOwner();

    long getLeaseExpiresAt();

    boolean isCancelRequested();

    /**
     * Gets the result reference of a successful job.
     */
    String getResult();

    /**
     * Gets the last failure reason.
     */
    String getError();

    /**
     * Gets the last progress percentage reported by the handler (0-100).
     */
    int getProgress();

    String getProgressMessage();

    /**
     * Gets the execution log, oldest entry first.
     */
    List<HistoryEntry> getHistory();

    long getVersion();

    default boolean isTerminal() {
        return getState().isTerminal();
    }

    /**
     * Time from the start of the latest attempt to completion, empty until the job has both.
     */
    default Optional<Duration> getDuration() {
        if (getStartedAt() == 0 || getCompletedAt() == 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(getCompletedAt() - getStartedAt()));
    }

    /**
     * One line of a job's execution log.
     */
    final class HistoryEntry {
        private final long timestamp;
        private final JobState state;
        private final String message;

        public HistoryEntry(long timestamp, JobState state, String message) {
            this.timestamp = timestamp;
            this.state = state;
            this.message = message;
        }

        public long getTimestamp() { return timestamp; }
        public JobState getState() { return state; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("[%d] %s %s", timestamp, state, message);
        }
    }
}
