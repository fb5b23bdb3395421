package com.umitunal.uniqueue.model;

import com.umitunal.uniqueue.core.CancelOutcome;
import com.umitunal.uniqueue.core.IllegalTransitionException;
import com.umitunal.uniqueue.core.Job;
import com.umitunal.uniqueue.core.JobState;
import com.umitunal.uniqueue.core.LeaseConflictException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Persisted job with full state management.
 *
 * <p>All transitions go through the methods below, which enforce the lifecycle and bump the
 * version. Lease-held transitions (report, renew, progress) take the {@link Lease} obtained
 * from {@link #lease} and fail with {@link LeaseConflictException} once that lease is stale.
 */
public class JobRecord implements Job {
    static final int MAX_HISTORY = 50;

    private String id;
    private long sequence;
    private final String type;
    private final String name;
    private final byte[] payload;
    private final int priority;
    private final int maxAttempts;
    private final long createdAt;
    private final long executionTimeoutMs;

    private JobState state;
    private int attemptCount;
    private long updatedAt;
    private long notBefore;
    private long startedAt;
    private long completedAt;
    private String leaseOwner;
    private long leaseExpiresAt;
    private long leaseEpoch;
    private long version;
    private boolean cancelRequested;
    private String result;
    private String error;
    private int progress;
    private String progressMessage;
    private final List<HistoryEntry> history = new ArrayList<>();

    JobRecord(String id, long sequence, String type, String name, byte[] payload,
              int priority, int maxAttempts, long executionTimeoutMs, long createdAt) {
        this.id = id;
        this.sequence = sequence;
        this.type = type;
        this.name = name;
        this.payload = payload;
        this.priority = priority;
        this.maxAttempts = maxAttempts;
        this.executionTimeoutMs = executionTimeoutMs;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.state = JobState.PENDING;
    }

    /**
     * Create an unsaved PENDING job. The store assigns id and sequence on submission.
     */
    public static JobRecord draft(String type, String name, byte[] payload, int priority,
                                  int maxAttempts, long notBefore, long now) {
        return draft(type, name, payload, priority, maxAttempts, 0, notBefore, now);
    }

    /**
     * @param executionTimeoutMs per-job execution timeout, 0 to use the type's
     */
    public static JobRecord draft(String type, String name, byte[] payload, int priority,
                                  int maxAttempts, long executionTimeoutMs, long notBefore, long now) {
        JobRecord record = new JobRecord(null, 0, type, name != null ? name : type,
                payload, priority, maxAttempts, executionTimeoutMs, now);
        record.notBefore = notBefore;
        return record;
    }

    /**
     * Bind the identity chosen by the store. Only valid once, on a draft.
     */
    public void assignIdentity(String id, long sequence) {
        if (this.id != null) {
            throw new IllegalStateException("Job already has id " + this.id);
        }
        this.id = id;
        this.sequence = sequence;
        appendHistory(createdAt, "submitted");
    }

    @Override public String getId() { return id; }
    public long getSequence() { return sequence; }
    @Override public String getType() { return type; }
    @Override public String getName() { return name; }
    @Override public byte[] getPayload() { return payload; }
    @Override public int getPriority() { return priority; }
    @Override public JobState getState() { return state; }
    @Override public int getAttemptCount() { return attemptCount; }
    @Override public int getMaxAttempts() { return maxAttempts; }
    @Override public long getCreatedAt() { return createdAt; }
    @Override public long getUpdatedAt() { return updatedAt; }
    @Override public long getNotBefore() { return notBefore; }
    @Override public long getStartedAt() { return startedAt; }
    @Override public long getCompletedAt() { return completedAt; }
    @Override public long getExecutionTimeoutMs() { return executionTimeoutMs; }
    @Override public String getLeaseOwner() { return leaseOwner; }
    @Override public long getLeaseExpiresAt() { return leaseExpiresAt; }
    public long getLeaseEpoch() { return leaseEpoch; }
    @Override public long getVersion() { return version; }
    @Override public boolean isCancelRequested() { return cancelRequested; }
    @Override public String getResult() { return result; }
    @Override public String getError() { return error; }
    @Override public int getProgress() { return progress; }
    @Override public String getProgressMessage() { return progressMessage; }

    @Override
    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public boolean isEligible(long now) {
        return state == JobState.PENDING && notBefore <= now;
    }

    public boolean isLeaseExpired(long now) {
        return state == JobState.LEASED && leaseExpiresAt < now;
    }

    // ========== Transitions ==========

    /**
     * PENDING -> LEASED. Starts a new lease epoch.
     */
    public Lease lease(String owner, long durationMs, long now) throws IllegalTransitionException {
        if (state != JobState.PENDING || notBefore > now || attemptCount >= maxAttempts) {
            throw new IllegalTransitionException(id, state, JobState.LEASED);
        }
        leaseOwner = owner;
        leaseEpoch++;
        leaseExpiresAt = now + durationMs;
        startedAt = now;
        completedAt = 0;
        moveTo(JobState.LEASED, now, "leased by " + owner + " (attempt " + (attemptCount + 1) + "/" + maxAttempts + ")");
        return new Lease(id, owner, leaseEpoch, leaseExpiresAt);
    }

    /**
     * Verify that {@code lease} is the current lease of this job.
     */
    public void checkLease(Lease lease) throws LeaseConflictException {
        if (state != JobState.LEASED) {
            throw new LeaseConflictException(id, "Job " + id + " is " + state + ", lease " + lease.getEpoch() + " is stale");
        }
        if (!lease.getOwner().equals(leaseOwner) || lease.getEpoch() != leaseEpoch) {
            throw new LeaseConflictException(id, String.format("Job %s is leased by %s (epoch %d), not %s (epoch %d)",
                    id, leaseOwner, leaseEpoch, lease.getOwner(), lease.getEpoch()));
        }
    }

    /**
     * Push the lease expiry to {@code now + durationMs}. Never shortens it.
     */
    public void renewLease(Lease lease, long durationMs, long now) throws LeaseConflictException {
        checkLease(lease);
        leaseExpiresAt = Math.max(leaseExpiresAt, now + durationMs);
        lease.setExpiresAt(leaseExpiresAt);
        touch(now);
    }

    public void reportProgress(Lease lease, int percent, String message, long now) throws LeaseConflictException {
        checkLease(lease);
        progress = Math.max(0, Math.min(100, percent));
        progressMessage = message;
        touch(now);
    }

    /**
     * LEASED -> SUCCEEDED, or CANCELLED when cancellation was requested meanwhile.
     */
    public void succeed(Lease lease, String result, long now) throws LeaseConflictException {
        checkLease(lease);
        attemptCount++;
        endLease();
        if (cancelRequested) {
            moveTo(JobState.CANCELLED, now, "cancelled, handler finished after cancellation request");
            return;
        }
        this.result = result;
        this.progress = 100;
        moveTo(JobState.SUCCEEDED, now, "succeeded on attempt " + attemptCount);
    }

    /**
     * LEASED -> RETRYING with the given earliest retry time. Falls through to FAILED if this
     * attempt was the last one allowed.
     */
    public void retry(Lease lease, String reason, long retryAt, long now) throws LeaseConflictException {
        checkLease(lease);
        attemptCount++;
        endLease();
        error = reason;
        if (cancelRequested) {
            moveTo(JobState.CANCELLED, now, "cancelled, handler failed after cancellation request: " + reason);
        } else if (attemptCount >= maxAttempts) {
            moveTo(JobState.FAILED, now, "failed permanently after " + attemptCount + " attempts: " + reason);
        } else {
            notBefore = retryAt;
            moveTo(JobState.RETRYING, now, "attempt " + attemptCount + " failed, retry at " + retryAt + ": " + reason);
        }
    }

    /**
     * LEASED -> FAILED regardless of remaining attempts.
     */
    public void fail(Lease lease, String reason, long now) throws LeaseConflictException {
        checkLease(lease);
        attemptCount++;
        endLease();
        error = reason;
        if (cancelRequested) {
            moveTo(JobState.CANCELLED, now, "cancelled, handler failed after cancellation request: " + reason);
        } else {
            moveTo(JobState.FAILED, now, "failed permanently: " + reason);
        }
    }

    /**
     * LEASED (expired) -> PENDING without counting an attempt.
     */
    public void reclaim(long now) throws IllegalTransitionException {
        if (!isLeaseExpired(now)) {
            throw new IllegalTransitionException(id, state, JobState.PENDING);
        }
        String previousOwner = leaseOwner;
        endLease();
        if (cancelRequested) {
            moveTo(JobState.CANCELLED, now, "cancelled, lease of " + previousOwner + " expired");
            return;
        }
        notBefore = now;
        moveTo(JobState.PENDING, now, "lease of " + previousOwner + " expired, returned to queue");
    }

    /**
     * LEASED -> PENDING by the lease holder itself, e.g. on shutdown. Does not count an attempt.
     */
    public void relinquish(Lease lease, String reason, long now) throws LeaseConflictException {
        checkLease(lease);
        endLease();
        if (cancelRequested) {
            moveTo(JobState.CANCELLED, now, "cancelled, released by worker: " + reason);
            return;
        }
        notBefore = now;
        moveTo(JobState.PENDING, now, "released by worker: " + reason);
    }

    /**
     * RETRYING -> PENDING once the backoff has elapsed.
     */
    public void promote(long now) throws IllegalTransitionException {
        if (state != JobState.RETRYING || notBefore > now) {
            throw new IllegalTransitionException(id, state, JobState.PENDING);
        }
        moveTo(JobState.PENDING, now, "backoff elapsed");
    }

    public CancelOutcome cancel(long now) {
        switch (state) {
            case PENDING:
            case RETRYING:
                moveTo(JobState.CANCELLED, now, "cancelled");
                return CancelOutcome.CANCELLED;
            case LEASED:
                if (!cancelRequested) {
                    cancelRequested = true;
                    appendHistory(now, "cancellation requested");
                    touch(now);
                }
                return CancelOutcome.CANCEL_REQUESTED;
            default:
                return CancelOutcome.NOT_CANCELLABLE;
        }
    }

    private void endLease() {
        leaseOwner = null;
        leaseExpiresAt = 0;
    }

    private void moveTo(JobState next, long now, String message) {
        state = next;
        if (next.isTerminal()) {
            completedAt = now;
        }
        appendHistory(now, message);
        touch(now);
    }

    private void touch(long now) {
        updatedAt = now;
        version++;
    }

    private void appendHistory(long now, String message) {
        history.add(new HistoryEntry(now, state, message));
        if (history.size() > MAX_HISTORY) {
            history.remove(0);
        }
    }

    // Package-private setters for deserialization

    void setState(JobState state) { this.state = state; }
    void setAttemptCount(int attemptCount) { this.attemptCount = attemptCount; }
    void setUpdatedAt(long updatedAt) { this.updatedAt = updatedAt; }
    void setNotBefore(long notBefore) { this.notBefore = notBefore; }
    void setStartedAt(long startedAt) { this.startedAt = startedAt; }
    void setCompletedAt(long completedAt) { this.completedAt = completedAt; }
    void setLeaseOwner(String leaseOwner) { this.leaseOwner = leaseOwner; }
    void setLeaseExpiresAt(long leaseExpiresAt) { this.leaseExpiresAt = leaseExpiresAt; }
    void setLeaseEpoch(long leaseEpoch) { this.leaseEpoch = leaseEpoch; }
    void setVersion(long version) { this.version = version; }
    void setCancelRequested(boolean cancelRequested) { this.cancelRequested = cancelRequested; }
    void setResult(String result) { this.result = result; }
    void setError(String error) { this.error = error; }
    void setProgress(int progress) { this.progress = progress; }
    void setProgressMessage(String progressMessage) { this.progressMessage = progressMessage; }
    void restoreHistory(List<HistoryEntry> entries) {
        history.clear();
        history.addAll(entries);
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id='%s', type='%s', state=%s, attempt=%d/%d, priority=%d, owner='%s', version=%d}",
                id, type, state, attemptCount, maxAttempts, priority, leaseOwner, version);
    }
}
