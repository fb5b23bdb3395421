package com.umitunal.uniqueue.core;

/**
 * A write was conditioned on a lease (owner and epoch) or record version that is no longer
 * current. The losing writer discards its update.
 */
public class LeaseConflictException extends QueueException {
    private final String jobId;

    public LeaseConflictException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
