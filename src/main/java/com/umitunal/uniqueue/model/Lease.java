package com.umitunal.uniqueue.model;

/**
 * Proof of ownership of a leased job: the owner id plus the lease epoch at acquisition time.
 * Reports made with a lease whose epoch is no longer current are rejected.
 */
public final class Lease {
    private final String jobId;
    private final String owner;
    private final long epoch;
    private volatile long expiresAt;

    public Lease(String jobId, String owner, long epoch, long expiresAt) {
        this.jobId = jobId;
        this.owner = owner;
        this.epoch = epoch;
        this.expiresAt = expiresAt;
    }

    public String getJobId() { return jobId; }
    public String getOwner() { return owner; }
    public long getEpoch() { return epoch; }
    public long getExpiresAt() { return expiresAt; }

    void setExpiresAt(long expiresAt) {
        this.expiresAt = expiresAt;
    }

    @Override
    public String toString() {
        return String.format("Lease{job='%s', owner='%s', epoch=%d, expiresAt=%d}", jobId, owner, epoch, expiresAt);
    }
}
