package com.umitunal.uniqueue.worker;

import com.umitunal.uniqueue.core.JobStore;
import com.umitunal.uniqueue.core.LeaseConflictException;
import com.umitunal.uniqueue.core.QueueException;
import com.umitunal.uniqueue.handler.CancellationToken;
import com.umitunal.uniqueue.handler.JobContext;
import com.umitunal.uniqueue.model.JobRecord;
import com.umitunal.uniqueue.model.Lease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

class DefaultJobContext implements JobContext {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobContext.class);

    private final JobRecord job;
    private final Lease lease;
    private final CancellationToken token;
    private final JobStore store;
    private final Clock clock;

    DefaultJobContext(JobRecord job, Lease lease, CancellationToken token, JobStore store, Clock clock) {
        this.job = job;
        this.lease = lease;
        this.token = token;
        this.store = store;
        this.clock = clock;
    }

    @Override public String getJobId() { return job.getId(); }
    @Override public String getType() { return job.getType(); }
    @Override public byte[] getPayload() { return job.getPayload(); }
    @Override public int getAttempt() { return job.getAttemptCount() + 1; }
    @Override public int getMaxAttempts() { return job.getMaxAttempts(); }
    @Override public CancellationToken getCancellationToken() { return token; }

    @Override
    public void reportProgress(int percent, String message) {
        long now = clock.millis();
        try {
            store.update(job.getId(), record -> record.reportProgress(lease, percent, message, now));
        } catch (LeaseConflictException e) {
            token.cancel(CancellationToken.Reason.LEASE_LOST);
            log.warn("Progress of job {} rejected: {}", job.getId(), e.getMessage());
        } catch (QueueException e) {
            log.warn("Failed to record progress of job {}: {}", job.getId(), e.getMessage());
        }
    }
}
