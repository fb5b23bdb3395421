package com.umitunal.uniqueue.lease;

import com.umitunal.uniqueue.config.QueueConfig;
import com.umitunal.uniqueue.core.JobState;
import com.umitunal.uniqueue.core.JobStore;
import com.umitunal.uniqueue.core.QueueException;
import com.umitunal.uniqueue.core.StoreException;
import com.umitunal.uniqueue.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Returns jobs whose lease expired to the queue.
 *
 * <p>A crashed or stalled worker stops renewing; once {@code leaseExpiresAt} has passed the job
 * goes back to PENDING without counting an attempt (or to CANCELLED if cancellation was
 * requested). Each reclaim is conditional on the version that was found expired, so a renewal
 * that lands first wins.
 */
public class LeaseManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LeaseManager.class);
    private static final long MAX_FAILURE_BACKOFF_MS = 60_000;

    private final JobStore store;
    private final QueueConfig config;
    private final Clock clock;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Runnable reclaimListener = () -> { };

    private ScheduledExecutorService executor;
    private int consecutiveFailures = 0;
    private long suspendedUntil = 0;

    public LeaseManager(JobStore store, QueueConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Called after a sweep that returned at least one job to the queue.
     */
    public void setReclaimListener(Runnable listener) {
        this.reclaimListener = listener;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "uniqueue-lease-manager");
            t.setDaemon(true);
            return t;
        });
        long interval = config.getReclaimInterval().toMillis();
        executor.scheduleWithFixedDelay(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Lease manager started (reclaim interval={}ms)", interval);
    }

    /**
     * One periodic run. Skipped while backing off after store failures.
     */
    void sweep() {
        long now = clock.millis();
        if (now < suspendedUntil) {
            return;
        }
        try {
            reclaimExpired();
            consecutiveFailures = 0;
            suspendedUntil = 0;
        } catch (StoreException e) {
            consecutiveFailures++;
            long backoff = Math.min(config.getReclaimInterval().toMillis() << Math.min(consecutiveFailures - 1, 16),
                    MAX_FAILURE_BACKOFF_MS);
            suspendedUntil = now + backoff;
            log.warn("Lease sweep failed ({} in a row), pausing {}ms: {}", consecutiveFailures, backoff, e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error in lease sweep", e);
        }
    }

    /**
     * Reclaim every expired lease now.
     *
     * @return number of jobs reclaimed
     */
    public int reclaimExpired() throws StoreException {
        long now = clock.millis();
        int reclaimed = 0;

        for (JobRecord job : store.listByState(JobState.LEASED)) {
            if (!job.isLeaseExpired(now)) {
                continue;
            }
            try {
                JobRecord after = store.update(job.getId(), job.getVersion(), record -> record.reclaim(now));
                reclaimed++;
                log.warn("Lease of {} on job {} expired at {}, job is now {}",
                        job.getLeaseOwner(), job.getId(), job.getLeaseExpiresAt(), after.getState());
            } catch (StoreException e) {
                throw e;
            } catch (QueueException e) {
                log.debug("Job {} changed before reclaim, skipped: {}", job.getId(), e.getMessage());
            }
        }

        if (reclaimed > 0) {
            reclaimListener.run();
        }
        return reclaimed;
    }

    @Override
    public void close() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Lease manager stopped");
    }
}
