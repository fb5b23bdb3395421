package com.umitunal.uniqueue.worker;

import com.umitunal.uniqueue.config.QueueConfig;
import com.umitunal.uniqueue.core.JobMutation;
import com.umitunal.uniqueue.core.JobNotFoundException;
import com.umitunal.uniqueue.core.JobStore;
import com.umitunal.uniqueue.core.LeaseConflictException;
import com.umitunal.uniqueue.core.QueueException;
import com.umitunal.uniqueue.core.StoreException;
import com.umitunal.uniqueue.core.UnknownTypeException;
import com.umitunal.uniqueue.handler.CancellationToken;
import com.umitunal.uniqueue.handler.HandlerRegistry;
import com.umitunal.uniqueue.handler.JobCancelledException;
import com.umitunal.uniqueue.handler.JobHandler;
import com.umitunal.uniqueue.handler.Outcome;
import com.umitunal.uniqueue.handler.UnrecoverableJobException;
import com.umitunal.uniqueue.model.JobRecord;
import com.umitunal.uniqueue.model.Lease;
import com.umitunal.uniqueue.retry.RetryController;
import com.umitunal.uniqueue.retry.RetryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One attempt of one leased job: runs the handler while keeping the lease alive, then
 * reports the outcome under that lease.
 */
class JobExecution implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(JobExecution.class);
    private static final int MAX_REPORT_ATTEMPTS = 3;

    private final JobRecord job;
    private final Lease lease;
    private final WorkerSlot slot;
    private final JobStore store;
    private final HandlerRegistry registry;
    private final RetryController retryController;
    private final QueueConfig config;
    private final Clock clock;
    private final ScheduledExecutorService renewals;
    private final CancellationToken token = new CancellationToken();

    private volatile ScheduledFuture<?> renewalTask;
    private volatile ScheduledFuture<?> timeoutTask;
    private volatile boolean finished;

    JobExecution(JobRecord job, Lease lease, WorkerSlot slot, JobStore store, HandlerRegistry registry,
                 RetryController retryController, QueueConfig config, Clock clock,
                 ScheduledExecutorService renewals) {
        this.job = job;
        this.lease = lease;
        this.slot = slot;
        this.store = store;
        this.registry = registry;
        this.retryController = retryController;
        this.config = config;
        this.clock = clock;
        this.renewals = renewals;
    }

    String getJobId() {
        return job.getId();
    }

    CancellationToken getToken() {
        return token;
    }

    @Override
    public void run() {
        long startedAt = clock.millis();
        log.debug("{} executing job {} ({}), attempt {}/{}", slot.getWorkerId(), job.getId(), job.getType(),
                job.getAttemptCount() + 1, job.getMaxAttempts());

        Outcome outcome;
        startLeaseKeeping();
        try {
            outcome = invoke(startedAt);
        } finally {
            stopLeaseKeeping();
        }

        if (token.getReason() == CancellationToken.Reason.SHUTDOWN && !outcome.isSuccess()) {
            report(record -> record.relinquish(lease, "worker shut down", clock.millis()), "released");
            return;
        }
        if (token.getReason() == CancellationToken.Reason.TIMEOUT
                && outcome.getKind() != Outcome.Kind.UNRECOVERABLE_FAILURE) {
            outcome = Outcome.recoverable("timed out after " + (clock.millis() - startedAt) + " ms");
        }
        reportOutcome(outcome);
    }

    private Outcome invoke(long startedAt) {
        JobHandler handler;
        try {
            handler = registry.resolve(job.getType());
        } catch (UnknownTypeException e) {
            return Outcome.unrecoverable(e.getMessage());
        }

        DefaultJobContext context = new DefaultJobContext(job, lease, token, store, clock);
        try {
            Outcome outcome = handler.execute(context);
            return outcome != null ? outcome : Outcome.recoverable("Handler returned no outcome");
        } catch (UnrecoverableJobException e) {
            return Outcome.unrecoverable(describe(e));
        } catch (JobCancelledException e) {
            return Outcome.recoverable("stopped at checkpoint: " + e.getReason());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.recoverable("interrupted");
        } catch (Exception e) {
            log.warn("Handler for job {} threw after {}ms", job.getId(), clock.millis() - startedAt, e);
            return Outcome.recoverable(describe(e));
        }
    }

    private void reportOutcome(Outcome outcome) {
        String message = outcome.getMessage();
        JobMutation mutation;
        switch (outcome.getKind()) {
            case SUCCESS:
                mutation = record -> record.succeed(lease, outcome.getResult(), clock.millis());
                break;
            case RECOVERABLE_FAILURE:
                mutation = record -> {
                    long now = clock.millis();
                    RetryDecision decision = retryController.decide(record.getType(),
                            record.getAttemptCount() + 1, record.getMaxAttempts(), now);
                    if (decision.shouldRetry()) {
                        record.retry(lease, message, decision.getRetryAt(), now);
                    } else {
                        record.fail(lease, message, now);
                    }
                };
                break;
            default:
                mutation = record -> record.fail(lease, message, clock.millis());
                break;
        }

        if (outcome.isSuccess()) {
            slot.recordProcessed();
        } else {
            slot.recordFailed();
        }
        report(mutation, outcome.getKind().name());
    }

    private void report(JobMutation mutation, String what) {
        for (int attempt = 1; attempt <= MAX_REPORT_ATTEMPTS; attempt++) {
            try {
                JobRecord after = store.update(job.getId(), mutation);
                log.info("Job {} ({}) {} -> {} [attempt {}/{}]", after.getId(), after.getType(), what,
                        after.getState(), after.getAttemptCount(), after.getMaxAttempts());
                return;
            } catch (LeaseConflictException e) {
                log.info("Discarding stale report for job {}: {}", job.getId(), e.getMessage());
                return;
            } catch (JobNotFoundException e) {
                log.warn("Job {} was deleted before its outcome could be recorded", job.getId());
                return;
            } catch (StoreException e) {
                log.warn("Recording outcome of job {} failed ({}/{}): {}",
                        job.getId(), attempt, MAX_REPORT_ATTEMPTS, e.getMessage());
                if (!pause(100L << attempt)) {
                    break;
                }
            } catch (QueueException e) {
                log.error("Outcome of job {} rejected", job.getId(), e);
                return;
            }
        }
        log.error("Gave up recording outcome of job {}, it will be re-run once its lease expires", job.getId());
    }

    private void startLeaseKeeping() {
        long interval = config.getLeaseRenewInterval().toMillis();
        renewalTask = renewals.scheduleAtFixedRate(this::renew, interval, interval, TimeUnit.MILLISECONDS);

        Duration timeout = job.getExecutionTimeoutMs() > 0
                ? Duration.ofMillis(job.getExecutionTimeoutMs())
                : config.typeOptions(job.getType()).getExecutionTimeout();
        if (timeout != null) {
            timeoutTask = renewals.schedule(() -> {
                if (token.cancel(CancellationToken.Reason.TIMEOUT)) {
                    log.warn("Job {} exceeded its execution timeout of {}ms", job.getId(), timeout.toMillis());
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void stopLeaseKeeping() {
        finished = true;
        renewalTask.cancel(false);
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
        }
    }

    void renew() {
        if (finished) {
            return;
        }
        long now = clock.millis();
        long duration = config.getLeaseDuration().toMillis();
        try {
            JobRecord record = store.update(job.getId(), r -> r.renewLease(lease, duration, now));
            if (record.isCancelRequested() && token.cancel(CancellationToken.Reason.CANCEL_REQUESTED)) {
                log.info("Cancellation of running job {} observed", job.getId());
            }
        } catch (LeaseConflictException e) {
            if (!finished && token.cancel(CancellationToken.Reason.LEASE_LOST)) {
                log.warn("{} lost the lease on job {}: {}", slot.getWorkerId(), job.getId(), e.getMessage());
            }
            renewalTask.cancel(false);
        } catch (QueueException e) {
            log.warn("Lease renewal for job {} failed, retrying next interval: {}", job.getId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error renewing lease of job {}", job.getId(), e);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage()
                : e.getClass().getSimpleName();
    }

    private static boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
