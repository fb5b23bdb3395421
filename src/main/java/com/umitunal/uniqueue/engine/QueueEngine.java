package com.umitunal.uniqueue.engine;

import com.umitunal.uniqueue.config.QueueConfig;
import com.umitunal.uniqueue.config.StorageConfig;
import com.umitunal.uniqueue.config.TypeOptions;
import com.umitunal.uniqueue.core.CancelOutcome;
import com.umitunal.uniqueue.core.IllegalTransitionException;
import com.umitunal.uniqueue.core.InvalidJobException;
import com.umitunal.uniqueue.core.Job;
import com.umitunal.uniqueue.core.JobQueue;
import com.umitunal.uniqueue.core.JobRequest;
import com.umitunal.uniqueue.core.JobState;
import com.umitunal.uniqueue.core.JobStore;
import com.umitunal.uniqueue.core.QueueException;
import com.umitunal.uniqueue.core.QueueMetrics;
import com.umitunal.uniqueue.core.StoreException;
import com.umitunal.uniqueue.core.UnknownTypeException;
import com.umitunal.uniqueue.handler.HandlerRegistry;
import com.umitunal.uniqueue.handler.JobHandler;
import com.umitunal.uniqueue.lease.LeaseManager;
import com.umitunal.uniqueue.model.JobRecord;
import com.umitunal.uniqueue.retry.RetryController;
import com.umitunal.uniqueue.scheduler.JobScheduler;
import com.umitunal.uniqueue.storage.RocksJobStore;
import com.umitunal.uniqueue.worker.WorkerPool;
import com.umitunal.uniqueue.worker.WorkerSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Job queue wiring a {@link JobStore} to the scheduler, worker pool and lease manager.
 *
 * <pre>{@code
 * try (QueueEngine queue = QueueEngine.builder(StorageConfig.newBuilder("./jobs").build())
 *         .register("pdf_render", renderHandler)
 *         .build()) {
 *     queue.start();
 *     String id = queue.submit(JobRequest.builder("pdf_render").payload(bytes).build());
 * }
 * }</pre>
 */
public class QueueEngine implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(QueueEngine.class);
    private static final Duration RECENT_WINDOW = Duration.ofHours(24);
    // Bounds that keep schedule arithmetic in epoch millis well clear of overflow
    private static final Instant MAX_SCHEDULE_INSTANT = Instant.ofEpochMilli(Long.MAX_VALUE / 4);
    private static final Duration MAX_DELAY = Duration.ofMillis(Long.MAX_VALUE / 4);

    private final JobStore store;
    private final boolean ownsStore;
    private final QueueConfig config;
    private final HandlerRegistry handlers;
    private final Clock clock;
    private final RetryController retryController;
    private final WorkerPool workerPool;
    private final JobScheduler scheduler;
    private final LeaseManager leaseManager;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile long startedAt;

    private QueueEngine(JobStore store, boolean ownsStore, Builder builder) {
        this.store = store;
        this.ownsStore = ownsStore;
        this.config = builder.config;
        this.handlers = builder.handlers;
        this.clock = builder.clock;
        this.retryController = new RetryController(config);
        this.workerPool = new WorkerPool(store, handlers, retryController, config, clock);
        this.scheduler = new JobScheduler(store, workerPool, config, clock);
        this.leaseManager = new LeaseManager(store, config, clock);

        workerPool.setSlotReleaseListener(scheduler::requestCycle);
        leaseManager.setReclaimListener(scheduler::requestCycle);
    }

    @Override
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Queue is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        startedAt = clock.millis();
        workerPool.start();
        leaseManager.start();
        scheduler.start();
        log.info("Queue started with handlers for {}", handlers.getRegisteredTypes());
    }

    @Override
    public String submit(JobRequest request) throws QueueException {
        validate(request);

        String type = request.getType();
        TypeOptions options = config.typeOptions(type);
        int priority = request.getPriority() != null ? request.getPriority() : options.getDefaultPriority();
        int maxAttempts = request.getMaxAttempts() != null
                ? request.getMaxAttempts()
                : retryController.defaultMaxAttempts(type);

        long timeoutMs = request.getTimeout() != null ? request.getTimeout().toMillis() : 0;

        long now = clock.millis();
        long notBefore = now;
        if (request.getNotBefore() != null) {
            notBefore = Math.max(notBefore, request.getNotBefore().toEpochMilli());
        }
        if (request.getDelay() != null) {
            notBefore = Math.max(notBefore, now + request.getDelay().toMillis());
        }

        JobRecord draft = JobRecord.draft(type, request.getName(), request.getPayload(),
                priority, maxAttempts, timeoutMs, notBefore, now);
        String id = store.submit(draft);
        log.debug("Submitted job {} ({}, priority={}, maxAttempts={})", id, type, priority, maxAttempts);

        scheduler.requestCycle();
        return id;
    }

    private void validate(JobRequest request) throws InvalidJobException {
        if (request.getType() == null || request.getType().isBlank()) {
            throw new InvalidJobException("Job type must not be blank");
        }
        if (request.getPayload() == null) {
            throw new InvalidJobException("Payload must not be null");
        }
        if (request.getPayload().length > config.getMaxPayloadBytes()) {
            throw new InvalidJobException(String.format("Payload of %d bytes exceeds the limit of %d bytes",
                    request.getPayload().length, config.getMaxPayloadBytes()));
        }
        if (request.getMaxAttempts() != null && request.getMaxAttempts() < 1) {
            throw new InvalidJobException("maxAttempts must be at least 1, was " + request.getMaxAttempts());
        }
        if (request.getNotBefore() != null
                && (request.getNotBefore().isBefore(Instant.EPOCH) || request.getNotBefore().isAfter(MAX_SCHEDULE_INSTANT))) {
            throw new InvalidJobException("notBefore must be between " + Instant.EPOCH + " and "
                    + MAX_SCHEDULE_INSTANT + ", was " + request.getNotBefore());
        }
        if (request.getDelay() != null
                && (request.getDelay().isNegative() || request.getDelay().compareTo(MAX_DELAY) > 0)) {
            throw new InvalidJobException("delay must be between 0 and " + MAX_DELAY + ", was " + request.getDelay());
        }
        if (request.getTimeout() != null
                && (request.getTimeout().isNegative() || request.getTimeout().isZero()
                    || request.getTimeout().compareTo(MAX_DELAY) > 0)) {
            throw new InvalidJobException("timeout must be positive and at most " + MAX_DELAY + ", was " + request.getTimeout());
        }
        if (!handlers.isRegistered(request.getType())) {
            throw new UnknownTypeException(request.getType());
        }
    }

    @Override
    public Job status(String jobId) throws QueueException {
        return store.get(jobId);
    }

    @Override
    public CancelOutcome cancel(String jobId) throws QueueException {
        long now = clock.millis();
        AtomicReference<CancelOutcome> outcome = new AtomicReference<>();
        store.update(jobId, record -> outcome.set(record.cancel(now)));

        if (outcome.get() == CancelOutcome.CANCEL_REQUESTED) {
            // Renewal would observe the flag too; signalling here saves up to one renew interval
            workerPool.requestCancellation(jobId);
        }
        log.info("Cancel of job {}: {}", jobId, outcome.get());
        return outcome.get();
    }

    @Override
    public String resubmit(String jobId) throws QueueException {
        JobRecord original = store.get(jobId);
        if (!original.isTerminal()) {
            throw new IllegalTransitionException(jobId, original.getState(), JobState.PENDING);
        }
        if (!handlers.isRegistered(original.getType())) {
            throw new UnknownTypeException(original.getType());
        }

        long now = clock.millis();
        JobRecord copy = JobRecord.draft(original.getType(), original.getName(), original.getPayload(),
                original.getPriority(), original.getMaxAttempts(), original.getExecutionTimeoutMs(), now, now);
        String id = store.submit(copy);
        log.info("Resubmitted {} job {} as {}", original.getState(), jobId, id);

        scheduler.requestCycle();
        return id;
    }

    @Override
    public QueueMetrics getMetrics() throws StoreException {
        long now = clock.millis();
        QueueMetrics metrics = store.getMetrics(now - RECENT_WINDOW.toMillis());
        if (startedAt == 0) {
            return metrics;
        }

        long succeeded = 0;
        long failed = 0;
        for (WorkerSlot slot : workerPool.getSlots()) {
            succeeded += slot.getProcessedCount();
            failed += slot.getFailedCount();
        }
        return metrics.withPerformance(new QueueMetrics.Performance(now - startedAt, succeeded, failed));
    }

    @Override
    public long purgeTerminal(Duration olderThan) throws StoreException {
        long purged = store.purgeTerminal(clock.millis() - olderThan.toMillis());
        log.info("Purged {} terminal jobs older than {}", purged, olderThan);
        return purged;
    }

    @Override
    public void pause() {
        workerPool.pause();
    }

    @Override
    public void resume() {
        workerPool.resume();
        scheduler.requestCycle();
    }

    @Override
    public boolean isPaused() {
        return workerPool.isPaused();
    }

    public HandlerRegistry getHandlers() {
        return handlers;
    }

    public WorkerPool getWorkerPool() {
        return workerPool;
    }

    public LeaseManager getLeaseManager() {
        return leaseManager;
    }

    public QueueConfig getConfig() {
        return config;
    }

    /**
     * Stop scheduling, let running jobs finish or release them, then close the store if this
     * engine opened it.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.close();
        leaseManager.close();
        workerPool.close();
        if (ownsStore) {
            try {
                store.close();
            } catch (Exception e) {
                log.error("Failed to close job store", e);
            }
        }
        log.info("Queue closed");
    }

    /**
     * Engine over a RocksDB store it opens and closes itself.
     */
    public static Builder builder(StorageConfig storage) {
        return new Builder(storage, null);
    }

    /**
     * Engine over an existing store. The caller keeps ownership of it.
     */
    public static Builder builder(JobStore store) {
        return new Builder(null, store);
    }

    public static class Builder {
        private final StorageConfig storage;
        private final JobStore store;
        private QueueConfig config = QueueConfig.defaults();
        private HandlerRegistry handlers = new HandlerRegistry();
        private Clock clock = Clock.systemUTC();

        private Builder(StorageConfig storage, JobStore store) {
            this.storage = storage;
            this.store = store;
        }

        public Builder withConfig(QueueConfig config) {
            this.config = config;
            return this;
        }

        public Builder withHandlers(HandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        public Builder register(String type, JobHandler handler) {
            handlers.register(type, handler);
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public QueueEngine build() throws StoreException {
            if (store != null) {
                return new QueueEngine(store, false, this);
            }
            return new QueueEngine(new RocksJobStore(storage), true, this);
        }
    }
}
