package com.umitunal.uniqueue.worker;

import com.umitunal.uniqueue.config.QueueConfig;
import com.umitunal.uniqueue.core.JobStore;
import com.umitunal.uniqueue.core.QueueException;
import com.umitunal.uniqueue.core.StoreException;
import com.umitunal.uniqueue.handler.CancellationToken;
import com.umitunal.uniqueue.handler.HandlerRegistry;
import com.umitunal.uniqueue.model.JobRecord;
import com.umitunal.uniqueue.model.Lease;
import com.umitunal.uniqueue.retry.RetryController;
import com.umitunal.uniqueue.scheduler.SlotDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker slots executing leased jobs concurrently.
 *
 * <p>A slot is taken before the lease is acquired and returned when the attempt has been
 * reported, so at most {@code poolSize} jobs run at once. Lease renewal and execution timeouts
 * run on a separate scheduled thread.
 */
public class WorkerPool implements SlotDispatcher, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final JobStore store;
    private final HandlerRegistry registry;
    private final RetryController retryController;
    private final QueueConfig config;
    private final Clock clock;

    private final List<WorkerSlot> slots;
    private final BlockingQueue<WorkerSlot> idleSlots;
    // Keyed by execution, not job id: a reclaimed job can run twice here until the stale attempt ends
    private final Set<JobExecution> running = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private volatile Runnable slotReleaseListener = () -> { };

    private ExecutorService executor;
    private ScheduledExecutorService renewals;

    public WorkerPool(JobStore store, HandlerRegistry registry, RetryController retryController,
                      QueueConfig config, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.retryController = retryController;
        this.config = config;
        this.clock = clock;

        List<WorkerSlot> created = new ArrayList<>();
        for (int i = 0; i < config.getPoolSize(); i++) {
            created.add(new WorkerSlot(i, config.getWorkerIdPrefix() + "-slot-" + i));
        }
        this.slots = Collections.unmodifiableList(created);
        this.idleSlots = new ArrayBlockingQueue<>(config.getPoolSize(), false, created);
    }

    /**
     * Called after each attempt frees its slot, typically to trigger a scheduling cycle.
     */
    public void setSlotReleaseListener(Runnable listener) {
        this.slotReleaseListener = listener;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        executor = Executors.newFixedThreadPool(config.getPoolSize(), namedThreads("uniqueue-worker-"));
        renewals = Executors.newSingleThreadScheduledExecutor(namedThreads("uniqueue-lease-renewal-"));
        log.info("Worker pool started with {} slots ({})", slots.size(), config.getWorkerIdPrefix());
    }

    @Override
    public boolean isPaused() {
        return paused.get();
    }

    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("Worker pool paused, {} jobs still running", running.size());
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("Worker pool resumed");
        }
    }

    @Override
    public int getAvailableSlots() {
        return started.get() ? idleSlots.size() : 0;
    }

    public int getRunningCount() {
        return running.size();
    }

    public List<WorkerSlot> getSlots() {
        return slots;
    }

    @Override
    public boolean tryDispatch(JobRecord job) throws StoreException {
        if (!started.get() || paused.get()) {
            return false;
        }
        WorkerSlot slot = idleSlots.poll();
        if (slot == null) {
            return false;
        }

        JobExecution execution;
        try {
            execution = lease(slot, job);
        } catch (StoreException e) {
            idleSlots.offer(slot);
            throw e;
        }
        if (execution == null) {
            idleSlots.offer(slot);
            return false;
        }

        running.add(execution);
        try {
            executor.execute(() -> runAndRelease(slot, execution));
        } catch (RejectedExecutionException e) {
            // The lease stays in the store and expires; the lease manager returns the job
            running.remove(execution);
            idleSlots.offer(slot);
            log.warn("Job {} leased but not started, pool is shutting down", job.getId());
            return false;
        }
        return true;
    }

    private JobExecution lease(WorkerSlot slot, JobRecord job) throws StoreException {
        long now = clock.millis();
        long duration = config.getLeaseDuration().toMillis();
        Lease[] acquired = new Lease[1];
        try {
            store.update(job.getId(), job.getVersion(),
                    record -> acquired[0] = record.lease(slot.getWorkerId(), duration, now));
        } catch (StoreException e) {
            throw e;
        } catch (QueueException e) {
            log.debug("{} did not get job {}: {}", slot.getWorkerId(), job.getId(), e.getMessage());
            return null;
        }

        // Execute against the pre-lease snapshot: attempt numbers count finished attempts
        return new JobExecution(job, acquired[0], slot, store, registry, retryController, config, clock, renewals);
    }

    private void runAndRelease(WorkerSlot slot, JobExecution execution) {
        try {
            execution.run();
        } catch (RuntimeException e) {
            log.error("Execution of job {} failed unexpectedly", execution.getJobId(), e);
        } finally {
            running.remove(execution);
            idleSlots.offer(slot);
            slotReleaseListener.run();
        }
    }

    /**
     * Signal a running job to stop at its next checkpoint.
     *
     * @return true if the job runs in this pool
     */
    public boolean requestCancellation(String jobId) {
        boolean found = false;
        for (JobExecution execution : running) {
            if (execution.getJobId().equals(jobId)) {
                execution.getToken().cancel(CancellationToken.Reason.CANCEL_REQUESTED);
                found = true;
            }
        }
        return found;
    }

    /**
     * Ask running handlers to stop, wait up to one lease duration for them, then stop threads.
     * Jobs stopped this way return to the queue without counting an attempt.
     */
    @Override
    public void close() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        running.forEach(execution -> execution.getToken().cancel(CancellationToken.Reason.SHUTDOWN));
        executor.shutdown();
        try {
            long grace = config.getLeaseDuration().toMillis();
            if (!executor.awaitTermination(grace, TimeUnit.MILLISECONDS)) {
                log.warn("{} jobs still running after {}ms, interrupting", running.size(), grace);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        renewals.shutdownNow();
        log.info("Worker pool stopped");
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
