package com.umitunal.uniqueue.scheduler;

import com.umitunal.uniqueue.config.QueueConfig;
import com.umitunal.uniqueue.core.JobState;
import com.umitunal.uniqueue.core.JobStore;
import com.umitunal.uniqueue.core.QueueException;
import com.umitunal.uniqueue.core.StoreException;
import com.umitunal.uniqueue.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Assigns eligible jobs to free worker slots.
 *
 * <p>A cycle promotes RETRYING jobs whose backoff elapsed, reads the eligible jobs and the
 * leased counts per type, divides the slots with {@link FairShareAllocator} and dispatches jobs
 * in priority / FIFO order while their type still has allowance. Cycles run on one thread,
 * periodically and whenever {@link #requestCycle()} is called; requests made while a cycle is
 * pending are coalesced. A cycle never waits for a slot.
 */
public class JobScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);
    private static final long MAX_FAILURE_BACKOFF_MS = 60_000;

    private final JobStore store;
    private final SlotDispatcher dispatcher;
    private final QueueConfig config;
    private final Clock clock;
    private final FairShareAllocator allocator = new FairShareAllocator();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean cycleRequested = new AtomicBoolean(false);
    private ScheduledExecutorService executor;

    // Only touched on the scheduler thread
    private int consecutiveFailures = 0;
    private long suspendedUntil = 0;

    public JobScheduler(JobStore store, SlotDispatcher dispatcher, QueueConfig config, Clock clock) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.config = config;
        this.clock = clock;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "uniqueue-scheduler");
            t.setDaemon(true);
            return t;
        });
        long interval = config.getSchedulerInterval().toMillis();
        executor.scheduleWithFixedDelay(this::tick, 0, interval, TimeUnit.MILLISECONDS);
        log.info("Scheduler started (interval={}ms)", interval);
    }

    /**
     * Ask for a cycle as soon as possible, e.g. after a submission or a freed slot.
     */
    public void requestCycle() {
        if (!started.get() || !cycleRequested.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::tick);
        } catch (RejectedExecutionException e) {
            cycleRequested.set(false);
            log.debug("Scheduler is shutting down, cycle request dropped");
        }
    }

    /**
     * One timer or requested run. Skipped while backing off after store failures.
     */
    void tick() {
        cycleRequested.set(false);
        long now = clock.millis();
        if (now < suspendedUntil) {
            return;
        }

        try {
            runCycle(now);
            consecutiveFailures = 0;
            suspendedUntil = 0;
        } catch (StoreException e) {
            consecutiveFailures++;
            long backoff = failureBackoff(consecutiveFailures);
            suspendedUntil = now + backoff;
            log.warn("Scheduling cycle failed ({} in a row), pausing {}ms: {}",
                    consecutiveFailures, backoff, e.getMessage(), e);
        } catch (RuntimeException e) {
            // Escaping exceptions would cancel the periodic task
            log.error("Unexpected error in scheduling cycle", e);
        }
    }

    /**
     * Run one scheduling cycle.
     *
     * @return number of jobs dispatched
     */
    public int runCycle(long now) throws StoreException {
        promoteDueRetries(now);

        if (dispatcher.isPaused()) {
            return 0;
        }
        int free = dispatcher.getAvailableSlots();
        if (free == 0) {
            return 0;
        }
        List<JobRecord> eligible = store.listEligible(now);
        if (eligible.isEmpty()) {
            return 0;
        }

        Map<String, Integer> leased = store.countLeasedByType(now);
        int running = leased.values().stream().mapToInt(Integer::intValue).sum();
        // Expired leases are dead work; counting them would widen the window past the pool

        // Types in order of their best eligible job, so allocation ties favour higher priority
        Map<String, Integer> demand = new LinkedHashMap<>();
        for (JobRecord job : eligible) {
            demand.merge(job.getType(), 1, Integer::sum);
        }
        leased.forEach((type, count) -> demand.merge(type, count, Integer::sum));

        Map<String, Integer> target = allocator.allocate(running + free, demand,
                type -> config.typeOptions(type).getWeight(),
                type -> config.typeOptions(type).getMaxConcurrent());

        Map<String, Integer> allowance = new HashMap<>();
        target.forEach((type, slots) -> allowance.put(type, Math.max(0, slots - leased.getOrDefault(type, 0))));

        int dispatched = 0;
        for (JobRecord job : eligible) {
            if (dispatcher.getAvailableSlots() == 0) {
                break;
            }
            int left = allowance.getOrDefault(job.getType(), 0);
            if (left <= 0) {
                continue;
            }
            if (dispatcher.tryDispatch(job)) {
                allowance.put(job.getType(), left - 1);
                dispatched++;
            }
        }

        if (dispatched > 0) {
            log.debug("Dispatched {} of {} eligible jobs (allocation={}, leased={})",
                    dispatched, eligible.size(), target, leased);
        }
        return dispatched;
    }

    private void promoteDueRetries(long now) throws StoreException {
        for (JobRecord job : store.listByState(JobState.RETRYING)) {
            if (job.getNotBefore() > now) {
                continue;
            }
            try {
                store.update(job.getId(), job.getVersion(), record -> record.promote(now));
                log.debug("Job {} is due for attempt {}", job.getId(), job.getAttemptCount() + 1);
            } catch (StoreException e) {
                throw e;
            } catch (QueueException e) {
                log.debug("Job {} changed before promotion, skipped: {}", job.getId(), e.getMessage());
            }
        }
    }

    private long failureBackoff(int failures) {
        int exp = Math.min(failures - 1, 16);
        return Math.min(config.getSchedulerInterval().toMillis() << exp, MAX_FAILURE_BACKOFF_MS);
    }

    @Override
    public void close() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Scheduler thread did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler stopped");
    }
}
