package com.umitunal.uniqueue.worker;

import java.util.concurrent.atomic.AtomicLong;

/**
 * One unit of execution capacity. Its id is the lease owner of the jobs it runs.
 */
public class WorkerSlot {
    private final int index;
    private final String workerId;
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);

    WorkerSlot(int index, String workerId) {
        this.index = index;
        this.workerId = workerId;
    }

    public int getIndex() { return index; }
    public String getWorkerId() { return workerId; }

    /**
     * Gets the number of attempts this slot finished successfully.
     */
    public long getProcessedCount() {
        return processedCount.get();
    }

    /**
     * Gets the number of attempts this slot finished with a failure.
     */
    public long getFailedCount() {
        return failedCount.get();
    }

    void recordProcessed() {
        processedCount.incrementAndGet();
    }

    void recordFailed() {
        failedCount.incrementAndGet();
    }

    @Override
    public String toString() {
        return String.format("WorkerSlot{id='%s', processed=%d, failed=%d}",
                workerId, processedCount.get(), failedCount.get());
    }
}
