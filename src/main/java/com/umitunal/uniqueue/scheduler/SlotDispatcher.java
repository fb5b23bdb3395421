package com.umitunal.uniqueue.scheduler;

import com.umitunal.uniqueue.core.StoreException;
import com.umitunal.uniqueue.model.JobRecord;

/**
 * The scheduler's view of the worker pool.
 */
public interface SlotDispatcher {

    boolean isPaused();

    int getAvailableSlots();

    /**
     * Lease the job for a free slot and start executing it.
     *
     * @return false if no slot was free or another worker leased the job first
     */
    boolean tryDispatch(JobRecord job) throws StoreException;
}
