package com.umitunal.uniqueue.core;

import com.umitunal.uniqueue.model.JobRecord;

/**
 * A change applied to the current persisted state of one job.
 * The store may call it more than once when a concurrent writer wins the commit, so it must
 * only depend on the record it is given. Throwing aborts the update without writing.
 */
@FunctionalInterface
public interface JobMutation {

    void apply(JobRecord record) throws QueueException;
}
