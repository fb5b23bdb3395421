package com.umitunal.uniqueue.handler;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop signal for a running handler. Handlers poll it at safe checkpoints;
 * they are never interrupted.
 */
public class CancellationToken {
    private final AtomicReference<Reason> reason = new AtomicReference<>();

    /**
     * Request the handler to stop. The first reason wins.
     *
     * @return true if this call set the reason
     */
    public boolean cancel(Reason why) {
        return reason.compareAndSet(null, why);
    }

    public boolean isCancellationRequested() {
        return reason.get() != null;
    }

    /**
     * Why the handler was asked to stop, or null.
     */
    public Reason getReason() {
        return reason.get();
    }

    /**
     * Checkpoint helper for handlers.
     *
     * @throws JobCancelledException if a stop was requested
     */
    public void throwIfCancellationRequested() throws JobCancelledException {
        Reason current = reason.get();
        if (current != null) {
            throw new JobCancelledException(current);
        }
    }

    public enum Reason {
        /** A caller cancelled the job. */
        CANCEL_REQUESTED,
        /** The job ran past the execution timeout of its type. */
        TIMEOUT,
        /** The lease was reclaimed; any report will be rejected. */
        LEASE_LOST,
        /** The worker pool is shutting down. */
        SHUTDOWN
    }
}
