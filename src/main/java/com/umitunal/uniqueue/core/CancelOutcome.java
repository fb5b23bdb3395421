package com.umitunal.uniqueue.core;

/**
 * Result of a cancellation request.
 */
public enum CancelOutcome {
    /** The job was not running and is now CANCELLED. */
    CANCELLED,
    /** The job is leased; the running handler has been asked to stop. */
    CANCEL_REQUESTED,
    /** The job had already reached a terminal state. */
    NOT_CANCELLABLE
}
