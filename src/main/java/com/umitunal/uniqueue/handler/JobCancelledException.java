package com.umitunal.uniqueue.handler;

/**
 * Thrown from a handler checkpoint once its {@link CancellationToken} was tripped.
 */
public class JobCancelledException extends Exception {
    private final CancellationToken.Reason reason;

    public JobCancelledException(CancellationToken.Reason reason) {
        super("Job execution stopped: " + reason);
        this.reason = reason;
    }

    public CancellationToken.Reason getReason() {
        return reason;
    }
}
