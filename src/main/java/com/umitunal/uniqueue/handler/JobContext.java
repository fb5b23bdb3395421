package com.umitunal.uniqueue.handler;

/**
 * What a handler sees of the job it executes. Handlers report their outcome by returning it;
 * they never touch queue state directly.
 */
public interface JobContext {

    String getJobId();

    String getType();

    /**
     * Gets the opaque payload exactly as submitted.
     */
    byte[] getPayload();

    /**
     * Gets the 1-based number of the attempt being executed.
     */
    int getAttempt();

    int getMaxAttempts();

    CancellationToken getCancellationToken();

    /**
     * Record progress on the job. Failures to record are logged, never thrown.
     *
     * @param percent 0-100, clamped
     * @param message optional description, may be null
     */
    void reportProgress(int percent, String message);

    /**
     * Shorthand for {@code getCancellationToken().throwIfCancellationRequested()}.
     */
    default void checkpoint() throws JobCancelledException {
        getCancellationToken().throwIfCancellationRequested();
    }
}
