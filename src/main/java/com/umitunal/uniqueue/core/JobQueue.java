package com.umitunal.uniqueue.core;

import java.time.Duration;

/**
 * Entry point of the queue: submission, status and lifecycle control.
 */
public interface JobQueue extends AutoCloseable {

    /**
     * Start scheduling, executing and lease reclamation. Idempotent.
     */
    void start();

    /**
     * Validate and durably persist a job. Returns once the record is committed.
     *
     * @return the new job id
     * @throws InvalidJobException if the request is malformed
     * @throws UnknownTypeException if no handler is registered for its type
     */
    String submit(JobRequest request) throws QueueException;

    /**
     * Current snapshot of a job: state, attempts, result or error, progress and history.
     */
    Job status(String jobId) throws QueueException;

    /**
     * Cancel a job. Pending work is cancelled at once; a running job is asked to stop at its
     * next checkpoint and is recorded as cancelled on its next report.
     */
    CancelOutcome cancel(String jobId) throws QueueException;

    /**
     * Submit a fresh copy of a terminal job. The original keeps its terminal state.
     *
     * @return the id of the copy
     * @throws IllegalTransitionException if the job is not terminal
     */
    String resubmit(String jobId) throws QueueException;

    QueueMetrics getMetrics() throws QueueException;

    /**
     * Delete terminal jobs that have not changed for at least {@code olderThan}.
     */
    long purgeTerminal(Duration olderThan) throws QueueException;

    /**
     * Stop handing new jobs to workers. Running jobs continue.
     */
    void pause();

    void resume();

    boolean isPaused();

    @Override
    void close();
}
