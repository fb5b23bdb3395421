package com.umitunal.uniqueue.core;

/**
 * A state change was requested that the job lifecycle does not allow from the current state.
 */
public class IllegalTransitionException extends QueueException {
    private final String jobId;
    private final JobState from;
    private final JobState to;

    public IllegalTransitionException(String jobId, JobState from, JobState to) {
        super(String.format("Job %s cannot move from %s to %s", jobId, from, to));
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public String getJobId() { return jobId; }
    public JobState getFrom() { return from; }
    public JobState getTo() { return to; }
}
