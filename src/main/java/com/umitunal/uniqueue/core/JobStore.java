package com.umitunal.uniqueue.core;

import com.umitunal.uniqueue.model.JobRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable source of truth for job records.
 *
 * <p>Every mutation is atomic per job id: readers never observe a partially applied update,
 * and two concurrent updates of the same job are serialized so that the later one sees the
 * earlier one's result.
 */
public interface JobStore extends AutoCloseable {

    /**
     * Persist a new job in PENDING state.
     *
     * @param draft a record built with {@link JobRecord#draft}; its id and sequence are assigned here
     * @return the assigned id
     */
    String submit(JobRecord draft) throws StoreException;

    /**
     * Load a job.
     *
     * @throws JobNotFoundException if no job has the id
     */
    JobRecord get(String id) throws JobNotFoundException, StoreException;

    Optional<JobRecord> find(String id) throws StoreException;

    /**
     * Apply a mutation to the current state of a job and persist the result.
     *
     * @return the record as written
     * @throws JobNotFoundException if no job has the id
     */
    JobRecord update(String id, JobMutation mutation) throws QueueException;

    /**
     * Like {@link #update(String, JobMutation)}, but only if the stored version still equals
     * {@code expectedVersion}.
     *
     * @throws LeaseConflictException if the job changed since that version was read
     */
    JobRecord update(String id, long expectedVersion, JobMutation mutation) throws QueueException;

    /**
     * PENDING jobs with {@code notBefore <= now}, highest priority first, oldest first within
     * equal priority.
     */
    List<JobRecord> listEligible(long now) throws StoreException;

    List<JobRecord> listByState(JobState state) throws StoreException;

    /**
     * Number of LEASED jobs per type whose lease is still live at {@code now}. Expired leases
     * awaiting reclaim are left out.
     */
    Map<String, Integer> countLeasedByType(long now) throws StoreException;

    /**
     * Counts per state and type, plus jobs that succeeded or failed at or after {@code recentSince}.
     */
    QueueMetrics getMetrics(long recentSince) throws StoreException;

    /**
     * Delete terminal jobs last updated before {@code cutoff} (millis since epoch).
     *
     * @return number of jobs removed
     */
    long purgeTerminal(long cutoff) throws StoreException;

    @Override
    void close();
}
