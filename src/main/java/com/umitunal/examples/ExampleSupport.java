package com.umitunal.examples;

import com.umitunal.uniqueue.core.Job;
import com.umitunal.uniqueue.core.JobQueue;

/**
 * Polling helper shared by the examples.
 */
final class ExampleSupport {

    private ExampleSupport() {
    }

    static Job awaitTerminal(JobQueue queue, String jobId, long timeoutMillis) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        Job job = queue.status(jobId);
        while (!job.isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
            job = queue.status(jobId);
        }
        return job;
    }

    static void printHistory(Job job) {
        System.out.println(job.getId() + " " + job.getState() + " after " + job.getAttemptCount() + " attempt(s)");
        for (Job.HistoryEntry entry : job.getHistory()) {
            System.out.println("    " + entry);
        }
    }
}
