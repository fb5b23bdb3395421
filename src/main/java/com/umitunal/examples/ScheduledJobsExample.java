package com.umitunal.examples;

import com.umitunal.uniqueue.config.QueueConfig;
import com.umitunal.uniqueue.config.StorageConfig;
import com.umitunal.uniqueue.core.Job;
import com.umitunal.uniqueue.core.JobRequest;
import com.umitunal.uniqueue.engine.QueueEngine;
import com.umitunal.uniqueue.handler.Outcome;

import java.time.Duration;
import java.time.Instant;

/**
 * Delayed jobs and priorities: nothing runs before its not-before time, and among ready jobs
 * higher priority goes first.
 */
public class ScheduledJobsExample {

    public static void main(String[] args) {
        System.out.println("=== Scheduled Jobs Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/uniqueue-scheduled")
                .withDurableWrites(false)
                .build();

        QueueConfig config = QueueConfig.newBuilder()
                .withPoolSize(1)
                .withSchedulerInterval(Duration.ofMillis(100))
                .build();

        try (QueueEngine queue = QueueEngine.builder(storage)
                .withConfig(config)
                .register("report_generate", context -> {
                    System.out.println("  " + Instant.now() + " running " + context.getJobId());
                    return Outcome.success();
                })
                .build()) {

            String later = queue.submit(JobRequest.builder("report_generate").name("nightly")
                    .delay(Duration.ofSeconds(1)).build());
            String low = queue.submit(JobRequest.builder("report_generate").name("low").priority(1).build());
            String high = queue.submit(JobRequest.builder("report_generate").name("high").priority(10).build());
            System.out.println("Submitted " + later + " (delayed), " + low + " (priority 1), " + high + " (priority 10)");

            queue.start();

            for (String id : new String[]{high, low, later}) {
                Job job = ExampleSupport.awaitTerminal(queue, id, 5000);
                System.out.println(job.getName() + ": " + job.getState());
            }

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
