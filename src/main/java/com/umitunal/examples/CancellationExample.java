package com.umitunal.examples;

import com.umitunal.uniqueue.config.QueueConfig;
import com.umitunal.uniqueue.config.StorageConfig;
import com.umitunal.uniqueue.core.CancelOutcome;
import com.umitunal.uniqueue.core.Job;
import com.umitunal.uniqueue.core.JobRequest;
import com.umitunal.uniqueue.engine.QueueEngine;
import com.umitunal.uniqueue.handler.Outcome;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Cancelling pending and running jobs. Running handlers stop at their next checkpoint.
 */
public class CancellationExample {

    public static void main(String[] args) {
        System.out.println("=== Cancellation Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/uniqueue-cancel")
                .withDurableWrites(false)
                .build();

        QueueConfig config = QueueConfig.newBuilder()
                .withPoolSize(1)
                .build();

        CountDownLatch started = new CountDownLatch(1);

        try (QueueEngine queue = QueueEngine.builder(storage)
                .withConfig(config)
                .register("dataset_export", context -> {
                    started.countDown();
                    for (int chunk = 0; chunk < 1000; chunk++) {
                        context.checkpoint();
                        Thread.sleep(20);
                    }
                    return Outcome.success();
                })
                .build()) {

            queue.start();
            String running = queue.submit(JobRequest.builder("dataset_export").name("running").build());
            String waiting = queue.submit(JobRequest.builder("dataset_export").name("waiting")
                    .delay(Duration.ofMinutes(1)).build());
            started.await();

            CancelOutcome first = queue.cancel(waiting);
            CancelOutcome second = queue.cancel(running);
            System.out.println("waiting: " + first + ", running: " + second);

            Job job = ExampleSupport.awaitTerminal(queue, running, 5000);
            ExampleSupport.printHistory(job);
            System.out.println("Cancel again: " + queue.cancel(running));

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
