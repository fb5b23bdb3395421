package com.umitunal.examples;

import com.umitunal.uniqueue.config.QueueConfig;
import com.umitunal.uniqueue.config.StorageConfig;
import com.umitunal.uniqueue.config.TypeOptions;
import com.umitunal.uniqueue.core.Job;
import com.umitunal.uniqueue.core.JobRequest;
import com.umitunal.uniqueue.engine.QueueEngine;
import com.umitunal.uniqueue.handler.Outcome;
import com.umitunal.uniqueue.retry.RetryPolicy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retry with exponential backoff: a renderer that fails twice before succeeding.
 */
public class RetryExample {

    public static void main(String[] args) {
        System.out.println("=== Retry Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/uniqueue-retry")
                .withDurableWrites(false)
                .build();

        QueueConfig config = QueueConfig.newBuilder()
                .withSchedulerInterval(Duration.ofMillis(50))
                .withTypeOptions("pdf_render", TypeOptions.newBuilder()
                        .withRetryPolicy(RetryPolicy.newBuilder()
                                .withMaxAttempts(3)
                                .withBaseDelay(Duration.ofMillis(100))
                                .withMaxDelay(Duration.ofSeconds(1))
                                .build())
                        .build())
                .build();

        AtomicInteger calls = new AtomicInteger();

        try (QueueEngine queue = QueueEngine.builder(storage)
                .withConfig(config)
                .register("pdf_render", context -> {
                    int call = calls.incrementAndGet();
                    System.out.println("  attempt " + context.getAttempt() + "/" + context.getMaxAttempts());
                    if (call < 3) {
                        return Outcome.recoverable("font server unavailable");
                    }
                    return Outcome.success("out/report.pdf");
                })
                .build()) {

            queue.start();
            String id = queue.submit(JobRequest.builder("pdf_render").payload(new byte[]{1}).build());

            Job job = ExampleSupport.awaitTerminal(queue, id, 10_000);
            ExampleSupport.printHistory(job);

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
