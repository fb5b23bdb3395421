package com.umitunal.examples;

import com.umitunal.uniqueue.config.QueueConfig;
import com.umitunal.uniqueue.config.StorageConfig;
import com.umitunal.uniqueue.config.TypeOptions;
import com.umitunal.uniqueue.core.JobRequest;
import com.umitunal.uniqueue.engine.QueueEngine;
import com.umitunal.uniqueue.handler.JobHandler;
import com.umitunal.uniqueue.handler.Outcome;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fair sharing: a flood of cheap jobs does not starve a second job type, and weights
 * skew the split.
 */
public class FairnessExample {

    public static void main(String[] args) throws IOException {
        System.out.println("=== Fairness Example ===\n");

        // Fresh directory so counts start from zero
        StorageConfig storage = StorageConfig.newBuilder(Files.createTempDirectory("uniqueue-fairness").toString())
                .withDurableWrites(false)
                .build();

        QueueConfig config = QueueConfig.newBuilder()
                .withPoolSize(4)
                .withSchedulerInterval(Duration.ofMillis(20))
                .withTypeOptions("thumbnail", TypeOptions.newBuilder().withWeight(1).build())
                .withTypeOptions("transcode", TypeOptions.newBuilder().withWeight(3).build())
                .build();

        Map<String, AtomicInteger> running = new ConcurrentHashMap<>();
        Map<String, AtomicInteger> peak = new ConcurrentHashMap<>();
        JobHandler handler = context -> {
            int now = running.computeIfAbsent(context.getType(), t -> new AtomicInteger()).incrementAndGet();
            peak.computeIfAbsent(context.getType(), t -> new AtomicInteger()).accumulateAndGet(now, Math::max);
            Thread.sleep(100);
            running.get(context.getType()).decrementAndGet();
            return Outcome.success();
        };

        try (QueueEngine queue = QueueEngine.builder(storage)
                .withConfig(config)
                .register("thumbnail", handler)
                .register("transcode", handler)
                .build()) {

            for (int i = 0; i < 40; i++) {
                queue.submit(JobRequest.builder("thumbnail").build());
            }
            for (int i = 0; i < 12; i++) {
                queue.submit(JobRequest.builder("transcode").build());
            }
            queue.start();

            while (queue.getMetrics().getSucceededJobs() < 52) {
                Thread.sleep(100);
            }
            System.out.println("Peak concurrency per type: " + peak);
            System.out.println(queue.getMetrics());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
