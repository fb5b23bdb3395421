package com.umitunal.examples;

import com.umitunal.uniqueue.config.StorageConfig;
import com.umitunal.uniqueue.core.Job;
import com.umitunal.uniqueue.core.JobRequest;
import com.umitunal.uniqueue.engine.QueueEngine;
import com.umitunal.uniqueue.handler.Outcome;
import com.umitunal.uniqueue.serialization.StringCodec;

import java.nio.charset.StandardCharsets;

/**
 * Basic usage: register a handler, submit a job, watch it finish.
 */
public class BasicExample {

    public static void main(String[] args) {
        System.out.println("=== Basic Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/uniqueue-basic")
                .withDurableWrites(false)
                .build();

        try (QueueEngine queue = QueueEngine.builder(storage)
                .register("video_convert", context -> {
                    String source = new String(context.getPayload(), StandardCharsets.UTF_8);
                    for (int step = 1; step <= 4; step++) {
                        context.checkpoint();
                        Thread.sleep(50);
                        context.reportProgress(step * 25, "converted segment " + step);
                    }
                    return Outcome.success(source.replace(".mov", ".mp4"));
                })
                .build()) {

            queue.start();

            String id = queue.submit(JobRequest.builder("video_convert")
                    .name("holiday clip")
                    .payload("clips/holiday.mov", new StringCodec())
                    .build());
            System.out.println("Submitted " + id);

            Job job = ExampleSupport.awaitTerminal(queue, id, 5000);
            System.out.println("Result: " + job.getResult() + " (progress " + job.getProgress() + "%)");
            ExampleSupport.printHistory(job);
            System.out.println("\n" + queue.getMetrics());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
