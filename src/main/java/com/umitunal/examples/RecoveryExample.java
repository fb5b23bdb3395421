package com.umitunal.examples;

import com.umitunal.uniqueue.config.QueueConfig;
import com.umitunal.uniqueue.config.StorageConfig;
import com.umitunal.uniqueue.core.Job;
import com.umitunal.uniqueue.engine.QueueEngine;
import com.umitunal.uniqueue.handler.Outcome;
import com.umitunal.uniqueue.model.JobRecord;
import com.umitunal.uniqueue.storage.RocksJobStore;

import java.time.Duration;

/**
 * Lease expiry: a job leased by a worker that crashed is returned to the queue and finished
 * by another worker, without the lost attempt being counted.
 */
public class RecoveryExample {

    public static void main(String[] args) {
        System.out.println("=== Lease Recovery Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/uniqueue-recovery")
                .withDurableWrites(false)
                .build();

        try (RocksJobStore store = new RocksJobStore(storage)) {
            long now = System.currentTimeMillis();
            String id = store.submit(JobRecord.draft("image_resize", "avatar", new byte[]{42}, 0, 3, now, now));

            // Lease it for a worker that then disappears without reporting
            store.update(id, record -> record.lease("crashed-worker", 500, now));
            System.out.println("Leased by: " + store.get(id).getLeaseOwner());

            QueueConfig config = QueueConfig.newBuilder()
                    .withWorkerIdPrefix("healthy")
                    .withReclaimInterval(Duration.ofMillis(200))
                    .withSchedulerInterval(Duration.ofMillis(100))
                    .build();

            try (QueueEngine queue = QueueEngine.builder(store)
                    .withConfig(config)
                    .register("image_resize", context -> Outcome.success("resized on attempt " + context.getAttempt()))
                    .build()) {
                queue.start();
                Job job = ExampleSupport.awaitTerminal(queue, id, 10_000);
                ExampleSupport.printHistory(job);
            }

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
