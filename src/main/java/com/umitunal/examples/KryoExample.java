package com.umitunal.examples;

import com.umitunal.uniqueue.config.StorageConfig;
import com.umitunal.uniqueue.core.Job;
import com.umitunal.uniqueue.core.JobRequest;
import com.umitunal.uniqueue.engine.QueueEngine;
import com.umitunal.uniqueue.handler.JobHandler;
import com.umitunal.uniqueue.handler.Outcome;
import com.umitunal.uniqueue.serialization.KryoCodec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compact binary payloads with Kryo, e.g. for large object graphs.
 */
public class KryoExample {

    public static class ArchiveRequest {
        private String archiveName;
        private List<String> files;
        private Map<String, String> metadata;

        public ArchiveRequest() {}

        public ArchiveRequest(String archiveName, List<String> files, Map<String, String> metadata) {
            this.archiveName = archiveName;
            this.files = files;
            this.metadata = metadata;
        }

        public String getArchiveName() { return archiveName; }
        public List<String> getFiles() { return files; }
        public Map<String, String> getMetadata() { return metadata; }
    }

    public static void main(String[] args) {
        System.out.println("=== Kryo Payload Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/uniqueue-kryo")
                .withDurableWrites(false)
                .build();

        KryoCodec<ArchiveRequest> codec = new KryoCodec<>(ArchiveRequest.class);

        try (QueueEngine queue = QueueEngine.builder(storage)
                .register("archive_create", JobHandler.typed(codec, (request, context) -> {
                    int done = 0;
                    for (String file : request.getFiles()) {
                        context.checkpoint();
                        done++;
                        context.reportProgress(done * 100 / request.getFiles().size(), "added " + file);
                    }
                    return Outcome.success(request.getArchiveName() + " (" + done + " files)");
                }))
                .build()) {

            queue.start();

            List<String> files = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                files.add("photos/img-" + i + ".jpg");
            }
            Map<String, String> metadata = new HashMap<>();
            metadata.put("owner", "user-42");

            String id = queue.submit(JobRequest.builder("archive_create")
                    .payload(new ArchiveRequest("photos.zip", files, metadata), codec)
                    .build());

            Job job = ExampleSupport.awaitTerminal(queue, id, 5000);
            System.out.println(job.getId() + ": " + job.getState() + " -> " + job.getResult());
            System.out.println("Last progress: " + job.getProgress() + "% " + job.getProgressMessage());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
