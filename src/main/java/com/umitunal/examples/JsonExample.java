package com.umitunal.examples;

import com.umitunal.uniqueue.config.StorageConfig;
import com.umitunal.uniqueue.core.Job;
import com.umitunal.uniqueue.core.JobRequest;
import com.umitunal.uniqueue.engine.QueueEngine;
import com.umitunal.uniqueue.handler.JobHandler;
import com.umitunal.uniqueue.handler.Outcome;
import com.umitunal.uniqueue.serialization.JsonCodec;

import java.nio.charset.StandardCharsets;

/**
 * Typed JSON payloads. A payload the handler's codec cannot read fails without retry.
 */
public class JsonExample {

    public static void main(String[] args) {
        System.out.println("=== JSON Payload Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/uniqueue-json")
                .withDurableWrites(false)
                .build();

        JsonCodec<EmailTask> codec = new JsonCodec<>(EmailTask.class);

        try (QueueEngine queue = QueueEngine.builder(storage)
                .register("send_email", JobHandler.typed(codec, (email, context) -> {
                    System.out.println("  Sending '" + email.getSubject() + "' to " + email.getRecipient()
                            + " using " + email.getTemplate());
                    return Outcome.success("message-" + context.getJobId());
                }))
                .build()) {

            queue.start();

            String welcome = queue.submit(JobRequest.builder("send_email")
                    .payload(new EmailTask("user@example.com", "Welcome!", "Welcome to our platform", "welcome-template"), codec)
                    .build());
            String broken = queue.submit(JobRequest.builder("send_email")
                    .payload("{not json".getBytes(StandardCharsets.UTF_8))
                    .build());

            Job sent = ExampleSupport.awaitTerminal(queue, welcome, 5000);
            Job rejected = ExampleSupport.awaitTerminal(queue, broken, 5000);
            System.out.println("\n" + sent.getId() + ": " + sent.getState() + " -> " + sent.getResult());
            System.out.println(rejected.getId() + ": " + rejected.getState() + " -> " + rejected.getError());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }

    /**
     * Example POJO for email tasks.
     */
    public static class EmailTask {
        private String recipient;
        private String subject;
        private String body;
        private String template;

        // Required for Jackson
        public EmailTask() {}

        public EmailTask(String recipient, String subject, String body, String template) {
            this.recipient = recipient;
            this.subject = subject;
            this.body = body;
            this.template = template;
        }

        public String getRecipient() { return recipient; }
        public void setRecipient(String recipient) { this.recipient = recipient; }

        public String getSubject() { return subject; }
        public void setSubject(String subject) { this.subject = subject; }

        public String getBody() { return body; }
        public void setBody(String body) { this.body = body; }

        public String getTemplate() { return template; }
        public void setTemplate(String template) { this.template = template; }
    }
}
