package com.umitunal.uniqueue.serialization;

import com.esotericsoftware.kryo.Kryo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class KryoCodecTest {

    @Test
    @DisplayName("Should carry a job payload object graph")
    void testPayloadObject() {
        // Given
        KryoCodec<ArchiveRequest> codec = new KryoCodec<>(ArchiveRequest.class);
        Map<String, String> metadata = new HashMap<>();
        metadata.put("owner", "user-42");
        ArchiveRequest original = new ArchiveRequest("photos.zip",
                new ArrayList<>(Arrays.asList("a.jpg", "b.jpg")), metadata);

        // When
        ArchiveRequest decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded.name).isEqualTo("photos.zip");
        assertThat(decoded.files).containsExactly("a.jpg", "b.jpg");
        assertThat(decoded.metadata).containsEntry("owner", "user-42");
    }

    @Test
    @DisplayName("Should handle circular references")
    void testCircularReferences() {
        // Given
        KryoCodec<Node> codec = new KryoCodec<>(Node.class);
        Node first = new Node("first");
        Node second = new Node("second");
        first.next = second;
        second.next = first;

        // When
        Node decoded = codec.decode(codec.encode(first));

        // Then
        assertThat(decoded.next.name).isEqualTo("second");
        assertThat(decoded.next.next).isSameAs(decoded);
    }

    @Test
    @DisplayName("Should wrap unreadable bytes in PayloadCodecException")
    void testMalformed() {
        KryoCodec<ArchiveRequest> codec = new KryoCodec<>(ArchiveRequest.class);

        assertThatThrownBy(() -> codec.decode(new byte[]{1}))
                .isInstanceOf(PayloadCodecException.class)
                .hasMessageContaining("ArchiveRequest");
    }

    @Test
    @DisplayName("Should work with custom Kryo factory")
    void testCustomFactory() {
        // Given
        KryoCodec<Node> codec = new KryoCodec<>(Node.class, () -> {
            Kryo kryo = new Kryo();
            kryo.register(Node.class);
            return kryo;
        });

        // When
        Node decoded = codec.decode(codec.encode(new Node("solo")));

        // Then
        assertThat(decoded.name).isEqualTo("solo");
        assertThat(decoded.next).isNull();
    }

    @Test
    @DisplayName("Should be thread-safe")
    void testThreadSafety() throws InterruptedException {
        // Given
        KryoCodec<String> codec = new KryoCodec<>(String.class);
        List<Throwable> errors = new ArrayList<>();
        Thread[] threads = new Thread[8];

        // When
        for (int i = 0; i < threads.length; i++) {
            final int threadNum = i;
            threads[i] = new Thread(() -> {
                for (int j = 0; j < 100; j++) {
                    String original = "job-" + threadNum + "-" + j;
                    if (!original.equals(codec.decode(codec.encode(original)))) {
                        synchronized (errors) {
                            errors.add(new AssertionError(original));
                        }
                    }
                }
            });
            threads[i].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        // Then
        assertThat(errors).isEmpty();
    }

    public static class ArchiveRequest {
        String name;
        List<String> files;
        Map<String, String> metadata;

        public ArchiveRequest() {}

        ArchiveRequest(String name, List<String> files, Map<String, String> metadata) {
            this.name = name;
            this.files = files;
            this.metadata = metadata;
        }
    }

    public static class Node {
        String name;
        Node next;

        public Node() {}

        Node(String name) {
            this.name = name;
        }
    }
}
