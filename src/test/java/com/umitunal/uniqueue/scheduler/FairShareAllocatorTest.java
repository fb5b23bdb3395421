package com.umitunal.uniqueue.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FairShareAllocatorTest {

    private final FairShareAllocator allocator = new FairShareAllocator();

    private static Map<String, Integer> demand(Object... typeAndCount) {
        Map<String, Integer> demand = new LinkedHashMap<>();
        for (int i = 0; i < typeAndCount.length; i += 2) {
            demand.put((String) typeAndCount[i], (Integer) typeAndCount[i + 1]);
        }
        return demand;
    }

    @Test
    @DisplayName("Should split slots evenly between saturated types of equal weight")
    void testEqualSplit() {
        Map<String, Integer> allocation = allocator.allocate(4,
                demand("video_convert", 1000, "email_send", 1000), t -> 1.0, t -> Integer.MAX_VALUE);

        assertThat(allocation).containsEntry("video_convert", 2).containsEntry("email_send", 2);
    }

    @Test
    @DisplayName("Should never give a type more than ceil(capacity / types) with equal weights")
    void testCeilingBound() {
        Map<String, Integer> allocation = allocator.allocate(7,
                demand("a", 100, "b", 100, "c", 100), t -> 1.0, t -> Integer.MAX_VALUE);

        assertThat(allocation.values()).allSatisfy(slots -> assertThat(slots).isLessThanOrEqualTo(3));
        assertThat(allocation.values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(7);
        // Ties go to the type listed first
        assertThat(allocation).containsEntry("a", 3);
    }

    @Test
    @DisplayName("Should hand unused share to types with more demand")
    void testRedistribution() {
        Map<String, Integer> allocation = allocator.allocate(8,
                demand("small", 1, "big", 50), t -> 1.0, t -> Integer.MAX_VALUE);

        assertThat(allocation).containsEntry("small", 1).containsEntry("big", 7);
    }

    @Test
    @DisplayName("Should split proportionally to weights")
    void testWeights() {
        Map<String, Integer> allocation = allocator.allocate(8,
                demand("thumbnail", 100, "transcode", 100),
                t -> t.equals("transcode") ? 3.0 : 1.0, t -> Integer.MAX_VALUE);

        assertThat(allocation).containsEntry("thumbnail", 2).containsEntry("transcode", 6);
    }

    @Test
    @DisplayName("Should respect per-type concurrency ceilings")
    void testMaxConcurrent() {
        Map<String, Integer> allocation = allocator.allocate(10,
                demand("gpu", 100, "cpu", 3), t -> 1.0, t -> t.equals("gpu") ? 2 : Integer.MAX_VALUE);

        assertThat(allocation).containsEntry("gpu", 2).containsEntry("cpu", 3);
    }

    @Test
    @DisplayName("Should allocate nothing without demand or capacity")
    void testEmpty() {
        assertThat(allocator.allocate(4, demand(), t -> 1.0, t -> 10)).isEmpty();
        assertThat(allocator.allocate(0, demand("a", 5), t -> 1.0, t -> 10)).containsEntry("a", 0);
    }
}
