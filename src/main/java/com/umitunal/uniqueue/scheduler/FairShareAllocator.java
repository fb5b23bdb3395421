package com.umitunal.uniqueue.scheduler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

/**
 * Weighted max-min fair division of worker slots among job types.
 *
 * <p>Slots are handed out one at a time to the type with the lowest {@code (allocated + 1) / weight}
 * among types whose demand (and concurrency ceiling) is not yet met. Slots a type cannot use
 * flow to the others. With equal weights and enough demand everywhere, no type gets more than
 * {@code ceil(capacity / types)}. Ties go to the type listed first.
 */
public class FairShareAllocator {

    /**
     * @param capacity      total slots to divide
     * @param demand        slots each type could use, in tie-break order
     * @param weight        relative share of a type, positive
     * @param maxConcurrent ceiling of a type
     * @return target concurrency per type, same order as {@code demand}
     */
    public Map<String, Integer> allocate(int capacity,
                                         Map<String, Integer> demand,
                                         ToDoubleFunction<String> weight,
                                         ToIntFunction<String> maxConcurrent) {
        Map<String, Integer> allocation = new LinkedHashMap<>();
        demand.keySet().forEach(type -> allocation.put(type, 0));

        int remaining = capacity;
        while (remaining > 0) {
            String next = null;
            double lowest = Double.POSITIVE_INFINITY;

            for (Map.Entry<String, Integer> entry : demand.entrySet()) {
                String type = entry.getKey();
                int allocated = allocation.get(type);
                int limit = Math.min(entry.getValue(), maxConcurrent.applyAsInt(type));
                if (allocated >= limit) {
                    continue;
                }
                double score = (allocated + 1) / weight.applyAsDouble(type);
                if (score < lowest) {
                    lowest = score;
                    next = type;
                }
            }

            if (next == null) {
                break; // every type is saturated
            }
            allocation.merge(next, 1, Integer::sum);
            remaining--;
        }
        return allocation;
    }
}
