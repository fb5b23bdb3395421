package com.umitunal.uniqueue.retry;

import java.time.Duration;

/**
 * Delay before a failed job becomes eligible again.
 * Implementations must be non-decreasing in the attempt count and bounded.
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param attemptCount attempts made so far, at least 1
     */
    Duration backoff(int attemptCount);
}
