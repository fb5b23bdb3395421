package com.umitunal.uniqueue.retry;

import com.umitunal.uniqueue.config.QueueConfig;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Decides whether and when a job is retried after a recoverable failure, using the retry
 * policy of its type.
 */
public class RetryController {
    private final QueueConfig config;
    private final Function<RetryPolicy, BackoffPolicy> backoffFactory;
    private final ConcurrentMap<String, BackoffPolicy> backoffByType = new ConcurrentHashMap<>();

    public RetryController(QueueConfig config) {
        this(config, ExponentialBackoff::new);
    }

    public RetryController(QueueConfig config, Function<RetryPolicy, BackoffPolicy> backoffFactory) {
        this.config = config;
        this.backoffFactory = backoffFactory;
    }

    /**
     * @param attemptsMade attempts including the one that just failed
     * @param maxAttempts  the job's attempt ceiling
     */
    public RetryDecision decide(String type, int attemptsMade, int maxAttempts, long now) {
        if (attemptsMade >= maxAttempts) {
            return RetryDecision.giveUp();
        }
        return RetryDecision.retryAt(now + backoff(type, attemptsMade).toMillis());
    }

    public Duration backoff(String type, int attemptCount) {
        return backoffByType
                .computeIfAbsent(type, t -> backoffFactory.apply(config.retryPolicy(t)))
                .backoff(attemptCount);
    }

    /**
     * Attempt ceiling applied to submissions of this type that do not set one.
     */
    public int defaultMaxAttempts(String type) {
        return config.retryPolicy(type).getMaxAttempts();
    }
}
