package com.umitunal.uniqueue.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with bounded jitter.
 *
 * <p>The undisturbed step is {@code step(n) = min(maxDelay, baseDelay * 2^(n-1))}. Jitter adds
 * a random share of the gap to the next step, {@code jitterFraction * r * (step(n+1) - step(n))}
 * with {@code r} in [0, 1), so every delay for attempt n lies in {@code [step(n), step(n+1)]}:
 * delays never shrink as attempts grow and never exceed maxDelay.
 */
public class ExponentialBackoff implements BackoffPolicy {
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final double jitterFraction;
    private final DoubleSupplier random;

    public ExponentialBackoff(RetryPolicy policy) {
        this(policy, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1)
     */
    public ExponentialBackoff(RetryPolicy policy, DoubleSupplier random) {
        this.baseDelayMillis = policy.getBaseDelay().toMillis();
        this.maxDelayMillis = policy.getMaxDelay().toMillis();
        this.jitterFraction = policy.getJitterFraction();
        this.random = random;
    }

    @Override
    public Duration backoff(int attemptCount) {
        int attempt = Math.max(1, attemptCount);
        long step = step(attempt);
        long gap = step(attempt + 1) - step;

        long jitter = 0;
        if (jitterFraction > 0 && gap > 0) {
            double r = Math.min(Math.max(random.getAsDouble(), 0.0), 1.0);
            jitter = (long) (jitterFraction * r * gap);
        }
        return Duration.ofMillis(Math.min(maxDelayMillis, step + jitter));
    }

    long step(int attempt) {
        int exp = attempt - 1;
        if (exp >= 62 || baseDelayMillis > (maxDelayMillis >> exp)) {
            return maxDelayMillis;
        }
        return Math.min(maxDelayMillis, baseDelayMillis << exp);
    }
}
