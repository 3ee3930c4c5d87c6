package com.sailfish.taskman.retry;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A retry strategy implementing exponential backoff with optional jitter.
 */
public class ExponentialBackoffRetryStrategy implements RetryStrategy {

    private final int maxRetries;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay; // Optional cap
    private final boolean addJitter;

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(500);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

    /**
     * Creates a default ExponentialBackoffRetryStrategy.
     * Max Retries: 3
     * Initial Delay: 500 milliseconds
     * Multiplier: 2.0
     * Max Delay: 10 seconds
     * Jitter: true
     */
    public ExponentialBackoffRetryStrategy() {
        this(DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_DELAY, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY, true);
    }

    /**
     * Creates a configurable ExponentialBackoffRetryStrategy.
     *
     * @param maxRetries Maximum number of retry attempts after the first failure.
     * @param initialDelay Delay before the first retry.
     * @param multiplier Factor by which the delay increases for each subsequent retry.
     * @param maxDelay Optional maximum delay cap. Set to null or Duration.ZERO to disable.
     * @param addJitter If true, varies each delay by up to 10% in either direction.
     */
    public ExponentialBackoffRetryStrategy(int maxRetries, Duration initialDelay, double multiplier, Duration maxDelay, boolean addJitter) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be non-negative");
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) throw new IllegalArgumentException("initialDelay must be positive");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be at least 1.0");

        this.maxRetries = maxRetries;
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = (maxDelay != null && !maxDelay.isNegative() && !maxDelay.isZero()) ? maxDelay : null;
        this.addJitter = addJitter;
    }

    @Override
    public boolean shouldRetry(int failedAttempts) {
        return failedAttempts >= 1 && failedAttempts <= this.maxRetries;
    }

    @Override
    public Optional<Duration> nextDelay(int failedAttempts) {
        if (!shouldRetry(failedAttempts)) {
            return Optional.empty();
        }

        long delayMillis = (long) (initialDelay.toMillis() * Math.pow(multiplier, failedAttempts - 1));

        if (maxDelay != null && delayMillis > maxDelay.toMillis()) {
            delayMillis = maxDelay.toMillis();
        }

        if (addJitter && delayMillis > 0) {
            long jitter = (long) (delayMillis * 0.1 * (ThreadLocalRandom.current().nextDouble() * 2 - 1)); // Range [-0.1, 0.1]
            delayMillis = Math.max(1, delayMillis + jitter);
        } else if (delayMillis <= 0) {
            delayMillis = 1;
        }

        return Optional.of(Duration.ofMillis(delayMillis));
    }
}
