package com.sailfish.taskman.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * Defines the strategy for retrying a failed attempt to reach the store.
 */
public interface RetryStrategy {

    /**
     * Determines if another attempt should be made.
     *
     * @param failedAttempts number of attempts that have failed so far (1 after the first failure)
     * @return true if another attempt should be made, false otherwise (e.g., retry limit reached)
     */
    boolean shouldRetry(int failedAttempts);

    /**
     * Calculates how long to wait before the next attempt.
     *
     * @param failedAttempts number of attempts that have failed so far
     * @return An Optional containing the delay, or empty if no retry should occur.
     */
    Optional<Duration> nextDelay(int failedAttempts);

}
