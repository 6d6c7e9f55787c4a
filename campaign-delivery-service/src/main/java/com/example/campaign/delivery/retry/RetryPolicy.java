package com.example.campaign.delivery.retry;

/**
 * Delay before the next delivery attempt.
 */
public interface RetryPolicy {

    /**
     * @param attempts number of attempts made so far, at least 1
     * @return delay in milliseconds before the next attempt
     */
    long computeDelayMs(int attempts);
}
