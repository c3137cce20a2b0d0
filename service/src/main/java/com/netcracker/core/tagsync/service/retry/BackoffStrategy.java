package com.netcracker.core.tagsync.service.retry;

import java.time.Duration;

public interface BackoffStrategy {
    /**
     * Delay before the retry following the failed attempt number {@code attempt} (0-indexed).
     */
    Duration next(int attempt, RetryPolicy policy);
}
