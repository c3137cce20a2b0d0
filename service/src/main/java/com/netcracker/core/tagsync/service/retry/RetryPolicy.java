package com.netcracker.core.tagsync.service.retry;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retry budget of one class of remote operations. {@code maxRetries} counts attempts after the first one.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {
    @Builder.Default int maxRetries = 0;
    @Builder.Default Duration baseDelay = Duration.ofMillis(500);
    @Builder.Default Duration maxDelay = Duration.ofSeconds(10);
    @Builder.Default boolean jitter = true;
    @Builder.Default Predicate<Throwable> retryable = RetryableErrors::isRetryable;
}
