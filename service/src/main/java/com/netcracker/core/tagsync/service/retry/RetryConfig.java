package com.netcracker.core.tagsync.service.retry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Retry budgets of remote calls. Reads are idempotent and get the larger budget; writes are
 * side-effecting and are retried conservatively.
 */
@ConfigMapping(prefix = "tagsync.retry")
public interface RetryConfig {

    Reads reads();

    Writes writes();

    interface Reads {
        @WithDefault("5")
        int maxRetries();

        @WithDefault("500ms")
        Duration baseDelay();

        @WithDefault("10s")
        Duration maxDelay();

        @WithDefault("true")
        boolean jitter();
    }

    interface Writes {
        @WithDefault("2")
        int maxRetries();

        @WithDefault("500ms")
        Duration baseDelay();

        @WithDefault("10s")
        Duration maxDelay();

        @WithDefault("true")
        boolean jitter();
    }
}
