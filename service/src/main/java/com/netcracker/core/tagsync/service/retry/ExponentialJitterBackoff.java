package com.netcracker.core.tagsync.service.retry;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * {@code min(maxDelay, baseDelay * 2^attempt)}, multiplied by a uniform factor in {@code [0.5, 1.5)}
 * when the policy enables jitter. Jitter comes from a strong random source so that many concurrent
 * workspace syncs do not retry in lockstep.
 */
public final class ExponentialJitterBackoff implements BackoffStrategy {
    private final Random rnd;

    public ExponentialJitterBackoff() {
        this(new SecureRandom());
    }

    ExponentialJitterBackoff(Random rnd) {
        this.rnd = Objects.requireNonNull(rnd);
    }

    @Override
    public Duration next(int attempt, RetryPolicy policy) {
        Objects.requireNonNull(policy);
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        Duration base = policy.getBaseDelay();
        Duration max = policy.getMaxDelay();
        if (base.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("Invalid backoff bounds");
        }

        double raw = base.toMillis() * Math.pow(2, attempt);
        double capped = Math.min(max.toMillis(), raw);
        double factor = policy.isJitter() ? 0.5 + rnd.nextDouble() : 1.0;
        return Duration.ofMillis((long) Math.floor(capped * factor));
    }
}
