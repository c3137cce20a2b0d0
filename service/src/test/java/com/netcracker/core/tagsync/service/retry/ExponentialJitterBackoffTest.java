package com.netcracker.core.tagsync.service.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExponentialJitterBackoffTest {

    private static final RetryPolicy NO_JITTER = RetryPolicy.builder()
            .baseDelay(Duration.ofMillis(500))
            .maxDelay(Duration.ofSeconds(10))
            .jitter(false)
            .build();

    @Test
    void doublesUntilCap() {
        ExponentialJitterBackoff backoff = new ExponentialJitterBackoff();

        assertThat(backoff.next(0, NO_JITTER)).isEqualTo(Duration.ofMillis(500));
        assertThat(backoff.next(1, NO_JITTER)).isEqualTo(Duration.ofMillis(1000));
        assertThat(backoff.next(4, NO_JITTER)).isEqualTo(Duration.ofMillis(8000));
        assertThat(backoff.next(5, NO_JITTER)).isEqualTo(Duration.ofSeconds(10));
        assertThat(backoff.next(30, NO_JITTER)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void jitterScalesByFactorFromHalfToOneAndAHalf() {
        RetryPolicy policy = NO_JITTER.toBuilder().jitter(true).build();

        assertThat(new ExponentialJitterBackoff(fixedRandom(0.0)).next(1, policy)).isEqualTo(Duration.ofMillis(500));
        assertThat(new ExponentialJitterBackoff(fixedRandom(0.5)).next(1, policy)).isEqualTo(Duration.ofMillis(1000));
        assertThat(new ExponentialJitterBackoff(fixedRandom(0.75)).next(1, policy)).isEqualTo(Duration.ofMillis(1250));
    }

    @Test
    void jitteredDelayStaysInBounds() {
        ExponentialJitterBackoff backoff = new ExponentialJitterBackoff();
        RetryPolicy policy = NO_JITTER.toBuilder().jitter(true).build();

        for (int i = 0; i < 200; i++) {
            assertThat(backoff.next(2, policy)).isBetween(Duration.ofMillis(1000), Duration.ofMillis(2999));
        }
    }

    @Test
    void negativeAttemptIsRejected() {
        ExponentialJitterBackoff backoff = new ExponentialJitterBackoff();

        assertThatThrownBy(() -> backoff.next(-1, NO_JITTER)).isInstanceOf(IllegalArgumentException.class);
    }

    private static Random fixedRandom(double value) {
        return new Random() {
            @Override
            public double nextDouble() {
                return value;
            }
        };
    }
}
