package com.netcracker.core.tagsync.service.retry;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs an asynchronous remote operation with bounded exponential backoff.
 * <p>
 * The returned future completes with the first successful result, or with the last failure once it is
 * not retryable or the policy's budget is exhausted. Waiting between attempts never blocks a thread.
 */
@ApplicationScoped
@Slf4j
public class RetryDriver {
    private final BackoffStrategy backoff;
    private final Executor executor;

    public RetryDriver() {
        this(new ExponentialJitterBackoff(), ForkJoinPool.commonPool());
    }

    RetryDriver(BackoffStrategy backoff, Executor executor) {
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public <T> CompletableFuture<T> execute(String operation, Supplier<CompletableFuture<T>> call, RetryPolicy policy) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(policy, "policy");
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, call, policy, 0, result);
        return result;
    }

    private <T> void attempt(String operation,
                             Supplier<CompletableFuture<T>> call,
                             RetryPolicy policy,
                             int attempt,
                             CompletableFuture<T> result) {
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException ex) {
            future = CompletableFuture.failedFuture(ex);
        }

        future.whenComplete((value, error) -> {
            if (error == null) {
                if (attempt > 0) {
                    log.info("Remote operation '{}' succeeded after {} attempts", operation, attempt + 1);
                }
                result.complete(value);
                return;
            }

            Throwable cause = RetryableErrors.unwrap(error);
            if (attempt >= policy.getMaxRetries() || !policy.getRetryable().test(cause)) {
                if (attempt > 0) {
                    log.error("Remote operation '{}' failed after {} attempts", operation, attempt + 1, cause);
                }
                result.completeExceptionally(cause);
                return;
            }

            Duration delay = backoff.next(attempt, policy);
            log.warn("Remote operation '{}' failed on attempt {}/{}. Retrying in {}. Cause: {}",
                    operation, attempt + 1, policy.getMaxRetries() + 1, delay, cause.toString());
            Executor delayed = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor);
            try {
                delayed.execute(() -> attempt(operation, call, policy, attempt + 1, result));
            } catch (RuntimeException ex) {
                log.debug("Retry scheduling rejected for '{}'", operation, ex);
                result.completeExceptionally(cause);
            }
        });
    }
}
