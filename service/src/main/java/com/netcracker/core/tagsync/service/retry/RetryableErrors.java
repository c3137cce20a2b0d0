package com.netcracker.core.tagsync.service.retry;

import com.netcracker.core.tagsync.client.RemoteApiException;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Decides whether a failed remote call is worth another attempt.
 * <p>
 * Retryable: HTTP 429/500/502/503/504, transient network failures, and HTTP 403 only when the error
 * payload names a rate-limit reason. Everything else, including permission denials and stale
 * fingerprints (409/412), is permanent.
 */
public final class RetryableErrors {
    static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);
    static final Set<String> TRANSIENT_NETWORK_CODES =
            Set.of("ECONNRESET", "ETIMEDOUT", "EAI_AGAIN", "ENOTFOUND", "ECONNREFUSED");
    static final Set<String> RATE_LIMIT_REASONS = Set.of("rateLimitExceeded", "userRateLimitExceeded");

    private RetryableErrors() {
    }

    public static boolean isRetryable(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RemoteApiException remote) {
            return isRetryable(remote);
        }
        return isTransientNetworkFailure(cause);
    }

    static boolean isRetryable(RemoteApiException error) {
        int status = error.getStatus();
        if (RETRYABLE_STATUSES.contains(status)) {
            return true;
        }
        if (error.getErrorCode() != null && TRANSIENT_NETWORK_CODES.contains(error.getErrorCode())) {
            return true;
        }
        if (status == 403) {
            return error.getReasons().stream().anyMatch(RATE_LIMIT_REASONS::contains);
        }
        return isTransientNetworkFailure(error.getCause());
    }

    static boolean isTransientNetworkFailure(Throwable error) {
        if (error instanceof ConnectException
                || error instanceof SocketTimeoutException
                || error instanceof UnknownHostException) {
            return true;
        }
        return error instanceof SocketException
                && error.getMessage() != null
                && error.getMessage().toLowerCase(Locale.ROOT).contains("connection reset");
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
