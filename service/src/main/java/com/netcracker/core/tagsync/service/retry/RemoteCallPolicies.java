package com.netcracker.core.tagsync.service.retry;

import lombok.Value;

/**
 * Read and write retry policies used against the remote directory.
 */
@Value
public class RemoteCallPolicies {
    RetryPolicy reads;
    RetryPolicy writes;

    public static RemoteCallPolicies from(RetryConfig config) {
        RetryConfig.Reads reads = config.reads();
        RetryConfig.Writes writes = config.writes();
        return new RemoteCallPolicies(
                RetryPolicy.builder()
                        .maxRetries(reads.maxRetries())
                        .baseDelay(reads.baseDelay())
                        .maxDelay(reads.maxDelay())
                        .jitter(reads.jitter())
                        .build(),
                RetryPolicy.builder()
                        .maxRetries(writes.maxRetries())
                        .baseDelay(writes.baseDelay())
                        .maxDelay(writes.maxDelay())
                        .jitter(writes.jitter())
                        .build());
    }
}
