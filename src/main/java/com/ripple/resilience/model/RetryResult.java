package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of one retried call. Not retained after the call returns.
 *
 * @param <T> type of the operation result
 */
@Value
@Builder
public class RetryResult<T> {
    boolean success;
    T data;
    /**
     * Error reported to callers: the last underlying error, or a
     * {@link com.ripple.resilience.exception.RetriesExhaustedException} wrapping it when
     * every attempt was used.
     */
    Exception error;
    Exception lastError;
    int attempts;
    Duration totalDuration;
    Duration lastAttemptDuration;

    /**
     * Returns the data of a successful result or rethrows the recorded error.
     */
    public T getOrThrow() throws Exception {
        if (success) {
            return data;
        }
        throw error;
    }
}
