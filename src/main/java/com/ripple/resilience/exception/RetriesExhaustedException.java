package com.ripple.resilience.exception;

import lombok.Getter;

/**
 * Wraps the last underlying error once every configured attempt has failed.
 */
@Getter
public class RetriesExhaustedException extends ResilienceException {

    private final int attempts;

    public RetriesExhaustedException(String operationName, int attempts, Throwable lastError) {
        super(String.format("Operation '%s' failed after %d attempts: %s",
                operationName, attempts, lastError.getMessage()),
            ErrorType.RETRIES_EXHAUSTED, false, lastError);
        this.attempts = attempts;
    }
}
