package com.ripple.resilience.exception;

import lombok.Getter;

/**
 * Structured failure raised by the engine or by caller operations.
 *
 * <p>The {@code retryable} flag is honoured by retry classification when neither the
 * retryable nor the non-retryable identity lists match the error.
 */
@Getter
public class ResilienceException extends RuntimeException {

    private final ErrorType errorType;
    private final boolean retryable;

    public ResilienceException(String message, ErrorType errorType, boolean retryable) {
        super(message);
        this.errorType = errorType;
        this.retryable = retryable;
    }

    public ResilienceException(String message, ErrorType errorType, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.retryable = retryable;
    }
}
