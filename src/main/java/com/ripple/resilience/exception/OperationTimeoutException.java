package com.ripple.resilience.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class OperationTimeoutException extends ResilienceException {

    private final Duration timeout;

    public OperationTimeoutException(String message, Duration timeout, Throwable cause) {
        super(message, ErrorType.TIMEOUT_ERROR, true, cause);
        this.timeout = timeout;
    }
}
