package com.ripple.resilience.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Thrown without invoking the protected operation while a circuit is open.
 */
@Getter
public class CircuitOpenException extends ResilienceException {

    private final String circuitName;
    private final Duration recoveryTimeout;

    public CircuitOpenException(String circuitName, Duration recoveryTimeout) {
        super(String.format("Circuit breaker '%s' is open. Please wait %d seconds before retrying.",
                circuitName, (long) Math.ceil(recoveryTimeout.toMillis() / 1000.0)),
            ErrorType.CIRCUIT_BREAKER_OPEN, true);
        this.circuitName = circuitName;
        this.recoveryTimeout = recoveryTimeout;
    }
}
