package com.ripple.resilience.exception;

/**
 * Error identities understood by retry classification. The name of the type is part
 * of an error's identity, so retryable/non-retryable lists can match on it.
 */
public enum ErrorType {
    NETWORK_ERROR,
    TIMEOUT_ERROR,
    RPC_CONNECTION_FAILED,
    CIRCUIT_BREAKER_OPEN,
    VALIDATION_ERROR,
    RETRIES_EXHAUSTED,
    INVALID_INPUT,
    UNKNOWN_ERROR
}
