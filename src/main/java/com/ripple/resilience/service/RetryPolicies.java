package com.ripple.resilience.service;

import com.ripple.resilience.model.RetrySettings;

import java.time.Duration;
import java.util.List;

/**
 * Retry policies for common kinds of calls.
 */
public final class RetryPolicies {

    private RetryPolicies() {
    }

    /**
     * Short, cheap retries for user-facing calls.
     */
    public static RetrySettings fast() {
        return RetrySettings.builder()
            .maxAttempts(2)
            .baseDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(1))
            .backoffMultiplier(1.5)
            .jitterFactor(0.2)
            .timeout(Duration.ofSeconds(3))
            .build();
    }

    public static RetrySettings standard() {
        return RetrySettings.builder()
            .maxAttempts(3)
            .baseDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(10))
            .backoffMultiplier(2)
            .jitterFactor(0.1)
            .timeout(Duration.ofSeconds(10))
            .build();
    }

    /**
     * More attempts with longer pauses, for critical operations.
     */
    public static RetrySettings conservative() {
        return RetrySettings.builder()
            .maxAttempts(5)
            .baseDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofMinutes(1))
            .backoffMultiplier(2)
            .jitterFactor(0.15)
            .timeout(Duration.ofSeconds(30))
            .build();
    }

    public static RetrySettings network() {
        return RetrySettings.builder()
            .maxAttempts(3)
            .baseDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(15))
            .backoffMultiplier(2)
            .jitterFactor(0.1)
            .timeout(Duration.ofSeconds(15))
            .retryableErrors(List.of(
                "NETWORK_ERROR",
                "TIMEOUT_ERROR",
                "RPC_CONNECTION_FAILED",
                "CIRCUIT_BREAKER_OPEN",
                "ECONNRESET",
                "ENOTFOUND",
                "ETIMEDOUT",
                "ConnectException",
                "SocketTimeoutException"))
            .build();
    }
}
