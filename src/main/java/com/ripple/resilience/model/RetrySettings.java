package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * Attempt bound, backoff curve and error classification lists for one retry policy.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class RetrySettings {

    @Builder.Default
    private int maxAttempts = 3;

    @Builder.Default
    private Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    private Duration maxDelay = Duration.ofSeconds(30);

    @Builder.Default
    private double backoffMultiplier = 2.0;

    /**
     * Delay is randomized by up to half of this fraction in either direction.
     */
    @Builder.Default
    private double jitterFactor = 0.1;

    /**
     * Per-attempt timeout. Zero or negative disables the attempt timer.
     */
    @Builder.Default
    private Duration timeout = Duration.ofSeconds(10);

    @Builder.Default
    private List<String> retryableErrors = List.of(
        "NETWORK_ERROR",
        "TIMEOUT_ERROR",
        "RPC_CONNECTION_FAILED",
        "CIRCUIT_BREAKER_OPEN");

    @Builder.Default
    private List<String> nonRetryableErrors = List.of(
        "INVALID_INPUT",
        "INSUFFICIENT_FUNDS",
        "INVALID_PRIVATE_KEY",
        "COMPLIANCE_VIOLATION");

    public static RetrySettings defaults() {
        return RetrySettings.builder().build();
    }
}
