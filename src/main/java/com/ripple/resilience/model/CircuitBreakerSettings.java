package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Thresholds for a single named circuit.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class CircuitBreakerSettings {

    /**
     * Failures inside the monitoring window that open the circuit.
     */
    @Builder.Default
    private int failureThreshold = 5;

    /**
     * Time an open circuit waits before letting a trial call through.
     */
    @Builder.Default
    private Duration recoveryTimeout = Duration.ofSeconds(30);

    /**
     * Calls running longer than this count as failures. Zero disables the limit.
     */
    @Builder.Default
    private Duration timeoutThreshold = Duration.ofSeconds(10);

    /**
     * Rolling window for failure counting and the failure rate.
     */
    @Builder.Default
    private Duration monitoringWindow = Duration.ofMinutes(1);

    public static CircuitBreakerSettings defaults() {
        return CircuitBreakerSettings.builder().build();
    }
}
