package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Selects the execution path and the checks applied to one resilient operation.
 */
@Value
@Builder(toBuilder = true)
public class OperationOptions {
    boolean useCircuitBreaker;
    boolean useRetry;

    @Builder.Default
    boolean useFallbacks = true;

    boolean validateData;

    @Builder.Default
    List<ConsistencyRule> consistencyRules = List.of();

    /**
     * Overrides the manager's retry policy for this operation when set.
     */
    RetrySettings retryConfig;

    /**
     * Defaults to {@code <service>_<name>} when not set.
     */
    String circuitBreakerName;

    public static OperationOptions defaults() {
        return OperationOptions.builder().build();
    }

    public boolean hasConsistencyRules() {
        return validateData && consistencyRules != null && !consistencyRules.isEmpty();
    }
}
