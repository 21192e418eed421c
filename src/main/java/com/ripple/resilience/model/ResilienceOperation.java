package com.ripple.resilience.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * One logical call submitted to the resilience manager.
 *
 * @param <T> type of the operation result
 */
@Value
@Builder
public class ResilienceOperation<T> {
    public static final String DATA_KEY = "data";

    @NonNull
    String name;

    @NonNull
    String service;

    @NonNull
    Callable<T> operation;

    @Builder.Default
    Map<String, Object> context = Map.of();

    @Builder.Default
    OperationOptions options = OperationOptions.defaults();

    /**
     * Data snapshot validated before execution, taken from the {@code data} context entry.
     */
    public Object getData() {
        return context == null ? null : context.get(DATA_KEY);
    }

    public String resolveCircuitName() {
        String configured = options.getCircuitBreakerName();
        return configured != null ? configured : service + "_" + name;
    }
}
