package com.ripple.resilience.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Alternate execution path for a service. Lower priority values are tried first.
 */
@Value
@Builder
public class FallbackStrategy {
    @NonNull
    String name;

    @Builder.Default
    String description = "";

    /**
     * Minimum service level at which this strategy may run.
     */
    @NonNull
    ServiceLevel serviceLevel;

    int priority;

    @Builder.Default
    BooleanSupplier availability = () -> true;

    @NonNull
    FallbackAction action;

    public boolean isAvailable() {
        return availability.getAsBoolean();
    }

    public Object execute(Map<String, Object> context) throws Exception {
        return action.execute(context);
    }
}
