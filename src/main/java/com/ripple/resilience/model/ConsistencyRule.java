package com.ripple.resilience.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Named predicate over a data snapshot, optionally paired with a repair function.
 *
 * <p>The repair function returns the repaired value. Mutable data may be fixed in place,
 * in which case the same instance is returned.
 */
@Value
@Builder
public class ConsistencyRule {
    @NonNull
    String name;

    @Builder.Default
    String description = "";

    @Builder.Default
    ConsistencySeverity severity = ConsistencySeverity.WARNING;

    boolean autoRepair;

    @NonNull
    Predicate<Object> validator;

    UnaryOperator<Object> repairer;

    public boolean validate(Object data) {
        return validator.test(data);
    }

    public boolean canRepair() {
        return repairer != null;
    }

    public Object repair(Object data) {
        if (repairer == null) {
            throw new UnsupportedOperationException("Rule '" + name + "' has no repair function");
        }
        return repairer.apply(data);
    }
}
