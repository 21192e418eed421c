package com.ripple.resilience.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RepairOutcome {
    boolean success;
    String error;
    Object repairedData;

    public static RepairOutcome repaired(Object repairedData) {
        return new RepairOutcome(true, null, repairedData);
    }

    public static RepairOutcome failed(String error) {
        return new RepairOutcome(false, error, null);
    }
}
