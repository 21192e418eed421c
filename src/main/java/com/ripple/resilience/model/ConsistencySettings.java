package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@Builder(toBuilder = true)
public class ConsistencySettings {

    @Builder.Default
    private boolean enableAutoRepair = true;

    /**
     * Successful automatic repairs allowed per rule for the lifetime of the checker.
     */
    @Builder.Default
    private int maxRepairAttempts = 3;

    @Builder.Default
    private boolean backupBeforeRepair = true;

    @Builder.Default
    private boolean logAllChecks = false;

    @Builder.Default
    private int historyLimit = 1000;

    public static ConsistencySettings defaults() {
        return ConsistencySettings.builder().build();
    }
}
