package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class ConsistencyCheck {
    String ruleName;
    boolean passed;
    String message;
    ConsistencySeverity severity;
    Instant timestamp;
    /**
     * Checked data, kept only when check logging is enabled.
     */
    Object data;
    boolean repairAttempted;
    boolean repairSuccessful;
    Object repairedData;
}
