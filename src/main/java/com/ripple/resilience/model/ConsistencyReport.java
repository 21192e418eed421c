package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ConsistencyReport {
    HealthStatus overallStatus;
    int totalChecks;
    int passedChecks;
    int failedChecks;
    int criticalFailures;
    int warnings;
    List<ConsistencyCheck> checks;
    Instant timestamp;
    Duration duration;

    /**
     * Report for a run with nothing to check.
     */
    public static ConsistencyReport empty(Instant timestamp) {
        return ConsistencyReport.builder()
            .overallStatus(HealthStatus.HEALTHY)
            .checks(List.of())
            .timestamp(timestamp)
            .duration(Duration.ZERO)
            .build();
    }

    public boolean isCritical() {
        return overallStatus == HealthStatus.CRITICAL;
    }
}
