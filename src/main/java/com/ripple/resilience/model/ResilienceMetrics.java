package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class ResilienceMetrics {
    Map<String, CircuitMetrics> circuitBreakers;
    Map<String, RetryStats> retryStats;
    Map<String, ServiceHealth> serviceHealth;
    Map<String, ConsistencyTally> consistencyTallies;
    ServiceLevel serviceLevel;
    HealthStatus overallHealth;
    Instant timestamp;
}
