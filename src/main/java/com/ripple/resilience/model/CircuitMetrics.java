package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CircuitMetrics {
    String name;
    CircuitState state;
    int failureCount;
    double currentFailureRate;
    long totalRequests;
    long successfulRequests;
    long failedRequests;
    long timeoutRequests;
    long rejectedRequests;
    double averageResponseTimeMillis;
    Instant lastFailureTime;
    Instant lastSuccessTime;
    long stateChangeCount;
}
