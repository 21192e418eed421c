package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Aggregated retry statistics for one operation name.
 */
@Value
@Builder
public class RetryStats {
    String operationName;
    long totalCalls;
    long successfulCalls;
    long failedCalls;
    long totalAttempts;
    double averageAttempts;
    double averageDurationMillis;
    Instant lastAttemptTime;
}
