package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * History entry written for every operation, whatever its outcome.
 */
@Value
@Builder
public class OperationRecord {
    String operationId;
    String name;
    String service;
    OperationStatus status;
    Duration duration;
    Instant timestamp;
    String error;
}
