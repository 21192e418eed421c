package com.ripple.resilience.model;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    CRITICAL
}
