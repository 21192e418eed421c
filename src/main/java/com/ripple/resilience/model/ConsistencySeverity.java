package com.ripple.resilience.model;

public enum ConsistencySeverity {
    CRITICAL,
    WARNING,
    INFO
}
