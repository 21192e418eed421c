package com.ripple.resilience.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
