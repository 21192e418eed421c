package com.ripple.resilience.model;

public enum OperationStatus {
    SUCCESS,
    FAILED
}
