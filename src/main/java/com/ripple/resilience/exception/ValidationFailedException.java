package com.ripple.resilience.exception;

import com.ripple.resilience.model.ConsistencyReport;
import lombok.Getter;

/**
 * Critical consistency failure before or after an operation. Never retried.
 */
@Getter
public class ValidationFailedException extends ResilienceException {

    private final transient ConsistencyReport report;

    public ValidationFailedException(String message, ConsistencyReport report) {
        super(message, ErrorType.VALIDATION_ERROR, false);
        this.report = report;
    }
}
