package com.ripple.resilience.service.executor;

import com.ripple.resilience.model.OperationOptions;
import com.ripple.resilience.model.ResilienceOperation;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Per-call facts shared by every stage of an execution chain.
 */
@Value
@Builder
public class ExecutionContext {
    String operationId;
    String operationName;
    String service;
    String circuitName;
    Map<String, Object> attributes;
    OperationOptions options;

    public static ExecutionContext of(String operationId, ResilienceOperation<?> operation) {
        return ExecutionContext.builder()
            .operationId(operationId)
            .operationName(operation.getName())
            .service(operation.getService())
            .circuitName(operation.resolveCircuitName())
            .attributes(operation.getContext() == null ? Map.of() : operation.getContext())
            .options(operation.getOptions())
            .build();
    }

    /**
     * Stable key for per-operation statistics.
     */
    public String qualifiedName() {
        return service + "_" + operationName;
    }
}
