package com.ripple.resilience.service;

import com.ripple.resilience.model.ConsistencyRule;
import com.ripple.resilience.model.OperationOptions;
import com.ripple.resilience.model.ResilienceOperation;
import com.ripple.resilience.model.RetrySettings;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Ready-made operation descriptors for the common kinds of calls. Submit them with
 * {@link ResilienceManager#execute(ResilienceOperation)}.
 */
public final class ResilienceOperations {

    private ResilienceOperations() {
    }

    /**
     * Remote API call: circuit breaker named {@code <service>_api} around three retries.
     */
    public static <T> ResilienceOperation<T> apiCall(String serviceName, String operationName,
                                                     Callable<T> call, Map<String, Object> context) {
        return ResilienceOperation.<T>builder()
            .name(operationName)
            .service(serviceName)
            .operation(call)
            .context(context)
            .options(OperationOptions.builder()
                .useCircuitBreaker(true)
                .useRetry(true)
                .circuitBreakerName(serviceName + "_api")
                .retryConfig(RetrySettings.builder()
                    .maxAttempts(3)
                    .baseDelay(Duration.ofSeconds(1))
                    .maxDelay(Duration.ofSeconds(10))
                    .build())
                .build())
            .build();
    }

    /**
     * Database call: circuit breaker and retry, with the {@code data} context entry and the
     * result validated against {@code rules}.
     */
    public static <T> ResilienceOperation<T> databaseOperation(String serviceName, String operationName,
                                                               Callable<T> call, List<ConsistencyRule> rules,
                                                               Map<String, Object> context) {
        return ResilienceOperation.<T>builder()
            .name(operationName)
            .service(serviceName)
            .operation(call)
            .context(context)
            .options(OperationOptions.builder()
                .useCircuitBreaker(true)
                .useRetry(true)
                .validateData(true)
                .consistencyRules(rules == null ? List.of() : List.copyOf(rules))
                .build())
            .build();
    }

    public static <T> ResilienceOperation<T> fileOperation(String serviceName, String operationName,
                                                           Callable<T> call, Map<String, Object> context) {
        return ResilienceOperation.<T>builder()
            .name(operationName)
            .service(serviceName)
            .operation(call)
            .context(context)
            .options(OperationOptions.builder()
                .useRetry(true)
                .retryConfig(RetrySettings.builder()
                    .maxAttempts(2)
                    .baseDelay(Duration.ofMillis(500))
                    .maxDelay(Duration.ofSeconds(2))
                    .build())
                .build())
            .build();
    }
}
