package com.ripple.resilience.service.executor;

import com.ripple.resilience.service.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.Callable;

/**
 * Runs the wrapped stage inside the circuit named by the context, so a failure of the whole
 * stage counts once against the circuit.
 */
@RequiredArgsConstructor
public class CircuitBreakingExecutor implements OperationExecutor {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final OperationExecutor delegate;

    @Override
    public <T> T execute(ExecutionContext context, Callable<T> operation) throws Exception {
        return circuitBreakerRegistry.getCircuitBreaker(context.getCircuitName())
            .execute(() -> delegate.execute(context, operation), context.getAttributes());
    }
}
