package com.ripple.resilience.service.executor;

import com.ripple.resilience.service.GracefulDegradation;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.Callable;

@RequiredArgsConstructor
public class DegradingExecutor implements OperationExecutor {

    private final GracefulDegradation gracefulDegradation;
    private final OperationExecutor delegate;

    @Override
    public <T> T execute(ExecutionContext context, Callable<T> operation) throws Exception {
        return gracefulDegradation.execute(
            context.getService(),
            () -> delegate.execute(context, operation),
            context.getAttributes(),
            context.getOptions().isUseFallbacks());
    }
}
