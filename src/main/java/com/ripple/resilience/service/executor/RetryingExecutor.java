package com.ripple.resilience.service.executor;

import com.ripple.resilience.model.RetryResult;
import com.ripple.resilience.service.RetryManager;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.Callable;

/**
 * Retries the wrapped stage and unwraps the {@link RetryResult}, rethrowing its error on
 * failure. The operation's own retry settings take precedence over the manager defaults.
 */
@RequiredArgsConstructor
public class RetryingExecutor implements OperationExecutor {

    private final RetryManager retryManager;
    private final OperationExecutor delegate;

    @Override
    public <T> T execute(ExecutionContext context, Callable<T> operation) throws Exception {
        RetryResult<T> result = retryManager.execute(
            context.qualifiedName(),
            () -> delegate.execute(context, operation),
            context.getAttributes(),
            context.getOptions().getRetryConfig());
        return result.getOrThrow();
    }
}
