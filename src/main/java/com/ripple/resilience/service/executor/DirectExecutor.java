package com.ripple.resilience.service.executor;

import java.util.concurrent.Callable;

public class DirectExecutor implements OperationExecutor {

    @Override
    public <T> T execute(ExecutionContext context, Callable<T> operation) throws Exception {
        return operation.call();
    }
}
