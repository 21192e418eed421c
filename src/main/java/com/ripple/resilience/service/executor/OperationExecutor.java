package com.ripple.resilience.service.executor;

import java.util.concurrent.Callable;

/**
 * One stage of an execution chain. Decorating stages add a failure-handling concern around
 * the stage they wrap; {@link DirectExecutor} ends the chain by calling the operation.
 */
public interface OperationExecutor {

    <T> T execute(ExecutionContext context, Callable<T> operation) throws Exception;
}
