package com.ripple.resilience.service;

import com.ripple.resilience.exception.OperationTimeoutException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs operations against a deadline using a Resilience4j {@link TimeLimiter}.
 *
 * <p>Guarded calls run on the supplied worker pool. When the deadline passes the running
 * future is cancelled with interruption, so the abandoned work is told to stop instead of
 * continuing unobserved in the background. The same happens when the waiting thread is
 * interrupted, for example by an enclosing guard whose own deadline passed first.
 */
@Slf4j
@RequiredArgsConstructor
public class TimeoutGuard {

    private final ExecutorService workerPool;
    private final Map<Duration, TimeLimiter> limiters = new ConcurrentHashMap<>();

    /**
     * Calls {@code operation}, failing with {@link OperationTimeoutException} once
     * {@code timeout} elapses. A zero or negative timeout runs the operation inline.
     *
     * @param label used in the timeout message
     */
    public <T> T call(Callable<T> operation, Duration timeout, String label) throws Exception {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return operation.call();
        }
        TimeLimiter limiter = limiters.computeIfAbsent(timeout, this::createLimiter);
        Future<T> future = workerPool.submit(operation);
        try {
            return limiter.executeFutureSupplier(() -> future);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.debug("Guarded wait interrupted, cancelling operation: label={}", label);
            throw e;
        } catch (TimeoutException e) {
            log.debug("Operation timed out: label={}, timeoutMs={}", label, timeout.toMillis());
            throw new OperationTimeoutException(
                String.format("Operation timeout: %s exceeded %d ms", label, timeout.toMillis()), timeout, e);
        }
    }

    public void shutdown() {
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private TimeLimiter createLimiter(Duration timeout) {
        return TimeLimiter.of("timeout-" + timeout.toMillis() + "ms", TimeLimiterConfig.custom()
            .timeoutDuration(timeout)
            .cancelRunningFuture(true)
            .build());
    }
}
