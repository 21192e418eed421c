package com.ripple.resilience.service;

import com.ripple.resilience.exception.ResilienceException;
import com.ripple.resilience.exception.RetriesExhaustedException;
import com.ripple.resilience.model.RetryResult;
import com.ripple.resilience.model.RetrySettings;
import com.ripple.resilience.model.RetryStats;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes a callable with bounded attempts, exponential backoff and jitter on top of a
 * Resilience4j {@link Retry}.
 *
 * <p>Attempts for one call are strictly sequential. Each attempt is raced against the
 * configured per-attempt timeout; a timeout counts as a retryable failure. Errors are
 * classified in this order, first match wins:
 * <ol>
 *   <li>identity matches an entry of {@code nonRetryableErrors}: stop</li>
 *   <li>identity matches an entry of {@code retryableErrors}: retry</li>
 *   <li>the error is a {@link ResilienceException}: honour its retryable flag</li>
 *   <li>otherwise retry only if the message mentions network, timeout or connection</li>
 * </ol>
 *
 * <p>The wait before attempt {@code k + 1} is {@code min(baseDelay * multiplier^(k-1), maxDelay)}
 * randomized by {@code +/- jitterFactor / 2} of itself. Base and maximum delays below one
 * millisecond are raised to one millisecond and multipliers below one are raised to one.
 *
 * <p>Statistics are kept per caller-supplied operation name.
 */
@Slf4j
public class RetryManager {

    private static final double MAX_RANDOMIZATION_FACTOR = 0.999;

    private final RetrySettings defaultSettings;
    private final TimeoutGuard timeoutGuard;
    private final Clock clock;
    private final Map<String, StatsAccumulator> stats = new ConcurrentHashMap<>();

    public RetryManager(RetrySettings defaultSettings, TimeoutGuard timeoutGuard, Clock clock) {
        this.defaultSettings = defaultSettings;
        this.timeoutGuard = timeoutGuard;
        this.clock = clock;
    }

    public <T> RetryResult<T> execute(String operationName, Callable<T> operation, Map<String, Object> context) {
        return execute(operationName, operation, context, defaultSettings);
    }

    public <T> RetryResult<T> execute(String operationName, Callable<T> operation,
                                      Map<String, Object> context, RetrySettings settings) {
        RetrySettings effective = settings != null ? settings : defaultSettings;
        int maxAttempts = Math.max(1, effective.getMaxAttempts());
        Retry retry = Retry.of(operationName, retryConfig(effective, maxAttempts));
        retry.getEventPublisher().onRetry(event -> log.warn(
            "Retry attempt failed: operation={}, attempt={}, maxAttempts={}, nextDelayMs={}, context={}, error={}",
            operationName, event.getNumberOfRetryAttempts(), maxAttempts, event.getWaitInterval().toMillis(),
            context, event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()));

        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<Duration> lastAttemptDuration = new AtomicReference<>(Duration.ZERO);
        Callable<T> attempt = () -> {
            int number = attempts.incrementAndGet();
            Instant attemptStart = clock.instant();
            try {
                return timeoutGuard.call(operation, effective.getTimeout(), operationName + " attempt " + number);
            } finally {
                lastAttemptDuration.set(Duration.between(attemptStart, clock.instant()));
            }
        };

        Instant start = clock.instant();
        try {
            T result = retry.executeCallable(attempt);
            Duration total = Duration.between(start, clock.instant());
            record(operationName, true, attempts.get(), total);

            if (attempts.get() > 1) {
                log.info("Operation succeeded after retry: operation={}, attempts={}, totalDurationMs={}",
                    operationName, attempts.get(), total.toMillis());
            }
            return RetryResult.<T>builder()
                .success(true)
                .data(result)
                .attempts(attempts.get())
                .totalDuration(total)
                .lastAttemptDuration(lastAttemptDuration.get())
                .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(operationName, e, e, attempts.get(), start, lastAttemptDuration.get());
        } catch (Exception e) {
            if (attempts.get() >= maxAttempts && isRetryable(e, effective)) {
                RetriesExhaustedException exhausted = new RetriesExhaustedException(operationName, maxAttempts, e);
                return failure(operationName, exhausted, e, maxAttempts, start, lastAttemptDuration.get());
            }
            return failure(operationName, e, e, attempts.get(), start, lastAttemptDuration.get());
        }
    }

    /**
     * Samples the randomized wait that follows failed attempt {@code attempt}.
     */
    public Duration computeDelay(int attempt, RetrySettings settings) {
        return Duration.ofMillis(intervalFunction(settings).apply(attempt));
    }

    public boolean isRetryable(Exception error, RetrySettings settings) {
        String identity = identityOf(error);
        if (settings.getNonRetryableErrors().stream().anyMatch(identity::contains)) {
            return false;
        }
        if (settings.getRetryableErrors().stream().anyMatch(identity::contains)) {
            return true;
        }
        if (error instanceof ResilienceException) {
            return ((ResilienceException) error).isRetryable();
        }
        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("network") || message.contains("timeout") || message.contains("connection");
    }

    public Map<String, RetryStats> getAllStats() {
        Map<String, RetryStats> snapshot = new TreeMap<>();
        stats.forEach((name, accumulator) -> snapshot.put(name, accumulator.snapshot(name)));
        return snapshot;
    }

    public void resetStats() {
        stats.clear();
    }

    public RetrySettings getDefaultSettings() {
        return defaultSettings;
    }

    private RetryConfig retryConfig(RetrySettings settings, int maxAttempts) {
        return RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(intervalFunction(settings))
            .retryOnException(error -> error instanceof Exception
                && !(error instanceof InterruptedException)
                && isRetryable((Exception) error, settings))
            .build();
    }

    private static IntervalFunction intervalFunction(RetrySettings settings) {
        long baseDelay = Math.max(1L, settings.getBaseDelay().toMillis());
        long maxDelay = Math.max(1L, settings.getMaxDelay().toMillis());
        double multiplier = Math.max(1.0, settings.getBackoffMultiplier());
        double randomization = Math.min(MAX_RANDOMIZATION_FACTOR, Math.max(0.0, settings.getJitterFactor() / 2));
        return IntervalFunction.ofExponentialRandomBackoff(baseDelay, multiplier, randomization, maxDelay);
    }

    private <T> RetryResult<T> failure(String operationName, Exception reported, Exception lastError,
                                       int attempts, Instant start, Duration lastAttemptDuration) {
        Duration total = Duration.between(start, clock.instant());
        record(operationName, false, attempts, total);
        log.warn("Operation failed: operation={}, attempts={}, totalDurationMs={}, error={}",
            operationName, attempts, total.toMillis(), lastError.getMessage());
        return RetryResult.<T>builder()
            .success(false)
            .error(reported)
            .lastError(lastError)
            .attempts(attempts)
            .totalDuration(total)
            .lastAttemptDuration(lastAttemptDuration)
            .build();
    }

    private void record(String operationName, boolean success, int attempts, Duration duration) {
        stats.computeIfAbsent(operationName, key -> new StatsAccumulator())
            .record(success, attempts, duration, clock.instant());
    }

    private static String identityOf(Exception error) {
        StringBuilder identity = new StringBuilder(error.getClass().getSimpleName());
        if (error.getMessage() != null) {
            identity.append(' ').append(error.getMessage());
        }
        if (error instanceof ResilienceException && ((ResilienceException) error).getErrorType() != null) {
            identity.append(' ').append(((ResilienceException) error).getErrorType().name());
        }
        return identity.toString();
    }

    private static final class StatsAccumulator {
        private long totalCalls;
        private long successfulCalls;
        private long failedCalls;
        private long totalAttempts;
        private long totalDurationMillis;
        private Instant lastAttemptTime;

        synchronized void record(boolean success, int attempts, Duration duration, Instant now) {
            totalCalls++;
            if (success) {
                successfulCalls++;
            } else {
                failedCalls++;
            }
            totalAttempts += attempts;
            totalDurationMillis += duration.toMillis();
            lastAttemptTime = now;
        }

        synchronized RetryStats snapshot(String operationName) {
            return RetryStats.builder()
                .operationName(operationName)
                .totalCalls(totalCalls)
                .successfulCalls(successfulCalls)
                .failedCalls(failedCalls)
                .totalAttempts(totalAttempts)
                .averageAttempts(totalCalls == 0 ? 0.0 : (double) totalAttempts / totalCalls)
                .averageDurationMillis(totalCalls == 0 ? 0.0 : (double) totalDurationMillis / totalCalls)
                .lastAttemptTime(lastAttemptTime)
                .build();
        }
    }
}
