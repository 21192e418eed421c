package com.ripple.resilience.service;

import com.ripple.resilience.exception.CircuitOpenException;
import com.ripple.resilience.exception.OperationTimeoutException;
import com.ripple.resilience.model.CircuitBreakerSettings;
import com.ripple.resilience.model.CircuitMetrics;
import com.ripple.resilience.model.CircuitState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Failure-threshold state machine guarding one named dependency.
 *
 * <p>Transitions:
 * <ul>
 *   <li><b>CLOSED</b>: calls pass through; once the failures recorded inside the monitoring
 *   window reach the threshold the circuit opens</li>
 *   <li><b>OPEN</b>: calls are rejected with {@link CircuitOpenException} without running the
 *   operation until the recovery timeout has elapsed</li>
 *   <li><b>HALF_OPEN</b>: exactly one trial call runs; success closes the circuit, failure
 *   opens it again and restarts the recovery timeout</li>
 * </ul>
 *
 * <p>Thread-Safety: state and counters are guarded by the instance monitor. The protected
 * operation itself runs outside the lock.
 */
@Slf4j
public class CircuitBreaker {

    private static final int RESPONSE_TIME_SAMPLES = 100;

    private final String name;
    private final CircuitBreakerSettings settings;
    private final TimeoutGuard timeoutGuard;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private Instant openedAt;
    private boolean trialInFlight;

    private final Deque<Outcome> window = new ArrayDeque<>();
    private final Deque<Long> responseTimes = new ArrayDeque<>();
    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private long timeoutRequests;
    private long rejectedRequests;
    private long stateChangeCount;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;

    public CircuitBreaker(String name, CircuitBreakerSettings settings, TimeoutGuard timeoutGuard, Clock clock) {
        this.name = name;
        this.settings = settings;
        this.timeoutGuard = timeoutGuard;
        this.clock = clock;
    }

    /**
     * Runs {@code operation} under circuit protection.
     *
     * @param context caller diagnostics, logged on rejection
     * @throws CircuitOpenException if the circuit rejects the call
     */
    public <T> T execute(Callable<T> operation, Map<String, Object> context) throws Exception {
        acquirePermission(context);

        Instant start = clock.instant();
        try {
            T result = timeoutGuard.call(operation, settings.getTimeoutThreshold(), "circuit " + name);
            onSuccess(Duration.between(start, clock.instant()));
            return result;
        } catch (Exception | Error e) {
            onFailure(e);
            throw e;
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    public synchronized CircuitMetrics getMetrics() {
        Instant now = clock.instant();
        pruneWindow(now);
        double averageResponseTime = responseTimes.stream()
            .mapToLong(Long::longValue)
            .average()
            .orElse(0.0);

        return CircuitMetrics.builder()
            .name(name)
            .state(state)
            .failureCount(countFailures())
            .currentFailureRate(failureRate())
            .totalRequests(totalRequests)
            .successfulRequests(successfulRequests)
            .failedRequests(failedRequests)
            .timeoutRequests(timeoutRequests)
            .rejectedRequests(rejectedRequests)
            .averageResponseTimeMillis(averageResponseTime)
            .lastFailureTime(lastFailureTime)
            .lastSuccessTime(lastSuccessTime)
            .stateChangeCount(stateChangeCount)
            .build();
    }

    /**
     * Forces the circuit closed and clears the failure window.
     */
    public synchronized void reset() {
        state = CircuitState.CLOSED;
        openedAt = null;
        trialInFlight = false;
        window.clear();
        log.info("Circuit breaker manually reset: circuitName={}", name);
    }

    private synchronized void acquirePermission(Map<String, Object> context) {
        if (state == CircuitState.OPEN) {
            if (Duration.between(openedAt, clock.instant()).compareTo(settings.getRecoveryTimeout()) >= 0) {
                transitionTo(CircuitState.HALF_OPEN);
            } else {
                reject(context);
            }
        }
        if (state == CircuitState.HALF_OPEN) {
            if (trialInFlight) {
                reject(context);
            }
            trialInFlight = true;
        }
        totalRequests++;
    }

    private void reject(Map<String, Object> context) {
        rejectedRequests++;
        log.debug("Circuit breaker rejected call: circuitName={}, state={}, context={}", name, state, context);
        throw new CircuitOpenException(name, settings.getRecoveryTimeout());
    }

    private synchronized void onSuccess(Duration responseTime) {
        Instant now = clock.instant();
        successfulRequests++;
        lastSuccessTime = now;
        responseTimes.addLast(responseTime.toMillis());
        if (responseTimes.size() > RESPONSE_TIME_SAMPLES) {
            responseTimes.removeFirst();
        }

        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            window.clear();
            transitionTo(CircuitState.CLOSED);
            return;
        }
        window.addLast(new Outcome(now, false));
        pruneWindow(now);

        log.debug("Circuit breaker success recorded: circuitName={}, responseTimeMs={}",
            name, responseTime.toMillis());
    }

    private synchronized void onFailure(Throwable error) {
        Instant now = clock.instant();
        failedRequests++;
        lastFailureTime = now;
        if (error instanceof OperationTimeoutException) {
            timeoutRequests++;
        }

        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            log.warn("Circuit breaker trial call failed: circuitName={}, error={}", name, error.getMessage());
            transitionTo(CircuitState.OPEN);
            return;
        }
        window.addLast(new Outcome(now, true));
        pruneWindow(now);

        int failureCount = countFailures();
        log.warn("Circuit breaker failure recorded: circuitName={}, failureCount={}, state={}, error={}",
            name, failureCount, state, error.getMessage());

        if (state == CircuitState.CLOSED && failureCount >= settings.getFailureThreshold()) {
            transitionTo(CircuitState.OPEN);
        }
    }

    private void transitionTo(CircuitState target) {
        CircuitState previous = state;
        state = target;
        stateChangeCount++;
        if (target == CircuitState.OPEN) {
            openedAt = clock.instant();
            log.warn("Circuit breaker opened: circuitName={}, previousState={}, failureCount={}, failureRate={}",
                name, previous, countFailures(), failureRate());
        } else {
            log.info("Circuit breaker state changed: circuitName={}, previousState={}, newState={}",
                name, previous, target);
        }
    }

    private void pruneWindow(Instant now) {
        Instant cutoff = now.minus(settings.getMonitoringWindow());
        while (!window.isEmpty() && window.peekFirst().at.isBefore(cutoff)) {
            window.removeFirst();
        }
    }

    private int countFailures() {
        return (int) window.stream().filter(outcome -> outcome.failure).count();
    }

    private double failureRate() {
        return window.isEmpty() ? 0.0 : (double) countFailures() / window.size();
    }

    private static final class Outcome {
        private final Instant at;
        private final boolean failure;

        private Outcome(Instant at, boolean failure) {
            this.at = at;
            this.failure = failure;
        }
    }
}
