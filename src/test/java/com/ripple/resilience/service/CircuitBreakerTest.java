package com.ripple.resilience.service;

import com.ripple.resilience.exception.CircuitOpenException;
import com.ripple.resilience.exception.ErrorType;
import com.ripple.resilience.exception.OperationTimeoutException;
import com.ripple.resilience.model.CircuitBreakerSettings;
import com.ripple.resilience.model.CircuitMetrics;
import com.ripple.resilience.model.CircuitState;
import com.ripple.resilience.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private MutableClock clock;
    private TimeoutGuard timeoutGuard;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        timeoutGuard = new TimeoutGuard(Executors.newCachedThreadPool());
        circuitBreaker = new CircuitBreaker("ledger", CircuitBreakerSettings.builder()
            .failureThreshold(2)
            .recoveryTimeout(Duration.ofSeconds(30))
            .timeoutThreshold(Duration.ZERO)
            .build(), timeoutGuard, clock);
    }

    @AfterEach
    void tearDown() {
        timeoutGuard.shutdown();
    }

    @Test
    void testExecute_Success() throws Exception {
        // When
        String result = circuitBreaker.execute(() -> "ok", Map.of());

        // Then
        assertEquals("ok", result);
        assertEquals(CircuitState.CLOSED, circuitBreaker.getState());
        assertEquals(1, circuitBreaker.getMetrics().getSuccessfulRequests());
    }

    @Test
    void testExecute_OpensAfterThresholdAndRejectsWithoutInvoking() {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        Callable<String> failing = () -> {
            invocations.incrementAndGet();
            throw new IOException("connection refused");
        };
        assertThrows(IOException.class, () -> circuitBreaker.execute(failing, Map.of()));
        assertThrows(IOException.class, () -> circuitBreaker.execute(failing, Map.of()));

        // When
        CircuitOpenException exception = assertThrows(CircuitOpenException.class,
            () -> circuitBreaker.execute(failing, Map.of()));

        // Then
        assertEquals(2, invocations.get());
        assertEquals(CircuitState.OPEN, circuitBreaker.getState());
        assertEquals(ErrorType.CIRCUIT_BREAKER_OPEN, exception.getErrorType());
        assertTrue(exception.isRetryable());
        assertTrue(exception.getMessage().contains("ledger"));
        assertEquals(1, circuitBreaker.getMetrics().getRejectedRequests());
    }

    @Test
    void testExecute_HalfOpenTrialSuccessCloses() throws Exception {
        // Given
        tripCircuit();
        clock.advance(Duration.ofSeconds(30));

        // When
        String result = circuitBreaker.execute(() -> "recovered", Map.of());

        // Then
        assertEquals("recovered", result);
        assertEquals(CircuitState.CLOSED, circuitBreaker.getState());
        assertEquals(0, circuitBreaker.getMetrics().getFailureCount());
    }

    @Test
    void testExecute_HalfOpenAllowsSingleTrial() throws Exception {
        // Given
        tripCircuit();
        clock.advance(Duration.ofSeconds(30));
        CountDownLatch trialStarted = new CountDownLatch(1);
        CountDownLatch releaseTrial = new CountDownLatch(1);
        AtomicInteger concurrentInvocations = new AtomicInteger();
        ExecutorService caller = Executors.newSingleThreadExecutor();

        try {
            Future<String> trial = caller.submit(() -> circuitBreaker.execute(() -> {
                trialStarted.countDown();
                releaseTrial.await(5, TimeUnit.SECONDS);
                return "trial";
            }, Map.of()));
            assertTrue(trialStarted.await(5, TimeUnit.SECONDS));

            // When
            assertThrows(CircuitOpenException.class, () -> circuitBreaker.execute(() -> {
                concurrentInvocations.incrementAndGet();
                return "second";
            }, Map.of()));
            releaseTrial.countDown();

            // Then
            assertEquals("trial", trial.get(5, TimeUnit.SECONDS));
            assertEquals(0, concurrentInvocations.get());
            assertEquals(CircuitState.CLOSED, circuitBreaker.getState());
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    void testExecute_HalfOpenTrialFailureReopens() {
        // Given
        tripCircuit();
        clock.advance(Duration.ofSeconds(31));

        // When
        assertThrows(IOException.class, () -> circuitBreaker.execute(() -> {
            throw new IOException("still down");
        }, Map.of()));

        // Then
        assertEquals(CircuitState.OPEN, circuitBreaker.getState());
        clock.advance(Duration.ofSeconds(29));
        assertThrows(CircuitOpenException.class, () -> circuitBreaker.execute(() -> "x", Map.of()));
    }

    @Test
    void testExecute_StaysOpenBeforeRecoveryTimeout() {
        // Given
        tripCircuit();
        clock.advance(Duration.ofSeconds(29));

        // When / Then
        assertThrows(CircuitOpenException.class, () -> circuitBreaker.execute(() -> "x", Map.of()));
        assertEquals(CircuitState.OPEN, circuitBreaker.getState());
    }

    @Test
    void testExecute_FailuresOutsideWindowDoNotOpen() {
        // Given
        CircuitBreaker windowed = new CircuitBreaker("windowed", CircuitBreakerSettings.builder()
            .failureThreshold(2)
            .timeoutThreshold(Duration.ZERO)
            .monitoringWindow(Duration.ofSeconds(60))
            .build(), timeoutGuard, clock);
        assertThrows(IOException.class, () -> windowed.execute(() -> {
            throw new IOException("first");
        }, Map.of()));
        clock.advance(Duration.ofSeconds(61));

        // When
        assertThrows(IOException.class, () -> windowed.execute(() -> {
            throw new IOException("second");
        }, Map.of()));

        // Then
        assertEquals(CircuitState.CLOSED, windowed.getState());
        assertEquals(1, windowed.getMetrics().getFailureCount());
    }

    @Test
    void testExecute_SlowCallCountsAsTimeoutFailure() {
        // Given
        CircuitBreaker guarded = new CircuitBreaker("slow", CircuitBreakerSettings.builder()
            .failureThreshold(1)
            .timeoutThreshold(Duration.ofMillis(50))
            .build(), timeoutGuard, clock);
        CountDownLatch never = new CountDownLatch(1);

        // When
        OperationTimeoutException exception = assertThrows(OperationTimeoutException.class,
            () -> guarded.execute(() -> never.await(5, TimeUnit.SECONDS), Map.of()));

        // Then
        assertEquals(ErrorType.TIMEOUT_ERROR, exception.getErrorType());
        CircuitMetrics metrics = guarded.getMetrics();
        assertEquals(1, metrics.getTimeoutRequests());
        assertEquals(CircuitState.OPEN, metrics.getState());
    }

    @Test
    void testGetMetrics_FailureRate() throws Exception {
        // Given
        circuitBreaker.execute(() -> "ok", Map.of());
        assertThrows(IOException.class, () -> circuitBreaker.execute(() -> {
            throw new IOException("boom");
        }, Map.of()));

        // When
        CircuitMetrics metrics = circuitBreaker.getMetrics();

        // Then
        assertEquals(0.5, metrics.getCurrentFailureRate(), 0.0001);
        assertEquals(2, metrics.getTotalRequests());
        assertEquals(1, metrics.getFailedRequests());
        assertNotNull(metrics.getLastFailureTime());
    }

    @Test
    void testReset_ClosesOpenCircuit() throws Exception {
        // Given
        tripCircuit();

        // When
        circuitBreaker.reset();

        // Then
        assertEquals(CircuitState.CLOSED, circuitBreaker.getState());
        assertEquals("ok", circuitBreaker.execute(() -> "ok", Map.of()));
    }

    private void tripCircuit() {
        for (int i = 0; i < 2; i++) {
            assertThrows(IOException.class, () -> circuitBreaker.execute(() -> {
                throw new IOException("connection refused");
            }, Map.of()));
        }
        assertEquals(CircuitState.OPEN, circuitBreaker.getState());
    }
}
