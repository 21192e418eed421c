package com.ripple.resilience.service;

import com.ripple.resilience.exception.ErrorType;
import com.ripple.resilience.exception.OperationTimeoutException;
import com.ripple.resilience.exception.ResilienceException;
import com.ripple.resilience.exception.RetriesExhaustedException;
import com.ripple.resilience.model.RetryResult;
import com.ripple.resilience.model.RetrySettings;
import com.ripple.resilience.model.RetryStats;
import com.ripple.resilience.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryManagerTest {

    private MutableClock clock;
    private TimeoutGuard timeoutGuard;
    private RetryManager retryManager;
    private RetrySettings settings;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        timeoutGuard = new TimeoutGuard(Executors.newCachedThreadPool());
        retryManager = new RetryManager(RetrySettings.defaults(), timeoutGuard, clock);
        settings = RetrySettings.builder()
            .maxAttempts(3)
            .baseDelay(Duration.ofMillis(10))
            .backoffMultiplier(2)
            .timeout(Duration.ZERO)
            .build();
    }

    @AfterEach
    void tearDown() {
        timeoutGuard.shutdown();
    }

    @Test
    void testExecute_SucceedsOnThirdAttempt() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        RetryResult<String> result = retryManager.execute("fetchRates", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("network unreachable");
            }
            return "rates";
        }, Map.of(), settings);

        // Then
        assertTrue(result.isSuccess());
        assertEquals("rates", result.getData());
        assertEquals(3, result.getAttempts());
        assertEquals(3, calls.get());
    }

    @Test
    void testExecute_ExhaustedWrapsLastError() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        RetryResult<String> result = retryManager.execute("submit", () -> {
            calls.incrementAndGet();
            throw new IOException("connection reset");
        }, Map.of(), settings);

        // Then
        assertFalse(result.isSuccess());
        assertEquals(3, calls.get());
        assertEquals(3, result.getAttempts());
        assertTrue(result.getError() instanceof RetriesExhaustedException);
        assertTrue(result.getLastError() instanceof IOException);
        assertSame(result.getLastError(), result.getError().getCause());
        assertTrue(result.getError().getMessage().contains("failed after 3 attempts"));
        assertThrows(RetriesExhaustedException.class, result::getOrThrow);
    }

    @Test
    void testExecute_NonRetryableStopsImmediately() {
        // Given
        ResilienceException invalid = new ResilienceException("amount must be positive", ErrorType.INVALID_INPUT, false);

        // When
        RetryResult<String> result = retryManager.execute("validate", () -> {
            throw invalid;
        }, Map.of(), settings);

        // Then
        assertFalse(result.isSuccess());
        assertEquals(1, result.getAttempts());
        assertSame(invalid, result.getError());
        assertSame(invalid, result.getLastError());
    }

    @Test
    void testExecute_AttemptTimeoutIsRetried() {
        // Given
        CountDownLatch never = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        RetrySettings timed = settings.toBuilder().timeout(Duration.ofMillis(50)).build();

        // When
        RetryResult<Boolean> result = retryManager.execute("slow", () -> {
            if (calls.incrementAndGet() == 1) {
                return never.await(5, TimeUnit.SECONDS);
            }
            return Boolean.TRUE;
        }, Map.of(), timed);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(2, result.getAttempts());
    }

    @Test
    void testExecute_UsesDefaultSettingsWhenNull() {
        // Given
        RetryManager withDefaults = new RetryManager(settings, timeoutGuard, clock);

        // When
        RetryResult<String> result = withDefaults.execute("op", () -> {
            throw new IOException("timeout talking to peer");
        }, Map.of(), null);

        // Then
        assertEquals(3, result.getAttempts());
    }

    @Test
    void testComputeDelay_JitterBounds() {
        // Given
        RetrySettings jittered = RetrySettings.builder()
            .baseDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(30))
            .jitterFactor(0.1)
            .build();

        // When / Then
        for (int i = 0; i < 200; i++) {
            long first = retryManager.computeDelay(1, jittered).toMillis();
            long third = retryManager.computeDelay(3, jittered).toMillis();
            long capped = retryManager.computeDelay(10, jittered).toMillis();
            assertTrue(first >= 950 && first <= 1050, "first delay out of range: " + first);
            assertTrue(third >= 3800 && third <= 4200, "third delay out of range: " + third);
            assertTrue(capped >= 28500 && capped <= 31500, "capped delay out of range: " + capped);
        }
    }

    @Test
    void testComputeDelay_NeverNegative() {
        // Given
        RetrySettings wild = RetrySettings.builder()
            .baseDelay(Duration.ofMillis(10))
            .jitterFactor(5.0)
            .build();

        // When / Then
        for (int i = 0; i < 200; i++) {
            long delay = retryManager.computeDelay(1, wild).toMillis();
            assertTrue(delay >= 0 && delay <= 20, "delay out of range: " + delay);
        }
    }

    @Test
    void testComputeDelay_ZeroBaseDelayRaisedToOneMillisecond() {
        // Given
        RetrySettings immediate = RetrySettings.builder()
            .baseDelay(Duration.ZERO)
            .jitterFactor(0)
            .build();

        // When / Then
        assertEquals(Duration.ofMillis(1), retryManager.computeDelay(1, immediate));
    }

    @Test
    void testIsRetryable_Classification() {
        RetrySettings defaults = RetrySettings.defaults();

        assertFalse(retryManager.isRetryable(new IllegalStateException("INSUFFICIENT_FUNDS: balance too low"), defaults));
        assertTrue(retryManager.isRetryable(new IllegalStateException("RPC_CONNECTION_FAILED"), defaults));
        assertTrue(retryManager.isRetryable(
            new OperationTimeoutException("Operation timeout: x exceeded 5 ms", Duration.ofMillis(5), null), defaults));
        assertTrue(retryManager.isRetryable(
            new ResilienceException("busy", ErrorType.UNKNOWN_ERROR, true), defaults));
        assertFalse(retryManager.isRetryable(
            new ResilienceException("broken", ErrorType.UNKNOWN_ERROR, false), defaults));
        assertTrue(retryManager.isRetryable(new RuntimeException("Network unreachable"), defaults));
        assertFalse(retryManager.isRetryable(new IllegalArgumentException("bad request"), defaults));
    }

    @Test
    void testGetAllStats_KeyedByOperationName() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        retryManager.execute("quote", () -> "a", Map.of(), settings);
        retryManager.execute("quote", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IOException("network blip");
            }
            return "b";
        }, Map.of(), settings);

        // When
        RetryStats stats = retryManager.getAllStats().get("quote");

        // Then
        assertEquals(2, stats.getTotalCalls());
        assertEquals(2, stats.getSuccessfulCalls());
        assertEquals(3, stats.getTotalAttempts());
        assertEquals(1.5, stats.getAverageAttempts(), 0.0001);

        retryManager.resetStats();
        assertTrue(retryManager.getAllStats().isEmpty());
    }
}
