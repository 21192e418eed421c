package com.ripple.resilience.service;

import com.ripple.resilience.exception.OperationTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TimeoutGuardTest {

    private TimeoutGuard timeoutGuard;

    @BeforeEach
    void setUp() {
        timeoutGuard = new TimeoutGuard(Executors.newCachedThreadPool());
    }

    @AfterEach
    void tearDown() {
        timeoutGuard.shutdown();
    }

    @Test
    void testCall_ReturnsResultWithinDeadline() throws Exception {
        // When
        String result = timeoutGuard.call(() -> "done", Duration.ofSeconds(1), "quick");

        // Then
        assertEquals("done", result);
    }

    @Test
    void testCall_TimeoutInterruptsRunningOperation() throws InterruptedException {
        // Given
        CountDownLatch interrupted = new CountDownLatch(1);

        // When
        OperationTimeoutException exception = assertThrows(OperationTimeoutException.class,
            () -> timeoutGuard.call(() -> sleepRecordingInterrupt(Duration.ofSeconds(2), interrupted, new AtomicBoolean()),
                Duration.ofMillis(100), "slow"));

        // Then
        assertTrue(exception.getMessage().contains("slow exceeded 100 ms"));
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    void testCall_OuterTimeoutCancelsOperationUnderInnerGuard() throws InterruptedException {
        // Given
        CountDownLatch interrupted = new CountDownLatch(1);
        AtomicBoolean completed = new AtomicBoolean();

        // When
        assertThrows(OperationTimeoutException.class, () -> timeoutGuard.call(
            () -> timeoutGuard.call(() -> sleepRecordingInterrupt(Duration.ofSeconds(1), interrupted, completed),
                Duration.ofSeconds(5), "inner"),
            Duration.ofMillis(100), "outer"));

        // Then
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
        assertFalse(completed.get());
    }

    @Test
    void testCall_ZeroTimeoutRunsInline() throws Exception {
        // Given
        Thread caller = Thread.currentThread();

        // When
        Thread runner = timeoutGuard.call(Thread::currentThread, Duration.ZERO, "inline");

        // Then
        assertSame(caller, runner);
    }

    private static String sleepRecordingInterrupt(Duration duration, CountDownLatch interrupted, AtomicBoolean completed) {
        try {
            Thread.sleep(duration.toMillis());
            completed.set(true);
            return "finished";
        } catch (InterruptedException e) {
            interrupted.countDown();
            Thread.currentThread().interrupt();
            return "interrupted";
        }
    }
}
