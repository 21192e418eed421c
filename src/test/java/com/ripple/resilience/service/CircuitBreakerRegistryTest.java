package com.ripple.resilience.service;

import com.ripple.resilience.model.CircuitBreakerSettings;
import com.ripple.resilience.model.CircuitMetrics;
import com.ripple.resilience.model.CircuitState;
import com.ripple.resilience.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CircuitBreakerRegistryTest {

    @Mock
    private TimeoutGuard timeoutGuard;

    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CircuitBreakerRegistry(CircuitBreakerSettings.defaults(), timeoutGuard,
            MutableClock.startingAt("2024-01-01T00:00:00Z"));
    }

    @Test
    void testGetCircuitBreaker_CreatesOncePerName() {
        // When
        CircuitBreaker first = registry.getCircuitBreaker("payments_api");
        CircuitBreaker second = registry.getCircuitBreaker("payments_api",
            CircuitBreakerSettings.builder().failureThreshold(1).build());

        // Then
        assertSame(first, second);
        assertEquals(5, second.getSettings().getFailureThreshold());
        assertEquals(1, registry.getAllCircuitBreakers().size());
    }

    @Test
    void testGetAllMetrics_SortedByName() {
        // Given
        registry.getCircuitBreaker("b");
        registry.getCircuitBreaker("a");

        // When
        Map<String, CircuitMetrics> metrics = registry.getAllMetrics();

        // Then
        assertEquals("a", metrics.keySet().iterator().next());
        assertEquals(CircuitState.CLOSED, metrics.get("b").getState());
    }

    @Test
    void testResetAll_ClosesEveryCircuit() throws Exception {
        // Given
        CircuitBreaker circuit = registry.getCircuitBreaker("flaky",
            CircuitBreakerSettings.builder().failureThreshold(1).build());
        when(timeoutGuard.call(any(), any(), anyString())).thenThrow(new IOException("down"));
        assertThrows(IOException.class, () -> circuit.execute(() -> "x", Map.of()));
        assertEquals(CircuitState.OPEN, circuit.getState());

        // When
        registry.resetAll();

        // Then
        assertEquals(CircuitState.CLOSED, circuit.getState());
    }
}
