package com.ripple.resilience.service;

import com.ripple.resilience.model.OperationOptions;
import com.ripple.resilience.model.ResilienceOperation;
import com.ripple.resilience.service.rules.ConsistencyRules;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResilienceOperationsTest {

    @Test
    void testApiCall_CircuitNamedAfterService() {
        // When
        ResilienceOperation<String> operation = ResilienceOperations.apiCall("fx", "quote", () -> "1.08", Map.of());

        // Then
        OperationOptions options = operation.getOptions();
        assertTrue(options.isUseCircuitBreaker());
        assertTrue(options.isUseRetry());
        assertEquals("fx_api", operation.resolveCircuitName());
        assertEquals(Duration.ofSeconds(10), options.getRetryConfig().getMaxDelay());
    }

    @Test
    void testDatabaseOperation_ValidatesWithRules() {
        // When
        ResilienceOperation<Integer> operation = ResilienceOperations.databaseOperation("db", "count", () -> 1,
            List.of(ConsistencyRules.notNull()), Map.of());

        // Then
        assertTrue(operation.getOptions().hasConsistencyRules());
        assertEquals("db_count", operation.resolveCircuitName());
    }

    @Test
    void testFileOperation_RetryOnly() {
        // When
        ResilienceOperation<String> operation = ResilienceOperations.fileOperation("fs", "read", () -> "x", Map.of());

        // Then
        OperationOptions options = operation.getOptions();
        assertFalse(options.isUseCircuitBreaker());
        assertTrue(options.isUseRetry());
        assertEquals(2, options.getRetryConfig().getMaxAttempts());
        assertEquals(Duration.ofMillis(500), options.getRetryConfig().getBaseDelay());
    }
}
