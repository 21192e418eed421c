package com.ripple.resilience.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundedHistoryTest {

    @Test
    void testAdd_EvictsOldestWhenFull() {
        // Given
        BoundedHistory<Integer> history = new BoundedHistory<>(3);

        // When
        history.addAll(List.of(1, 2, 3, 4, 5));

        // Then
        assertEquals(3, history.size());
        assertEquals(List.of(3, 4, 5), history.latest(0));
    }

    @Test
    void testLatest_ReturnsMostRecentOldestFirst() {
        // Given
        BoundedHistory<String> history = new BoundedHistory<>(10);
        history.addAll(List.of("a", "b", "c"));

        // When / Then
        assertEquals(List.of("b", "c"), history.latest(2));
        assertEquals(List.of("a", "b", "c"), history.latest(50));
    }

    @Test
    void testConstructor_RejectsNonPositiveCapacity() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new BoundedHistory<>(0));
        assertTrue(exception.getMessage().contains("capacity"));
    }
}
