package com.ripple.resilience.service;

import com.ripple.resilience.model.RetrySettings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryPoliciesTest {

    @Test
    void testNetwork_AddsTransportErrorIdentities() {
        // When
        RetrySettings network = RetryPolicies.network();

        // Then
        assertTrue(network.getRetryableErrors().contains("ECONNRESET"));
        assertTrue(network.getRetryableErrors().contains("SocketTimeoutException"));
        assertTrue(network.getRetryableErrors().contains("NETWORK_ERROR"));
    }

    @Test
    void testFast_IsShorterThanConservative() {
        assertTrue(RetryPolicies.fast().getMaxAttempts() < RetryPolicies.conservative().getMaxAttempts());
        assertTrue(RetryPolicies.fast().getBaseDelay().compareTo(RetryPolicies.standard().getBaseDelay()) < 0);
    }
}
