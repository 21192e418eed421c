package com.ripple.resilience.service;

import com.ripple.resilience.model.CircuitBreakerSettings;
import com.ripple.resilience.model.CircuitMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily creates and keeps one {@link CircuitBreaker} per name for the process lifetime.
 */
@Slf4j
@RequiredArgsConstructor
public class CircuitBreakerRegistry {

    private final CircuitBreakerSettings defaultSettings;
    private final TimeoutGuard timeoutGuard;
    private final Clock clock;
    private final Map<String, CircuitBreaker> circuits = new ConcurrentHashMap<>();

    public CircuitBreaker getCircuitBreaker(String name) {
        return getCircuitBreaker(name, defaultSettings);
    }

    /**
     * Returns the circuit registered under {@code name}, creating it with {@code settings} on
     * first use. Settings passed for an existing circuit are ignored.
     */
    public CircuitBreaker getCircuitBreaker(String name, CircuitBreakerSettings settings) {
        return circuits.computeIfAbsent(name, key -> {
            log.info("Circuit breaker created: circuitName={}, settings={}", key, settings);
            return new CircuitBreaker(key, settings, timeoutGuard, clock);
        });
    }

    public Map<String, CircuitBreaker> getAllCircuitBreakers() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(circuits));
    }

    public Map<String, CircuitMetrics> getAllMetrics() {
        Map<String, CircuitMetrics> metrics = new TreeMap<>();
        circuits.forEach((name, circuit) -> metrics.put(name, circuit.getMetrics()));
        return metrics;
    }

    public void resetAll() {
        circuits.values().forEach(CircuitBreaker::reset);
        log.info("All circuit breakers reset: count={}", circuits.size());
    }
}
