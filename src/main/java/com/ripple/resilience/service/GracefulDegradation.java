package com.ripple.resilience.service;

import com.ripple.resilience.model.DegradationSettings;
import com.ripple.resilience.model.FallbackStrategy;
import com.ripple.resilience.model.ServiceHealth;
import com.ripple.resilience.model.ServiceLevel;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks per-service health, owns the service level and runs fallback chains.
 *
 * <p>The service level is a single value shared by every service handled by this instance.
 * Failures on a service past the degradation threshold lower it to the best level that
 * service still has a fallback for; a run of successes with no recorded failures raises it
 * one rank at a time.
 *
 * <p>Thread-Safety: each health record is guarded by its own monitor, fallback lists are
 * replaced copy-on-write and the level is an atomic reference.
 */
@Slf4j
public class GracefulDegradation {

    private static final Comparator<FallbackStrategy> BY_PRIORITY =
        Comparator.comparingInt(FallbackStrategy::getPriority);

    private final DegradationSettings settings;
    private final Clock clock;
    private final Map<String, ServiceHealth> serviceHealth = new ConcurrentHashMap<>();
    private final Map<String, List<FallbackStrategy>> fallbackStrategies = new ConcurrentHashMap<>();
    private final AtomicReference<ServiceLevel> currentServiceLevel = new AtomicReference<>(ServiceLevel.FULL);

    public GracefulDegradation(DegradationSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Registers {@code strategy} for {@code serviceName}, keeping the list ordered by ascending
     * priority. Strategies with equal priority keep their registration order.
     */
    public void registerFallback(String serviceName, FallbackStrategy strategy) {
        fallbackStrategies.compute(serviceName, (name, existing) -> {
            List<FallbackStrategy> updated = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            updated.add(strategy);
            updated.sort(BY_PRIORITY);
            return List.copyOf(updated);
        });

        log.info("Fallback strategy registered: serviceName={}, strategyName={}, priority={}, serviceLevel={}",
            serviceName, strategy.getName(), strategy.getPriority(), strategy.getServiceLevel());
    }

    public <T> T execute(String serviceName, Callable<T> primaryOperation, Map<String, Object> context) throws Exception {
        return execute(serviceName, primaryOperation, context, true);
    }

    /**
     * Runs the primary operation, falling back through the registered strategies on failure.
     *
     * @param useFallbacks whether this call may use fallbacks at all
     * @throws Exception the primary error when no fallback produced a result; failures of
     *                   attempted fallbacks are attached to it as suppressed exceptions
     */
    @SuppressWarnings("unchecked")
    public <T> T execute(String serviceName, Callable<T> primaryOperation, Map<String, Object> context,
                         boolean useFallbacks) throws Exception {
        getOrCreateHealth(serviceName);

        T result;
        try {
            result = primaryOperation.call();
        } catch (Exception primaryError) {
            recordFailure(serviceName, primaryError);

            if (settings.isEnableFallbacks() && useFallbacks) {
                FallbackAttempt attempt = tryFallbacks(serviceName, context, primaryError);
                if (attempt.succeeded) {
                    return (T) attempt.result;
                }
            }
            throw primaryError;
        }

        recordSuccess(serviceName);
        return result;
    }

    public ServiceLevel getCurrentServiceLevel() {
        return currentServiceLevel.get();
    }

    public void setServiceLevel(ServiceLevel level) {
        ServiceLevel previous = currentServiceLevel.getAndSet(level);
        log.info("Service level manually changed: previousLevel={}, newLevel={}", previous, level);
    }

    public List<FallbackStrategy> getFallbackStrategies(String serviceName) {
        return fallbackStrategies.getOrDefault(serviceName, List.of());
    }

    public Map<String, ServiceHealth> getAllServiceHealth() {
        Map<String, ServiceHealth> snapshot = new TreeMap<>();
        serviceHealth.forEach((name, health) -> {
            synchronized (health) {
                snapshot.put(name, health.copy());
            }
        });
        return snapshot;
    }

    /**
     * Clears every health record and restores the {@link ServiceLevel#FULL} level.
     */
    public void resetHealth() {
        serviceHealth.clear();
        currentServiceLevel.set(ServiceLevel.FULL);
        log.info("All service health records reset");
    }

    /**
     * Clears the counters of records not touched within the monitoring window and refreshes
     * each record's health flag and level. Invoked periodically by {@link HealthMonitor}.
     */
    public void performHealthChecks() {
        Instant cutoff = clock.instant().minus(settings.getMonitoringWindow());
        ServiceLevel level = currentServiceLevel.get();
        serviceHealth.forEach((name, health) -> {
            synchronized (health) {
                if (health.getLastCheck().isBefore(cutoff)) {
                    log.debug("Clearing stale service counters: serviceName={}, lastCheck={}", name, health.getLastCheck());
                    health.setFailureCount(0);
                    health.setSuccessCount(0);
                }
                health.setHealthy(health.getFailureCount() < settings.getDegradationThreshold());
                health.setCurrentLevel(level);
            }
        });
    }

    public DegradationSettings getSettings() {
        return settings;
    }

    private FallbackAttempt tryFallbacks(String serviceName, Map<String, Object> context, Exception primaryError) {
        for (FallbackStrategy strategy : getFallbackStrategies(serviceName)) {
            ServiceLevel level = currentServiceLevel.get();
            try {
                if (!strategy.isAvailable()) {
                    log.debug("Fallback strategy not available: serviceName={}, strategyName={}",
                        serviceName, strategy.getName());
                    continue;
                }
                if (!strategy.getServiceLevel().isAtMost(level)) {
                    log.debug("Fallback strategy not compatible with current service level: serviceName={}, strategyName={}, strategyLevel={}, currentLevel={}",
                        serviceName, strategy.getName(), strategy.getServiceLevel(), level);
                    continue;
                }

                log.info("Using fallback strategy: serviceName={}, strategyName={}, serviceLevel={}",
                    serviceName, strategy.getName(), strategy.getServiceLevel());
                Object result = strategy.execute(context);

                ServiceHealth health = getOrCreateHealth(serviceName);
                synchronized (health) {
                    health.setFallbackActive(true);
                }
                return FallbackAttempt.success(result);
            } catch (Exception e) {
                primaryError.addSuppressed(e);
                log.warn("Fallback strategy failed: serviceName={}, strategyName={}, error={}",
                    serviceName, strategy.getName(), e.getMessage());
            }
        }
        log.warn("No fallback strategy succeeded: serviceName={}, currentLevel={}",
            serviceName, currentServiceLevel.get());
        return FallbackAttempt.NONE;
    }

    private void recordSuccess(String serviceName) {
        ServiceHealth health = getOrCreateHealth(serviceName);
        synchronized (health) {
            health.setSuccessCount(health.getSuccessCount() + 1);
            health.setLastCheck(clock.instant());
            health.setFallbackActive(false);

            if (health.getSuccessCount() >= settings.getRecoveryThreshold()) {
                health.setFailureCount(0);
                health.setHealthy(true);
                if (settings.isAutoRecovery()) {
                    recover(health);
                }
            }
            health.setCurrentLevel(currentServiceLevel.get());
        }
    }

    private void recover(ServiceHealth health) {
        ServiceLevel previous = currentServiceLevel.get();
        ServiceLevel next = previous.next();
        if (next != previous && currentServiceLevel.compareAndSet(previous, next)) {
            log.info("Service recovered: serviceName={}, previousLevel={}, newLevel={}, successCount={}",
                health.getServiceName(), previous, next, health.getSuccessCount());
        }
        health.setSuccessCount(0);
    }

    private void recordFailure(String serviceName, Exception error) {
        ServiceHealth health = getOrCreateHealth(serviceName);
        synchronized (health) {
            health.setFailureCount(health.getFailureCount() + 1);
            health.setSuccessCount(0);
            health.setLastCheck(clock.instant());
            health.setHealthy(false);

            log.warn("Service operation failed: serviceName={}, failureCount={}, error={}",
                serviceName, health.getFailureCount(), error.getMessage());

            if (health.getFailureCount() >= settings.getDegradationThreshold()) {
                degrade(health);
            }
            health.setCurrentLevel(currentServiceLevel.get());
        }
    }

    private void degrade(ServiceHealth health) {
        ServiceLevel previous = currentServiceLevel.get();
        ServiceLevel target = getFallbackStrategies(health.getServiceName()).stream()
            .map(FallbackStrategy::getServiceLevel)
            .filter(level -> level.isAtMost(previous))
            .max(Comparator.comparingInt(ServiceLevel::getRank))
            .orElse(ServiceLevel.EMERGENCY);

        currentServiceLevel.set(target);
        if (target != previous) {
            log.warn("Service degraded: serviceName={}, previousLevel={}, newLevel={}, failureCount={}",
                health.getServiceName(), previous, target, health.getFailureCount());
        }
    }

    private ServiceHealth getOrCreateHealth(String serviceName) {
        return serviceHealth.computeIfAbsent(serviceName, name -> ServiceHealth.builder()
            .serviceName(name)
            .healthy(true)
            .lastCheck(clock.instant())
            .currentLevel(currentServiceLevel.get())
            .build());
    }

    private static final class FallbackAttempt {
        private static final FallbackAttempt NONE = new FallbackAttempt(false, null);

        private final boolean succeeded;
        private final Object result;

        private FallbackAttempt(boolean succeeded, Object result) {
            this.succeeded = succeeded;
            this.result = result;
        }

        private static FallbackAttempt success(Object result) {
            return new FallbackAttempt(true, result);
        }
    }
}
