package com.ripple.resilience.config;

import com.ripple.resilience.service.CircuitBreakerRegistry;
import com.ripple.resilience.service.DataConsistencyChecker;
import com.ripple.resilience.service.GracefulDegradation;
import com.ripple.resilience.service.HealthMonitor;
import com.ripple.resilience.service.ResilienceManager;
import com.ripple.resilience.service.RetryManager;
import com.ripple.resilience.service.TimeoutGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.Executors;

/**
 * Wires the engine components as singletons sharing one clock, one timeout worker pool and
 * one service level.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ResilienceEngineConfig {

    private final ResilienceProperties properties;

    @Bean
    public Clock resilienceClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public TimeoutGuard timeoutGuard() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("resilience-worker-");
        threadFactory.setDaemon(true);
        return new TimeoutGuard(Executors.newCachedThreadPool(threadFactory));
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(TimeoutGuard timeoutGuard, Clock resilienceClock) {
        return new CircuitBreakerRegistry(properties.circuitBreakerSettings(), timeoutGuard, resilienceClock);
    }

    @Bean
    public RetryManager retryManager(TimeoutGuard timeoutGuard, Clock resilienceClock) {
        return new RetryManager(properties.retrySettings(), timeoutGuard, resilienceClock);
    }

    @Bean
    public GracefulDegradation gracefulDegradation(Clock resilienceClock) {
        return new GracefulDegradation(properties.degradationSettings(), resilienceClock);
    }

    @Bean
    public DataConsistencyChecker dataConsistencyChecker(Clock resilienceClock) {
        return new DataConsistencyChecker(properties.consistencySettings(), resilienceClock);
    }

    @Bean(destroyMethod = "stop")
    public HealthMonitor healthMonitor(GracefulDegradation gracefulDegradation) {
        return new HealthMonitor(gracefulDegradation, properties.degradationSettings().getCheckInterval());
    }

    @Bean
    public ResilienceManager resilienceManager(CircuitBreakerRegistry circuitBreakerRegistry,
                                               RetryManager retryManager,
                                               GracefulDegradation gracefulDegradation,
                                               DataConsistencyChecker dataConsistencyChecker,
                                               HealthMonitor healthMonitor,
                                               Clock resilienceClock) {
        ResilienceManager manager = new ResilienceManager(circuitBreakerRegistry, retryManager,
            gracefulDegradation, dataConsistencyChecker, healthMonitor, resilienceClock);
        if (properties.isMonitoringEnabled()) {
            manager.startMonitoring();
        }
        log.info("Resilience manager initialized: monitoringEnabled={}, circuitSettings={}, retrySettings={}",
            properties.isMonitoringEnabled(), properties.circuitBreakerSettings(), properties.retrySettings());
        return manager;
    }
}
