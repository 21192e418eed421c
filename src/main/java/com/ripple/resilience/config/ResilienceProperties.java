package com.ripple.resilience.config;

import com.ripple.resilience.model.CircuitBreakerSettings;
import com.ripple.resilience.model.ConsistencySettings;
import com.ripple.resilience.model.DegradationSettings;
import com.ripple.resilience.model.RetrySettings;
import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Engine defaults read from {@code resilience.*} properties. Durations are in milliseconds.
 */
@Data
@Configuration
public class ResilienceProperties {

    @Value("${resilience.circuit-breaker.failure-threshold:5}")
    private int circuitFailureThreshold;

    @Value("${resilience.circuit-breaker.recovery-timeout:30000}")
    private long circuitRecoveryTimeout;

    @Value("${resilience.circuit-breaker.timeout-threshold:10000}")
    private long circuitTimeoutThreshold;

    @Value("${resilience.circuit-breaker.monitoring-window:60000}")
    private long circuitMonitoringWindow;

    @Value("${resilience.retry.max-attempts:3}")
    private int retryMaxAttempts;

    @Value("${resilience.retry.base-delay:1000}")
    private long retryBaseDelay;

    @Value("${resilience.retry.max-delay:30000}")
    private long retryMaxDelay;

    @Value("${resilience.retry.backoff-multiplier:2.0}")
    private double retryBackoffMultiplier;

    @Value("${resilience.retry.jitter-factor:0.1}")
    private double retryJitterFactor;

    @Value("${resilience.retry.timeout:10000}")
    private long retryTimeout;

    @Value("${resilience.degradation.check-interval:30000}")
    private long degradationCheckInterval;

    @Value("${resilience.degradation.degradation-threshold:3}")
    private int degradationThreshold;

    @Value("${resilience.degradation.recovery-threshold:5}")
    private int recoveryThreshold;

    @Value("${resilience.degradation.monitoring-window:300000}")
    private long degradationMonitoringWindow;

    @Value("${resilience.degradation.enable-fallbacks:true}")
    private boolean enableFallbacks;

    @Value("${resilience.degradation.auto-recovery:true}")
    private boolean autoRecovery;

    @Value("${resilience.consistency.enable-auto-repair:true}")
    private boolean enableAutoRepair;

    @Value("${resilience.consistency.max-repair-attempts:3}")
    private int maxRepairAttempts;

    @Value("${resilience.consistency.backup-before-repair:true}")
    private boolean backupBeforeRepair;

    @Value("${resilience.consistency.log-all-checks:false}")
    private boolean logAllChecks;

    @Value("${resilience.consistency.history-limit:1000}")
    private int consistencyHistoryLimit;

    @Value("${resilience.monitoring.enabled:true}")
    private boolean monitoringEnabled;

    public CircuitBreakerSettings circuitBreakerSettings() {
        return CircuitBreakerSettings.builder()
            .failureThreshold(circuitFailureThreshold)
            .recoveryTimeout(Duration.ofMillis(circuitRecoveryTimeout))
            .timeoutThreshold(Duration.ofMillis(circuitTimeoutThreshold))
            .monitoringWindow(Duration.ofMillis(circuitMonitoringWindow))
            .build();
    }

    public RetrySettings retrySettings() {
        return RetrySettings.builder()
            .maxAttempts(retryMaxAttempts)
            .baseDelay(Duration.ofMillis(retryBaseDelay))
            .maxDelay(Duration.ofMillis(retryMaxDelay))
            .backoffMultiplier(retryBackoffMultiplier)
            .jitterFactor(retryJitterFactor)
            .timeout(Duration.ofMillis(retryTimeout))
            .build();
    }

    public DegradationSettings degradationSettings() {
        return DegradationSettings.builder()
            .checkInterval(Duration.ofMillis(degradationCheckInterval))
            .degradationThreshold(degradationThreshold)
            .recoveryThreshold(recoveryThreshold)
            .monitoringWindow(Duration.ofMillis(degradationMonitoringWindow))
            .enableFallbacks(enableFallbacks)
            .autoRecovery(autoRecovery)
            .build();
    }

    public ConsistencySettings consistencySettings() {
        return ConsistencySettings.builder()
            .enableAutoRepair(enableAutoRepair)
            .maxRepairAttempts(maxRepairAttempts)
            .backupBeforeRepair(backupBeforeRepair)
            .logAllChecks(logAllChecks)
            .historyLimit(consistencyHistoryLimit)
            .build();
    }
}
