package com.ripple.resilience.service;

import com.ripple.resilience.exception.ValidationFailedException;
import com.ripple.resilience.model.CircuitMetrics;
import com.ripple.resilience.model.ConsistencyCheck;
import com.ripple.resilience.model.ConsistencyReport;
import com.ripple.resilience.model.ConsistencyRule;
import com.ripple.resilience.model.ConsistencySeverity;
import com.ripple.resilience.model.ConsistencyTally;
import com.ripple.resilience.model.FallbackStrategy;
import com.ripple.resilience.model.HealthStatus;
import com.ripple.resilience.model.OperationOptions;
import com.ripple.resilience.model.OperationRecord;
import com.ripple.resilience.model.OperationStatus;
import com.ripple.resilience.model.ResilienceMetrics;
import com.ripple.resilience.model.ResilienceOperation;
import com.ripple.resilience.model.ServiceHealth;
import com.ripple.resilience.service.executor.CircuitBreakingExecutor;
import com.ripple.resilience.service.executor.DegradingExecutor;
import com.ripple.resilience.service.executor.DirectExecutor;
import com.ripple.resilience.service.executor.ExecutionContext;
import com.ripple.resilience.service.executor.OperationExecutor;
import com.ripple.resilience.service.executor.RetryingExecutor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the engine. Runs one {@link ResilienceOperation} through the following
 * stages:
 * <ul>
 *   <li>Pre-validation of the {@code data} context entry against the operation's consistency rules</li>
 *   <li>Exactly one execution path: circuit breaker around retry, retry alone, or graceful
 *   degradation with fallbacks</li>
 *   <li>Post-validation of the result against the same rules</li>
 *   <li>A history entry for the operation's service, recorded whatever the outcome</li>
 * </ul>
 *
 * <p>A critical validation result aborts the operation with a non-retryable
 * {@link ValidationFailedException}. Any other failure is rethrown unchanged.
 */
@Slf4j
public class ResilienceManager {

    public static final int HISTORY_CAPACITY = 100;
    private static final int RECENT_CHECKS = 10;
    private static final double CRITICAL_FAILURE_RATE = 0.5;
    private static final double DEGRADED_FAILURE_RATE = 0.2;

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryManager retryManager;
    private final GracefulDegradation gracefulDegradation;
    private final DataConsistencyChecker dataConsistencyChecker;
    private final HealthMonitor healthMonitor;
    private final Clock clock;

    private final OperationExecutor circuitBreakerChain;
    private final OperationExecutor retryChain;
    private final OperationExecutor degradationChain;
    private final Map<String, BoundedHistory<OperationRecord>> operationHistory = new ConcurrentHashMap<>();

    public ResilienceManager(CircuitBreakerRegistry circuitBreakerRegistry,
                             RetryManager retryManager,
                             GracefulDegradation gracefulDegradation,
                             DataConsistencyChecker dataConsistencyChecker,
                             HealthMonitor healthMonitor,
                             Clock clock) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryManager = retryManager;
        this.gracefulDegradation = gracefulDegradation;
        this.dataConsistencyChecker = dataConsistencyChecker;
        this.healthMonitor = healthMonitor;
        this.clock = clock;

        OperationExecutor direct = new DirectExecutor();
        this.retryChain = new RetryingExecutor(retryManager, direct);
        this.circuitBreakerChain = new CircuitBreakingExecutor(circuitBreakerRegistry, retryChain);
        this.degradationChain = new DegradingExecutor(gracefulDegradation, direct);
    }

    /**
     * Executes {@code operation} with the protections its options select.
     *
     * @return the operation result, or a fallback result on the degradation path
     * @throws ValidationFailedException if pre- or post-validation reports a critical failure
     * @throws Exception the error of the failing stage
     */
    public <T> T execute(ResilienceOperation<T> operation) throws Exception {
        String operationId = UUID.randomUUID().toString();
        ExecutionContext context = ExecutionContext.of(operationId, operation);
        OperationOptions options = operation.getOptions();
        Instant start = clock.instant();

        log.debug("Executing resilient operation: operationId={}, name={}, service={}, options={}",
            operationId, operation.getName(), operation.getService(), options);

        try {
            if (options.hasConsistencyRules()) {
                ConsistencyReport report = validateInput(operation.getData(), options.getConsistencyRules(), context);
                if (report.isCritical()) {
                    throw new ValidationFailedException(
                        "Critical data validation failed for operation '" + operation.getName() + "'", report);
                }
            }

            T result = selectExecutor(options).execute(context, operation.getOperation());

            if (options.hasConsistencyRules()) {
                ConsistencyReport report = dataConsistencyChecker.validateData(
                    result, options.getConsistencyRules(), context.getAttributes());
                if (report.isCritical()) {
                    throw new ValidationFailedException(
                        "Operation result validation failed for operation '" + operation.getName() + "'", report);
                }
            }

            Duration duration = Duration.between(start, clock.instant());
            record(context, OperationStatus.SUCCESS, duration, null);
            log.info("Resilient operation completed: operationId={}, name={}, service={}, durationMs={}",
                operationId, operation.getName(), operation.getService(), duration.toMillis());
            return result;
        } catch (Exception | Error e) {
            Duration duration = Duration.between(start, clock.instant());
            record(context, OperationStatus.FAILED, duration, e.getMessage());
            log.error("Resilient operation failed: operationId={}, name={}, service={}, durationMs={}, error={}",
                operationId, operation.getName(), operation.getService(), duration.toMillis(), e.getMessage());
            throw e;
        }
    }

    public void registerFallback(String serviceName, FallbackStrategy strategy) {
        gracefulDegradation.registerFallback(serviceName, strategy);
    }

    public void registerConsistencyRule(ConsistencyRule rule) {
        dataConsistencyChecker.registerRule(rule);
    }

    /**
     * Aggregates circuit, retry, service health and recent consistency figures.
     *
     * <p>Overall health starts healthy. A circuit failure rate above 50% or a failing critical
     * check among the last ten checks makes it critical; a rate above 20% makes it at least
     * degraded. Each unhealthy service escalates it by one step.
     */
    public ResilienceMetrics getMetrics() {
        Map<String, CircuitMetrics> circuits = circuitBreakerRegistry.getAllMetrics();
        Map<String, ServiceHealth> services = gracefulDegradation.getAllServiceHealth();
        List<ConsistencyCheck> recentChecks = dataConsistencyChecker.getCheckHistory(RECENT_CHECKS);

        return ResilienceMetrics.builder()
            .circuitBreakers(circuits)
            .retryStats(retryManager.getAllStats())
            .serviceHealth(services)
            .consistencyTallies(tally(recentChecks))
            .serviceLevel(gracefulDegradation.getCurrentServiceLevel())
            .overallHealth(overallHealth(circuits, services, recentChecks))
            .timestamp(clock.instant())
            .build();
    }

    /**
     * Returns up to {@code limit} most recent operations of {@code serviceName}, oldest first.
     * A non-positive limit returns the whole retained history.
     */
    public List<OperationRecord> getOperationHistory(String serviceName, int limit) {
        BoundedHistory<OperationRecord> history = operationHistory.get(serviceName);
        return history == null ? List.of() : history.latest(limit);
    }

    public void reset() {
        circuitBreakerRegistry.resetAll();
        retryManager.resetStats();
        gracefulDegradation.resetHealth();
        dataConsistencyChecker.clearCheckHistory();
        dataConsistencyChecker.resetRepairHistory();
        operationHistory.clear();
        log.info("Resilience manager reset");
    }

    public void startMonitoring() {
        healthMonitor.start();
    }

    public void stopMonitoring() {
        healthMonitor.stop();
    }

    private OperationExecutor selectExecutor(OperationOptions options) {
        if (options.isUseCircuitBreaker()) {
            return circuitBreakerChain;
        }
        if (options.isUseRetry()) {
            return retryChain;
        }
        return degradationChain;
    }

    private ConsistencyReport validateInput(Object data, List<ConsistencyRule> rules, ExecutionContext context) {
        if (data == null) {
            return ConsistencyReport.empty(clock.instant());
        }
        return dataConsistencyChecker.validateData(data, rules, context.getAttributes());
    }

    private void record(ExecutionContext context, OperationStatus status, Duration duration, String error) {
        OperationRecord entry = OperationRecord.builder()
            .operationId(context.getOperationId())
            .name(context.getOperationName())
            .service(context.getService())
            .status(status)
            .duration(duration)
            .timestamp(clock.instant())
            .error(error)
            .build();
        operationHistory
            .computeIfAbsent(context.getService(), service -> new BoundedHistory<>(HISTORY_CAPACITY))
            .add(entry);
    }

    private static Map<String, ConsistencyTally> tally(List<ConsistencyCheck> checks) {
        Map<String, ConsistencyTally> tallies = new TreeMap<>();
        for (ConsistencyCheck check : checks) {
            tallies.merge(check.getRuleName(), new ConsistencyTally(0, 0, 0).add(check.isPassed()),
                (current, single) -> current.add(check.isPassed()));
        }
        return tallies;
    }

    private static HealthStatus overallHealth(Map<String, CircuitMetrics> circuits,
                                              Map<String, ServiceHealth> services,
                                              List<ConsistencyCheck> recentChecks) {
        HealthStatus status = HealthStatus.HEALTHY;

        for (CircuitMetrics circuit : circuits.values()) {
            if (circuit.getCurrentFailureRate() > CRITICAL_FAILURE_RATE) {
                status = HealthStatus.CRITICAL;
            } else if (circuit.getCurrentFailureRate() > DEGRADED_FAILURE_RATE && status == HealthStatus.HEALTHY) {
                status = HealthStatus.DEGRADED;
            }
        }

        for (ServiceHealth health : services.values()) {
            if (!health.isHealthy()) {
                status = status == HealthStatus.HEALTHY ? HealthStatus.DEGRADED : HealthStatus.CRITICAL;
            }
        }

        boolean criticalCheckFailing = recentChecks.stream()
            .anyMatch(check -> !check.isPassed() && check.getSeverity() == ConsistencySeverity.CRITICAL);
        if (criticalCheckFailing) {
            status = HealthStatus.CRITICAL;
        }
        return status;
    }
}
