package com.ripple.resilience.service;

import com.ripple.resilience.model.ConsistencyCheck;
import com.ripple.resilience.model.ConsistencyReport;
import com.ripple.resilience.model.ConsistencyRule;
import com.ripple.resilience.model.ConsistencySettings;
import com.ripple.resilience.model.ConsistencySeverity;
import com.ripple.resilience.model.HealthStatus;
import com.ripple.resilience.model.RepairOutcome;
import com.ripple.resilience.model.Snapshottable;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Validates data snapshots against consistency rules, auto-repairing where a rule allows it.
 *
 * <p>Each rule has a budget of {@code maxRepairAttempts} successful automatic repairs for the
 * lifetime of the checker. Once the budget is spent the rule's failures stand. Manual
 * repairs through {@link #repairData(String, Object)} do not touch the budget.
 *
 * <p>Before repairing, {@link Snapshottable} data is copied when backups are enabled and put
 * back if the repaired value still fails validation.
 */
@Slf4j
public class DataConsistencyChecker {

    private final ConsistencySettings settings;
    private final Clock clock;
    private final Map<String, ConsistencyRule> rules = new LinkedHashMap<>();
    private final Map<String, AtomicInteger> repairCounts = new ConcurrentHashMap<>();
    private final BoundedHistory<ConsistencyCheck> checkHistory;

    public DataConsistencyChecker(ConsistencySettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.checkHistory = new BoundedHistory<>(settings.getHistoryLimit());
    }

    public void registerRule(ConsistencyRule rule) {
        synchronized (rules) {
            rules.put(rule.getName(), rule);
        }
        log.info("Consistency rule registered: ruleName={}, description={}, severity={}, autoRepair={}",
            rule.getName(), rule.getDescription(), rule.getSeverity(), rule.isAutoRepair());
    }

    /**
     * Validates {@code data} against every registered rule.
     */
    public ConsistencyReport validateData(Object data, Map<String, Object> context) {
        return validateData(data, getRegisteredRules(), context);
    }

    /**
     * Validates {@code data} against {@code rulesToApply}. Repair budgets are shared with
     * registered rules of the same name.
     */
    public ConsistencyReport validateData(Object data, Collection<ConsistencyRule> rulesToApply,
                                          Map<String, Object> context) {
        Instant start = clock.instant();
        List<ConsistencyCheck> checks = new ArrayList<>();
        int failedChecks = 0;
        int criticalFailures = 0;
        int warnings = 0;

        log.debug("Starting data consistency validation: dataType={}, ruleCount={}, context={}",
            data == null ? "null" : data.getClass().getSimpleName(), rulesToApply.size(), context);

        for (ConsistencyRule rule : rulesToApply) {
            Instant checkStart = clock.instant();
            ConsistencyCheck check;
            try {
                boolean valid = rule.validate(data);
                ConsistencyCheck.ConsistencyCheckBuilder builder = ConsistencyCheck.builder()
                    .ruleName(rule.getName())
                    .passed(valid)
                    .message(valid ? "Validation passed" : "Validation failed")
                    .severity(rule.getSeverity())
                    .timestamp(clock.instant())
                    .data(settings.isLogAllChecks() ? data : null);

                if (!valid && settings.isEnableAutoRepair() && rule.isAutoRepair() && rule.canRepair()) {
                    RepairOutcome repair = attemptRepair(rule, data);
                    builder.repairAttempted(true).repairSuccessful(repair.isSuccess());
                    if (repair.isSuccess()) {
                        builder.passed(true)
                            .message("Validation failed but auto-repair successful")
                            .repairedData(repair.getRepairedData());
                    } else {
                        builder.message("Validation failed and auto-repair failed: " + repair.getError());
                    }
                }
                check = builder.build();
            } catch (RuntimeException e) {
                log.error("Consistency check error: ruleName={}, error={}", rule.getName(), e.getMessage());
                check = ConsistencyCheck.builder()
                    .ruleName(rule.getName())
                    .passed(false)
                    .message("Validation error: " + e.getMessage())
                    .severity(rule.getSeverity())
                    .timestamp(clock.instant())
                    .data(settings.isLogAllChecks() ? data : null)
                    .build();
            }

            if (!check.isPassed()) {
                failedChecks++;
                if (rule.getSeverity() == ConsistencySeverity.CRITICAL) {
                    criticalFailures++;
                } else if (rule.getSeverity() == ConsistencySeverity.WARNING) {
                    warnings++;
                }
            }
            checks.add(check);

            log.debug("Consistency check completed: ruleName={}, passed={}, durationMs={}, repairAttempted={}, repairSuccessful={}",
                rule.getName(), check.isPassed(), Duration.between(checkStart, clock.instant()).toMillis(),
                check.isRepairAttempted(), check.isRepairSuccessful());
        }

        checkHistory.addAll(checks);

        HealthStatus overallStatus;
        if (criticalFailures > 0) {
            overallStatus = HealthStatus.CRITICAL;
        } else if (failedChecks > 0) {
            overallStatus = HealthStatus.DEGRADED;
        } else {
            overallStatus = HealthStatus.HEALTHY;
        }

        ConsistencyReport report = ConsistencyReport.builder()
            .overallStatus(overallStatus)
            .totalChecks(checks.size())
            .passedChecks(checks.size() - failedChecks)
            .failedChecks(failedChecks)
            .criticalFailures(criticalFailures)
            .warnings(warnings)
            .checks(List.copyOf(checks))
            .timestamp(clock.instant())
            .duration(Duration.between(start, clock.instant()))
            .build();

        log.info("Data consistency validation completed: overallStatus={}, totalChecks={}, passedChecks={}, failedChecks={}, criticalFailures={}, durationMs={}",
            overallStatus, report.getTotalChecks(), report.getPassedChecks(), failedChecks, criticalFailures,
            report.getDuration().toMillis());
        return report;
    }

    /**
     * Repairs {@code data} with the named rule outside the automatic repair budget.
     */
    public RepairOutcome repairData(String ruleName, Object data) {
        ConsistencyRule rule;
        synchronized (rules) {
            rule = rules.get(ruleName);
        }
        if (rule == null) {
            return RepairOutcome.failed("Rule '" + ruleName + "' not found");
        }
        if (!rule.canRepair()) {
            return RepairOutcome.failed("No repair function available for this rule");
        }

        try {
            Object repaired = rule.repair(data);
            if (rule.validate(repaired)) {
                log.info("Manual data repair successful: ruleName={}", ruleName);
                return RepairOutcome.repaired(repaired);
            }
            return RepairOutcome.failed("Repaired data failed validation");
        } catch (RuntimeException e) {
            log.warn("Manual data repair failed: ruleName={}, error={}", ruleName, e.getMessage());
            return RepairOutcome.failed(e.getMessage());
        }
    }

    public List<ConsistencyCheck> getCheckHistory(int limit) {
        return checkHistory.latest(limit);
    }

    public Map<String, Integer> getRepairHistory() {
        Map<String, Integer> history = new TreeMap<>();
        repairCounts.forEach((name, count) -> history.put(name, count.get()));
        return history;
    }

    public void clearCheckHistory() {
        checkHistory.clear();
        log.info("Consistency check history cleared");
    }

    public void resetRepairHistory() {
        repairCounts.clear();
        log.info("Repair history reset");
    }

    public List<ConsistencyRule> getRegisteredRules() {
        synchronized (rules) {
            return List.copyOf(rules.values());
        }
    }

    private RepairOutcome attemptRepair(ConsistencyRule rule, Object data) {
        AtomicInteger repairCount = repairCounts.computeIfAbsent(rule.getName(), name -> new AtomicInteger());
        synchronized (repairCount) {
            if (repairCount.get() >= settings.getMaxRepairAttempts()) {
                return RepairOutcome.failed("Maximum repair attempts exceeded");
            }

            Object backup = settings.isBackupBeforeRepair() ? snapshotOf(data) : null;
            try {
                Object repaired = rule.repair(data);
                if (rule.validate(repaired)) {
                    int count = repairCount.incrementAndGet();
                    log.info("Data repair successful: ruleName={}, repairCount={}", rule.getName(), count);
                    return RepairOutcome.repaired(repaired);
                }
                restore(data, backup);
                log.warn("Data repair failed validation: ruleName={}, repairCount={}", rule.getName(), repairCount.get());
                return RepairOutcome.failed("Repaired data failed validation");
            } catch (RuntimeException e) {
                restore(data, backup);
                log.error("Data repair error: ruleName={}, error={}", rule.getName(), e.getMessage());
                return RepairOutcome.failed(e.getMessage());
            }
        }
    }

    private static Object snapshotOf(Object data) {
        return data instanceof Snapshottable ? ((Snapshottable<?>) data).snapshot() : null;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static void restore(Object data, Object backup) {
        if (backup != null) {
            ((Snapshottable) data).restore((Snapshottable) backup);
        }
    }
}
