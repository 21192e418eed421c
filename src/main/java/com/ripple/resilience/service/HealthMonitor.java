package com.ripple.resilience.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Background task running the stale-health sweep of a {@link GracefulDegradation} at a
 * fixed interval. Owns its scheduler thread; {@link #stop()} cancels the sweep and shuts the
 * scheduler down.
 */
@Slf4j
public class HealthMonitor {

    private final GracefulDegradation degradation;
    private final Duration checkInterval;
    private ThreadPoolTaskScheduler scheduler;
    private ScheduledFuture<?> sweep;

    public HealthMonitor(GracefulDegradation degradation, Duration checkInterval) {
        this.degradation = degradation;
        this.checkInterval = checkInterval;
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("resilience-health-");
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        scheduler.initialize();

        sweep = scheduler.scheduleAtFixedRate(this::runSweep, checkInterval);
        log.info("Graceful degradation monitoring started: checkIntervalMs={}", checkInterval.toMillis());
    }

    public synchronized void stop() {
        if (!isRunning()) {
            return;
        }
        sweep.cancel(false);
        scheduler.shutdown();
        sweep = null;
        scheduler = null;
        log.info("Graceful degradation monitoring stopped");
    }

    public synchronized boolean isRunning() {
        return sweep != null && !sweep.isCancelled();
    }

    private void runSweep() {
        try {
            degradation.performHealthChecks();
        } catch (RuntimeException e) {
            // an escaping exception cancels all later runs of a fixed-rate task
            log.error("Health sweep failed: {}", e.getMessage(), e);
        }
    }
}
