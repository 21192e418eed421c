package com.ripple.resilience.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Mutable health record for one service. Callers receive copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ServiceHealth {
    private String serviceName;
    private boolean healthy;
    private int failureCount;
    private int successCount;
    private ServiceLevel currentLevel;
    private boolean fallbackActive;
    private Instant lastCheck;

    public ServiceHealth copy() {
        return toBuilder().build();
    }
}
