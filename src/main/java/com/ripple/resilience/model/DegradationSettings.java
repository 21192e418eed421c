package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

@Getter
@ToString
@Builder(toBuilder = true)
public class DegradationSettings {

    /**
     * Period of the background health sweep.
     */
    @Builder.Default
    private Duration checkInterval = Duration.ofSeconds(30);

    @Builder.Default
    private int degradationThreshold = 3;

    @Builder.Default
    private int recoveryThreshold = 5;

    /**
     * Records untouched for longer than this have their counters cleared by the sweep.
     */
    @Builder.Default
    private Duration monitoringWindow = Duration.ofMinutes(5);

    @Builder.Default
    private boolean enableFallbacks = true;

    @Builder.Default
    private boolean autoRecovery = true;

    public static DegradationSettings defaults() {
        return DegradationSettings.builder().build();
    }
}
