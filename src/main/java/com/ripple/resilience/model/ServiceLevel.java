package com.ripple.resilience.model;

/**
 * Coarse availability tier. Higher rank means more features available.
 */
public enum ServiceLevel {
    EMERGENCY(1),
    LIMITED(2),
    DEGRADED(3),
    FULL(4);

    private final int rank;

    ServiceLevel(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Next tier up, or this tier when already at {@link #FULL}.
     */
    public ServiceLevel next() {
        return this == FULL ? FULL : values()[ordinal() + 1];
    }

    public boolean isAtMost(ServiceLevel other) {
        return rank <= other.rank;
    }
}
