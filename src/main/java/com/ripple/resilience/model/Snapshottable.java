package com.ripple.resilience.model;

/**
 * Data that can be copied before an auto-repair and put back if the repair fails.
 *
 * @param <T> the implementing type
 */
public interface Snapshottable<T extends Snapshottable<T>> {

    /**
     * Returns an independent full copy of the current state.
     */
    T snapshot();

    /**
     * Overwrites the current state with a copy previously taken by {@link #snapshot()}.
     */
    void restore(T snapshot);
}
