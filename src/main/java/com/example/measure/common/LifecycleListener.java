package com.example.measure.common;

/**
 * Observes allocation and release of shared Common Data.
 *
 * <p>Each allocation is followed by exactly one release once every snapshot
 * referencing the data has been closed.
 */
public interface LifecycleListener {

    LifecycleListener NONE = new LifecycleListener() {
    };

    /**
     * Called after Common Data was allocated for a new monitored target.
     *
     * @param id   the shared data identity
     * @param kind "system" or "process"
     */
    default void onAllocated(long id, String kind) {
    }

    /**
     * Called once the last snapshot referencing the Common Data released it.
     *
     * @param id   the shared data identity
     * @param kind "system" or "process"
     */
    default void onReleased(long id, String kind) {
    }
}
