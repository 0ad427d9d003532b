package com.example.measure.system;

/**
 * Cumulative CPU time since boot, summed over all CPUs, in clock ticks.
 *
 * @param total ticks in every state
 * @param idle  ticks in the idle state
 */
public record CpuTicks(long total, long idle) {
}
