package com.example.measure.system;

import java.util.EnumSet;

/**
 * System resource groups that can be requested when initializing or refreshing
 * a {@link SystemSnapshot}.
 */
public enum SystemResource {

    /** MemTotal and SwapTotal from meminfo, read once into Common Data. */
    MEM_TOTALS,
    /** Maximum CPU frequency of cpu0, read once into Common Data. */
    CPU_MAX_FREQ,
    /** Control-group memory usage; at initialization selects the default group. */
    MEM_CGROUPS,
    /** Milliseconds since local midnight. */
    TIMESTAMP,
    /** Free, buffer, cache and swap figures from meminfo. */
    MEM_USAGE,
    /** Low/high memory watermark flags exported by some kernels under /sys/kernel. */
    MEM_WATERMARK,
    /** Total and idle ticks from the aggregate cpu line of /proc/stat. */
    CPU_USAGE,
    /** Ticks spent per frequency, from cpu0's cpufreq time_in_state table. */
    CPU_FREQ;

    /**
     * Every group that exists on a typical Linux system: all but watermarks and
     * control groups.
     */
    public static EnumSet<SystemResource> defaults() {
        return EnumSet.complementOf(EnumSet.of(MEM_WATERMARK, MEM_CGROUPS));
    }

    public static EnumSet<SystemResource> all() {
        return EnumSet.allOf(SystemResource.class);
    }
}
