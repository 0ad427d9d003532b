package com.example.measure.system;

import com.example.measure.MeasureEnvironment;

import java.nio.file.Path;

/**
 * Kernel files consulted for system snapshots, resolved under one filesystem root.
 */
record SystemPaths(
        Path meminfo,
        Path stat,
        Path cpuMaxFrequency,
        Path timeInState,
        Path lowWatermark,
        Path highWatermark
) {
    static final String CGROUP_MEMORY_USAGE = "memory.memsw.usage_in_bytes";

    static SystemPaths resolve(MeasureEnvironment environment) {
        return new SystemPaths(
                environment.resolve("/proc/meminfo"),
                environment.resolve("/proc/stat"),
                environment.resolve("/sys/devices/system/cpu/cpu0/cpufreq/cpuinfo_max_freq"),
                environment.resolve("/sys/devices/system/cpu/cpu0/cpufreq/stats/time_in_state"),
                environment.resolve("/sys/kernel/low_watermark"),
                environment.resolve("/sys/kernel/high_watermark")
        );
    }
}
