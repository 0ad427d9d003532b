package com.example.measure.monitor;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The monitored process's part of a {@link MonitorSample}.
 *
 * @param pid            process identifier
 * @param name           display name, null if unknown
 * @param privateCleanKb private clean memory
 * @param privateDirtyKb private dirty plus swapped memory
 * @param memoryChangeKb change of {@code privateDirtyKb}
 * @param cpuUsage       share of all CPU ticks the process used, percent times 100
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessSample(
        int pid,
        String name,
        Long privateCleanKb,
        Long privateDirtyKb,
        Long memoryChangeKb,
        Long cpuUsage
) {
}
