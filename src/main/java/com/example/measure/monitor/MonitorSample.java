package com.example.measure.monitor;

import com.example.measure.common.Delta;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.OptionalLong;

/**
 * One line of monitor output: what changed since the previous sample.
 *
 * <p>Values that could not be read or compared are null and left out of the JSON
 * form. Percentages are stored times 100, e.g. 832 for 8.32%.
 *
 * @param sequence             1 for the first sample, counting up
 * @param elapsedMs            wall-clock time since the previous sample
 * @param memoryUsedKb         system memory in use, including swap
 * @param memoryChangeKb       change of {@code memoryUsedKb}
 * @param cpuUsage             system CPU usage, percent times 100
 * @param cpuFrequencyKhz      tick-weighted average CPU frequency
 * @param cgroupMemoryChangeKb change of the selected control group's memory, when one is selected
 * @param process              the monitored process, when there is one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonitorSample(
        long sequence,
        Long elapsedMs,
        Long memoryUsedKb,
        Long memoryChangeKb,
        Long cpuUsage,
        Long cpuFrequencyKhz,
        Long cgroupMemoryChangeKb,
        ProcessSample process
) {

    static Long valueOf(Delta delta) {
        return delta.isValid() ? delta.getAsLong() : null;
    }

    static Long valueOf(OptionalLong value) {
        return value.isPresent() ? value.getAsLong() : null;
    }
}
