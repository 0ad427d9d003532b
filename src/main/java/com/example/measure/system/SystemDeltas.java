package com.example.measure.system;

import com.example.measure.common.Delta;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Differences between two system snapshots of the same Common Data.
 *
 * <p>Every method takes the earlier snapshot first. The result is invalid when the
 * snapshots do not share Common Data, or when a value the calculation needs is
 * absent on either side.
 */
public final class SystemDeltas {

    /** Milliseconds in a day, added when the clock passed midnight between snapshots. */
    public static final long DAY_MILLIS = 24L * 60 * 60 * 1000;

    static final String NOT_COMPARABLE = "snapshots do not share common data";

    private SystemDeltas() {
    }

    /**
     * Wall-clock time between two snapshots (ms), in {@code [0, DAY_MILLIS)}.
     *
     * <p>Timestamps count from local midnight, so a later timestamp smaller than the
     * earlier one means midnight passed in between.
     */
    public static Delta elapsedMillis(SystemSnapshot earlier, SystemSnapshot later) {
        if (!comparable(earlier, later)) {
            return Delta.invalid(NOT_COMPARABLE);
        }
        OptionalLong start = earlier.timestamp();
        OptionalLong end = later.timestamp();
        if (start.isEmpty() || end.isEmpty()) {
            return missing(SystemResource.TIMESTAMP);
        }
        long elapsed = end.getAsLong() - start.getAsLong();
        if (elapsed < 0) {
            elapsed += DAY_MILLIS;
        }
        return Delta.of(elapsed);
    }

    /**
     * Total CPU ticks elapsed between two snapshots.
     */
    public static Delta cpuTicks(SystemSnapshot earlier, SystemSnapshot later) {
        if (!comparable(earlier, later)) {
            return Delta.invalid(NOT_COMPARABLE);
        }
        Optional<CpuTicks> start = earlier.cpuTicks();
        Optional<CpuTicks> end = later.cpuTicks();
        if (start.isEmpty() || end.isEmpty()) {
            return missing(SystemResource.CPU_USAGE);
        }
        return Delta.of(end.get().total() - start.get().total());
    }

    /**
     * CPU usage between two snapshots as percent times 100, e.g. 832 for 8.32%.
     *
     * <p>Computed as {@code (dTotal - dIdle) * 10000 / dTotal}; 0 when no ticks elapsed.
     */
    public static Delta cpuUsage(SystemSnapshot earlier, SystemSnapshot later) {
        if (!comparable(earlier, later)) {
            return Delta.invalid(NOT_COMPARABLE);
        }
        Optional<CpuTicks> start = earlier.cpuTicks();
        Optional<CpuTicks> end = later.cpuTicks();
        if (start.isEmpty() || end.isEmpty()) {
            return missing(SystemResource.CPU_USAGE);
        }
        long totalDelta = end.get().total() - start.get().total();
        if (totalDelta == 0) {
            return Delta.of(0);
        }
        long idleDelta = end.get().idle() - start.get().idle();
        return Delta.of((totalDelta - idleDelta) * 10_000 / totalDelta);
    }

    /**
     * Tick-weighted average CPU frequency (kHz) between two snapshots.
     *
     * @see FrequencyResidencyTable#averageFrequencySince(FrequencyResidencyTable)
     */
    public static Delta averageCpuFrequency(SystemSnapshot earlier, SystemSnapshot later) {
        if (!comparable(earlier, later)) {
            return Delta.invalid(NOT_COMPARABLE);
        }
        Optional<FrequencyResidencyTable> start = earlier.frequencyTable();
        Optional<FrequencyResidencyTable> end = later.frequencyTable();
        if (start.isEmpty() || end.isEmpty()) {
            return missing(SystemResource.CPU_FREQ);
        }
        return Delta.of(end.get().averageFrequencySince(start.get()));
    }

    /**
     * Change of used memory (kB) between two snapshots.
     *
     * @see SystemSnapshot#memoryUsed()
     */
    public static Delta memoryUsed(SystemSnapshot earlier, SystemSnapshot later) {
        if (!comparable(earlier, later)) {
            return Delta.invalid(NOT_COMPARABLE);
        }
        if (earlier.common().memoryTotals().isEmpty()) {
            return missing(SystemResource.MEM_TOTALS);
        }
        OptionalLong start = earlier.memoryUsed();
        OptionalLong end = later.memoryUsed();
        if (start.isEmpty() || end.isEmpty()) {
            return missing(SystemResource.MEM_USAGE);
        }
        return Delta.of(end.getAsLong() - start.getAsLong());
    }

    /**
     * Change of the selected control group's memory usage (kB) between two snapshots.
     */
    public static Delta cgroupMemory(SystemSnapshot earlier, SystemSnapshot later) {
        if (!comparable(earlier, later)) {
            return Delta.invalid(NOT_COMPARABLE);
        }
        OptionalLong start = earlier.cgroupMemoryKb();
        OptionalLong end = later.cgroupMemoryKb();
        if (start.isEmpty() || end.isEmpty()) {
            return missing(SystemResource.MEM_CGROUPS);
        }
        return Delta.of(end.getAsLong() - start.getAsLong());
    }

    private static boolean comparable(SystemSnapshot earlier, SystemSnapshot later) {
        return earlier != null && earlier.isComparableTo(later);
    }

    private static Delta missing(SystemResource resource) {
        return Delta.invalid(resource + " was not retrieved");
    }
}
