package com.example.measure.system;

import com.example.measure.MeasureEnvironment;

import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * System properties that do not change between snapshots of the same machine.
 *
 * <p>Shared by every {@link SystemSnapshot} derived from the same initialization.
 * Only the control-group root changes after construction, through
 * {@link SystemSnapshot#selectGroup(String)}.
 */
public final class CommonSystemData {

    private final MeasureEnvironment environment;
    private final SystemPaths paths;
    private final MemoryTotals memoryTotals;
    private final OptionalLong cpuMaxFrequencyKhz;
    private Path cgroupRoot;

    CommonSystemData(
            MeasureEnvironment environment,
            SystemPaths paths,
            MemoryTotals memoryTotals,
            OptionalLong cpuMaxFrequencyKhz
    ) {
        this.environment = environment;
        this.paths = paths;
        this.memoryTotals = memoryTotals;
        this.cpuMaxFrequencyKhz = cpuMaxFrequencyKhz;
    }

    /**
     * Total memory and swap, empty if they were not requested or could not be read.
     */
    public Optional<MemoryTotals> memoryTotals() {
        return Optional.ofNullable(memoryTotals);
    }

    public OptionalLong memTotalKb() {
        return memoryTotals == null ? OptionalLong.empty() : OptionalLong.of(memoryTotals.memTotalKb());
    }

    public OptionalLong swapTotalKb() {
        return memoryTotals == null ? OptionalLong.empty() : OptionalLong.of(memoryTotals.swapTotalKb());
    }

    public OptionalLong cpuMaxFrequencyKhz() {
        return cpuMaxFrequencyKhz;
    }

    /**
     * The selected control group directory, empty until one was selected.
     */
    public Optional<Path> cgroupRoot() {
        return Optional.ofNullable(cgroupRoot);
    }

    public MeasureEnvironment environment() {
        return environment;
    }

    SystemPaths paths() {
        return paths;
    }

    void cgroupRoot(Path cgroupRoot) {
        this.cgroupRoot = cgroupRoot;
    }

    @Override
    public String toString() {
        return "CommonSystemData[memoryTotals=" + memoryTotals
                + ", cpuMaxFrequencyKhz=" + cpuMaxFrequencyKhz
                + ", cgroupRoot=" + cgroupRoot + "]";
    }
}
