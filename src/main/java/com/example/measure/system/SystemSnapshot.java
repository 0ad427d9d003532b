package com.example.measure.system;

import com.example.measure.MeasureEnvironment;
import com.example.measure.common.Initialization;
import com.example.measure.common.Outcome;
import com.example.measure.common.SharedData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;

/**
 * A point-in-time reading of system resource usage.
 *
 * <p>Snapshots of the same machine share one {@link CommonSystemData}. The first
 * snapshot allocates it, further snapshots are derived from a sample and share it;
 * only snapshots sharing it can be compared with {@link SystemDeltas}.
 *
 * <p>Example usage:
 * <pre>{@code
 * MeasureEnvironment env = MeasureEnvironment.defaults();
 * try (SystemSnapshot before = SystemSnapshot.initialize(env, SystemResource.defaults()).orElseThrow();
 *      SystemSnapshot after = SystemSnapshot.initialize(before).orElseThrow()) {
 *     before.refresh(SystemResource.defaults(), "before");
 *     doWork();
 *     after.refresh(SystemResource.defaults(), "after");
 *
 *     Delta usage = SystemDeltas.cpuUsage(before, after);     // percent * 100
 *     Delta freq = SystemDeltas.averageCpuFrequency(before, after);
 * }
 * }</pre>
 *
 * <p>Each resource group is either present or absent. A group is absent until it
 * was read, and becomes absent again when a later read of it fails, so a value is
 * never stale. Deltas refuse to use absent groups.
 *
 * <p>Not thread-safe, and neither is the Common Data shared between snapshots:
 * confine all snapshots of one machine to one thread or lock around refresh and
 * comparison.
 */
public final class SystemSnapshot implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SystemSnapshot.class);

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final SharedData<CommonSystemData> common;
    private final SystemResourceReader reader;
    private boolean closed;

    private String label;
    private OptionalLong timestamp = OptionalLong.empty();
    private MemoryUsage memoryUsage;
    private OptionalLong cgroupMemoryKb = OptionalLong.empty();
    private OptionalInt memoryWatermark = OptionalInt.empty();
    private CpuTicks cpuTicks;
    private final FrequencyResidencyTable frequencyTable = new FrequencyResidencyTable();
    private boolean frequencyTableRead;

    private SystemSnapshot(SharedData<CommonSystemData> common) {
        this.common = common;
        this.reader = new SystemResourceReader();
    }

    /**
     * Creates the first snapshot of a machine, allocating new Common Data.
     *
     * <p>{@link SystemResource#MEM_TOTALS} and {@link SystemResource#CPU_MAX_FREQ} are
     * read into the Common Data; {@link SystemResource#MEM_CGROUPS} selects the
     * control-group search root. Other flags are ignored here.
     *
     * @param environment where to read resources from
     * @param resources   the initialization-time groups to read
     * @return SUCCESS, PARTIAL with the groups that failed, or FAILED if the
     *         filesystem root does not exist
     */
    public static Initialization<SystemSnapshot, SystemResource> initialize(
            MeasureEnvironment environment,
            Set<SystemResource> resources
    ) {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(resources, "resources");
        if (!Files.isDirectory(environment.fsRoot())) {
            return Initialization.failed("Filesystem root " + environment.fsRoot() + " does not exist");
        }

        SystemPaths paths = SystemPaths.resolve(environment);
        SystemResourceReader reader = new SystemResourceReader();
        EnumSet<SystemResource> failed = EnumSet.noneOf(SystemResource.class);

        MemoryTotals totals = null;
        if (resources.contains(SystemResource.MEM_TOTALS)) {
            try {
                totals = reader.readMemoryTotals(paths.meminfo());
            } catch (IOException e) {
                logReadFailure(SystemResource.MEM_TOTALS, e);
                failed.add(SystemResource.MEM_TOTALS);
            }
        }
        OptionalLong maxFrequency = OptionalLong.empty();
        if (resources.contains(SystemResource.CPU_MAX_FREQ)) {
            try {
                maxFrequency = OptionalLong.of(reader.readMaxFrequency(paths.cpuMaxFrequency()));
            } catch (IOException e) {
                logReadFailure(SystemResource.CPU_MAX_FREQ, e);
                failed.add(SystemResource.CPU_MAX_FREQ);
            }
        }

        CommonSystemData data = new CommonSystemData(environment, paths, totals, maxFrequency);
        SharedData<CommonSystemData> shared = SharedData.create(data, SystemSnapshot::releaseCommon);
        environment.lifecycleListener().onAllocated(shared.id(), "system");
        log.debug("Allocated system common data #{}: {}", shared.id(), data);

        SystemSnapshot snapshot = new SystemSnapshot(shared);
        if (resources.contains(SystemResource.MEM_CGROUPS)) {
            snapshot.selectGroup(null);
        }
        return Initialization.of(snapshot, Outcome.<SystemResource>ofFailures(failed));
    }

    /**
     * Creates another snapshot of the machine a sample snapshot monitors, sharing
     * its Common Data. The new snapshot has no readings until refreshed.
     *
     * @param sample an open snapshot
     * @return SUCCESS, or FAILED if the sample was already closed
     */
    public static Initialization<SystemSnapshot, SystemResource> initialize(SystemSnapshot sample) {
        Objects.requireNonNull(sample, "sample");
        if (sample.closed) {
            return Initialization.failed("Sample snapshot is closed");
        }
        return Initialization.of(new SystemSnapshot(sample.common.retain()), Outcome.<SystemResource>success());
    }

    private static void releaseCommon(SharedData<CommonSystemData> shared) {
        CommonSystemData data = shared.value();
        data.cgroupRoot(null);
        log.debug("Released system common data #{}", shared.id());
        data.environment().lifecycleListener().onReleased(shared.id(), "system");
    }

    /**
     * Re-reads the requested resource groups.
     *
     * <p>Groups are read independently; a failed group is cleared and reported in
     * the outcome without stopping the others. Initialization-only flags are ignored.
     *
     * @param resources the groups to read
     * @param label     new snapshot label, or null to keep the current one
     * @return SUCCESS, PARTIAL with the groups that failed, or FAILED if the snapshot
     *         is closed (nothing is changed in that case)
     */
    public Outcome<SystemResource> refresh(Set<SystemResource> resources, String label) {
        Objects.requireNonNull(resources, "resources");
        if (closed) {
            return Outcome.failed("Snapshot is closed");
        }
        if (label != null) {
            this.label = label;
        }

        CommonSystemData data = common.value();
        SystemPaths paths = data.paths();
        EnumSet<SystemResource> failed = EnumSet.noneOf(SystemResource.class);

        if (resources.contains(SystemResource.TIMESTAMP)) {
            timestamp = OptionalLong.of(LocalTime.now(data.environment().clock()).toNanoOfDay() / NANOS_PER_MILLI);
        }
        if (resources.contains(SystemResource.MEM_USAGE)) {
            try {
                memoryUsage = reader.readMemoryUsage(paths.meminfo());
            } catch (IOException e) {
                memoryUsage = null;
                fail(failed, SystemResource.MEM_USAGE, e);
            }
        }
        if (resources.contains(SystemResource.MEM_CGROUPS)) {
            Optional<Path> cgroupRoot = data.cgroupRoot();
            if (cgroupRoot.isEmpty()) {
                log.debug("Cannot read {}: no control group selected", SystemResource.MEM_CGROUPS);
                cgroupMemoryKb = OptionalLong.empty();
                failed.add(SystemResource.MEM_CGROUPS);
            } else {
                try {
                    cgroupMemoryKb = OptionalLong.of(reader.readCgroupMemoryKb(cgroupRoot.get()));
                } catch (IOException e) {
                    cgroupMemoryKb = OptionalLong.empty();
                    fail(failed, SystemResource.MEM_CGROUPS, e);
                }
            }
        }
        if (resources.contains(SystemResource.MEM_WATERMARK)) {
            try {
                memoryWatermark = OptionalInt.of(reader.readWatermarks(paths.lowWatermark(), paths.highWatermark()));
            } catch (IOException e) {
                memoryWatermark = OptionalInt.empty();
                fail(failed, SystemResource.MEM_WATERMARK, e);
            }
        }
        if (resources.contains(SystemResource.CPU_USAGE)) {
            try {
                cpuTicks = reader.readCpuTicks(paths.stat());
            } catch (IOException e) {
                cpuTicks = null;
                fail(failed, SystemResource.CPU_USAGE, e);
            }
        }
        if (resources.contains(SystemResource.CPU_FREQ)) {
            try {
                reader.readTimeInState(paths.timeInState(), frequencyTable);
                frequencyTableRead = true;
            } catch (IOException e) {
                frequencyTableRead = false;
                fail(failed, SystemResource.CPU_FREQ, e);
            }
        }
        return Outcome.ofFailures(failed);
    }

    /**
     * Selects the control group whose memory usage {@link SystemResource#MEM_CGROUPS}
     * reports, for every snapshot sharing this snapshot's Common Data.
     *
     * @param pattern substring of the group path; null or empty selects the search root
     * @return the selected group directory
     */
    public Path selectGroup(String pattern) {
        CommonSystemData data = common.value();
        Path selected = new CgroupSelector(data.environment()).select(pattern);
        data.cgroupRoot(selected);
        log.debug("Selected control group {} for system common data #{}", selected, common.id());
        return selected;
    }

    /**
     * Releases this snapshot's reference to the Common Data. Closing twice has no
     * further effect.
     */
    @Override
    public void close() {
        if (closed) {
            log.warn("System snapshot '{}' of common data #{} closed twice", label, common.id());
            return;
        }
        closed = true;
        label = null;
        common.release();
    }

    /**
     * Checks whether two snapshots monitor the same Common Data instance.
     */
    public boolean isComparableTo(SystemSnapshot other) {
        return other != null && common.sameIdentity(other.common);
    }

    public CommonSystemData common() {
        return common.value();
    }

    /**
     * The identity of the shared Common Data.
     */
    public long commonId() {
        return common.id();
    }

    /**
     * Number of open snapshots sharing this snapshot's Common Data.
     */
    public int commonRefCount() {
        return common.refCount();
    }

    public boolean isClosed() {
        return closed;
    }

    public Optional<String> label() {
        return Optional.ofNullable(label);
    }

    /**
     * Milliseconds since local midnight at the last refresh.
     */
    public OptionalLong timestamp() {
        return timestamp;
    }

    public Optional<MemoryUsage> memoryUsage() {
        return Optional.ofNullable(memoryUsage);
    }

    /**
     * Memory in use including swap, present when both the totals and the usage
     * were read.
     */
    public OptionalLong memoryUsed() {
        Optional<MemoryTotals> totals = common.value().memoryTotals();
        if (memoryUsage == null || totals.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(memoryUsage.usedKb(totals.get()));
    }

    public OptionalLong cgroupMemoryKb() {
        return cgroupMemoryKb;
    }

    /**
     * Watermark bitmask, see {@link MemoryWatermark}.
     */
    public OptionalInt memoryWatermark() {
        return memoryWatermark;
    }

    public Optional<CpuTicks> cpuTicks() {
        return Optional.ofNullable(cpuTicks);
    }

    /**
     * The frequency residency table, empty if it was never read successfully.
     */
    public Optional<FrequencyResidencyTable> frequencyTable() {
        return frequencyTableRead ? Optional.of(frequencyTable) : Optional.empty();
    }

    private static void fail(Set<SystemResource> failed, SystemResource resource, IOException e) {
        logReadFailure(resource, e);
        failed.add(resource);
    }

    private static void logReadFailure(SystemResource resource, IOException e) {
        log.debug("Cannot read {}: {}", resource, e.toString());
    }

    @Override
    public String toString() {
        return "SystemSnapshot[label=" + label
                + ", common=#" + common.id()
                + ", timestamp=" + timestamp
                + ", memoryUsage=" + memoryUsage
                + ", cpuTicks=" + cpuTicks
                + ", frequencies=" + frequencyTable.size() + "]";
    }
}
