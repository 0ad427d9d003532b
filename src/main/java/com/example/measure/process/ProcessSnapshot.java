package com.example.measure.process;

import com.example.measure.MeasureEnvironment;
import com.example.measure.common.Initialization;
import com.example.measure.common.Outcome;
import com.example.measure.common.SharedData;
import com.example.measure.source.ProcessInfoReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * A point-in-time reading of one process's memory and CPU time.
 *
 * <p>Works like {@link com.example.measure.system.SystemSnapshot}: snapshots of one
 * process share a {@link CommonProcessData}, and only those can be compared with
 * {@link ProcessDeltas}. In addition every refresh first checks that the process
 * still exists.
 *
 * <p>Not thread-safe.
 */
public final class ProcessSnapshot implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessSnapshot.class);

    private final SharedData<CommonProcessData> common;
    private final ProcessResourceReader reader;
    private boolean closed;

    private String label;
    private ProcessMemory memory;
    private ProcessCpuTicks cpuTicks;

    private ProcessSnapshot(SharedData<CommonProcessData> common) {
        this.common = common;
        this.reader = new ProcessResourceReader();
    }

    /**
     * Creates the first snapshot of a process, allocating new Common Data.
     *
     * <p>The process's file paths and display name are resolved here. No resource
     * group is read at initialization, the flags are accepted for symmetry with
     * system snapshots.
     *
     * @param environment where to read resources from
     * @param pid         the process to monitor
     * @param resources   currently unused
     * @return SUCCESS, or FAILED if the process does not exist
     */
    public static Initialization<ProcessSnapshot, ProcessResource> initialize(
            MeasureEnvironment environment,
            int pid,
            Set<ProcessResource> resources
    ) {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(resources, "resources");
        ProcessInfoReader info = new ProcessInfoReader(environment);
        if (!info.isAlive(pid)) {
            return Initialization.failed("Process " + pid + " does not exist");
        }

        String name = info.displayName(pid).orElse(null);
        CommonProcessData data = new CommonProcessData(
                environment, pid, info.procFile(pid, "smaps"), info.procFile(pid, "stat"), name);
        SharedData<CommonProcessData> shared = SharedData.create(data, ProcessSnapshot::releaseCommon);
        environment.lifecycleListener().onAllocated(shared.id(), "process");
        log.debug("Allocated process common data #{}: {}", shared.id(), data);
        return Initialization.of(new ProcessSnapshot(shared), Outcome.<ProcessResource>success());
    }

    /**
     * Creates another snapshot of the process a sample snapshot monitors, sharing
     * its Common Data.
     *
     * @param sample an open snapshot
     * @return SUCCESS, or FAILED if the sample was already closed
     */
    public static Initialization<ProcessSnapshot, ProcessResource> initialize(ProcessSnapshot sample) {
        Objects.requireNonNull(sample, "sample");
        if (sample.closed) {
            return Initialization.failed("Sample snapshot is closed");
        }
        return Initialization.of(new ProcessSnapshot(sample.common.retain()), Outcome.<ProcessResource>success());
    }

    private static void releaseCommon(SharedData<CommonProcessData> shared) {
        CommonProcessData data = shared.value();
        data.name(null);
        log.debug("Released process common data #{} (pid {})", shared.id(), data.pid());
        data.environment().lifecycleListener().onReleased(shared.id(), "process");
    }

    /**
     * Re-reads the requested resource groups.
     *
     * @param resources the groups to read
     * @param label     new snapshot label, or null to keep the current one
     * @return SUCCESS, PARTIAL with the groups that failed, or FAILED if the snapshot
     *         is closed or the process exited; nothing is changed when FAILED
     */
    public Outcome<ProcessResource> refresh(Set<ProcessResource> resources, String label) {
        Objects.requireNonNull(resources, "resources");
        if (closed) {
            return Outcome.failed("Snapshot is closed");
        }
        CommonProcessData data = common.value();
        if (!Files.exists(data.statPath())) {
            return Outcome.failed("Process " + data.pid() + " has exited");
        }
        if (label != null) {
            this.label = label;
        }

        EnumSet<ProcessResource> failed = EnumSet.noneOf(ProcessResource.class);
        if (resources.contains(ProcessResource.MEM_USAGE)) {
            try {
                memory = reader.readMemory(data.smapsPath());
            } catch (IOException e) {
                memory = null;
                fail(failed, ProcessResource.MEM_USAGE, e);
            }
        }
        if (resources.contains(ProcessResource.CPU_USAGE)) {
            try {
                cpuTicks = reader.readCpuTicks(data.statPath());
            } catch (IOException e) {
                cpuTicks = null;
                fail(failed, ProcessResource.CPU_USAGE, e);
            }
        }
        return Outcome.ofFailures(failed);
    }

    /**
     * Re-resolves the display name of the process, for every snapshot sharing this
     * snapshot's Common Data. Counters are left alone.
     *
     * @return SUCCESS, or FAILED if the snapshot is closed or no name could be resolved
     *         (the previous name is kept then)
     */
    public Outcome<ProcessResource> reidentify() {
        if (closed) {
            return Outcome.failed("Snapshot is closed");
        }
        CommonProcessData data = common.value();
        Optional<String> name = new ProcessInfoReader(data.environment()).displayName(data.pid());
        if (name.isEmpty()) {
            return Outcome.failed("Cannot resolve the name of process " + data.pid());
        }
        data.name(name.get());
        return Outcome.success();
    }

    /**
     * Releases this snapshot's reference to the Common Data. Closing twice has no
     * further effect.
     */
    @Override
    public void close() {
        if (closed) {
            log.warn("Process snapshot '{}' of common data #{} closed twice", label, common.id());
            return;
        }
        closed = true;
        label = null;
        common.release();
    }

    public boolean isComparableTo(ProcessSnapshot other) {
        return other != null && common.sameIdentity(other.common);
    }

    public CommonProcessData common() {
        return common.value();
    }

    public long commonId() {
        return common.id();
    }

    public int commonRefCount() {
        return common.refCount();
    }

    public boolean isClosed() {
        return closed;
    }

    public Optional<String> label() {
        return Optional.ofNullable(label);
    }

    public Optional<ProcessMemory> memory() {
        return Optional.ofNullable(memory);
    }

    public Optional<ProcessCpuTicks> cpuTicks() {
        return Optional.ofNullable(cpuTicks);
    }

    /**
     * Private dirty plus swapped memory (kB), present when memory was read.
     */
    public OptionalLong privateDirtySum() {
        return memory == null ? OptionalLong.empty() : OptionalLong.of(memory.privateDirtySum());
    }

    private static void fail(Set<ProcessResource> failed, ProcessResource resource, IOException e) {
        log.debug("Cannot read {}: {}", resource, e.toString());
        failed.add(resource);
    }

    @Override
    public String toString() {
        return "ProcessSnapshot[label=" + label
                + ", common=#" + common.id()
                + ", memory=" + memory
                + ", cpuTicks=" + cpuTicks + "]";
    }
}
