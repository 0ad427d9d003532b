package com.example.measure.monitor;

import com.example.measure.MeasureEnvironment;
import com.example.measure.common.Delta;
import com.example.measure.common.Initialization;
import com.example.measure.common.Outcome;
import com.example.measure.process.CommonProcessData;
import com.example.measure.process.ProcessDeltas;
import com.example.measure.process.ProcessMemory;
import com.example.measure.process.ProcessResource;
import com.example.measure.process.ProcessSnapshot;
import com.example.measure.system.SystemDeltas;
import com.example.measure.system.SystemResource;
import com.example.measure.system.SystemSnapshot;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Samples system, and optionally process, resource usage at an interval.
 *
 * <p>Keeps two snapshots per target sharing one Common Data. Each sample refreshes
 * the older snapshot, compares it with the newer one and then swaps them, so no
 * snapshot is allocated after {@link #open}.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (ResourceMonitor monitor = ResourceMonitor.open(MeasureEnvironment.defaults(), OptionalInt.of(pid), null)) {
 *     monitor.samples(Duration.ofSeconds(1))
 *         .take(10)
 *         .doOnNext(System.out::println)
 *         .blockLast();
 * }
 * }</pre>
 *
 * <p>A monitor must be used from one thread at a time; a {@link Flux} returned by
 * {@link #samples} serializes its signals and satisfies that.
 */
public final class ResourceMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResourceMonitor.class);

    private final Set<SystemResource> systemResources;
    private SystemSnapshot previousSystem;
    private SystemSnapshot currentSystem;
    private ProcessSnapshot previousProcess;
    private ProcessSnapshot currentProcess;
    private long sequence;
    private boolean closed;

    private ResourceMonitor(Set<SystemResource> systemResources,
                            SystemSnapshot previousSystem, SystemSnapshot currentSystem,
                            ProcessSnapshot previousProcess, ProcessSnapshot currentProcess) {
        this.systemResources = systemResources;
        this.previousSystem = previousSystem;
        this.currentSystem = currentSystem;
        this.previousProcess = previousProcess;
        this.currentProcess = currentProcess;
    }

    /**
     * Initializes the snapshots and takes the initial reading.
     *
     * @param environment   where to read resources from
     * @param pid           process to monitor as well, if any
     * @param cgroupPattern control group to report memory of, or null for none
     * @throws MonitorException if the system cannot be read or the process does not exist
     */
    public static ResourceMonitor open(MeasureEnvironment environment, OptionalInt pid, String cgroupPattern) {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(pid, "pid");
        EnumSet<SystemResource> resources = SystemResource.defaults();
        if (cgroupPattern != null) {
            resources.add(SystemResource.MEM_CGROUPS);
        }

        SystemSnapshot first = initialized(SystemSnapshot.initialize(environment, resources), "system snapshot");
        SystemSnapshot second = initialized(SystemSnapshot.initialize(first), "second system snapshot");
        if (cgroupPattern != null) {
            log.info("Monitoring control group {}", first.selectGroup(cgroupPattern));
        }

        ProcessSnapshot firstProcess = null;
        ProcessSnapshot secondProcess = null;
        if (pid.isPresent()) {
            Initialization<ProcessSnapshot, ProcessResource> init =
                    ProcessSnapshot.initialize(environment, pid.getAsInt(), ProcessResource.all());
            if (init.isFailed()) {
                first.close();
                second.close();
                throw new MonitorException("Cannot monitor process " + pid.getAsInt() + ": " + init.outcome().reason());
            }
            firstProcess = init.orElseThrow();
            secondProcess = ProcessSnapshot.initialize(firstProcess).orElseThrow();
        }

        ResourceMonitor monitor = new ResourceMonitor(resources, first, second, firstProcess, secondProcess);
        monitor.readInitial();
        return monitor;
    }

    private static SystemSnapshot initialized(Initialization<SystemSnapshot, SystemResource> init, String what) {
        if (init.isFailed()) {
            throw new MonitorException("Cannot initialize " + what + ": " + init.outcome().reason());
        }
        if (init.outcome().isPartial()) {
            log.warn("Initialized {} without {}", what, init.outcome().failed());
        }
        return init.orElseThrow();
    }

    private void readInitial() {
        Outcome<SystemResource> system = previousSystem.refresh(systemResources, "0");
        if (!system.isSuccess()) {
            log.warn("Initial system reading incomplete: {}", system);
        }
        if (previousProcess != null && previousProcess.refresh(ProcessResource.all(), "0").isFailed()) {
            int pid = previousProcess.common().pid();
            close();
            throw new MonitorException("Process " + pid + " exited");
        }
    }

    /**
     * Takes the next sample, comparing it with the previous one.
     *
     * @throws MonitorException if the monitor is closed or the monitored process exited
     */
    public MonitorSample sample() {
        if (closed) {
            throw new MonitorException("Monitor is closed");
        }
        String label = Long.toString(sequence + 1);
        Outcome<SystemResource> system = currentSystem.refresh(systemResources, label);
        if (system.isFailed()) {
            throw new MonitorException("Cannot refresh system snapshot: " + system.reason());
        }
        if (system.isPartial()) {
            log.debug("Sample {} lacks {}", label, system.failed());
        }

        ProcessSample process = null;
        if (currentProcess != null) {
            Outcome<ProcessResource> outcome = currentProcess.refresh(ProcessResource.all(), label);
            if (outcome.isFailed()) {
                throw new MonitorException(outcome.reason());
            }
            process = processSample();
        }

        sequence++;
        MonitorSample sample = new MonitorSample(
                sequence,
                MonitorSample.valueOf(SystemDeltas.elapsedMillis(previousSystem, currentSystem)),
                MonitorSample.valueOf(currentSystem.memoryUsed()),
                MonitorSample.valueOf(SystemDeltas.memoryUsed(previousSystem, currentSystem)),
                MonitorSample.valueOf(SystemDeltas.cpuUsage(previousSystem, currentSystem)),
                MonitorSample.valueOf(SystemDeltas.averageCpuFrequency(previousSystem, currentSystem)),
                systemResources.contains(SystemResource.MEM_CGROUPS)
                        ? MonitorSample.valueOf(SystemDeltas.cgroupMemory(previousSystem, currentSystem))
                        : null,
                process
        );
        swap();
        return sample;
    }

    private ProcessSample processSample() {
        CommonProcessData data = currentProcess.common();
        Optional<ProcessMemory> memory = currentProcess.memory();
        Delta systemTicks = SystemDeltas.cpuTicks(previousSystem, currentSystem);
        Delta processTicks = ProcessDeltas.cpuTicks(previousProcess, currentProcess);
        Long cpuUsage = null;
        if (systemTicks.isValid() && processTicks.isValid()) {
            cpuUsage = systemTicks.getAsLong() == 0
                    ? 0L
                    : processTicks.getAsLong() * 10_000 / systemTicks.getAsLong();
        }
        return new ProcessSample(
                data.pid(),
                data.name().orElse(null),
                memory.map(ProcessMemory::privateClean).orElse(null),
                memory.map(ProcessMemory::privateDirtySum).orElse(null),
                MonitorSample.valueOf(ProcessDeltas.privateDirty(previousProcess, currentProcess)),
                cpuUsage
        );
    }

    private void swap() {
        SystemSnapshot system = previousSystem;
        previousSystem = currentSystem;
        currentSystem = system;
        ProcessSnapshot process = previousProcess;
        previousProcess = currentProcess;
        currentProcess = process;
    }

    /**
     * Samples once per interval until the subscriber cancels or the monitored
     * process exits (signalled as a {@link MonitorException} error).
     */
    public Flux<MonitorSample> samples(Duration interval) {
        return samples(Flux.interval(interval));
    }

    /**
     * Samples once per element emitted by {@code ticks}.
     */
    public Flux<MonitorSample> samples(Publisher<?> ticks) {
        return Flux.from(ticks).map(tick -> sample());
    }

    /**
     * The monitored process, if any.
     */
    public Optional<CommonProcessData> process() {
        return currentProcess == null ? Optional.empty() : Optional.of(currentProcess.common());
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        previousSystem.close();
        currentSystem.close();
        if (previousProcess != null) {
            previousProcess.close();
            currentProcess.close();
        }
    }
}
