package com.example.measure.process;

import com.example.measure.MeasureEnvironment;
import com.example.measure.RootFs;
import com.example.measure.common.Initialization;
import com.example.measure.common.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessSnapshotTest {

    @TempDir
    Path root;

    private RootFs.LifecycleTracker tracker;
    private MeasureEnvironment environment;

    @BeforeEach
    void setUp() {
        RootFs.install("rootfs1", root);
        tracker = new RootFs.LifecycleTracker();
        environment = RootFs.environment(root).withLifecycleListener(tracker);
    }

    // =========================================================================
    // INITIALIZATION
    // =========================================================================

    @Test
    @DisplayName("Initialization resolves identity, paths and name")
    void initializeResolvesIdentity() {
        // When
        Initialization<ProcessSnapshot, ProcessResource> init =
                ProcessSnapshot.initialize(environment, RootFs.PID, ProcessResource.all());

        // Then
        assertThat(init.outcome().isSuccess()).isTrue();
        try (ProcessSnapshot snapshot = init.orElseThrow()) {
            CommonProcessData common = snapshot.common();
            assertThat(common.pid()).isEqualTo(RootFs.PID);
            assertThat(common.name()).contains("eclipse");
            assertThat(common.smapsPath()).isEqualTo(root.resolve("proc/25268/smaps"));
            assertThat(common.statPath()).isEqualTo(root.resolve("proc/25268/stat"));
            assertThat(tracker.allocated).containsExactly(snapshot.commonId());
        }
    }

    @Test
    @DisplayName("A process that does not exist cannot be monitored")
    void initializeFailsForMissingProcess() {
        Initialization<ProcessSnapshot, ProcessResource> init =
                ProcessSnapshot.initialize(environment, 1, ProcessResource.all());

        assertThat(init.isFailed()).isTrue();
        assertThat(init.outcome().reason()).contains("1");
        assertThat(tracker.allocated).isEmpty();
    }

    // =========================================================================
    // REFRESH
    // =========================================================================

    @Test
    @DisplayName("Refresh sums memory over all mappings and reads CPU ticks")
    void refreshReadsMemoryAndTicks() {
        try (ProcessSnapshot snapshot = ProcessSnapshot.initialize(environment, RootFs.PID, ProcessResource.all()).orElseThrow()) {
            // When
            Outcome<ProcessResource> outcome = snapshot.refresh(ProcessResource.all(), "first");

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(snapshot.label()).contains("first");
            assertThat(snapshot.memory()).contains(new ProcessMemory(
                    14104, 95992, 16192, 686500, 3540, 768, 110781, 114404, 68956));
            assertThat(snapshot.privateDirtySum()).hasValue(112184);
            assertThat(snapshot.cpuTicks()).contains(new ProcessCpuTicks(47282, 262287));
        }
    }

    @Test
    @DisplayName("A failed group is cleared while the other is still read")
    void failedGroupIsCleared() throws IOException {
        try (ProcessSnapshot snapshot = ProcessSnapshot.initialize(environment, RootFs.PID, ProcessResource.all()).orElseThrow()) {
            // Given
            snapshot.refresh(ProcessResource.all(), null);
            Files.delete(root.resolve("proc/25268/smaps"));

            // When
            Outcome<ProcessResource> outcome = snapshot.refresh(ProcessResource.all(), null);

            // Then
            assertThat(outcome.failed()).containsExactly(ProcessResource.MEM_USAGE);
            assertThat(snapshot.memory()).isEmpty();
            assertThat(snapshot.privateDirtySum()).isEmpty();
            assertThat(snapshot.cpuTicks()).isPresent();
        }
    }

    @Test
    @DisplayName("A command name with spaces and parentheses does not shift the tick fields")
    void commandNameWithParentheses() throws IOException {
        // Given
        String stat = Files.readString(root.resolve("proc/25268/stat"), StandardCharsets.UTF_8)
                .replace("(eclipse)", "(Web Content (1))");
        Files.writeString(root.resolve("proc/25268/stat"), stat, StandardCharsets.UTF_8);

        try (ProcessSnapshot snapshot = ProcessSnapshot.initialize(environment, RootFs.PID, ProcessResource.all()).orElseThrow()) {
            // When
            snapshot.refresh(ProcessResource.all(), null);

            // Then
            assertThat(snapshot.cpuTicks()).contains(new ProcessCpuTicks(47282, 262287));
        }
    }

    @Test
    @DisplayName("Bytes that are not UTF-8 in the command name and mapping paths are read")
    void nonUtf8BytesAreRead() throws IOException {
        // Given
        Path statFile = root.resolve("proc/25268/stat");
        Path smapsFile = root.resolve("proc/25268/smaps");
        String stat = Files.readString(statFile, StandardCharsets.UTF_8).replace("(eclipse)", "(caf\u00e9)");
        Files.write(statFile, stat.getBytes(StandardCharsets.ISO_8859_1));
        String smaps = Files.readString(smapsFile, StandardCharsets.UTF_8).replace("/lib/ld-2.10.1.so", "/tmp/caf\u00e9");
        Files.write(smapsFile, smaps.getBytes(StandardCharsets.ISO_8859_1));

        try (ProcessSnapshot snapshot = ProcessSnapshot.initialize(environment, RootFs.PID, ProcessResource.all()).orElseThrow()) {
            // When
            Outcome<ProcessResource> outcome = snapshot.refresh(ProcessResource.all(), null);

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(snapshot.privateDirtySum()).hasValue(112184);
            assertThat(snapshot.cpuTicks()).contains(new ProcessCpuTicks(47282, 262287));
        }
    }

    @Test
    @DisplayName("Refresh of an exited process fails without touching the snapshot")
    void refreshAfterExitFails() throws IOException {
        try (ProcessSnapshot snapshot = ProcessSnapshot.initialize(environment, RootFs.PID, ProcessResource.all()).orElseThrow()) {
            // Given
            snapshot.refresh(ProcessResource.all(), "alive");
            Files.delete(root.resolve("proc/25268/stat"));

            // When
            Outcome<ProcessResource> outcome = snapshot.refresh(ProcessResource.all(), "gone");

            // Then
            assertThat(outcome.isFailed()).isTrue();
            assertThat(snapshot.label()).contains("alive");
            assertThat(snapshot.memory()).isPresent();
            assertThat(snapshot.cpuTicks()).contains(new ProcessCpuTicks(47282, 262287));
        }
    }

    // =========================================================================
    // REIDENTIFY
    // =========================================================================

    @Test
    @DisplayName("Reidentify updates the shared name and nothing else")
    void reidentifyUpdatesName() throws IOException {
        try (ProcessSnapshot first = ProcessSnapshot.initialize(environment, RootFs.PID, ProcessResource.all()).orElseThrow();
             ProcessSnapshot second = ProcessSnapshot.initialize(first).orElseThrow()) {
            // Given
            first.refresh(ProcessResource.all(), null);
            RootFs.install("rootfs2", root);
            Files.write(root.resolve("proc/25268/cmdline"), "/usr/bin/java\0-jar\0app.jar\0".getBytes(StandardCharsets.UTF_8));

            // When
            Outcome<ProcessResource> outcome = first.reidentify();

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(second.common().name()).contains("java -jar app.jar");
            assertThat(first.cpuTicks()).contains(new ProcessCpuTicks(47282, 262287));
        }
    }

    @Test
    @DisplayName("Reidentify keeps the old name when no new one can be resolved")
    void reidentifyKeepsOldName() throws IOException {
        try (ProcessSnapshot snapshot = ProcessSnapshot.initialize(environment, RootFs.PID, ProcessResource.all()).orElseThrow()) {
            Files.delete(root.resolve("proc/25268/cmdline"));
            Files.delete(root.resolve("proc/25268/status"));

            assertThat(snapshot.reidentify().isFailed()).isTrue();
            assertThat(snapshot.common().name()).contains("eclipse");
        }
    }

    // =========================================================================
    // LIFECYCLE
    // =========================================================================

    @Test
    @DisplayName("Common Data is released when the last sharing snapshot closes")
    void commonDataReleasedWithLastSnapshot() {
        // Given
        ProcessSnapshot first = ProcessSnapshot.initialize(environment, RootFs.PID, ProcessResource.all()).orElseThrow();
        ProcessSnapshot second = ProcessSnapshot.initialize(first).orElseThrow();

        // When
        second.close();
        second.close();

        // Then
        assertThat(tracker.released).isEmpty();
        assertThat(first.commonRefCount()).isEqualTo(1);
        assertThat(second.refresh(ProcessResource.all(), null).isFailed()).isTrue();

        first.close();
        assertThat(tracker.released).containsExactly(first.commonId());
        assertThat(ProcessSnapshot.initialize(first).isFailed()).isTrue();
    }
}
