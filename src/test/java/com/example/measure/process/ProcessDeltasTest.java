package com.example.measure.process;

import com.example.measure.MeasureEnvironment;
import com.example.measure.RootFs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessDeltasTest {

    @TempDir
    Path root;

    private MeasureEnvironment environment;
    private ProcessSnapshot earlier;
    private ProcessSnapshot later;

    @BeforeEach
    void setUp() {
        RootFs.install("rootfs1", root);
        environment = RootFs.environment(root);
        earlier = ProcessSnapshot.initialize(environment, RootFs.PID, ProcessResource.all()).orElseThrow();
        later = ProcessSnapshot.initialize(earlier).orElseThrow();
    }

    @AfterEach
    void tearDown() {
        earlier.close();
        later.close();
    }

    @Test
    @DisplayName("Deltas between two readings of the same process")
    void deltasBetweenReadings() {
        // Given
        earlier.refresh(ProcessResource.all(), null);
        RootFs.install("rootfs2", root);

        // When
        later.refresh(ProcessResource.all(), null);

        // Then
        assertThat(later.privateDirtySum()).hasValue(112180);
        assertThat(ProcessDeltas.privateDirty(earlier, later).getAsLong()).isEqualTo(-4);
        assertThat(ProcessDeltas.cpuTicks(earlier, later).getAsLong()).isEqualTo(209);
    }

    @Test
    @DisplayName("Snapshots of separately initialized processes cannot be compared")
    void differentCommonDataIsInvalid() {
        earlier.refresh(ProcessResource.all(), null);

        try (ProcessSnapshot stranger = ProcessSnapshot.initialize(environment, RootFs.PID, ProcessResource.all()).orElseThrow()) {
            stranger.refresh(ProcessResource.all(), null);

            assertThat(ProcessDeltas.privateDirty(earlier, stranger).reason()).isEqualTo(ProcessDeltas.NOT_COMPARABLE);
            assertThat(ProcessDeltas.cpuTicks(earlier, stranger).isInvalid()).isTrue();
            assertThat(ProcessDeltas.cpuTicks(null, stranger).isInvalid()).isTrue();
        }
    }

    @Test
    @DisplayName("Groups missing on either side make the delta invalid")
    void missingGroupsAreInvalid() {
        earlier.refresh(ProcessResource.all(), null);
        later.refresh(EnumSet.of(ProcessResource.CPU_USAGE), null);

        assertThat(ProcessDeltas.cpuTicks(earlier, later).getAsLong()).isZero();
        assertThat(ProcessDeltas.privateDirty(earlier, later).reason()).contains("MEM_USAGE");
    }
}
