package com.example.measure.system;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FrequencyResidencyTableTest {

    // =========================================================================
    // RECORDING
    // =========================================================================

    @Test
    @DisplayName("Recording a known frequency overwrites its ticks")
    void recordOverwrites() {
        FrequencyResidencyTable table = new FrequencyResidencyTable();
        table.record(500000, 10);
        table.record(250000, 20);

        table.record(500000, 15);

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.ticksAt(500000)).hasValue(15);
        assertThat(table.entries()).containsExactly(
                new FrequencyResidency(500000, 15),
                new FrequencyResidency(250000, 20));
    }

    @Test
    @DisplayName("Storage grows in chunks, not per entry")
    void storageGrowsInChunks() {
        // Given
        FrequencyResidencyTable table = new FrequencyResidencyTable();

        // When
        table.record(1, 1);

        // Then
        assertThat(table.capacity()).isEqualTo(FrequencyResidencyTable.CHUNK_SIZE);

        for (int i = 2; i <= FrequencyResidencyTable.CHUNK_SIZE; i++) {
            table.record(i, i);
        }
        assertThat(table.capacity()).isEqualTo(FrequencyResidencyTable.CHUNK_SIZE);

        table.record(FrequencyResidencyTable.CHUNK_SIZE + 1, 0);
        assertThat(table.size()).isEqualTo(FrequencyResidencyTable.CHUNK_SIZE + 1);
        assertThat(table.capacity()).isEqualTo(2 * FrequencyResidencyTable.CHUNK_SIZE);
        assertThat(table.ticksAt(1)).hasValue(1);
    }

    // =========================================================================
    // AVERAGE FREQUENCY
    // =========================================================================

    @Test
    @DisplayName("Average is weighted by the ticks spent at each frequency")
    void averageIsTickWeighted() {
        // Given
        FrequencyResidencyTable earlier = new FrequencyResidencyTable();
        earlier.record(100, 50);
        earlier.record(200, 30);
        FrequencyResidencyTable later = new FrequencyResidencyTable();
        later.record(100, 80);
        later.record(200, 70);

        // Then: (100 * 30 + 200 * 40) / 70
        assertThat(later.averageFrequencySince(earlier)).isEqualTo(157);
    }

    @Test
    @DisplayName("Frequencies are matched by value, not by position")
    void matchesByFrequency() {
        FrequencyResidencyTable earlier = new FrequencyResidencyTable();
        earlier.record(200, 30);
        earlier.record(100, 50);
        FrequencyResidencyTable later = new FrequencyResidencyTable();
        later.record(100, 80);
        later.record(200, 70);

        assertThat(later.averageFrequencySince(earlier)).isEqualTo(157);
    }

    @Test
    @DisplayName("A frequency missing from the earlier table counts from zero")
    void newFrequencyCountsFromZero() {
        FrequencyResidencyTable earlier = new FrequencyResidencyTable();
        earlier.record(100, 50);
        FrequencyResidencyTable later = new FrequencyResidencyTable();
        later.record(100, 50);
        later.record(300, 10);

        assertThat(later.averageFrequencySince(earlier)).isEqualTo(300);
    }

    @Test
    @DisplayName("No elapsed ticks averages to zero")
    void noTicksIsZero() {
        FrequencyResidencyTable table = new FrequencyResidencyTable();
        table.record(100, 50);

        assertThat(table.averageFrequencySince(table)).isZero();
        assertThat(new FrequencyResidencyTable().averageFrequencySince(table)).isZero();
    }

    @Test
    @DisplayName("A counter that went backwards contributes nothing")
    void backwardsCounterIgnored() {
        FrequencyResidencyTable earlier = new FrequencyResidencyTable();
        earlier.record(100, 50);
        earlier.record(200, 30);
        FrequencyResidencyTable later = new FrequencyResidencyTable();
        later.record(100, 40);
        later.record(200, 40);

        assertThat(later.averageFrequencySince(earlier)).isEqualTo(200);
    }

    @Test
    @DisplayName("Weighted sums beyond the range of a long still average correctly")
    void largeCountersDoNotOverflow() {
        // Given
        long ticks = Long.MAX_VALUE / 1000;
        FrequencyResidencyTable earlier = new FrequencyResidencyTable();
        FrequencyResidencyTable later = new FrequencyResidencyTable();
        later.record(2201000, ticks);
        later.record(1000000, ticks);

        // When
        long average = later.averageFrequencySince(earlier);

        // Then
        assertThat(average).isEqualTo(1600500);
    }
}
