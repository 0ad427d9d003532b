package com.example.measure.system;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

/**
 * Per-frequency cumulative tick counters of one snapshot.
 *
 * <p>Frequencies are unique keys kept in insertion order. Recording a frequency
 * that is already present overwrites its tick count; a new frequency is appended.
 * Entries are never removed. Storage grows in chunks of {@value #CHUNK_SIZE}
 * entries, so repeated refreshes of the same table do not reallocate.
 *
 * <p>Example usage:
 * <pre>{@code
 * FrequencyResidencyTable earlier = new FrequencyResidencyTable();
 * earlier.record(100, 50);
 * earlier.record(200, 30);
 *
 * FrequencyResidencyTable later = new FrequencyResidencyTable();
 * later.record(100, 80);
 * later.record(200, 70);
 *
 * long avg = later.averageFrequencySince(earlier);   // (100*30 + 200*40) / 70 = 157
 * }</pre>
 *
 * <p>Not thread-safe.
 */
public final class FrequencyResidencyTable {

    static final int CHUNK_SIZE = 32;

    private long[] frequencies = new long[0];
    private long[] ticks = new long[0];
    private int size;

    /**
     * Records the cumulative ticks observed at a frequency.
     *
     * @param frequencyKhz    the frequency (kHz)
     * @param cumulativeTicks ticks spent at the frequency since boot
     */
    public void record(long frequencyKhz, long cumulativeTicks) {
        int index = indexOf(frequencyKhz);
        if (index < 0) {
            if (size == frequencies.length) {
                frequencies = Arrays.copyOf(frequencies, size + CHUNK_SIZE);
                ticks = Arrays.copyOf(ticks, size + CHUNK_SIZE);
            }
            index = size++;
            frequencies[index] = frequencyKhz;
        }
        ticks[index] = cumulativeTicks;
    }

    /**
     * Returns the ticks recorded for a frequency.
     *
     * @param frequencyKhz the frequency (kHz)
     * @return the ticks, or empty if the frequency was never recorded
     */
    public OptionalLong ticksAt(long frequencyKhz) {
        int index = indexOf(frequencyKhz);
        return index < 0 ? OptionalLong.empty() : OptionalLong.of(ticks[index]);
    }

    /**
     * Computes the tick-weighted average frequency over the interval that started
     * with {@code earlier} and ended with this table.
     *
     * <p>For each frequency in this table, the ticks spent at it during the interval
     * are this table's count minus the count recorded for the same frequency in
     * {@code earlier} (zero if it has none). A counter that went backwards
     * contributes nothing.
     *
     * @param earlier the table at the start of the interval
     * @return the average frequency (kHz), 0 if no ticks elapsed
     */
    public long averageFrequencySince(FrequencyResidencyTable earlier) {
        // frequency * ticks may exceed a long when counters are large
        BigInteger totalTime = BigInteger.ZERO;
        BigInteger totalFrequencyTime = BigInteger.ZERO;
        for (int i = 0; i < size; i++) {
            long frequency = frequencies[i];
            long tickDelta = ticks[i] - earlier.ticksAt(frequency).orElse(0);
            if (tickDelta <= 0) {
                continue;
            }
            BigInteger delta = BigInteger.valueOf(tickDelta);
            totalTime = totalTime.add(delta);
            totalFrequencyTime = totalFrequencyTime.add(BigInteger.valueOf(frequency).multiply(delta));
        }
        return totalTime.signum() == 0 ? 0 : totalFrequencyTime.divide(totalTime).longValueExact();
    }

    /**
     * Returns the entries in insertion order.
     */
    public List<FrequencyResidency> entries() {
        List<FrequencyResidency> entries = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            entries.add(new FrequencyResidency(frequencies[i], ticks[i]));
        }
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    int capacity() {
        return frequencies.length;
    }

    private int indexOf(long frequencyKhz) {
        for (int i = 0; i < size; i++) {
            if (frequencies[i] == frequencyKhz) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "FrequencyResidencyTable" + entries();
    }
}
