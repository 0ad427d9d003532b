package com.example.measure.system;

import java.util.EnumSet;
import java.util.Set;

/**
 * Memory pressure flags exported by kernels with low-memory notification.
 * A snapshot stores them as a bitmask.
 */
public enum MemoryWatermark {
    LOW(1),
    HIGH(1 << 1);

    private final int bit;

    MemoryWatermark(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    public static Set<MemoryWatermark> fromMask(int mask) {
        EnumSet<MemoryWatermark> set = EnumSet.noneOf(MemoryWatermark.class);
        for (MemoryWatermark watermark : values()) {
            if ((mask & watermark.bit) != 0) {
                set.add(watermark);
            }
        }
        return set;
    }
}
