package com.example.measure.process;

import com.example.measure.common.Delta;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Differences between two snapshots of the same process. The earlier snapshot
 * comes first.
 */
public final class ProcessDeltas {

    static final String NOT_COMPARABLE = "snapshots do not share common data";

    private ProcessDeltas() {
    }

    /**
     * Change of private dirty plus swapped memory (kB).
     */
    public static Delta privateDirty(ProcessSnapshot earlier, ProcessSnapshot later) {
        if (!comparable(earlier, later)) {
            return Delta.invalid(NOT_COMPARABLE);
        }
        OptionalLong start = earlier.privateDirtySum();
        OptionalLong end = later.privateDirtySum();
        if (start.isEmpty() || end.isEmpty()) {
            return missing(ProcessResource.MEM_USAGE);
        }
        return Delta.of(end.getAsLong() - start.getAsLong());
    }

    /**
     * CPU ticks (system plus user) the process consumed between two snapshots.
     */
    public static Delta cpuTicks(ProcessSnapshot earlier, ProcessSnapshot later) {
        if (!comparable(earlier, later)) {
            return Delta.invalid(NOT_COMPARABLE);
        }
        Optional<ProcessCpuTicks> start = earlier.cpuTicks();
        Optional<ProcessCpuTicks> end = later.cpuTicks();
        if (start.isEmpty() || end.isEmpty()) {
            return missing(ProcessResource.CPU_USAGE);
        }
        return Delta.of(end.get().total() - start.get().total());
    }

    private static boolean comparable(ProcessSnapshot earlier, ProcessSnapshot later) {
        return earlier != null && earlier.isComparableTo(later);
    }

    private static Delta missing(ProcessResource resource) {
        return Delta.invalid(resource + " was not retrieved");
    }
}
