package com.example.measure.process;

import com.example.measure.source.KeyValueTableReader;
import com.example.measure.source.ProcFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads the process resource groups from /proc/&lt;pid&gt;.
 */
class ProcessResourceReader {

    private static final List<String> SMAPS_KEYS = List.of(
            "Private_Clean", "Private_Dirty", "Swap", "Size",
            "Shared_Clean", "Shared_Dirty", "Pss", "Rss", "Referenced"
    );

    // utime and stime are fields 14 and 15 of stat, i.e. 11 and 12 after the state field
    private static final int UTIME_INDEX = 11;
    private static final int STIME_INDEX = 12;

    private final KeyValueTableReader tableReader;

    ProcessResourceReader() {
        this(new KeyValueTableReader());
    }

    ProcessResourceReader(KeyValueTableReader tableReader) {
        this.tableReader = tableReader;
    }

    /**
     * Sums the memory figures of every mapping. Figures missing from the file
     * (older kernels have no Swap line) count as zero.
     */
    ProcessMemory readMemory(Path smaps) throws IOException {
        Map<String, Long> totals = tableReader.sum(smaps, SMAPS_KEYS);
        return new ProcessMemory(
                totals.get("Private_Clean"),
                totals.get("Private_Dirty"),
                totals.get("Swap"),
                totals.get("Size"),
                totals.get("Shared_Clean"),
                totals.get("Shared_Dirty"),
                totals.get("Pss"),
                totals.get("Rss"),
                totals.get("Referenced")
        );
    }

    /**
     * Reads user and system ticks from a stat line such as
     * {@code 25268 (eclipse) S 1 25268 ... 262287 47282 ...}.
     *
     * <p>The command name may contain spaces and parentheses, so fields are counted
     * from the last closing parenthesis.
     */
    ProcessCpuTicks readCpuTicks(Path stat) throws IOException {
        String line = ProcFiles.readString(stat);
        int commEnd = line.lastIndexOf(')');
        if (commEnd < 0) {
            throw new IOException("No command name in " + stat);
        }
        String[] fields = line.substring(commEnd + 1).trim().split("\\s+");
        if (fields.length <= STIME_INDEX) {
            throw new IOException("Truncated " + stat + ": " + fields.length + " fields after the command name");
        }
        try {
            return new ProcessCpuTicks(Long.parseLong(fields[STIME_INDEX]), Long.parseLong(fields[UTIME_INDEX]));
        } catch (NumberFormatException e) {
            throw new IOException("Malformed cpu time in " + stat, e);
        }
    }
}
