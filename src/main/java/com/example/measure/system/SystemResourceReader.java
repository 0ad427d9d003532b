package com.example.measure.system;

import com.example.measure.source.IntFileReader;
import com.example.measure.source.KeyValueTableReader;
import com.example.measure.source.ProcFiles;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads the system resource groups from their kernel files.
 *
 * <p>Every method either returns a complete group or throws; a group is never
 * returned half-filled.
 */
class SystemResourceReader {

    private static final List<String> TOTAL_KEYS = List.of("MemTotal", "SwapTotal");
    private static final List<String> USAGE_KEYS = List.of("MemFree", "Buffers", "Cached", "SwapFree", "SwapCached");

    private final KeyValueTableReader tableReader;
    private final IntFileReader intReader;

    SystemResourceReader() {
        this(new KeyValueTableReader(), new IntFileReader());
    }

    SystemResourceReader(KeyValueTableReader tableReader, IntFileReader intReader) {
        this.tableReader = tableReader;
        this.intReader = intReader;
    }

    MemoryTotals readMemoryTotals(Path meminfo) throws IOException {
        Map<String, Long> values = readAll(meminfo, TOTAL_KEYS);
        return new MemoryTotals(values.get("MemTotal"), values.get("SwapTotal"));
    }

    MemoryUsage readMemoryUsage(Path meminfo) throws IOException {
        Map<String, Long> values = readAll(meminfo, USAGE_KEYS);
        return new MemoryUsage(
                values.get("MemFree"),
                values.get("Buffers"),
                values.get("Cached"),
                values.get("SwapFree"),
                values.get("SwapCached")
        );
    }

    long readMaxFrequency(Path cpuMaxFrequency) throws IOException {
        return intReader.read(cpuMaxFrequency);
    }

    /**
     * Reads the aggregate {@code cpu} line of /proc/stat.
     *
     * <p>Format: {@code cpu  user nice system idle iowait irq softirq ...}. The total
     * is the sum of every column, idle is the fourth.
     */
    CpuTicks readCpuTicks(Path stat) throws IOException {
        try (BufferedReader reader = ProcFiles.newReader(stat)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.startsWith("cpu ")) {
                    continue;
                }
                String[] columns = line.substring(4).trim().split("\\s+");
                if (columns.length < 4) {
                    throw new IOException("Truncated cpu line in " + stat + ": " + line);
                }
                long total = 0;
                for (String column : columns) {
                    total += parse(column, stat);
                }
                return new CpuTicks(total, parse(columns[3], stat));
            }
        }
        throw new IOException("No aggregate cpu line in " + stat);
    }

    /**
     * Records every {@code <frequency> <ticks>} row of a time_in_state table.
     */
    void readTimeInState(Path timeInState, FrequencyResidencyTable table) throws IOException {
        try (BufferedReader reader = ProcFiles.newReader(timeInState)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String[] columns = line.trim().split("\\s+");
                if (columns.length != 2 || !isCounter(columns[0]) || !isCounter(columns[1])) {
                    continue;
                }
                table.record(parse(columns[0], timeInState), parse(columns[1], timeInState));
            }
        }
    }

    /**
     * Reads the low and high watermark flags into a {@link MemoryWatermark} bitmask.
     */
    int readWatermarks(Path low, Path high) throws IOException {
        long lowValue = intReader.read(low);
        long highValue = intReader.read(high);
        int mask = 0;
        if (lowValue != 0) {
            mask |= MemoryWatermark.LOW.bit();
        }
        if (highValue != 0) {
            mask |= MemoryWatermark.HIGH.bit();
        }
        return mask;
    }

    /**
     * Reads the memory+swap usage of a control group, converted from bytes to kB.
     */
    long readCgroupMemoryKb(Path cgroupRoot) throws IOException {
        return intReader.read(cgroupRoot.resolve(SystemPaths.CGROUP_MEMORY_USAGE)) >> 10;
    }

    private Map<String, Long> readAll(Path file, List<String> keys) throws IOException {
        Map<String, Long> values = tableReader.read(file, keys);
        if (values.size() != keys.size()) {
            throw new IOException("Missing " + keys.stream().filter(k -> !values.containsKey(k)).toList()
                    + " in " + file);
        }
        return values;
    }

    private static boolean isCounter(String column) {
        return !column.isEmpty() && column.chars().allMatch(Character::isDigit);
    }

    private static long parse(String column, Path file) throws IOException {
        try {
            return Long.parseLong(column);
        } catch (NumberFormatException e) {
            throw new IOException("Malformed counter '" + column + "' in " + file, e);
        }
    }
}
