package com.example.measure.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads line-oriented {@code key: value} tables such as {@code /proc/meminfo}
 * and {@code /proc/<pid>/smaps}.
 *
 * <p>Format example:
 * <pre>
 * MemTotal:        3096748 kB
 * MemFree:          460588 kB
 * </pre>
 *
 * <p>The key is everything before the first colon; the value is the leading
 * integer after it, any unit suffix is ignored. Lines that do not have this
 * shape are skipped.
 */
public class KeyValueTableReader {

    /**
     * Reads the first value of each requested key.
     *
     * <p>Keys that do not appear in the file are absent from the result; the number
     * of matched keys is the size of the returned map.
     *
     * @param file the table to read
     * @param keys the keys to look for
     * @return matched keys and their values, in file order
     * @throws IOException if the file cannot be read
     */
    public Map<String, Long> read(Path file, Collection<String> keys) throws IOException {
        Set<String> wanted = Set.copyOf(keys);
        Map<String, Long> found = new LinkedHashMap<>();
        try (BufferedReader reader = ProcFiles.newReader(file)) {
            String line;
            while (found.size() < wanted.size() && (line = reader.readLine()) != null) {
                Optional<Entry> entry = parseLine(line);
                if (entry.isPresent() && wanted.contains(entry.get().key())) {
                    found.putIfAbsent(entry.get().key(), entry.get().value());
                }
            }
        }
        return found;
    }

    /**
     * Sums every occurrence of each requested key.
     *
     * <p>Used for tables that repeat the same keys per section, like the per-mapping
     * blocks of {@code smaps}. Requested keys that never occur are reported as zero.
     *
     * @param file the table to read
     * @param keys the keys to sum
     * @return the sum for every requested key
     * @throws IOException if the file cannot be read
     */
    public Map<String, Long> sum(Path file, Collection<String> keys) throws IOException {
        Map<String, Long> totals = new LinkedHashMap<>();
        for (String key : keys) {
            totals.put(key, 0L);
        }
        try (BufferedReader reader = ProcFiles.newReader(file)) {
            String line;
            while ((line = reader.readLine()) != null) {
                parseLine(line).ifPresent(entry -> totals.computeIfPresent(entry.key(), (k, v) -> v + entry.value()));
            }
        }
        return totals;
    }

    /**
     * Parses one {@code key: value} line.
     *
     * @param line the line to parse
     * @return the entry, or empty if the line has no key or no leading integer value
     */
    static Optional<Entry> parseLine(String line) {
        int colon = line.indexOf(':');
        if (colon <= 0) {
            return Optional.empty();
        }
        String key = line.substring(0, colon);
        return IntFileReader.parseLeadingLong(line.substring(colon + 1))
                .stream()
                .mapToObj(value -> new Entry(key, value))
                .findFirst();
    }

    /**
     * A single parsed table row.
     */
    record Entry(String key, long value) {
    }
}
