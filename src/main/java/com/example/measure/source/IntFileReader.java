package com.example.measure.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.OptionalLong;

/**
 * Reads files holding a single integer, like {@code cpuinfo_max_freq} or a
 * control-group usage counter.
 */
public class IntFileReader {

    /**
     * Reads the file's trimmed content as an integer.
     *
     * @param file the file to read
     * @return the value
     * @throws IOException if the file cannot be read or holds no integer
     */
    public long read(Path file) throws IOException {
        String content = ProcFiles.readString(file);
        OptionalLong value = parseLeadingLong(content);
        if (value.isEmpty()) {
            throw new IOException("No integer value in " + file);
        }
        return value.getAsLong();
    }

    /**
     * Parses the integer at the start of the trimmed text, ignoring anything after it.
     *
     * @param text text such as {@code "  3096748 kB"}
     * @return the value, or empty if the text does not start with an integer
     */
    static OptionalLong parseLeadingLong(String text) {
        String trimmed = text.strip();
        int end = 0;
        if (end < trimmed.length() && (trimmed.charAt(end) == '-' || trimmed.charAt(end) == '+')) {
            end++;
        }
        int digitsStart = end;
        while (end < trimmed.length() && Character.isDigit(trimmed.charAt(end))) {
            end++;
        }
        if (end == digitsStart) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(trimmed.substring(0, end)));
        } catch (NumberFormatException e) {
            // more digits than a long holds
            return OptionalLong.empty();
        }
    }
}
