package com.example.measure.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens kernel text files.
 *
 * <p>Command names in {@code stat} and {@code status} and mapping paths in
 * {@code smaps} are raw bytes, so invalid UTF-8 sequences are replaced with
 * U+FFFD instead of failing the read.
 */
public final class ProcFiles {

    private ProcFiles() {
    }

    public static BufferedReader newReader(Path file) throws IOException {
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8));
    }

    public static String readString(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }
}
