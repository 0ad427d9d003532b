package com.example.measure.source;

import com.example.measure.MeasureEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Answers whether a process exists and what it is called.
 *
 * <p>The display name comes from {@code /proc/<pid>/cmdline}: the program name
 * without its directory, followed by its arguments separated by spaces. Kernel
 * threads and zombies have an empty command line; for them the short name from
 * the {@code Name:} line of {@code /proc/<pid>/status} is used, in brackets,
 * e.g. {@code [kthreadd]}.
 */
public class ProcessInfoReader {

    private static final Logger log = LoggerFactory.getLogger(ProcessInfoReader.class);

    private final MeasureEnvironment environment;

    public ProcessInfoReader(MeasureEnvironment environment) {
        this.environment = environment;
    }

    /**
     * Resolves a file of the process's procfs directory, e.g. {@code stat}.
     */
    public Path procFile(int pid, String name) {
        return environment.resolve("/proc/" + pid + "/" + name);
    }

    /**
     * Checks whether the process exists.
     */
    public boolean isAlive(int pid) {
        return Files.exists(procFile(pid, "stat"));
    }

    /**
     * Resolves the display name of the process.
     *
     * @param pid the process identifier
     * @return the name, or empty if neither cmdline nor status could provide one
     */
    public Optional<String> displayName(int pid) {
        Optional<String> fromCmdline = readCmdline(procFile(pid, "cmdline"));
        if (fromCmdline.isPresent()) {
            return fromCmdline;
        }
        return readStatusName(procFile(pid, "status")).map(name -> "[" + name + "]");
    }

    private Optional<String> readCmdline(Path cmdline) {
        byte[] raw;
        try {
            raw = Files.readAllBytes(cmdline);
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", cmdline, e.toString());
            return Optional.empty();
        }
        List<String> args = new ArrayList<>();
        for (String arg : new String(raw, StandardCharsets.UTF_8).split("\0")) {
            if (!arg.isEmpty()) {
                args.add(arg);
            }
        }
        if (args.isEmpty()) {
            return Optional.empty();
        }
        String program = args.get(0);
        int slash = program.lastIndexOf('/');
        if (slash >= 0) {
            program = program.substring(slash + 1);
        }
        args.set(0, program);
        String name = String.join(" ", args).strip();
        return name.isEmpty() ? Optional.empty() : Optional.of(name);
    }

    private Optional<String> readStatusName(Path status) {
        try (BufferedReader reader = ProcFiles.newReader(status)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith("Name:")) {
                    String name = line.substring("Name:".length()).strip();
                    return name.isEmpty() ? Optional.empty() : Optional.of(name);
                }
            }
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", status, e.toString());
        }
        return Optional.empty();
    }
}
