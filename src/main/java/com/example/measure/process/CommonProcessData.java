package com.example.measure.process;

import com.example.measure.MeasureEnvironment;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Identity of a monitored process, shared by every {@link ProcessSnapshot} derived
 * from the same initialization.
 *
 * <p>The pid and file paths never change. The display name can be refreshed with
 * {@link ProcessSnapshot#reidentify()}, e.g. after the process called exec.
 */
public final class CommonProcessData {

    private final MeasureEnvironment environment;
    private final int pid;
    private final Path smapsPath;
    private final Path statPath;
    private String name;

    CommonProcessData(MeasureEnvironment environment, int pid, Path smapsPath, Path statPath, String name) {
        this.environment = environment;
        this.pid = pid;
        this.smapsPath = smapsPath;
        this.statPath = statPath;
        this.name = name;
    }

    public int pid() {
        return pid;
    }

    /**
     * The display name, empty if it could not be resolved.
     */
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Path smapsPath() {
        return smapsPath;
    }

    public Path statPath() {
        return statPath;
    }

    public MeasureEnvironment environment() {
        return environment;
    }

    void name(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return "CommonProcessData[pid=" + pid + ", name=" + name + "]";
    }
}
