package com.example.measure;

import com.example.measure.common.LifecycleListener;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Where and how snapshots read their resources.
 *
 * <p>The filesystem root prefixes every kernel pseudo-file path, so a snapshot can
 * be pointed at a saved copy of {@code /proc} and {@code /sys} for offline analysis
 * or tests. Paths are resolved once, when Common Data is created; snapshots that
 * already exist are not affected by an environment built later with another root.
 *
 * <p>Example usage:
 * <pre>{@code
 * MeasureEnvironment live = MeasureEnvironment.defaults();
 * MeasureEnvironment saved = live.withFsRoot(Path.of("/tmp/rootfs"));
 * MeasureEnvironment reset = saved.withFsRoot(null);   // back to "/"
 * }</pre>
 *
 * @param fsRoot            root of the filesystem holding proc and sys
 * @param cgroupSearchRoot  absolute path of the tree searched for control groups,
 *                          resolved under {@code fsRoot}
 * @param clock             clock used for snapshot timestamps
 * @param lifecycleListener notified when Common Data is allocated and released
 */
public record MeasureEnvironment(
        Path fsRoot,
        String cgroupSearchRoot,
        Clock clock,
        LifecycleListener lifecycleListener
) {

    public static final Path DEFAULT_FS_ROOT = Path.of("/");
    public static final String DEFAULT_CGROUP_SEARCH_ROOT = "/syspart";

    public static final String FS_ROOT_PROPERTY = "measure.fs.root";
    public static final String CGROUP_ROOT_PROPERTY = "measure.cgroup.root";

    public MeasureEnvironment {
        fsRoot = fsRoot != null ? fsRoot : DEFAULT_FS_ROOT;
        cgroupSearchRoot = cgroupSearchRoot != null ? cgroupSearchRoot : DEFAULT_CGROUP_SEARCH_ROOT;
        clock = clock != null ? clock : Clock.systemDefaultZone();
        lifecycleListener = lifecycleListener != null ? lifecycleListener : LifecycleListener.NONE;
    }

    /**
     * The live system: root {@code /}, control groups under {@code /syspart}.
     */
    public static MeasureEnvironment defaults() {
        return new MeasureEnvironment(null, null, null, null);
    }

    /**
     * Builds an environment from the {@code measure.fs.root} and
     * {@code measure.cgroup.root} system properties, falling back to the defaults.
     */
    public static MeasureEnvironment fromSystemProperties() {
        String root = System.getProperty(FS_ROOT_PROPERTY);
        String cgroupRoot = System.getProperty(CGROUP_ROOT_PROPERTY);
        return new MeasureEnvironment(
                root != null && !root.isBlank() ? Path.of(root) : null,
                cgroupRoot != null && !cgroupRoot.isBlank() ? cgroupRoot : null,
                null,
                null
        );
    }

    /**
     * Returns a copy with another filesystem root; null restores the default root.
     */
    public MeasureEnvironment withFsRoot(Path root) {
        return new MeasureEnvironment(root, cgroupSearchRoot, clock, lifecycleListener);
    }

    public MeasureEnvironment withCgroupSearchRoot(String searchRoot) {
        return new MeasureEnvironment(fsRoot, searchRoot, clock, lifecycleListener);
    }

    public MeasureEnvironment withClock(Clock clock) {
        return new MeasureEnvironment(fsRoot, cgroupSearchRoot, clock, lifecycleListener);
    }

    public MeasureEnvironment withLifecycleListener(LifecycleListener listener) {
        return new MeasureEnvironment(fsRoot, cgroupSearchRoot, clock, listener);
    }

    /**
     * Resolves an absolute kernel path such as {@code /proc/meminfo} under the root.
     *
     * @param absolutePath path as seen on a live system
     * @return the path under {@link #fsRoot()}
     */
    public Path resolve(String absolutePath) {
        Objects.requireNonNull(absolutePath, "absolutePath");
        String relative = absolutePath;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        return fsRoot.resolve(relative);
    }

    /**
     * The control-group search root resolved under the filesystem root.
     */
    public Path cgroupSearchPath() {
        return resolve(cgroupSearchRoot);
    }
}
