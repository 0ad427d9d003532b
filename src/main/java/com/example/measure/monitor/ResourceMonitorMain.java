package com.example.measure.monitor;

import com.example.measure.MeasureEnvironment;
import reactor.core.publisher.Flux;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Prints system, and optionally process, resource usage changes at an interval.
 *
 * <p>Usage:
 * <pre>
 * java -cp ... com.example.measure.monitor.ResourceMonitorMain \
 *     --pid=25268 \
 *     --interval=1000 \
 *     --count=60 \
 *     --root=/tmp/rootfs \
 *     --cgroup=browser \
 *     --json
 * </pre>
 *
 * <p>All flags are optional. Without {@code --count} the monitor runs until the
 * monitored process exits or the program is interrupted. {@code --root} reads
 * /proc and /sys below another directory, e.g. a copy taken from a device.
 */
public class ResourceMonitorMain {

    private static final int DEFAULT_INTERVAL = 1000;
    private static final String USAGE =
            "Usage: java ... ResourceMonitorMain [--pid=N] [--interval=MS] [--count=N] [--root=DIR] [--cgroup=NAME] [--json]";

    public static void main(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        }

        MeasureEnvironment environment = MeasureEnvironment.fromSystemProperties();
        if (options.root() != null) {
            environment = environment.withFsRoot(Path.of(options.root()));
        }
        SampleFormatter formatter = options.json() ? new JsonSampleFormatter() : new TextSampleFormatter();

        try (ResourceMonitor monitor = ResourceMonitor.open(environment, options.pid(), options.cgroup())) {
            formatter.header(monitor.process()).forEach(System.out::println);

            Flux<MonitorSample> samples = monitor.samples(Duration.ofMillis(options.intervalMs()));
            if (options.count() > 0) {
                samples = samples.take(options.count());
            }
            samples.map(formatter::format)
                    .doOnNext(System.out::println)
                    .blockLast();
        } catch (MonitorException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Parsed command line flags.
     *
     * @param pid        process to monitor, empty for system only
     * @param intervalMs time between samples
     * @param count      number of samples, 0 for unlimited
     * @param root       directory holding /proc and /sys, or null for the live ones
     * @param cgroup     control group pattern, or null for none
     * @param json       whether to print JSON instead of columns
     */
    record Options(OptionalInt pid, int intervalMs, int count, String root, String cgroup, boolean json) {

        /**
         * @throws IllegalArgumentException if a numeric flag is malformed or out of range
         */
        static Options parse(String[] args) {
            int pid = parseIntArg(args, "pid", 0);
            int interval = parseIntArg(args, "interval", DEFAULT_INTERVAL);
            int count = parseIntArg(args, "count", 0);
            if (pid < 0) {
                throw new IllegalArgumentException("--pid must not be negative");
            }
            if (interval <= 0) {
                throw new IllegalArgumentException("--interval must be positive");
            }
            if (count < 0) {
                throw new IllegalArgumentException("--count must not be negative");
            }
            return new Options(
                    pid > 0 ? OptionalInt.of(pid) : OptionalInt.empty(),
                    interval,
                    count,
                    parseStringArg(args, "root"),
                    parseStringArg(args, "cgroup"),
                    hasFlag(args, "json"));
        }

        private static int parseIntArg(String[] args, String name, int defaultValue) {
            String value = parseStringArg(args, name);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for --" + name + ": " + value, e);
            }
        }

        private static String parseStringArg(String[] args, String name) {
            String prefix = "--" + name + "=";
            for (String arg : args) {
                if (arg.startsWith(prefix)) {
                    return arg.substring(prefix.length());
                }
            }
            return null;
        }

        private static boolean hasFlag(String[] args, String name) {
            return Arrays.asList(args).contains("--" + name);
        }
    }
}
