package com.example.measure.system;

import com.example.measure.MeasureEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds a control group directory by name.
 *
 * <p>Walks the search root depth-first and picks the first directory whose path,
 * as seen on the live system (e.g. {@code /syspart/applications/browser}),
 * contains the pattern. The sibling order is whatever the filesystem reports, so
 * a pattern matching several groups selects an unspecified one of them.
 */
class CgroupSelector {

    private static final Logger log = LoggerFactory.getLogger(CgroupSelector.class);

    private final MeasureEnvironment environment;

    CgroupSelector(MeasureEnvironment environment) {
        this.environment = environment;
    }

    /**
     * Selects the control group matching the pattern.
     *
     * @param pattern substring of the group path; null or empty selects the search root
     * @return the matching directory, or the search root if nothing matched
     */
    Path select(String pattern) {
        Path searchRoot = environment.cgroupSearchPath();
        if (pattern == null || pattern.isEmpty()) {
            return searchRoot;
        }
        return find(searchRoot, pattern).orElseGet(() -> {
            log.debug("No control group matching '{}' under {}", pattern, searchRoot);
            return searchRoot;
        });
    }

    private Optional<Path> find(Path searchRoot, String pattern) {
        if (!Files.isDirectory(searchRoot)) {
            return Optional.empty();
        }
        try (Stream<Path> tree = Files.walk(searchRoot)) {
            return tree.filter(Files::isDirectory)
                    .filter(dir -> livePath(dir).contains(pattern))
                    .findFirst();
        } catch (IOException | UncheckedIOException e) {
            log.debug("Control group search under {} failed: {}", searchRoot, e.toString());
            return Optional.empty();
        }
    }

    private String livePath(Path dir) {
        Path relative = environment.fsRoot().relativize(dir);
        return "/" + relative.toString().replace(dir.getFileSystem().getSeparator(), "/");
    }
}
