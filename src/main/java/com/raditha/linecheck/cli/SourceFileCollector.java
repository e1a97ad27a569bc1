package com.raditha.linecheck.cli;

import com.raditha.linecheck.config.CheckerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Expands the paths given on the command line into the files to check.
 * <p>
 * A file named explicitly is checked unless its name is excluded. A directory
 * is walked recursively: files matching a filename pattern are collected and
 * any file or directory whose name matches an exclude pattern is skipped
 * together with everything below it.
 * </p>
 */
public class SourceFileCollector {

    private static final Logger logger = LoggerFactory.getLogger(SourceFileCollector.class);

    private final CheckerConfig config;

    public SourceFileCollector(CheckerConfig config) {
        this.config = config;
    }

    /**
     * @param roots files and directories to check
     * @return the files to check, sorted and without duplicates
     * @throws IllegalArgumentException if a root does not exist
     * @throws IOException if a directory cannot be walked
     */
    public List<Path> collect(List<Path> roots) throws IOException {
        TreeSet<Path> files = new TreeSet<>();
        for (Path root : roots) {
            if (!Files.exists(root)) {
                throw new IllegalArgumentException("Path not found: " + root);
            }
            if (Files.isDirectory(root)) {
                files.addAll(walk(root));
            } else if (!isExcluded(root)) {
                files.add(root);
            }
        }
        logger.debug("Collected {} files from {} paths", files.size(), roots.size());
        return new ArrayList<>(files);
    }

    private List<Path> walk(Path root) throws IOException {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> !isExcludedBelow(root, p))
                    .filter(p -> config.matchesFilename(p.getFileName().toString()))
                    .toList();
        }
    }

    private boolean isExcludedBelow(Path root, Path file) {
        for (Path part : root.relativize(file)) {
            if (config.shouldExclude(part.toString())) {
                return true;
            }
        }
        return false;
    }

    private boolean isExcluded(Path file) {
        Path name = file.getFileName();
        return name != null && config.shouldExclude(name.toString());
    }
}
