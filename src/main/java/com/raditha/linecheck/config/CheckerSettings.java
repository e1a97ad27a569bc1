package com.raditha.linecheck.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Loads checker configuration from linecheck.yml with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > linecheck.yml > defaults
 * </p>
 * Expected layout:
 * <pre>
 * linecheck:
 *   max_line_length: 99
 *   ignore: [E24, W191]
 *   select: [E241]
 *   exclude: [.git, build]
 *   filename: ["*.py"]
 * </pre>
 */
public class CheckerSettings {

    private static final Logger logger = LoggerFactory.getLogger(CheckerSettings.class);

    public static final String DEFAULT_FILE_NAME = "linecheck.yml";
    private static final String CONFIG_KEY = "linecheck";

    private CheckerSettings() {
    }

    /**
     * Values given on the command line. Zero or null means not given.
     */
    public record Overrides(
            int maxLineLength,
            List<String> ignore,
            List<String> select,
            List<String> exclude,
            List<String> filename) {

        public static Overrides none() {
            return new Overrides(0, null, null, null, null);
        }
    }

    /**
     * Load configuration from a YAML file, applying CLI overrides where provided.
     *
     * @param configFile YAML file to read; when null, linecheck.yml in the
     *                   working directory is used if it exists
     * @param overrides  CLI values
     * @return complete checker configuration
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static CheckerConfig loadConfig(Path configFile, Overrides overrides) throws IOException {
        Path file = configFile != null ? configFile : Path.of(DEFAULT_FILE_NAME);
        Map<String, Object> config = Map.of();
        if (Files.isRegularFile(file)) {
            config = readSection(file);
            logger.debug("Loaded configuration from {}", file);
        } else if (configFile != null) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        return merge(config, overrides);
    }

    /**
     * Build configuration from an already parsed {@code linecheck} section.
     */
    public static CheckerConfig merge(Map<String, Object> config, Overrides overrides) {
        int maxLineLength = overrides.maxLineLength() != 0
                ? overrides.maxLineLength()
                : getInt(config, "max_line_length", CheckerConfig.DEFAULT_MAX_LINE_LENGTH);
        List<String> ignore = firstNonNull(overrides.ignore(),
                getListString(config, "ignore"), CheckerConfig.DEFAULT_IGNORE);
        List<String> select = firstNonNull(overrides.select(),
                getListString(config, "select"), List.of());
        List<String> exclude = firstNonNull(overrides.exclude(),
                getListString(config, "exclude"), CheckerConfig.DEFAULT_EXCLUDE);
        List<String> filename = firstNonNull(overrides.filename(),
                getListString(config, "filename"), CheckerConfig.DEFAULT_FILENAME);
        return new CheckerConfig(maxLineLength, ignore, select, exclude, filename);
    }

    /**
     * Split a comma separated option value such as "E24,W6" into its parts.
     */
    public static List<String> splitList(String value) {
        if (value == null) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readSection(Path file) throws IOException {
        if (Files.size(file) == 0) {
            return Map.of();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        Map<String, Object> root = mapper.readValue(file.toFile(), Map.class);
        if (root == null) {
            return Map.of();
        }
        Object section = root.get(CONFIG_KEY);
        if (section instanceof Map) {
            return (Map<String, Object>) section;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(Object::toString).toList();
        }
        if (value instanceof String s) {
            return splitList(s);
        }
        return null;
    }

    @SafeVarargs
    private static List<String> firstNonNull(List<String>... candidates) {
        return Arrays.stream(candidates)
                .filter(c -> c != null)
                .findFirst()
                .orElse(List.of());
    }
}
