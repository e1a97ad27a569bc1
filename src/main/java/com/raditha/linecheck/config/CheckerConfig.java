package com.raditha.linecheck.config;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Configuration for a style check run.
 * Immutable, so one instance can be shared by every file of a run.
 *
 * @param maxLineLength    Longest line length accepted by E501
 * @param ignore           Code prefixes to suppress, e.g. "E24" or "W191"
 * @param select           Code prefixes to report even when an ignore prefix matches
 * @param excludePatterns  File or directory names to skip (glob format)
 * @param filenamePatterns File names to check when walking directories (glob format)
 */
public record CheckerConfig(
        int maxLineLength,
        List<String> ignore,
        List<String> select,
        List<String> excludePatterns,
        List<String> filenamePatterns) {

    public static final int DEFAULT_MAX_LINE_LENGTH = 79;
    public static final List<String> DEFAULT_IGNORE = List.of("E24", "W191");
    public static final List<String> DEFAULT_EXCLUDE = List.of(".svn", "CVS", ".bzr", ".hg", ".git");
    public static final List<String> DEFAULT_FILENAME = List.of("*.py");

    /**
     * Validate configuration.
     */
    public CheckerConfig {
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be >= 1, got: " + maxLineLength);
        }
        ignore = ignore == null ? List.of() : List.copyOf(ignore);
        select = select == null ? List.of() : List.copyOf(select);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        filenamePatterns = filenamePatterns == null || filenamePatterns.isEmpty()
                ? DEFAULT_FILENAME
                : List.copyOf(filenamePatterns);
    }

    /**
     * Default configuration: 79 columns, E24 and W191 ignored.
     */
    public static CheckerConfig defaults() {
        return new CheckerConfig(DEFAULT_MAX_LINE_LENGTH, DEFAULT_IGNORE, List.of(), DEFAULT_EXCLUDE,
                DEFAULT_FILENAME);
    }

    public CheckerConfig withMaxLineLength(int maxLineLength) {
        return new CheckerConfig(maxLineLength, ignore, select, excludePatterns, filenamePatterns);
    }

    public CheckerConfig withIgnore(List<String> ignore) {
        return new CheckerConfig(maxLineLength, ignore, select, excludePatterns, filenamePatterns);
    }

    public CheckerConfig withSelect(List<String> select) {
        return new CheckerConfig(maxLineLength, ignore, select, excludePatterns, filenamePatterns);
    }

    /**
     * A code is suppressed if it starts with an ignored prefix and does not
     * start with a selected one.
     */
    public boolean isSuppressed(String code) {
        return startsWithAny(code, ignore) && !startsWithAny(code, select);
    }

    /**
     * Check if a file or directory name matches any exclusion pattern.
     */
    public boolean shouldExclude(String name) {
        return matchesAny(name, excludePatterns);
    }

    /**
     * Check if a file name is one that should be analyzed.
     */
    public boolean matchesFilename(String name) {
        return matchesAny(name, filenamePatterns);
    }

    private static boolean startsWithAny(String code, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (code.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesAny(String name, List<String> patterns) {
        for (String pattern : patterns) {
            if (matchesGlobPattern(name, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob pattern matching.
     * Supports * and ? wildcards.
     */
    static boolean matchesGlobPattern(String name, String pattern) {
        StringBuilder regex = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return name.matches(regex.toString());
    }
}
