package com.raditha.linecheck.cli;

/**
 * Formats for the --export option.
 */
public enum ExportFormat {
    /**
     * Comma separated summary, per-file and per-code tables.
     */
    CSV,

    /**
     * A single JSON document.
     */
    JSON,

    /**
     * Both files side by side.
     */
    BOTH;

    /**
     * Convert a string value to ExportFormat enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding ExportFormat
     * @throws IllegalArgumentException if the value is not a valid format
     */
    public static ExportFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ExportFormat value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "csv" -> CSV;
            case "json" -> JSON;
            case "both" -> BOTH;
            default -> throw new IllegalArgumentException(
                    "Export format must be 'csv', 'json', or 'both', got: " + value);
        };
    }

    public boolean includesCsv() {
        return this == CSV || this == BOTH;
    }

    public boolean includesJson() {
        return this == JSON || this == BOTH;
    }
}
