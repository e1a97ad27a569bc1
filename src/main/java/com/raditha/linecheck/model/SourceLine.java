package com.raditha.linecheck.model;

/**
 * A line a checker runs against: either a raw physical line or a
 * reconstructed logical line.
 */
public sealed interface SourceLine permits PhysicalLine, LogicalLine {

    /**
     * The text the checker sees.
     */
    String text();

    /**
     * Line number the diagnostics fall back to.
     */
    int lineNumber();

    /**
     * Resolve a reported column to an absolute location in the file.
     */
    Location locate(Column column);
}
