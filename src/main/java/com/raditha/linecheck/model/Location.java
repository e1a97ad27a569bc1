package com.raditha.linecheck.model;

/**
 * Absolute location of a diagnostic in the analyzed file.
 *
 * @param row    1-based line number
 * @param column 0-based column
 */
public record Location(int row, int column) {

    public static Location of(Position position) {
        return new Location(position.row(), position.column());
    }

    /**
     * Format as "row:column" with a 1-based column, the way editors expect it.
     */
    public String toDisplayString() {
        return row + ":" + (column + 1);
    }
}
