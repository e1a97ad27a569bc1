package com.raditha.linecheck.model;

/**
 * A point in the source text.
 *
 * @param row    1-based physical line number
 * @param column 0-based character offset within the physical line
 */
public record Position(int row, int column) implements Comparable<Position> {

    @Override
    public int compareTo(Position other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ")";
    }
}
