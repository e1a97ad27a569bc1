package com.raditha.linecheck.model;

/**
 * One raw line of source text.
 *
 * @param text       Line text including its terminator, if any
 * @param lineNumber 1-based line number
 */
public record PhysicalLine(String text, int lineNumber) implements SourceLine {

    public PhysicalLine {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
    }

    @Override
    public Location locate(Column column) {
        if (column instanceof Column.Offset offset) {
            return new Location(lineNumber, offset.value());
        }
        if (column instanceof Column.At at) {
            return Location.of(at.position());
        }
        return new Location(lineNumber, 0);
    }
}
