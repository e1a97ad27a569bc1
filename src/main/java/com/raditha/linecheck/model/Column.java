package com.raditha.linecheck.model;

/**
 * Where on its line a checker placed a diagnostic.
 * A checker either reports nothing, an offset into the line text it was
 * given, or a position it already resolved from token coordinates.
 */
public sealed interface Column permits Column.Absent, Column.Offset, Column.At {

    static Column none() {
        return Absent.INSTANCE;
    }

    static Column offset(int offset) {
        return new Offset(offset);
    }

    static Column at(Position position) {
        return new At(position);
    }

    /** No column: the diagnostic applies to the whole line. */
    record Absent() implements Column {
        static final Absent INSTANCE = new Absent();

        @Override
        public String toString() {
            return "";
        }
    }

    /** Offset into the text of the reporting line. */
    record Offset(int value) implements Column {
        public Offset {
            if (value < 0) {
                throw new IllegalArgumentException("offset must be >= 0, got: " + value);
            }
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /** Position already expressed in source coordinates. */
    record At(Position position) implements Column {
        @Override
        public String toString() {
            return position.toString();
        }
    }
}
