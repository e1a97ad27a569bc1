package com.raditha.linecheck.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A style violation reported by a checker.
 *
 * @param code    Diagnostic code
 * @param column  Where on the originating line the violation is
 * @param context Values interpolated into the message template
 * @param origin  Line the checker ran against
 */
public record Diagnostic(
        DiagnosticCode code,
        Column column,
        Map<String, Object> context,
        SourceLine origin) {

    public Diagnostic {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (column == null) {
            column = Column.none();
        }
        context = context == null || context.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static Diagnostic of(DiagnosticCode code, SourceLine origin) {
        return new Diagnostic(code, Column.none(), Map.of(), origin);
    }

    public static Diagnostic of(DiagnosticCode code, Column column, SourceLine origin) {
        return new Diagnostic(code, column, Map.of(), origin);
    }

    public static Diagnostic of(DiagnosticCode code, Column column, SourceLine origin, String key, Object value) {
        return new Diagnostic(code, column, Map.of(key, value), origin);
    }

    /**
     * Absolute location in the analyzed file.
     */
    public Location location() {
        return origin.locate(column);
    }

    /**
     * Human readable message without the code.
     */
    public String message() {
        return code.render(context);
    }

    /**
     * Code followed by the message, e.g. "E225 missing whitespace around operator".
     */
    public String description() {
        return code.name() + " " + message();
    }

    /**
     * Compact form used in tests and debug output, e.g. "E201: 5".
     */
    @Override
    public String toString() {
        if (column instanceof Column.Absent) {
            return code.name();
        }
        return code.name() + ": " + column;
    }
}
