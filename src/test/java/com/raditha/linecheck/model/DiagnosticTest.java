package com.raditha.linecheck.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    private final PhysicalLine line = new PhysicalLine("x = (1 )\n", 7);

    @Test
    void testToStringForEachColumnKind() {
        assertEquals("E111", Diagnostic.of(DiagnosticCode.E111, line).toString());
        assertEquals("E202: 6", Diagnostic.of(DiagnosticCode.E202, Column.offset(6), line, "char", ")").toString());
        assertEquals("E211: (1, 4)",
                Diagnostic.of(DiagnosticCode.E211, Column.at(new Position(1, 4)), line, "char", "(").toString());
    }

    @Test
    void testMessageRendering() {
        Diagnostic diagnostic = Diagnostic.of(DiagnosticCode.E202, Column.offset(6), line, "char", ")");

        assertEquals("whitespace before ')'", diagnostic.message());
        assertEquals("E202 whitespace before ')'", diagnostic.description());
    }

    @Test
    void testMissingPlaceholderValue() {
        Diagnostic diagnostic = Diagnostic.of(DiagnosticCode.E302, line);

        assertThrows(IllegalArgumentException.class, diagnostic::message);
    }

    @Test
    void testPhysicalLocation() {
        assertEquals(new Location(7, 6), Diagnostic.of(DiagnosticCode.W291, Column.offset(6), line).location());
        assertEquals(new Location(7, 0), Diagnostic.of(DiagnosticCode.W391, line).location());
    }

    @Test
    void testNullColumnMeansAbsent() {
        Diagnostic diagnostic = new Diagnostic(DiagnosticCode.E113, null, null, line);

        assertInstanceOf(Column.Absent.class, diagnostic.column());
        assertEquals(Map.of(), diagnostic.context());
    }

    @Test
    void testNegativeOffsetRejected() {
        assertThrows(IllegalArgumentException.class, () -> Column.offset(-1));
    }

    @Test
    void testCodeProperties() {
        assertEquals(DiagnosticCode.Severity.WARNING, DiagnosticCode.W601.severity());
        assertEquals(DiagnosticCode.Severity.ERROR, DiagnosticCode.E501.severity());
        assertEquals(DiagnosticCode.Category.BLANK_LINES, DiagnosticCode.E303.category());
        assertTrue(DiagnosticCode.E241.matchesPrefix("E24"));
        assertFalse(DiagnosticCode.E241.matchesPrefix(""));
        assertFalse(DiagnosticCode.E241.matchesPrefix("W"));
    }

    @Test
    void testDisplayLocationIsOneBased() {
        assertEquals("3:1", new Location(3, 0).toDisplayString());
    }
}
