package com.raditha.linecheck.analyzer;

import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.PhysicalLine;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticSinkTest {

    private final PhysicalLine line = new PhysicalLine("x=1 \n", 1);

    @Test
    void testInsertionOrderIsKept() {
        DiagnosticSink sink = new DiagnosticSink();
        sink.add(Diagnostic.of(DiagnosticCode.W291, Column.offset(3), line));
        sink.add(Diagnostic.of(DiagnosticCode.E225, Column.offset(1), line));
        sink.add(Diagnostic.of(DiagnosticCode.W291, Column.offset(3), line));

        assertEquals(3, sink.size());
        assertEquals(List.of(DiagnosticCode.W291, DiagnosticCode.E225), List.copyOf(sink.distinctCodes()));
        assertEquals(2, sink.withCode(DiagnosticCode.W291).size());
        assertTrue(sink.containsCode(DiagnosticCode.E225));
        assertFalse(sink.containsCode(DiagnosticCode.E501));
    }

    @Test
    void testIgnoring() {
        DiagnosticSink sink = new DiagnosticSink();
        sink.add(Diagnostic.of(DiagnosticCode.W291, Column.offset(3), line));
        sink.add(Diagnostic.of(DiagnosticCode.E225, Column.offset(1), line));

        List<Diagnostic> kept = sink.ignoring(EnumSet.of(DiagnosticCode.W291));
        assertEquals(1, kept.size());
        assertEquals(DiagnosticCode.E225, kept.get(0).code());
    }

    @Test
    void testViewIsReadOnly() {
        DiagnosticSink sink = new DiagnosticSink();

        assertTrue(sink.isEmpty());
        assertThrows(UnsupportedOperationException.class,
                () -> sink.all().add(Diagnostic.of(DiagnosticCode.E111, line)));
    }
}
