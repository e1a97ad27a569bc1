package com.raditha.linecheck.checks.logical;

import com.raditha.linecheck.checks.LogicalLineCheck;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.testing.LogicalLines;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LayoutChecksTest {

    private static String code(LogicalLineCheck check, String source) {
        return LogicalLines.checkLast(check, source).map(d -> d.code().name()).orElse("Okay");
    }

    static Stream<Arguments> indentation() {
        return Stream.of(
                Arguments.of("a = 1", "Okay"),
                Arguments.of("if a == 0:\n    a = 1", "Okay"),
                Arguments.of("  a = 1", "E111"),
                Arguments.of("for item in items:\n    pass", "Okay"),
                Arguments.of("for item in items:\npass", "E112"),
                Arguments.of("a = 1\nb = 2", "Okay"),
                Arguments.of("a = 1\n    b = 2", "E113"),
                Arguments.of("if x:\n\ty = 1", "Okay"),
                Arguments.of("if x:\n    y = 1\nz = 2", "Okay"));
    }

    @ParameterizedTest
    @MethodSource("indentation")
    void testIndentation(String source, String expected) {
        assertEquals(expected, code(new Indentation(), source));
    }

    @Test
    void testIndentationReportsStartOfStatement() {
        Diagnostic diagnostic = LogicalLines.checkLast(new Indentation(), "x = [\n    1]\n   y = 2").orElseThrow();

        assertEquals(DiagnosticCode.E111, diagnostic.code());
        assertEquals(3, diagnostic.location().row());
        assertEquals(0, diagnostic.location().column());
    }

    static Stream<Arguments> blankLines() {
        return Stream.of(
                Arguments.of("def a():\n    pass\n\n\ndef b():", "Okay"),
                Arguments.of("default = 1\nfoo = 1", "Okay"),
                Arguments.of("class Foo:\n    b = 0\n    def bar():", "E301"),
                Arguments.of("class Foo:\n    def bar():", "Okay"),
                Arguments.of("class Foo:\n    \"\"\"Doc.\"\"\"\n    def bar():", "Okay"),
                Arguments.of("def a():\n    pass\n\ndef b(n):", "E302"),
                Arguments.of("x = 1\ndef b(n):", "E302"),
                Arguments.of("def a():\n    pass\n\n\n\ndef b(n):", "E303"),
                Arguments.of("def a():\n\n\n\n    pass", "E303"),
                Arguments.of("class Foo:\n    x = 1\n\n\n    y = 2", "E303"),
                Arguments.of("@decorator\n\ndef a():", "E304"),
                Arguments.of("@decorator\ndef a():", "Okay"),
                Arguments.of("@decorator\n# comment\ndef a():", "Okay"),
                Arguments.of("@decorator\n\n# comment\ndef a():", "E304"),
                Arguments.of("@decorator\n# comment\n\ndef a():", "E304"),
                Arguments.of("x = 1\n\n\n# comment\ndef f():", "Okay"),
                Arguments.of("x = 1\n\n# comment\n\n\ndef f():", "Okay"),
                Arguments.of("x = 1\n\n# comment\n\ndef f():", "E302"),
                Arguments.of("x = 1\n# comment\ndef f():", "E302"));
    }

    @ParameterizedTest
    @MethodSource("blankLines")
    void testBlankLines(String source, String expected) {
        assertEquals(expected, code(new BlankLines(), source));
    }

    @Test
    void testBlankLinesMessages() {
        Optional<Diagnostic> e302 = LogicalLines.checkLast(new BlankLines(), "x = 1\n\ndef f():");
        assertEquals("expected 2 blank lines, found 1", e302.orElseThrow().message());

        Optional<Diagnostic> e303 = LogicalLines.checkLast(new BlankLines(), "x = 1\n\n\n\n\ny = 2");
        assertEquals("too many blank lines (4)", e303.orElseThrow().message());
    }

    @Test
    void testFirstStatementIsNeverReported() {
        assertEquals("Okay", code(new BlankLines(), "\n\n\n\ndef f():"));
    }
}
