package com.raditha.linecheck.detection;

import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Location;
import com.raditha.linecheck.model.LogicalLine;
import com.raditha.linecheck.model.OffsetMapping;
import com.raditha.linecheck.model.Token;
import com.raditha.linecheck.model.TokenType;
import com.raditha.linecheck.testing.LogicalLines;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LogicalLineBuilderTest {

    static Stream<Arguments> statements() {
        return Stream.of(
                Arguments.of("f(a,\n  b)", "f(a, b)"),
                Arguments.of("x = [\n    1]", "x = [1]"),
                Arguments.of("x = (1 +\n     2)", "x = (1 + 2)"),
                Arguments.of("foo(1\n)", "foo(1)"),
                Arguments.of("x = 1 + \\\n    2", "x = 1 + 2"),
                Arguments.of("s = 'abc'", "s = 'xxx'"),
                Arguments.of("x = 1  # note", "x = 1"),
                Arguments.of("d = {'a':  1}", "d = {'x':  1}"));
    }

    @ParameterizedTest
    @MethodSource("statements")
    void testTextReconstruction(String source, String expected) {
        assertEquals(expected, LogicalLines.single(source).text());
    }

    @Test
    void testIndentationIsKept() {
        List<LogicalLine> lines = LogicalLines.parse("if x:\n    y = 1\n");

        assertEquals("if x:", lines.get(0).text());
        assertEquals("    y = 1", lines.get(1).text());
        assertEquals("    ", lines.get(1).indentation());
        assertEquals("y = 1", lines.get(1).dedentedText());
    }

    @Test
    void testOffsetsMapBackToSource() {
        LogicalLine line = LogicalLines.single("x = foo(a,\n        b)\n");

        assertEquals("x = foo(a, b)", line.text());
        List<Integer> offsets = line.tokenOffsetMapping().stream().map(OffsetMapping::offset).toList();
        assertEquals(List.of(0, 2, 4, 7, 8, 9, 11, 12), offsets);
        assertEquals(new Location(2, 8), line.locate(Column.offset(11)));
        assertEquals(new Location(2, 9), line.locate(Column.offset(12)));
        assertEquals(new Location(1, 5), line.locate(Column.offset(5)));
    }

    @Test
    void testLineNumberIsRowOfNewline() {
        LogicalLine line = LogicalLines.single("x = (1,\n     2)\n");

        assertEquals(2, line.lineNumber());
    }

    @Test
    void testStatementWithoutContributingTokensIsSkipped() {
        LogicalLineBuilder builder = new LogicalLineBuilder(List.of("\n"));
        Token newline = Token.of(TokenType.NEWLINE, "\n", 1, 0, "\n");

        Optional<LogicalLine> line = builder.build(List.of(newline), 0, 0, 1);

        assertTrue(line.isEmpty());
    }

    @Test
    void testBlankLineCountsArePassedThrough() {
        LogicalLineBuilder builder = new LogicalLineBuilder(List.of("x\n"));
        Token name = Token.of(TokenType.NAME, "x", 1, 0, "x\n");

        LogicalLine line = builder.build(List.of(name), 2, 3, 1).orElseThrow();

        assertEquals(2, line.blankLines());
        assertEquals(3, line.blankLinesBeforeComment());
        assertEquals(3, line.maxBlankLines());
    }

    @Test
    void testCommentTokensAreKeptButNotInText() {
        LogicalLine line = LogicalLines.single("x = 1  # note\n");

        assertTrue(line.tokens().stream().anyMatch(t -> t.type() == TokenType.COMMENT));
        assertEquals(3, line.contributingTokens().size());
    }
}
