package com.raditha.linecheck.analyzer;

import com.raditha.linecheck.detection.LogicalLineBuilder;
import com.raditha.linecheck.model.LogicalLine;
import com.raditha.linecheck.model.Position;
import com.raditha.linecheck.model.StructuralException;
import com.raditha.linecheck.model.Token;
import com.raditha.linecheck.model.TokenType;
import com.raditha.linecheck.testing.LogicalLines;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementSegmenterTest {

    @Test
    void testOneLogicalLinePerStatement() {
        List<LogicalLine> lines = LogicalLines.parse("x = 1\ny = [1,\n     2]\nz = 3\n");

        assertEquals(List.of("x = 1", "y = [1, 2]", "z = 3"), lines.stream().map(LogicalLine::text).toList());
        assertEquals(List.of(1, 3, 4), lines.stream().map(LogicalLine::lineNumber).toList());
    }

    @Test
    void testBlankLinesAreCounted() {
        List<LogicalLine> lines = LogicalLines.parse("x = 1\n\n\ny = 2\nz = 3\n");

        assertEquals(0, lines.get(0).blankLines());
        assertEquals(2, lines.get(1).blankLines());
        assertEquals(0, lines.get(2).blankLines());
    }

    @Test
    void testCommentBlockKeepsBlankLinesAboveIt() {
        List<LogicalLine> lines = LogicalLines.parse("x = 1\n\n\n# comment\ny = 2\n");

        LogicalLine y = lines.get(1);
        assertEquals(0, y.blankLines());
        assertEquals(2, y.blankLinesBeforeComment());
        assertEquals(2, y.maxBlankLines());
    }

    @Test
    void testBlankLinesAfterComment() {
        List<LogicalLine> lines = LogicalLines.parse("x = 1\n# comment\n\ny = 2\n");

        assertEquals(1, lines.get(1).blankLines());
        assertEquals(0, lines.get(1).blankLinesBeforeComment());
    }

    @Test
    void testCommentLinesJoinTheNextStatement() {
        List<LogicalLine> lines = LogicalLines.parse("x = 1\n#first\n\n# second\ny = 2\n");

        List<String> comments = lines.get(1).tokens().stream()
                .filter(t -> t.type() == TokenType.COMMENT)
                .map(Token::text)
                .toList();
        assertEquals(List.of("#first", "# second"), comments);
        assertEquals("y = 2", lines.get(1).text());
        assertTrue(lines.get(0).tokens().stream().noneMatch(t -> t.type() == TokenType.COMMENT));
    }

    @Test
    void testInlineCommentDoesNotMoveCount() {
        List<LogicalLine> lines = LogicalLines.parse("x = 1\n\ny = 2  # note\n");

        assertEquals(1, lines.get(1).blankLines());
        assertEquals(0, lines.get(1).blankLinesBeforeComment());
    }

    @Test
    void testBlankLineAfterDecorator() {
        List<LogicalLine> lines = LogicalLines.parse("@decorator\n\ndef f():\n    pass\n");

        assertEquals("@decorator", lines.get(0).text());
        assertEquals(1, lines.get(1).blankLines());
    }

    @Test
    void testCountersResetAfterStatement() {
        LogicalLineBuilder builder = new LogicalLineBuilder(List.of("\n", "x\n"));
        StatementSegmenter segmenter = new StatementSegmenter(builder);

        segmenter.accept(Token.of(TokenType.NL, "\n", 1, 0, "\n"));
        assertEquals(1, segmenter.getBlankLines());
        segmenter.accept(Token.of(TokenType.NAME, "x", 2, 0, "x\n"));
        LogicalLine line = segmenter.accept(Token.of(TokenType.NEWLINE, "\n", 2, 1, "x\n")).orElseThrow();

        assertEquals(1, line.blankLines());
        assertEquals(0, segmenter.getBlankLines());
        assertEquals(0, segmenter.getBlankLinesBeforeComment());
    }

    @Test
    void testUnbalancedClosingBracket() {
        StatementSegmenter segmenter = new StatementSegmenter(new LogicalLineBuilder(List.of("x)\n")));
        segmenter.accept(Token.of(TokenType.NAME, "x", 1, 0, "x)\n"));

        StructuralException e = assertThrows(StructuralException.class,
                () -> segmenter.accept(Token.of(TokenType.OP, ")", 1, 1, "x)\n")));
        assertEquals(new Position(1, 1), e.getPosition());
    }

    @Test
    void testEndOfInputInsideStatement() {
        StatementSegmenter segmenter = new StatementSegmenter(new LogicalLineBuilder(List.of("f(\n")));
        segmenter.accept(Token.of(TokenType.NAME, "f", 1, 0, "f(\n"));
        segmenter.accept(Token.of(TokenType.OP, "(", 1, 1, "f(\n"));
        assertEquals(1, segmenter.getDepth());

        Token end = Token.of(TokenType.ENDMARKER, "", 2, 0, "");
        assertThrows(StructuralException.class, () -> segmenter.accept(end));
    }

    @Test
    void testNewlineInsideBracketsDoesNotEndStatement() {
        StatementSegmenter segmenter = new StatementSegmenter(new LogicalLineBuilder(List.of("f(\n", ")\n")));
        segmenter.accept(Token.of(TokenType.NAME, "f", 1, 0, "f(\n"));
        segmenter.accept(Token.of(TokenType.OP, "(", 1, 1, "f(\n"));

        assertTrue(segmenter.accept(Token.of(TokenType.NEWLINE, "\n", 1, 2, "f(\n")).isEmpty());
        segmenter.accept(Token.of(TokenType.OP, ")", 2, 0, ")\n"));
        LogicalLine line = segmenter.accept(Token.of(TokenType.NEWLINE, "\n", 2, 1, ")\n")).orElseThrow();
        assertEquals("f()", line.text());
    }
}
