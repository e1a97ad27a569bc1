package com.raditha.linecheck.detection;

import com.raditha.linecheck.model.LogicalLine;
import com.raditha.linecheck.model.OffsetMapping;
import com.raditha.linecheck.model.StructuralException;
import com.raditha.linecheck.model.Token;
import com.raditha.linecheck.model.TokenType;
import com.raditha.linecheck.util.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds the text of one statement from its buffered tokens.
 * <p>
 * Comments and layout tokens are dropped, string literals are muted and the
 * whitespace between tokens is normalized: tokens on the same row keep the
 * original gap, tokens on different rows are joined by at most one space.
 * While the text is assembled an offset mapping is recorded so that a column
 * in the rebuilt text can be traced back to a row and column of the source.
 * </p>
 */
public class LogicalLineBuilder {

    private final List<String> documentLines;

    /**
     * @param documentLines physical lines of the file, used to inspect the
     *                      character before a line break
     */
    public LogicalLineBuilder(List<String> documentLines) {
        this.documentLines = documentLines;
    }

    /**
     * Build the logical line for a statement.
     *
     * @param tokens                  every token buffered for the statement
     * @param blankLines              blank lines directly before the statement
     * @param blankLinesBeforeComment blank lines before a preceding comment block
     * @param lineNumber              row of the token that ended the statement
     * @return the logical line, or empty if no token contributes text
     */
    public Optional<LogicalLine> build(List<Token> tokens, int blankLines, int blankLinesBeforeComment,
                                       int lineNumber) {
        StringBuilder body = new StringBuilder();
        List<Token> contributing = new ArrayList<>();
        List<Integer> offsets = new ArrayList<>();
        Token previous = null;

        for (Token token : tokens) {
            if (!token.isContributing()) {
                continue;
            }
            String text = token.type() == TokenType.STRING ? StringMuter.mute(token.text()) : token.text();
            if (previous != null) {
                body.append(separatorBefore(previous, token, text));
            }
            offsets.add(body.length());
            contributing.add(token);
            body.append(text);
            previous = token;
        }

        if (contributing.isEmpty()) {
            return Optional.empty();
        }

        String bodyText = body.toString();
        if (!bodyText.isEmpty()
                && (isFiller(bodyText.charAt(0)) || isFiller(bodyText.charAt(bodyText.length() - 1)))) {
            throw new StructuralException("logical line has surrounding whitespace", contributing.get(0).start());
        }

        Token first = contributing.get(0);
        String indent = indentationOf(first);
        List<OffsetMapping> mapping = new ArrayList<>(contributing.size());
        for (int i = 0; i < contributing.size(); i++) {
            mapping.add(new OffsetMapping(indent.length() + offsets.get(i), contributing.get(i)));
        }
        return Optional.of(new LogicalLine(indent + bodyText, lineNumber, tokens,
                blankLines, blankLinesBeforeComment, mapping));
    }

    /**
     * The filler placed between {@code previous} and {@code next}.
     */
    private String separatorBefore(Token previous, Token next, String nextText) {
        int previousRow = previous.end().row();
        int previousColumn = previous.end().column();
        int row = next.start().row();
        int column = next.start().column();

        if (previousRow != row) {
            char before = charBefore(previousRow, previousColumn);
            boolean nextIsCloser = nextText.isEmpty()
                    || (nextText.length() == 1 && SourceText.CLOSE_BRACKETS.indexOf(nextText.charAt(0)) >= 0);
            if (before == ',' || (SourceText.OPEN_BRACKETS.indexOf(before) < 0 && !nextIsCloser)) {
                return " ";
            }
            return "";
        }
        if (previousColumn != column) {
            String line = next.sourceLine();
            if (column <= line.length() && previousColumn <= column) {
                return line.substring(previousColumn, column);
            }
        }
        return "";
    }

    private char charBefore(int row, int column) {
        if (row < 1 || row > documentLines.size() || column < 1) {
            return '\0';
        }
        String line = documentLines.get(row - 1);
        return column - 1 < line.length() ? line.charAt(column - 1) : '\0';
    }

    /**
     * Only the characters the tokenizer skips between tokens count here. Other
     * control characters reach the text as ERROR tokens and are kept.
     */
    private static boolean isFiller(char c) {
        return c == ' ' || c == '\t' || c == '\f';
    }

    private static String indentationOf(Token first) {
        String line = first.sourceLine();
        int column = Math.min(first.start().column(), line.length());
        return SourceText.leadingIndentation(line.substring(0, column));
    }
}
