package com.raditha.linecheck.model;

import com.raditha.linecheck.util.SourceText;

import java.util.List;

/**
 * One reconstructed statement: continuation lines joined, string contents
 * muted, comments dropped and whitespace between tokens normalized.
 *
 * @param text                    Leading indentation followed by the normalized statement
 * @param lineNumber              Row of the NEWLINE token that ended the statement
 * @param tokens                  All tokens buffered for the statement, comments and NL included
 * @param blankLines              Blank lines directly before the statement
 * @param blankLinesBeforeComment Blank lines before the comment block preceding the statement
 * @param tokenOffsetMapping      Offsets in {@code text} where each contributing token starts,
 *                                strictly increasing
 */
public record LogicalLine(
        String text,
        int lineNumber,
        List<Token> tokens,
        int blankLines,
        int blankLinesBeforeComment,
        List<OffsetMapping> tokenOffsetMapping) implements SourceLine {

    public LogicalLine {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        tokenOffsetMapping = tokenOffsetMapping == null ? List.of() : List.copyOf(tokenOffsetMapping);
    }

    /**
     * Create a logical line from text alone, without tokens or blank line history.
     */
    public static LogicalLine of(String text) {
        return new LogicalLine(text, 1, List.of(), 0, 0, List.of());
    }

    /**
     * The leading run of spaces and tabs.
     */
    public String indentation() {
        return SourceText.leadingIndentation(text);
    }

    /**
     * Indentation width with tabs expanded to multiples of 8.
     */
    public int indentLevel() {
        return SourceText.indentationLevel(text);
    }

    /**
     * The text with its leading indentation removed.
     */
    public String dedentedText() {
        return text.substring(indentation().length());
    }

    /**
     * Largest blank line run before this statement, comment blocks included.
     */
    public int maxBlankLines() {
        return Math.max(blankLines, blankLinesBeforeComment);
    }

    /**
     * Tokens that contributed text to this line, in source order.
     */
    public List<Token> contributingTokens() {
        return tokens.stream().filter(Token::isContributing).toList();
    }

    @Override
    public Location locate(Column column) {
        if (column instanceof Column.At at) {
            return Location.of(at.position());
        }
        if (column instanceof Column.Offset offset) {
            return locateOffset(offset.value());
        }
        return new Location(lineNumber, 0);
    }

    private Location locateOffset(int offset) {
        if (tokenOffsetMapping.isEmpty()) {
            return new Location(lineNumber, offset);
        }
        OffsetMapping anchor = tokenOffsetMapping.get(0);
        for (OffsetMapping entry : tokenOffsetMapping) {
            if (entry.offset() > offset) {
                break;
            }
            anchor = entry;
        }
        Position start = anchor.token().start();
        return new Location(start.row(), start.column() + offset - anchor.offset());
    }
}
