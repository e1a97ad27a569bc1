package com.raditha.linecheck.analyzer;

import com.raditha.linecheck.detection.LogicalLineBuilder;
import com.raditha.linecheck.model.LogicalLine;
import com.raditha.linecheck.model.StructuralException;
import com.raditha.linecheck.model.Token;
import com.raditha.linecheck.util.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Groups a token stream into statements.
 * <p>
 * Tokens are buffered until a NEWLINE closes the statement at bracket depth
 * zero. Blank lines are counted between statements; a standalone comment
 * moves the running count into a separate counter so that a comment block
 * does not hide the blank lines above it from the spacing rules. Comment
 * lines stay in the buffer and reach the next statement's token list.
 * </p>
 */
public class StatementSegmenter {

    private final LogicalLineBuilder builder;
    private final List<Token> buffer = new ArrayList<>();
    private int depth;
    private int lineStart;
    private int blankLines;
    private int blankLinesBeforeComment;

    public StatementSegmenter(LogicalLineBuilder builder) {
        this.builder = builder;
    }

    /**
     * Consume the next token.
     *
     * @return the logical line completed by this token, if any
     * @throws StructuralException if brackets close more than they open or
     *                             input ends inside a statement
     */
    public Optional<LogicalLine> accept(Token token) {
        buffer.add(token);
        if (token.isOpenBracket()) {
            depth++;
        } else if (token.isCloseBracket()) {
            depth--;
            if (depth < 0) {
                throw new StructuralException("unbalanced closing bracket", token.start());
            }
        }

        switch (token.type()) {
            case NEWLINE -> {
                if (depth == 0) {
                    return completeStatement(token.start().row());
                }
            }
            case NL -> {
                if (depth == 0) {
                    if (buffer.size() - lineStart == 1) {
                        blankLines++;
                        buffer.remove(buffer.size() - 1);
                    }
                    lineStart = buffer.size();
                }
            }
            case COMMENT -> acceptComment(token);
            case ENDMARKER -> finish(token);
            default -> {
                // buffered until the statement ends
            }
        }
        return Optional.empty();
    }

    /**
     * Blank lines counted since the last statement.
     */
    public int getBlankLines() {
        return blankLines;
    }

    public int getBlankLinesBeforeComment() {
        return blankLinesBeforeComment;
    }

    public int getDepth() {
        return depth;
    }

    private void acceptComment(Token token) {
        String line = token.sourceLine();
        int column = Math.min(token.start().column(), line.length());
        if (SourceText.isBlank(line.substring(0, column))) {
            blankLinesBeforeComment = Math.max(blankLines, blankLinesBeforeComment);
            blankLines = 0;
        }
        if (SourceText.endsWithLineTerminator(token.text()) && depth == 0) {
            lineStart = buffer.size();
        }
    }

    private Optional<LogicalLine> completeStatement(int lineNumber) {
        Optional<LogicalLine> line = builder.build(buffer, blankLines, blankLinesBeforeComment, lineNumber);
        buffer.clear();
        lineStart = 0;
        blankLines = 0;
        blankLinesBeforeComment = 0;
        return line;
    }

    private void finish(Token endMarker) {
        boolean open = buffer.stream().anyMatch(Token::isContributing);
        if (open || depth != 0) {
            throw new StructuralException("unterminated statement", endMarker.start());
        }
        buffer.clear();
        lineStart = 0;
    }
}
