package com.raditha.linecheck.model;

import com.raditha.linecheck.util.SourceText;

import java.util.List;
import java.util.Optional;

/**
 * The analyzed file: its raw lines plus the indentation character and line
 * ending most of them use. Computed once and never changed.
 */
public final class Document {

    private static final List<String> LINE_ENDINGS = List.of("\n", "\r\n", "\r");

    private final List<String> lines;
    private final char indentChar;
    private final String lineEnding;

    private Document(List<String> lines) {
        this.lines = List.copyOf(lines);
        this.indentChar = mostCommonIndentChar(this.lines);
        this.lineEnding = mostCommonLineEnding(this.lines);
    }

    /**
     * Create a document from lines that keep their terminators.
     */
    public static Document of(List<String> lines) {
        return new Document(lines);
    }

    /**
     * Create a document from source text.
     */
    public static Document fromSource(String source) {
        return new Document(SourceText.splitLines(source));
    }

    public List<String> lines() {
        return lines;
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * Get a line by its 1-based number, or "" past the end.
     */
    public String line(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.size()) {
            return "";
        }
        return lines.get(lineNumber - 1);
    }

    /**
     * The indentation character used most: ' ' or '\t'. Spaces win a tie.
     */
    public char indentChar() {
        return indentChar;
    }

    /**
     * The line terminator used most, empty when no line has one.
     * "\n" wins a tie over "\r\n", which wins over "\r".
     */
    public Optional<String> lineEnding() {
        return Optional.ofNullable(lineEnding);
    }

    static char mostCommonIndentChar(List<String> lines) {
        int spaces = 0;
        int tabs = 0;
        for (String line : lines) {
            String indentation = SourceText.leadingIndentation(line);
            for (int i = 0; i < indentation.length(); i++) {
                if (indentation.charAt(i) == ' ') {
                    spaces++;
                } else {
                    tabs++;
                }
            }
        }
        return tabs > spaces ? '\t' : ' ';
    }

    static String mostCommonLineEnding(List<String> lines) {
        String best = null;
        int bestCount = 0;
        for (String candidate : LINE_ENDINGS) {
            int count = 0;
            for (String line : lines) {
                if (SourceText.lineEnding(line).equals(candidate)) {
                    count++;
                }
            }
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }
}
