package com.raditha.linecheck.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Text helpers shared by the tokenizer, the logical line builder and the checkers.
 */
public final class SourceText {

    public static final String INDENTATION_WHITESPACE = " \t";
    public static final String OPEN_BRACKETS = "([{";
    public static final String CLOSE_BRACKETS = ")]}";

    private SourceText() {
    }

    /**
     * Return the leading run of spaces and tabs of a string.
     */
    public static String leadingIndentation(String s) {
        return leadingRun(s, INDENTATION_WHITESPACE);
    }

    /**
     * Return the leading run of characters drawn from {@code chars}.
     */
    public static String leadingRun(String s, String chars) {
        int i = 0;
        while (i < s.length() && chars.indexOf(s.charAt(i)) >= 0) {
            i++;
        }
        return s.substring(0, i);
    }

    /**
     * Return the amount of indentation. Tabs are expanded to the next multiple of 8.
     */
    public static int indentationLevel(String s) {
        int result = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\t') {
                result = result / 8 * 8 + 8;
            } else if (c == ' ') {
                result++;
            } else {
                break;
            }
        }
        return result;
    }

    /**
     * Remove line terminators (\n, \r and form feed) from the end of a line.
     */
    public static String stripLineTerminators(String s) {
        int end = s.length();
        while (end > 0 && isTerminatorChar(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }

    /**
     * Return the terminator characters at the end of a line, or "" if there are none.
     */
    public static String lineEnding(String s) {
        return s.substring(stripLineTerminators(s).length());
    }

    public static boolean endsWithLineTerminator(String s) {
        return !s.isEmpty() && (s.charAt(s.length() - 1) == '\n' || s.charAt(s.length() - 1) == '\r');
    }

    /**
     * Whether the string contains only whitespace.
     */
    public static boolean isBlank(String s) {
        return s.strip().isEmpty();
    }

    /**
     * Split source text into lines, keeping each line's terminator (\n, \r\n or \r).
     */
    public static List<String> splitLines(String source) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\n') {
                lines.add(source.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = i + 1 < source.length() && source.charAt(i + 1) == '\n' ? i + 2 : i + 1;
                lines.add(source.substring(start, end));
                start = end;
                i = end - 1;
            }
            i++;
        }
        if (start < source.length()) {
            lines.add(source.substring(start));
        }
        return lines;
    }

    private static boolean isTerminatorChar(char c) {
        return c == '\n' || c == '\r' || c == '\f';
    }
}
