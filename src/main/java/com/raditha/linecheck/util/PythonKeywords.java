package com.raditha.linecheck.util;

import java.util.Set;

/**
 * Reserved words of the analyzed language.
 */
public final class PythonKeywords {

    /**
     * Keywords that may legitimately be followed or preceded by an operator
     * without whitespace, so they never end an operand. {@code True},
     * {@code False} and {@code None} are values and therefore left out;
     * {@code print} is included because it is a statement in older sources.
     */
    public static final Set<String> KEYWORDS = Set.of(
            "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "exec", "finally", "for",
            "from", "global", "if", "import", "in", "is", "lambda", "nonlocal",
            "not", "or", "pass", "print", "raise", "return", "try", "while",
            "with", "yield");

    private PythonKeywords() {
    }

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }
}
