package com.raditha.linecheck.checks.logical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.LogicalLineCheck;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.LogicalLine;

import java.util.Optional;

/**
 * Each comma, semicolon or colon should be followed by whitespace.
 * Slice colons and the comma of a one element tuple are exempt.
 */
public class MissingWhitespaceAfterSeparator implements LogicalLineCheck {

    private static final String SEPARATORS = ",;:";
    private static final String WHITESPACE = " \t";

    @Override
    public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
        String text = line.dedentedText();
        int indent = line.indentation().length();
        for (int index = 0; index < text.length() - 1; index++) {
            char c = text.charAt(index);
            char next = text.charAt(index + 1);
            if (SEPARATORS.indexOf(c) < 0 || WHITESPACE.indexOf(next) >= 0) {
                continue;
            }
            String before = text.substring(0, index);
            if (c == ':' && count(before, '[') > count(before, ']')) {
                continue;
            }
            if (c == ',' && next == ')') {
                continue;
            }
            return Optional.of(Diagnostic.of(DiagnosticCode.E231, Column.offset(indent + index), line,
                    "char", String.valueOf(c)));
        }
        return Optional.empty();
    }

    static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    @Override
    public String documentation() {
        return """
                Each comma, semicolon or colon should be followed by whitespace.

                Okay: [a, b]
                Okay: (3,)
                Okay: a[1:4]
                Okay: a[:4]
                Okay: a[1:]
                Okay: a[1:4:2]
                E231: ['a','b']
                E231: foo(bar,baz)
                """;
    }
}
