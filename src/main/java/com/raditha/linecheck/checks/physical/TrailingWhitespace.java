package com.raditha.linecheck.checks.physical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.PhysicalLineCheck;
import com.raditha.linecheck.checks.PhysicalLineFix;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.PhysicalLine;

import java.util.Optional;

/**
 * Trailing whitespace is superfluous.
 * <p>
 * A line holding only whitespace is reported as W293, any other line with
 * trailing whitespace as W291 at the end of its content. The trailing run of
 * newlines, carriage returns and form feeds is not whitespace here.
 * </p>
 */
public class TrailingWhitespace implements PhysicalLineCheck, PhysicalLineFix {

    @Override
    public Optional<Diagnostic> check(PhysicalLine line, CheckerContext context) {
        String content = withoutTerminator(line.text());
        String stripped = stripTrailingBlanks(content);
        if (content.equals(stripped)) {
            return Optional.empty();
        }
        if (stripped.isEmpty()) {
            return Optional.of(Diagnostic.of(DiagnosticCode.W293, line));
        }
        return Optional.of(Diagnostic.of(DiagnosticCode.W291, Column.offset(stripped.length()), line));
    }

    @Override
    public String fix(PhysicalLine line, CheckerContext context) {
        String text = line.text();
        String content = withoutTerminator(text);
        String stripped = stripTrailingBlanks(content);
        if (content.equals(stripped)) {
            return text;
        }
        return stripped + text.substring(content.length());
    }

    @Override
    public String documentation() {
        return """
                Trailing whitespace is superfluous.

                The warning returned varies on whether the line itself is blank,
                for easier filtering for those who want to indent their blank lines.

                Okay: spam(1)
                W291: spam(1)\\s
                W293: class Foo(object):\\n    \\n    bang = 12
                """;
    }

    /**
     * Drop the trailing run of newlines, carriage returns and form feeds, in any order.
     */
    static String withoutTerminator(String text) {
        return stripTrailing(text, "\n\r\f");
    }

    private static String stripTrailingBlanks(String s) {
        return stripTrailing(s, " \t\n\r\u000B\f");
    }

    private static String stripTrailing(String s, String chars) {
        int end = s.length();
        while (end > 0 && chars.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(0, end);
    }
}
