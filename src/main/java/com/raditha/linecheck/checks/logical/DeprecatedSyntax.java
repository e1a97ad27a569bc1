package com.raditha.linecheck.checks.logical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.LogicalLineCheck;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.LogicalLine;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Constructs removed from the language in Python 3.
 */
public final class DeprecatedSyntax {

    private DeprecatedSyntax() {
    }

    private static Optional<Diagnostic> find(LogicalLine line, String needle, DiagnosticCode code) {
        int found = line.text().indexOf(needle);
        if (found >= 0) {
            return Optional.of(Diagnostic.of(code, Column.offset(found), line));
        }
        return Optional.empty();
    }

    /**
     * {@code dict.has_key(key)} was removed; use {@code key in dict}.
     */
    public static class HasKey implements LogicalLineCheck {
        @Override
        public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
            return find(line, ".has_key(", DiagnosticCode.W601);
        }

        @Override
        public String documentation() {
            return """
                    The {}.has_key() method will be removed in the future version of
                    Python. Use the 'in' operation instead, like:
                    d = {"a": 1, "b": 2}
                    if "b" in d:
                        print d["b"]
                    """;
        }
    }

    /**
     * {@code raise E, "message"} must be written {@code raise E("message")}.
     */
    public static class RaiseComma implements LogicalLineCheck {

        private static final Pattern RAISE_COMMA = Pattern.compile("raise\\s+\\w+\\s*(,)");

        @Override
        public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
            Matcher matcher = RAISE_COMMA.matcher(line.dedentedText());
            if (matcher.lookingAt()) {
                int offset = line.indentation().length() + matcher.start(1);
                return Optional.of(Diagnostic.of(DiagnosticCode.W602, Column.offset(offset), line));
            }
            return Optional.empty();
        }

        @Override
        public String documentation() {
            return """
                    When raising an exception, use "raise ValueError('message')"
                    instead of the older form "raise ValueError, 'message'".

                    The paren-using form is preferred because when the exception
                    arguments are long or include string formatting, you don't need to
                    use line continuation characters thanks to the containing
                    parentheses. The older form will be removed in Python 3000.
                    """;
        }
    }

    public static class NotEqual implements LogicalLineCheck {
        @Override
        public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
            return find(line, "<>", DiagnosticCode.W603);
        }

        @Override
        public String documentation() {
            return """
                    != can also be written <>, but this is an obsolete usage kept for
                    backwards compatibility only. New code should always use !=.
                    The older syntax is removed in Python 3000.
                    """;
        }
    }

    public static class Backticks implements LogicalLineCheck {
        @Override
        public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
            return find(line, "`", DiagnosticCode.W604);
        }

        @Override
        public String documentation() {
            return """
                    Backticks are removed in Python 3000.
                    Use repr() instead.
                    """;
        }
    }
}
