package com.raditha.linecheck.checks.logical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.LogicalLineCheck;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.LogicalLine;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Compound statements (multiple statements on the same line) are generally
 * discouraged.
 * <p>
 * A colon inside a dict display or a slice, or one that follows
 * {@code lambda}, does not end a statement and is skipped.
 * </p>
 */
public class CompoundStatements implements LogicalLineCheck {

    private static final Pattern LAMBDA = Pattern.compile("\\blambda\\b");

    @Override
    public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
        String text = line.text();
        int found = text.indexOf(':');
        if (found >= 0 && found < text.length() - 1) {
            String before = text.substring(0, found);
            if (balanced(before, '{', '}')
                    && balanced(before, '[', ']')
                    && !LAMBDA.matcher(before).find()) {
                return Optional.of(Diagnostic.of(DiagnosticCode.E701, Column.offset(found), line));
            }
        }
        found = text.indexOf(';');
        if (found >= 0) {
            return Optional.of(Diagnostic.of(DiagnosticCode.E702, Column.offset(found), line));
        }
        return Optional.empty();
    }

    private static boolean balanced(String s, char open, char close) {
        return MissingWhitespaceAfterSeparator.count(s, open) <= MissingWhitespaceAfterSeparator.count(s, close);
    }

    @Override
    public String documentation() {
        return """
                Compound statements (multiple statements on the same line) are
                generally discouraged.

                While sometimes it's okay to put an if/for/while with a small body
                on the same line, never do this for multi-clause statements. Also
                avoid folding such long lines!

                Okay: if foo == 'blah':\\n    do_blah_thing()
                Okay: do_one()
                Okay: do_two()
                Okay: do_three()

                E701: if foo == 'blah': do_blah_thing()
                E701: for x in lst: total += x
                E701: while t < 10: t = delay()
                E701: if foo == 'blah': do_blah_thing()
                E701: else: do_non_blah_thing()
                E701: try: something()
                E701: finally: cleanup()
                E701: if foo == 'blah': one(); two(); three()

                E702: do_one(); do_two(); do_three()
                """;
    }
}
