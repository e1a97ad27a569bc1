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
 * Avoid extraneous whitespace immediately inside brackets and before
 * commas, semicolons and colons.
 */
public class ExtraneousWhitespace implements LogicalLineCheck {

    private static final Pattern EXTRANEOUS_WHITESPACE = Pattern.compile("[\\[({] | [\\]}),;:]");

    @Override
    public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
        String text = line.dedentedText();
        int indent = line.indentation().length();
        Matcher matcher = EXTRANEOUS_WHITESPACE.matcher(text);
        while (matcher.find()) {
            String match = matcher.group();
            String symbol = match.strip();
            int found = matcher.start();
            if (match.equals(symbol + " ")) {
                return Optional.of(Diagnostic.of(DiagnosticCode.E201, Column.offset(indent + found + 1), line,
                        "char", symbol));
            }
            if (found > 0 && text.charAt(found - 1) != ',') {
                DiagnosticCode code = "}])".contains(symbol) ? DiagnosticCode.E202 : DiagnosticCode.E203;
                return Optional.of(Diagnostic.of(code, Column.offset(indent + found), line, "char", symbol));
            }
        }
        return Optional.empty();
    }

    @Override
    public String documentation() {
        return """
                Avoid extraneous whitespace in the following situations:

                - Immediately inside parentheses, brackets or braces.
                - Immediately before a comma, semicolon, or colon.

                Okay: spam(ham[1], {eggs: 2})
                E201: spam( ham[1], {eggs: 2})
                E201: spam(ham[ 1], {eggs: 2})
                E201: spam(ham[1], { eggs: 2})
                E202: spam(ham[1], {eggs: 2} )
                E202: spam(ham[1 ], {eggs: 2})
                E202: spam(ham[1], {eggs: 2 })

                E203: if x == 4: print x, y; x, y = y , x
                E203: if x == 4: print x, y ; x, y = y, x
                E203: if x == 4 : print x, y; x, y = y, x
                """;
    }
}
