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
 * Don't use spaces around the '=' sign of a keyword argument or a default
 * parameter value.
 */
public class WhitespaceAroundNamedParameterEquals implements LogicalLineCheck {

    private static final Pattern NAMED_PARAMETER_EQUALS = Pattern.compile("[()]|\\s=[^=]|[^=!<>]=\\s");

    @Override
    public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
        String text = line.dedentedText();
        int indent = line.indentation().length();
        int parens = 0;
        Matcher matcher = NAMED_PARAMETER_EQUALS.matcher(text);
        while (matcher.find()) {
            String match = matcher.group();
            if (parens != 0 && match.length() == 3) {
                return Optional.of(Diagnostic.of(DiagnosticCode.E251, Column.offset(indent + matcher.start()), line));
            }
            if (match.equals("(")) {
                parens++;
            } else if (match.equals(")")) {
                parens--;
            }
        }
        return Optional.empty();
    }

    @Override
    public String documentation() {
        return """
                Don't use spaces around the '=' sign when used to indicate a
                keyword argument or a default parameter value.

                Okay: def complex(real, imag=0.0):
                Okay: return magic(r=real, i=imag)
                Okay: boolean(a == b)
                Okay: boolean(a != b)
                Okay: boolean(a <= b)
                Okay: boolean(a >= b)

                E251: def complex(real, imag = 0.0):
                E251: return magic(r = real, i = imag)
                """;
    }
}
