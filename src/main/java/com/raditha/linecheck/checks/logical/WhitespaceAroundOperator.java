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
 * Avoid extraneous whitespace around an operator: more than one space or a
 * tab on either side.
 */
public class WhitespaceAroundOperator implements LogicalLineCheck {

    private static final Pattern WHITESPACE_AROUND_OPERATOR = Pattern.compile(
            "([^\\w\\s]*)\\s*(\\t|  )\\s*([^\\w\\s]*)", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
        String text = line.dedentedText();
        int indent = line.indentation().length();
        Matcher matcher = WHITESPACE_AROUND_OPERATOR.matcher(text);
        while (matcher.find()) {
            String before = matcher.group(1);
            boolean tab = matcher.group(2).equals("\t");
            String after = matcher.group(3);
            Column column = Column.offset(indent + matcher.start(2));
            if (Operators.OPERATORS.contains(before)) {
                return Optional.of(Diagnostic.of(tab ? DiagnosticCode.E224 : DiagnosticCode.E222, column, line));
            }
            if (Operators.OPERATORS.contains(after)) {
                return Optional.of(Diagnostic.of(tab ? DiagnosticCode.E223 : DiagnosticCode.E221, column, line));
            }
        }
        return Optional.empty();
    }

    @Override
    public String documentation() {
        return """
                Avoid extraneous whitespace in the following situations:

                - More than one space around an assignment (or other) operator to
                  align it with another.

                Okay: a = 12 + 3
                E221: a = 4  + 5
                E222: a = 4 +  5
                E223: a = 4\\t+ 5
                E224: a = 4 +\\t5
                """;
    }
}
