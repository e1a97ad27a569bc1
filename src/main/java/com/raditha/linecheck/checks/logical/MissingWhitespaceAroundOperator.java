package com.raditha.linecheck.checks.logical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.LogicalLineCheck;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.LogicalLine;
import com.raditha.linecheck.model.Position;
import com.raditha.linecheck.model.Token;
import com.raditha.linecheck.model.TokenType;
import com.raditha.linecheck.util.PythonKeywords;

import java.util.Optional;

/**
 * Surround binary operators with a single space on either side.
 * <p>
 * Walks the tokens of the statement. Once a binary operator has been seen,
 * the next token must be separated from it; an operator that touches the
 * token before it is reported straight away. Keyword arguments and lambda
 * defaults may use {@code =} without spaces, and an operator in unary
 * position (after another operator, after a keyword or at the start of an
 * expression) needs no space.
 * </p>
 */
public class MissingWhitespaceAroundOperator implements LogicalLineCheck {

    @Override
    public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
        int parens = 0;
        boolean needSpace = false;
        TokenType previousType = TokenType.OP;
        String previousText = null;
        Position previousEnd = null;

        for (Token token : line.tokens()) {
            if (!token.isContributing() || token.type() == TokenType.ERROR) {
                continue;
            }
            String text = token.text();
            if (text.equals("(") || text.equals("lambda")) {
                parens++;
            } else if (text.equals(")")) {
                parens--;
            }

            if (needSpace) {
                if (!token.start().equals(previousEnd)) {
                    needSpace = false;
                } else if (!(text.equals(">") && "<".equals(previousText))) {
                    return report(previousEnd, line);
                }
            } else if (token.type() == TokenType.OP && previousEnd != null) {
                if (text.equals("=") && parens > 0) {
                    // keyword argument or default value
                    needSpace = false;
                } else if (Operators.BINARY_OPERATORS.contains(text)) {
                    needSpace = true;
                } else if (Operators.UNARY_OPERATORS.contains(text)) {
                    boolean afterOperand = previousType != TokenType.OP || isCloser(previousText);
                    boolean afterKeyword = previousType == TokenType.NAME && PythonKeywords.isKeyword(previousText);
                    needSpace = afterOperand && !afterKeyword;
                }
                if (needSpace && token.start().equals(previousEnd)) {
                    return report(previousEnd, line);
                }
            }
            previousType = token.type();
            previousText = text;
            previousEnd = token.end();
        }
        return Optional.empty();
    }

    private static boolean isCloser(String text) {
        return text != null && (text.equals("}") || text.equals("]") || text.equals(")"));
    }

    private static Optional<Diagnostic> report(Position position, LogicalLine line) {
        return Optional.of(Diagnostic.of(DiagnosticCode.E225, Column.at(position), line));
    }

    @Override
    public String documentation() {
        return """
                Surround these binary operators with a single space on either side:
                assignment (=), augmented assignment (+=, -= etc.),
                comparisons (==, <, >, !=, <>, <=, >=, in, not in, is, is not),
                Booleans (and, or, not).

                Use spaces around arithmetic operators.

                Okay: i = i + 1
                Okay: submitted += 1
                Okay: x = x * 2 - 1
                Okay: hypot2 = x * x + y * y
                Okay: c = (a + b) * (a - b)
                Okay: foo(bar, key='word', *args, **kwargs)
                Okay: baz(**kwargs)
                Okay: negative = -1
                Okay: spam(-1)
                Okay: alpha[:-i]
                Okay: if not -5 < x < +5:\\n    pass
                Okay: lambda *args, **kw: (args, kw)

                E225: i=i+1
                E225: submitted +=1
                E225: x = x*2 - 1
                E225: hypot2 = x*x + y*y
                E225: c = (a+b) * (a-b)
                E225: c = alpha -4
                E225: z = x **y
                E225: z = (x + 1) **y
                E225: z = (x + 1)** y
                E225: _1kB = _1MB >>10
                E225: i=i+ 1
                E225: i=i +1
                """;
    }
}
