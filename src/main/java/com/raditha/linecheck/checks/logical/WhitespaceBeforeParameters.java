package com.raditha.linecheck.checks.logical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.LogicalLineCheck;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.LogicalLine;
import com.raditha.linecheck.model.Token;
import com.raditha.linecheck.model.TokenType;
import com.raditha.linecheck.util.PythonKeywords;

import java.util.List;
import java.util.Optional;

/**
 * Avoid whitespace before the parenthesis that starts an argument list or
 * the bracket that starts an indexing or slicing.
 * <p>
 * {@code class A (B):} is tolerated, and so is a keyword followed by a
 * parenthesized expression such as {@code return (x)}.
 * </p>
 */
public class WhitespaceBeforeParameters implements LogicalLineCheck {

    @Override
    public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
        List<Token> tokens = line.contributingTokens();
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        Token previous = tokens.get(0);
        for (int index = 1; index < tokens.size(); index++) {
            Token token = tokens.get(index);
            if (opensParameters(token)
                    && !token.start().equals(previous.end())
                    && (previous.type() == TokenType.NAME || previous.isCloseBracket())
                    && (index < 2 || !tokens.get(index - 2).text().equals("class"))
                    && !PythonKeywords.isKeyword(previous.text())) {
                return Optional.of(Diagnostic.of(DiagnosticCode.E211, Column.at(previous.end()), line,
                        "char", token.text()));
            }
            previous = token;
        }
        return Optional.empty();
    }

    private static boolean opensParameters(Token token) {
        return token.isOperator("(") || token.isOperator("[");
    }

    @Override
    public String documentation() {
        return """
                Avoid extraneous whitespace immediately before the open parenthesis
                that starts the argument list of a function call, or before the open
                bracket that starts an indexing or slicing.

                Okay: spam(1)
                E211: spam (1)

                Okay: dict['key'] = list[index]
                E211: dict ['key'] = list[index]
                E211: dict['key'] = list [index]
                """;
    }
}
