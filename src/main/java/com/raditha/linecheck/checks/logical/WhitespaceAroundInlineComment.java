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
import com.raditha.linecheck.util.SourceText;

import java.util.Optional;

/**
 * Separate inline comments by at least two spaces and start every comment
 * with '# '. A comment that stands alone on its line is only held to the
 * second rule. A bare '#' and a '#!' first line are accepted.
 */
public class WhitespaceAroundInlineComment implements LogicalLineCheck {

    @Override
    public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
        Position previousEnd = new Position(0, 0);
        for (Token token : line.tokens()) {
            if (token.type() == TokenType.NL) {
                continue;
            }
            if (token.type() != TokenType.COMMENT) {
                previousEnd = token.end();
                continue;
            }
            Position start = token.start();
            String source = token.sourceLine();
            boolean shebang = start.row() == 1 && token.text().startsWith("#!");
            if (!shebang && badlyStarted(SourceText.stripLineTerminators(token.text()))) {
                return Optional.of(Diagnostic.of(DiagnosticCode.E262, Column.at(start), line));
            }
            boolean standalone = SourceText.isBlank(source.substring(0, Math.min(start.column(), source.length())));
            if (!standalone && previousEnd.row() == start.row() && start.column() < previousEnd.column() + 2) {
                return Optional.of(Diagnostic.of(DiagnosticCode.E261, Column.at(previousEnd), line));
            }
        }
        return Optional.empty();
    }

    private static boolean badlyStarted(String text) {
        return text.length() > 1 && (text.startsWith("#  ") || !text.startsWith("# "));
    }

    @Override
    public String documentation() {
        return """
                Separate inline comments by at least two spaces.

                An inline comment is a comment on the same line as a statement.
                Inline comments should be separated by at least two spaces from the
                statement. They should start with a # and a single space.

                Okay: x = x + 1  # Increment x
                Okay: x = x + 1    # Increment x
                E261: x = x + 1 # Increment x
                E262: x = x + 1  #Increment x
                E262: x = x + 1  #  Increment x
                E262: #Block comment
                """;
    }
}
