package com.raditha.linecheck.tokenize;

import com.raditha.linecheck.model.Position;
import com.raditha.linecheck.model.Token;
import com.raditha.linecheck.model.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy tokenizer for Python source. Lines are pulled from a {@link LineReader}
 * only when the consumer asks for more tokens, so a caller can observe every
 * physical line at the moment it is read.
 *
 * <p>Token boundaries follow the classic Python 2 {@code generate_tokens}
 * contract: comment-only and blank lines produce COMMENT/NL, line breaks
 * inside brackets produce NL, INDENT/DEDENT are synthesized at statement
 * starts and the stream ends with ENDMARKER. A statement whose last line has
 * no terminator is closed by a NEWLINE token with empty text.</p>
 */
public class PythonTokenizer implements Iterator<Token> {

    private static final int TAB_SIZE = 8;
    private static final String STRING_PREFIX_CHARS = "rRbBuUfF";
    private static final String WHITESPACE = " \f\t";
    private static final List<String> OPERATORS = List.of(
            "**=", ">>=", "<<=", "//=",
            "**", ">>", "<<", "<>", "!=", "//", "->",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "==", "<=", ">=", "@=",
            "+", "-", "*", "/", "%", "&", "|", "^", "=", "<", ">", "~",
            "(", ")", "[", "]", "{", "}", ":", ";", ".", ",", "@");

    private static final int UNTERMINATED = -1;
    private static final int CONTINUED = -2;

    private final LineReader reader;
    private final Deque<Token> pending = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    private int lineNumber;
    private int parenLevel;
    private boolean continued;
    private boolean statementOpen;
    private boolean finished;
    private String previousLine = "";

    // State of a string literal spanning several lines
    private StringBuilder contStr;
    private StringBuilder contLine;
    private Position strStart;
    private int contentOffset;
    private String closingQuote;
    private boolean needCont;
    private int lastStringEnd;

    public PythonTokenizer(LineReader reader) {
        this.reader = reader;
        this.indents.push(0);
    }

    /**
     * Tokenize a complete list of lines eagerly.
     */
    public static List<Token> tokenize(List<String> lines) {
        Iterator<String> it = lines.iterator();
        PythonTokenizer tokenizer = new PythonTokenizer(() -> it.hasNext() ? it.next() : "");
        List<Token> tokens = new ArrayList<>();
        tokenizer.forEachRemaining(tokens::add);
        return tokens;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && !finished) {
            readNextLine();
        }
        return !pending.isEmpty();
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("token stream exhausted");
        }
        return pending.poll();
    }

    private void readNextLine() {
        String line = reader.readLine();
        if (line == null) {
            line = "";
        }
        lineNumber++;
        int pos = 0;
        int max = line.length();

        if (contStr != null) {
            if (!continueString(line)) {
                return;
            }
            pos = lastStringEnd;
        } else if (parenLevel == 0 && !continued) {
            if (line.isEmpty()) {
                finish();
                return;
            }
            int column = 0;
            while (pos < max) {
                char c = line.charAt(pos);
                if (c == ' ') {
                    column++;
                } else if (c == '\t') {
                    column = (column / TAB_SIZE + 1) * TAB_SIZE;
                } else if (c == '\f') {
                    column = 0;
                } else {
                    break;
                }
                pos++;
            }
            if (pos == max) {
                finish();
                return;
            }

            char c = line.charAt(pos);
            if (c == '#' || c == '\r' || c == '\n') {
                emitNonLogicalLine(line, pos);
                previousLine = line;
                return;
            }

            if (column > indents.peek()) {
                indents.push(column);
                emit(new Token(TokenType.INDENT, line.substring(0, pos),
                        new Position(lineNumber, 0), new Position(lineNumber, pos), line));
            }
            while (column < indents.peek()) {
                if (!indents.contains(column)) {
                    throw new TokenizeException("unindent does not match any outer indentation level",
                            new Position(lineNumber, pos));
                }
                indents.pop();
                emit(new Token(TokenType.DEDENT, "",
                        new Position(lineNumber, pos), new Position(lineNumber, pos), line));
            }
        } else {
            if (line.isEmpty()) {
                throw new TokenizeException("EOF in multi-line statement", new Position(lineNumber, 0));
            }
            continued = false;
        }

        scanTokens(line, pos);
        previousLine = line;
    }

    /**
     * Feed one more line into a string literal left open on a previous line.
     *
     * @return true when the string was closed and scanning continues on this line
     */
    private boolean continueString(String line) {
        if (line.isEmpty()) {
            throw new TokenizeException("EOF in multi-line string", strStart);
        }
        String combined = contStr + line;
        int end = findStringEnd(combined, contentOffset, closingQuote);
        if (end >= 0) {
            lastStringEnd = end - contStr.length();
            emit(new Token(TokenType.STRING, combined.substring(0, end), strStart,
                    new Position(lineNumber, lastStringEnd), contLine + line));
            statementOpen = true;
            contStr = null;
            contLine = null;
            return true;
        }
        if (needCont && !endsWithEscapedNewline(line)) {
            emit(new Token(TokenType.ERROR, combined, strStart,
                    new Position(lineNumber, line.length()), contLine + line));
            statementOpen = true;
            contStr = null;
            contLine = null;
            previousLine = line;
            return false;
        }
        contStr.append(line);
        contLine.append(line);
        previousLine = line;
        return false;
    }

    private void emitNonLogicalLine(String line, int pos) {
        int max = line.length();
        if (line.charAt(pos) == '#') {
            String comment = stripCrLf(line.substring(pos));
            int nlPos = pos + comment.length();
            emit(Token.of(TokenType.COMMENT, comment, lineNumber, pos, line));
            emit(new Token(TokenType.NL, line.substring(nlPos),
                    new Position(lineNumber, nlPos), new Position(lineNumber, max), line));
        } else {
            emit(new Token(TokenType.NL, line.substring(pos),
                    new Position(lineNumber, pos), new Position(lineNumber, max), line));
        }
    }

    private void scanTokens(String line, int pos) {
        int max = line.length();
        while (pos < max) {
            int start = pos;
            while (start < max && WHITESPACE.indexOf(line.charAt(start)) >= 0) {
                start++;
            }
            if (start == max) {
                return;
            }
            char initial = line.charAt(start);

            if (initial == '\\') {
                if (isLineBreak(line.substring(start + 1))) {
                    continued = true;
                    return;
                }
                emitContributing(Token.of(TokenType.ERROR, "\\", lineNumber, start, line));
                pos = start + 1;
                continue;
            }

            if (initial == '#') {
                String comment = stripCrLf(line.substring(start));
                emit(Token.of(TokenType.COMMENT, comment, lineNumber, start, line));
                pos = start + comment.length();
                continue;
            }

            if (initial == '\n' || initial == '\r') {
                String newline = line.startsWith("\r\n", start) ? "\r\n" : String.valueOf(initial);
                if (parenLevel > 0) {
                    emit(Token.of(TokenType.NL, newline, lineNumber, start, line));
                } else {
                    emit(Token.of(TokenType.NEWLINE, newline, lineNumber, start, line));
                    statementOpen = false;
                }
                pos = start + newline.length();
                continue;
            }

            int prefixLength = stringPrefixLength(line, start);
            if (prefixLength >= 0) {
                int next = scanString(line, start, prefixLength);
                if (next == CONTINUED) {
                    return;
                }
                if (next >= 0) {
                    pos = next;
                    continue;
                }
                if (prefixLength == 0) {
                    emitContributing(Token.of(TokenType.ERROR, String.valueOf(initial), lineNumber, start, line));
                    pos = start + 1;
                    continue;
                }
                // unterminated prefixed string: the prefix lexes as a name
            }

            if (isDigit(initial) || (initial == '.' && start + 1 < max && isDigit(line.charAt(start + 1)))) {
                int end = scanNumber(line, start);
                emitContributing(Token.of(TokenType.NUMBER, line.substring(start, end), lineNumber, start, line));
                pos = end;
                continue;
            }

            if (isNameStart(initial)) {
                int end = start + 1;
                while (end < max && isNamePart(line.charAt(end))) {
                    end++;
                }
                emitContributing(Token.of(TokenType.NAME, line.substring(start, end), lineNumber, start, line));
                pos = end;
                continue;
            }

            String operator = matchOperator(line, start);
            if (operator != null) {
                if (operator.length() == 1 && "([{".contains(operator)) {
                    parenLevel++;
                } else if (operator.length() == 1 && ")]}".contains(operator)) {
                    parenLevel--;
                }
                emitContributing(Token.of(TokenType.OP, operator, lineNumber, start, line));
                pos = start + operator.length();
                continue;
            }

            emitContributing(Token.of(TokenType.ERROR, String.valueOf(initial), lineNumber, start, line));
            pos = start + 1;
        }
    }

    /**
     * Scan a string literal starting at {@code start}.
     *
     * @return the index after the literal, {@link #CONTINUED} if it runs onto
     * the next line, or {@link #UNTERMINATED}
     */
    private int scanString(String line, int start, int prefixLength) {
        int quoteStart = start + prefixLength;
        char quote = line.charAt(quoteStart);
        String triple = String.valueOf(quote).repeat(3);

        if (line.startsWith(triple, quoteStart)) {
            int end = findStringEnd(line, quoteStart + 3, triple);
            if (end >= 0) {
                emitContributing(Token.of(TokenType.STRING, line.substring(start, end), lineNumber, start, line));
                return end;
            }
            openContinuation(line, start, quoteStart + 3 - start, triple, false);
            return CONTINUED;
        }

        int end = findSingleQuotedEnd(line, quoteStart + 1, quote);
        if (end >= 0) {
            emitContributing(Token.of(TokenType.STRING, line.substring(start, end), lineNumber, start, line));
            return end;
        }
        if (end == CONTINUED) {
            openContinuation(line, start, quoteStart + 1 - start, String.valueOf(quote), true);
            return CONTINUED;
        }
        return UNTERMINATED;
    }

    private void openContinuation(String line, int start, int offset, String quote, boolean escapedNewline) {
        strStart = new Position(lineNumber, start);
        contStr = new StringBuilder(line.substring(start));
        contLine = new StringBuilder(line);
        contentOffset = offset;
        closingQuote = quote;
        needCont = escapedNewline;
        statementOpen = true;
    }

    private void finish() {
        if (statementOpen) {
            int row = Math.max(lineNumber - 1, 1);
            emit(new Token(TokenType.NEWLINE, "", new Position(row, previousLine.length()),
                    new Position(row, previousLine.length() + 1), previousLine));
            statementOpen = false;
        }
        while (indents.size() > 1) {
            indents.pop();
            emit(new Token(TokenType.DEDENT, "",
                    new Position(lineNumber, 0), new Position(lineNumber, 0), ""));
        }
        emit(new Token(TokenType.ENDMARKER, "",
                new Position(lineNumber, 0), new Position(lineNumber, 0), ""));
        finished = true;
    }

    private void emit(Token token) {
        pending.add(token);
    }

    private void emitContributing(Token token) {
        statementOpen = true;
        pending.add(token);
    }

    static int findStringEnd(CharSequence text, int from, String delimiter) {
        String s = text.toString();
        int i = from;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (s.startsWith(delimiter, i)) {
                return i + delimiter.length();
            }
            i++;
        }
        return UNTERMINATED;
    }

    private static int findSingleQuotedEnd(String line, int from, char quote) {
        int i = from;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\') {
                if (isLineBreak(line.substring(i + 1))) {
                    return CONTINUED;
                }
                if (i + 1 >= line.length()) {
                    return UNTERMINATED;
                }
                i += 2;
                continue;
            }
            if (c == '\n' || c == '\r') {
                return UNTERMINATED;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return UNTERMINATED;
    }

    /**
     * Length of the string prefix at {@code start} if a string literal starts there, otherwise -1.
     */
    private static int stringPrefixLength(String line, int start) {
        for (int k = 0; k <= 2 && start + k < line.length(); k++) {
            char c = line.charAt(start + k);
            if (c == '\'' || c == '"') {
                return k;
            }
            if (STRING_PREFIX_CHARS.indexOf(c) < 0) {
                return -1;
            }
        }
        return -1;
    }

    private static int scanNumber(String line, int start) {
        int max = line.length();
        int i = start;
        if (line.charAt(i) == '0' && i + 1 < max && "xXoObB".indexOf(line.charAt(i + 1)) >= 0) {
            i += 2;
            while (i < max && (isAsciiAlphanumeric(line.charAt(i)) || line.charAt(i) == '_')) {
                i++;
            }
        } else {
            i = skipDigits(line, i);
            if (i < max && line.charAt(i) == '.') {
                i = skipDigits(line, i + 1);
            }
            if (i < max && (line.charAt(i) == 'e' || line.charAt(i) == 'E')) {
                int j = i + 1;
                if (j < max && (line.charAt(j) == '+' || line.charAt(j) == '-')) {
                    j++;
                }
                if (j < max && isDigit(line.charAt(j))) {
                    i = skipDigits(line, j);
                }
            }
        }
        if (i < max && "jJlL".indexOf(line.charAt(i)) >= 0) {
            i++;
        }
        return i;
    }

    private static int skipDigits(String line, int i) {
        while (i < line.length() && (isDigit(line.charAt(i)) || line.charAt(i) == '_')) {
            i++;
        }
        return i;
    }

    private static String matchOperator(String line, int start) {
        for (String operator : OPERATORS) {
            if (line.startsWith(operator, start)) {
                return operator;
            }
        }
        return null;
    }

    private static boolean isLineBreak(String rest) {
        return rest.equals("\n") || rest.equals("\r\n") || rest.equals("\r");
    }

    private static boolean endsWithEscapedNewline(String line) {
        return line.endsWith("\\\n") || line.endsWith("\\\r\n") || line.endsWith("\\\r");
    }

    private static String stripCrLf(String s) {
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '\n' || s.charAt(end - 1) == '\r')) {
            end--;
        }
        return s.substring(0, end);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isNameStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isNamePart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
