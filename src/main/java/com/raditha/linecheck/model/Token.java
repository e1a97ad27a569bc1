package com.raditha.linecheck.model;

/**
 * A lexical token of the analyzed source.
 *
 * @param type       Token type category
 * @param text       Exact source text of the token (strings keep prefix and quotes)
 * @param start      Position of the first character
 * @param end        Position just past the last character
 * @param sourceLine Physical line(s) the token was lexed from
 */
public record Token(
        TokenType type,
        String text,
        Position start,
        Position end,
        String sourceLine) {

    /**
     * Create a token that starts and ends on one row.
     */
    public static Token of(TokenType type, String text, int row, int column, String sourceLine) {
        return new Token(type, text, new Position(row, column), new Position(row, column + text.length()), sourceLine);
    }

    /**
     * Check if this is an operator token with the given text.
     */
    public boolean isOperator(String operator) {
        return type == TokenType.OP && text.equals(operator);
    }

    public boolean isOpenBracket() {
        return type == TokenType.OP && text.length() == 1 && "([{".indexOf(text.charAt(0)) >= 0;
    }

    public boolean isCloseBracket() {
        return type == TokenType.OP && text.length() == 1 && ")]}".indexOf(text.charAt(0)) >= 0;
    }

    public boolean isContributing() {
        return type.isContributing();
    }
}
