package com.raditha.linecheck.model;

/**
 * Kind of a lexical token produced by the tokenizer.
 * Mirrors the token classes of the Python tokenizer.
 */
public enum TokenType {
    /** Identifier or keyword */
    NAME(true),

    /** Numeric literal */
    NUMBER(true),

    /** Operator, bracket or delimiter */
    OP(true),

    /** String literal including prefix and quotes */
    STRING(true),

    /** Comment, without the line terminator */
    COMMENT(false),

    /** End of a logical statement */
    NEWLINE(false),

    /** Line break that does not end a statement (blank line, comment line, inside brackets) */
    NL(false),

    /** Increase of the indentation level */
    INDENT(false),

    /** Decrease of the indentation level */
    DEDENT(false),

    /** End of input */
    ENDMARKER(false),

    /** Character the tokenizer could not classify (e.g. a backtick) */
    ERROR(true),

    /** Other/unknown token type */
    OTHER(true);

    private final boolean contributing;

    TokenType(boolean contributing) {
        this.contributing = contributing;
    }

    /**
     * Whether tokens of this type contribute text to a logical line.
     */
    public boolean isContributing() {
        return contributing;
    }
}
