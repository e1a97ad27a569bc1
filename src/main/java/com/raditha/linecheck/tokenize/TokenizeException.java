package com.raditha.linecheck.tokenize;

import com.raditha.linecheck.model.Position;
import com.raditha.linecheck.model.StructuralException;

/**
 * Lexical failure the tokenizer cannot recover from: end of input inside a
 * multi-line string or statement, or a dedent to an unknown level.
 */
public class TokenizeException extends StructuralException {

    public TokenizeException(String message, Position position) {
        super(message, position);
    }
}
