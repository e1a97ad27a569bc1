package com.raditha.linecheck.tokenize;

/**
 * Supplies physical lines to the tokenizer one at a time.
 */
@FunctionalInterface
public interface LineReader {

    /**
     * Return the next physical line including its terminator, or "" at end of input.
     */
    String readLine();
}
