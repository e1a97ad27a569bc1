package com.raditha.linecheck.model;

/**
 * Associates an offset in a logical line's text with the token that
 * starts there.
 */
public record OffsetMapping(int offset, Token token) {
}
