package com.raditha.linecheck.model;

/**
 * Raised when the token stream of a file is malformed or truncated, e.g. a
 * statement left open at end of input or a closing bracket without an
 * opening one. Distinct from style diagnostics: it stops the analysis of
 * the file it occurred in.
 */
public class StructuralException extends RuntimeException {

    private final transient Position position;

    public StructuralException(String message, Position position) {
        super(message + " at " + position);
        this.position = position;
    }

    /**
     * Where in the source the problem was detected.
     */
    public Position getPosition() {
        return position;
    }
}
