package com.raditha.linecheck.checks;

import com.raditha.linecheck.model.PhysicalLine;

/**
 * Implemented by physical rules whose violations can be repaired by
 * rewriting the offending line.
 */
public interface PhysicalLineFix {

    /**
     * Return the corrected text of the line, terminator included.
     * Lines without a violation are returned unchanged.
     */
    String fix(PhysicalLine line, CheckerContext context);
}
