package com.raditha.linecheck.checks;

/**
 * Which kind of line a checker runs against.
 */
public enum LineScope {
    PHYSICAL,
    LOGICAL
}
