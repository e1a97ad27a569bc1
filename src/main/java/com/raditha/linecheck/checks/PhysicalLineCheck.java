package com.raditha.linecheck.checks;

import com.raditha.linecheck.model.PhysicalLine;

/**
 * Rule that runs once for every raw line of the file.
 */
@FunctionalInterface
public interface PhysicalLineCheck extends LineCheck<PhysicalLine> {
}
