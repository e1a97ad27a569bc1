package com.raditha.linecheck.checks;

import com.raditha.linecheck.model.LogicalLine;

/**
 * Rule that runs once for every reconstructed statement.
 */
@FunctionalInterface
public interface LogicalLineCheck extends LineCheck<LogicalLine> {
}
