package com.raditha.linecheck.checks;

import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.SourceLine;

import java.util.Set;

/**
 * Registry entry describing one checker.
 *
 * @param id    Stable name of the checker, e.g. {@code extraneous-whitespace}
 * @param scope Whether the checker sees physical or logical lines
 * @param codes Codes the checker may emit
 * @param check The rule itself
 * @param <L>   Line type matching {@code scope}
 */
public record CheckerDescriptor<L extends SourceLine>(
        String id,
        LineScope scope,
        Set<DiagnosticCode> codes,
        LineCheck<L> check) {

    public CheckerDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("checker id cannot be blank");
        }
        if (codes == null || codes.isEmpty()) {
            throw new IllegalArgumentException("checker " + id + " must declare at least one code");
        }
        codes = Set.copyOf(codes);
    }

    public boolean emits(DiagnosticCode code) {
        return codes.contains(code);
    }
}
