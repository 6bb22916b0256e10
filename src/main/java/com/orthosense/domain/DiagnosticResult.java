package com.orthosense.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Verdict of the biomechanical rules for one evaluated set of frames.
 *
 * <p>Violations keep the order in which rules first fired.
 *
 * @param correct    true when no rule fired
 * @param violations names of the rules that fired
 */
public record DiagnosticResult(boolean correct, Set<String> violations) {

    public DiagnosticResult {
        Objects.requireNonNull(violations, "violations");
        violations = Collections.unmodifiableSet(new LinkedHashSet<>(violations));
    }

    public static DiagnosticResult of(Set<String> violations) {
        return new DiagnosticResult(violations.isEmpty(), violations);
    }

    public static DiagnosticResult passed() {
        return new DiagnosticResult(true, Set.of());
    }
}
