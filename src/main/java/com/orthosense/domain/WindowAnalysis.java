package com.orthosense.domain;

import java.util.Objects;

/**
 * Combined classification and evaluation of one window.
 */
public record WindowAnalysis(
        ClassificationResult classification,
        DiagnosticResult diagnostic,
        boolean windowVisible
) {
    public WindowAnalysis {
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(diagnostic, "diagnostic");
    }
}
