package com.orthosense.service.report;

import com.orthosense.domain.DiagnosticResult;
import com.orthosense.domain.ExerciseLabel;
import com.orthosense.service.diagnostics.Violations;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the narrative summary of a recording from its per-window evaluations.
 *
 * <p>The score is the percentage of correct windows. Above 90 the form is excellent, above 60 up to 90
 * good with deviations, otherwise in need of improvement. When any window failed, the most frequent
 * violation is named with its advice sentence.
 */
@Component
public class ReportGenerator {

    static final double EXCELLENT_ABOVE = 90.0;
    static final double GOOD_ABOVE = 60.0;

    static final String EXCELLENT = "Conclusion: Excellent form! Keep it up.";
    static final String GOOD = "Conclusion: Good technique with occasional deviations.";
    static final String NEEDS_IMPROVEMENT = "Conclusion: Technique needs improvement.";

    public String generate(ExerciseLabel exercise, List<DiagnosticResult> windows) {
        Objects.requireNonNull(exercise, "exercise");
        Objects.requireNonNull(windows, "windows");

        StringBuilder report = new StringBuilder();
        report.append("Exercise Analysis: ").append(exercise.displayName()).append('\n');
        if (windows.isEmpty()) {
            report.append("No windows were evaluated.");
            return report.toString();
        }

        long correct = windows.stream().filter(DiagnosticResult::correct).count();
        double score = score(correct, windows.size());
        report.append(String.format(Locale.ROOT, "Score: %.1f%% (%d of %d windows correct)\n",
                score, correct, windows.size()));
        report.append(conclusion(score));

        mostFrequentViolation(windows).ifPresent(violation -> report.append('\n')
                .append("Most frequent issue: ").append(violation).append('\n')
                .append("Recommendation: ").append(Violations.adviceFor(violation)));
        return report.toString();
    }

    static double score(long correct, int total) {
        return total == 0 ? 0.0 : correct * 100.0 / total;
    }

    static String conclusion(double score) {
        if (score > EXCELLENT_ABOVE) {
            return EXCELLENT;
        }
        if (score > GOOD_ABOVE) {
            return GOOD;
        }
        return NEEDS_IMPROVEMENT;
    }

    /** Most frequent violation across windows; the first seen wins a tie. */
    static Optional<String> mostFrequentViolation(List<DiagnosticResult> windows) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (DiagnosticResult result : windows) {
            for (String violation : result.violations()) {
                counts.merge(violation, 1, Integer::sum);
            }
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return Optional.ofNullable(best);
    }
}
