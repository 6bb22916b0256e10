package com.orthosense.service.report;

import com.orthosense.domain.DiagnosticResult;
import com.orthosense.domain.ExerciseLabel;
import com.orthosense.service.diagnostics.Violations;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ReportGeneratorTest {

    private final ReportGenerator generator = new ReportGenerator();

    @Test
    void allCorrectIsExcellent() {
        String report = generator.generate(ExerciseLabel.DEEP_SQUAT, windows(10, 0, Violations.TOO_SHALLOW));

        assertThat(report).startsWith("Exercise Analysis: Deep Squat\n")
                .contains("Score: 100.0% (10 of 10 windows correct)")
                .contains(ReportGenerator.EXCELLENT)
                .doesNotContain("Most frequent issue");
    }

    @Test
    void seventyPercentIsGoodAndNamesIssue() {
        String report = generator.generate(ExerciseLabel.SIDE_LUNGE, windows(7, 3, Violations.HEELS_RISING));

        assertThat(report).contains("Score: 70.0% (7 of 10 windows correct)")
                .contains(ReportGenerator.GOOD)
                .contains("Most frequent issue: " + Violations.HEELS_RISING)
                .contains("Recommendation: " + Violations.adviceFor(Violations.HEELS_RISING));
    }

    @Test
    void sixtyPercentNeedsImprovement() {
        String report = generator.generate(ExerciseLabel.SIDE_LUNGE, windows(6, 4, Violations.HEELS_RISING));

        assertThat(report).contains("Score: 60.0%").contains(ReportGenerator.NEEDS_IMPROVEMENT);
    }

    @Test
    void ninetyPercentIsOnlyGood() {
        assertThat(ReportGenerator.conclusion(90.0)).isEqualTo(ReportGenerator.GOOD);
        assertThat(ReportGenerator.conclusion(90.1)).isEqualTo(ReportGenerator.EXCELLENT);
    }

    @Test
    void mostFrequentViolationPrefersFirstSeenOnTie() {
        List<DiagnosticResult> windows = List.of(
                DiagnosticResult.of(Set.of(Violations.SHRUGGING)),
                DiagnosticResult.of(Set.of(Violations.ELBOW_DRIFT)),
                DiagnosticResult.of(Set.of(Violations.ELBOW_DRIFT)),
                DiagnosticResult.of(Set.of(Violations.SHRUGGING)));

        assertThat(ReportGenerator.mostFrequentViolation(windows)).contains(Violations.SHRUGGING);
    }

    @Test
    void emptyRecordingSaysSo() {
        String report = generator.generate(ExerciseLabel.HURDLE_STEP, List.of());

        assertThat(report).isEqualTo("Exercise Analysis: Hurdle Step\nNo windows were evaluated.");
    }

    private static List<DiagnosticResult> windows(int correct, int incorrect, String violation) {
        List<DiagnosticResult> out = new ArrayList<>(Collections.nCopies(correct, DiagnosticResult.passed()));
        for (int i = 0; i < incorrect; i++) {
            out.add(DiagnosticResult.of(Set.of(violation)));
        }
        return out;
    }
}
