package com.orthosense.domain;

import java.util.Objects;

/**
 * Immutable per-window exercise decision.
 *
 * @param label       catalogue member or {@link ExerciseLabel#NO_EXERCISE_DETECTED}
 * @param confidence  derived confidence in [0,1]
 * @param sourceModel decision path that produced the label
 */
public record ClassificationResult(ExerciseLabel label, double confidence, SourceModel sourceModel) {

    public ClassificationResult {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(sourceModel, "sourceModel");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    /** Result for a caller-supplied exercise; inference is skipped. */
    public static ClassificationResult locked(ExerciseLabel label) {
        return new ClassificationResult(label, 1.0, SourceModel.LOCKED);
    }

    public static ClassificationResult noExercise() {
        return new ClassificationResult(ExerciseLabel.NO_EXERCISE_DETECTED, 0.0, SourceModel.NONE);
    }

    public ClassificationResult withLabel(ExerciseLabel newLabel, SourceModel newSource) {
        return new ClassificationResult(newLabel, confidence, newSource);
    }

    public boolean isDetected() {
        return label.isDetected();
    }
}
