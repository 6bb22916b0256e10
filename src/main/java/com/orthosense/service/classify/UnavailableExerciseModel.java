package com.orthosense.service.classify;

import com.orthosense.domain.ExerciseFamily;
import com.orthosense.domain.Window;

import java.util.Objects;

/**
 * Stand-in for a classifier that could not be loaded.
 *
 * <p>Always reports unavailable and predicts {@link ModelPrediction#empty()}, which resolves to
 * "No Exercise Detected" with zero confidence.
 */
public final class UnavailableExerciseModel implements ExerciseModel {

    private final String name;
    private final ExerciseFamily family;

    public UnavailableExerciseModel(String name, ExerciseFamily family) {
        this.name = Objects.requireNonNull(name, "name");
        this.family = Objects.requireNonNull(family, "family");
    }

    @Override
    public ModelPrediction predict(Window window) {
        return ModelPrediction.empty();
    }

    @Override
    public String getModelName() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public ExerciseFamily family() {
        return family;
    }

    @Override
    public String toString() {
        return "UnavailableExerciseModel[" + name + "]";
    }
}
