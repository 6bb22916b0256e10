package com.orthosense.service.classify;

import com.orthosense.domain.ExerciseFamily;
import com.orthosense.domain.Window;

/**
 * Contract for pluggable window classifiers.
 *
 * <p>Implementations wrap a trained model (sequence network, remote inference service, test double)
 * behind a uniform interface. Two instances are wired at startup, one per {@link ExerciseFamily}.
 *
 * <p>Thread Safety: implementations must tolerate concurrent {@link #predict(Window)} calls
 * from independent sessions.
 *
 * @see UnavailableExerciseModel
 * @see EnsembleClassifier
 */
public interface ExerciseModel {

    /**
     * Predicts per-frame class probabilities for a window.
     *
     * <p>Timeouts and retries are the implementation's concern. Any exception thrown here
     * makes the ensemble treat this model as unavailable for the window.
     *
     * @param window window to classify (never null, never empty)
     * @return prediction with the model's class list and one probability vector per frame
     */
    ModelPrediction predict(Window window);

    /**
     * Returns the name of this model for logging and monitoring.
     *
     * @return model name (e.g., "legs", "arms")
     */
    String getModelName();

    /**
     * Checks whether the model is loaded and can serve predictions.
     *
     * @return true if the model is operational
     */
    boolean isAvailable();

    /** Family of exercises this model was trained on. */
    ExerciseFamily family();

    /**
     * Creates a model that never predicts anything.
     *
     * @param name   model name for logging
     * @param family family the missing model would have covered
     */
    static ExerciseModel unavailable(String name, ExerciseFamily family) {
        return new UnavailableExerciseModel(name, family);
    }
}
