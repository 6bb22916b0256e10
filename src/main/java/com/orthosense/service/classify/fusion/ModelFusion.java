package com.orthosense.service.classify.fusion;

import com.orthosense.domain.ClassificationResult;

/**
 * Strategy for choosing between the legs and arms model outputs for one window.
 *
 * <p><b>Null Handling Contract:</b> a null candidate means that model was unavailable or failed
 * for the window. When both are null, implementations return
 * {@link ClassificationResult#noExercise()}.
 *
 * <p>Implementations must be stateless and thread-safe.
 */
public interface ModelFusion {

    /**
     * @param legs candidate from the legs model (may be null)
     * @param arms candidate from the arms model (may be null)
     * @return the chosen candidate, before overrides and the confidence gate
     */
    ClassificationResult fuse(ClassificationResult legs, ClassificationResult arms);
}
