package com.orthosense.service.classify.fusion;

import com.orthosense.domain.ClassificationResult;

/**
 * Template for fusion strategies that handles missing candidates.
 *
 * <ul>
 *   <li>both missing → "No Exercise Detected" at zero confidence</li>
 *   <li>one missing → the other candidate</li>
 *   <li>both present → {@link #doFuse(ClassificationResult, ClassificationResult)}</li>
 * </ul>
 */
public abstract class AbstractModelFusion implements ModelFusion {

    @Override
    public final ClassificationResult fuse(ClassificationResult legs, ClassificationResult arms) {
        if (legs == null && arms == null) {
            return ClassificationResult.noExercise();
        }
        if (legs == null) {
            return arms;
        }
        if (arms == null) {
            return legs;
        }
        return doFuse(legs, arms);
    }

    /**
     * Chooses between two present candidates.
     *
     * @param legs legs candidate (never null)
     * @param arms arms candidate (never null)
     */
    protected abstract ClassificationResult doFuse(ClassificationResult legs, ClassificationResult arms);
}
