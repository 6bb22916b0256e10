package com.orthosense.service.classify.fusion;

import com.orthosense.domain.ClassificationResult;

/**
 * Picks the candidate with strictly higher confidence; an exact tie goes to the legs model.
 */
public final class ConfidenceFusion extends AbstractModelFusion {

    @Override
    protected ClassificationResult doFuse(ClassificationResult legs, ClassificationResult arms) {
        if (arms.confidence() > legs.confidence()) {
            return arms;
        }
        return legs;
    }
}
