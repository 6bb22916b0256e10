package com.orthosense.service.classify.override;

import com.orthosense.config.properties.ClassifierProperties;
import com.orthosense.domain.ClassificationResult;
import com.orthosense.domain.ExerciseLabel;
import com.orthosense.domain.Window;
import com.orthosense.service.geometry.PoseMetrics;

/**
 * Relabels an Inline Lunge as Deep Squat when both ankles stay at the same depth.
 *
 * <p>A lunge places one foot in front of the other; without that depth split the movement is a squat.
 */
public final class LungeSymmetryOverride implements ClassificationOverride {

    private final PoseMetrics metrics;
    private final ClassifierProperties props;

    public LungeSymmetryOverride(PoseMetrics metrics, ClassifierProperties props) {
        this.metrics = metrics;
        this.props = props;
    }

    @Override
    public ClassificationResult apply(Window window, ClassificationResult current) {
        if (current.label() != ExerciseLabel.INLINE_LUNGE) {
            return current;
        }
        if (metrics.meanAnkleDepthDifference(window) < props.getLungeAnkleDepthDifference()) {
            return current.withLabel(ExerciseLabel.DEEP_SQUAT, current.sourceModel());
        }
        return current;
    }

    @Override
    public String name() {
        return "lunge-symmetry";
    }
}
