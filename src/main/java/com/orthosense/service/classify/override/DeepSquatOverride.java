package com.orthosense.service.classify.override;

import com.orthosense.config.properties.ClassifierProperties;
import com.orthosense.domain.ClassificationResult;
import com.orthosense.domain.ExerciseFamily;
import com.orthosense.domain.ExerciseLabel;
import com.orthosense.domain.SourceModel;
import com.orthosense.domain.Window;
import com.orthosense.service.geometry.PoseMetrics;

/**
 * Reassigns a standing-family decision to Deep Squat when the knees are clearly bent.
 *
 * <p>Fires when the winner belongs to the arms family and either the mean per-frame minimum knee
 * angle is below the squat angle while the hips travel vertically, or that angle is below the
 * hard squat angle regardless of hip travel.
 */
public final class DeepSquatOverride implements ClassificationOverride {

    private final PoseMetrics metrics;
    private final ClassifierProperties props;

    public DeepSquatOverride(PoseMetrics metrics, ClassifierProperties props) {
        this.metrics = metrics;
        this.props = props;
    }

    @Override
    public ClassificationResult apply(Window window, ClassificationResult current) {
        if (current.label().family() != ExerciseFamily.ARMS) {
            return current;
        }
        double kneeAngle = metrics.meanMinKneeAngle(window);
        boolean bentWithTravel = kneeAngle < props.getSquatKneeAngle()
                && metrics.hipAnkleGapRange(window) > props.getHipTravelRange();
        boolean deeplyBent = kneeAngle < props.getSquatHardKneeAngle();
        if (bentWithTravel || deeplyBent) {
            return current.withLabel(ExerciseLabel.DEEP_SQUAT, SourceModel.LEGS_FORCED);
        }
        return current;
    }

    @Override
    public String name() {
        return "deep-squat";
    }
}
