package com.orthosense.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Geometry thresholds of the ensemble override rules.
 */
@Validated
@ConfigurationProperties(prefix = "orthosense.classifier")
public class ClassifierProperties {

    /** Mean deepest knee angle (degrees) that suggests a squat when the hips also travel. */
    @Min(0)
    @Max(180)
    private final double squatKneeAngle;

    /** Mean deepest knee angle (degrees) that alone forces a squat. */
    @Min(0)
    @Max(180)
    private final double squatHardKneeAngle;

    /** Minimum range of the vertical hip-ankle gap across the window. */
    @Min(0)
    private final double hipTravelRange;

    /** Mean ankle depth difference below which a lunge is relabelled as a squat. */
    @Min(0)
    private final double lungeAnkleDepthDifference;

    @ConstructorBinding
    public ClassifierProperties(Double squatKneeAngle, Double squatHardKneeAngle,
                                Double hipTravelRange, Double lungeAnkleDepthDifference) {
        this.squatKneeAngle = squatKneeAngle == null ? 135.0 : squatKneeAngle;
        this.squatHardKneeAngle = squatHardKneeAngle == null ? 110.0 : squatHardKneeAngle;
        this.hipTravelRange = hipTravelRange == null ? 0.10 : hipTravelRange;
        this.lungeAnkleDepthDifference = lungeAnkleDepthDifference == null ? 0.20 : lungeAnkleDepthDifference;
        if (this.squatHardKneeAngle > this.squatKneeAngle) {
            throw new IllegalArgumentException(
                    "orthosense.classifier.squat-hard-knee-angle must not exceed squat-knee-angle");
        }
    }

    public static ClassifierProperties defaults() {
        return new ClassifierProperties(null, null, null, null);
    }

    public double getSquatKneeAngle() {
        return squatKneeAngle;
    }

    public double getSquatHardKneeAngle() {
        return squatHardKneeAngle;
    }

    public double getHipTravelRange() {
        return hipTravelRange;
    }

    public double getLungeAnkleDepthDifference() {
        return lungeAnkleDepthDifference;
    }
}
