package com.orthosense.service.geometry;

import com.orthosense.domain.Frame;
import com.orthosense.domain.Joint;
import com.orthosense.domain.Window;
import org.springframework.stereotype.Component;

import static com.orthosense.domain.PoseLandmark.LEFT_ANKLE;
import static com.orthosense.domain.PoseLandmark.LEFT_EAR;
import static com.orthosense.domain.PoseLandmark.LEFT_ELBOW;
import static com.orthosense.domain.PoseLandmark.LEFT_HIP;
import static com.orthosense.domain.PoseLandmark.LEFT_KNEE;
import static com.orthosense.domain.PoseLandmark.LEFT_SHOULDER;
import static com.orthosense.domain.PoseLandmark.LEFT_WRIST;
import static com.orthosense.domain.PoseLandmark.RIGHT_ANKLE;
import static com.orthosense.domain.PoseLandmark.RIGHT_EAR;
import static com.orthosense.domain.PoseLandmark.RIGHT_ELBOW;
import static com.orthosense.domain.PoseLandmark.RIGHT_HIP;
import static com.orthosense.domain.PoseLandmark.RIGHT_KNEE;
import static com.orthosense.domain.PoseLandmark.RIGHT_SHOULDER;
import static com.orthosense.domain.PoseLandmark.RIGHT_WRIST;

/**
 * Body measurements derived from single frames and whole windows.
 *
 * <p>Built on {@link GeometryKit}; shares its silent handling of degenerate geometry.
 * Thread-safe.
 */
@Component
public class PoseMetrics {

    private final GeometryKit geometry;

    public PoseMetrics(GeometryKit geometry) {
        this.geometry = geometry;
    }

    public GeometryKit geometry() {
        return geometry;
    }

    public double leftKneeAngle(Frame f) {
        return geometry.angle(f.joint(LEFT_HIP), f.joint(LEFT_KNEE), f.joint(LEFT_ANKLE));
    }

    public double rightKneeAngle(Frame f) {
        return geometry.angle(f.joint(RIGHT_HIP), f.joint(RIGHT_KNEE), f.joint(RIGHT_ANKLE));
    }

    /** Mean of left and right knee angles, in degrees. */
    public double meanKneeAngle(Frame f) {
        return (leftKneeAngle(f) + rightKneeAngle(f)) / 2.0;
    }

    public double leftElbowAngle(Frame f) {
        return geometry.angle(f.joint(LEFT_SHOULDER), f.joint(LEFT_ELBOW), f.joint(LEFT_WRIST));
    }

    public double rightElbowAngle(Frame f) {
        return geometry.angle(f.joint(RIGHT_SHOULDER), f.joint(RIGHT_ELBOW), f.joint(RIGHT_WRIST));
    }

    /** Horizontal offset between shoulder and hip midpoints. */
    public double lateralTorsoShift(Frame f) {
        return Math.abs(f.shoulderMid().x() - f.hipMid().x());
    }

    /**
     * Horizontal shoulder-hip offset divided by spine length.
     *
     * @return lean ratio, or 0 when the spine has zero length
     */
    public double leanRatio(Frame f) {
        Joint shoulders = f.shoulderMid();
        Joint hips = f.hipMid();
        double spine = geometry.distance(shoulders, hips);
        if (spine == 0.0) {
            return 0.0;
        }
        return Math.abs(shoulders.x() - hips.x()) / spine;
    }

    /** Smaller of the two ear-to-shoulder distances. */
    public double earShoulderDistance(Frame f) {
        double left = geometry.distance(f.joint(LEFT_EAR), f.joint(LEFT_SHOULDER));
        double right = geometry.distance(f.joint(RIGHT_EAR), f.joint(RIGHT_SHOULDER));
        return Math.min(left, right);
    }

    public double wristHeightAsymmetry(Frame f) {
        return Math.abs(f.joint(LEFT_WRIST).y() - f.joint(RIGHT_WRIST).y());
    }

    public double pelvicTilt(Frame f) {
        return Math.abs(f.joint(LEFT_HIP).y() - f.joint(RIGHT_HIP).y());
    }

    public double kneeDistance(Frame f) {
        return geometry.distance(f.joint(LEFT_KNEE), f.joint(RIGHT_KNEE));
    }

    public double ankleDistance(Frame f) {
        return geometry.distance(f.joint(LEFT_ANKLE), f.joint(RIGHT_ANKLE));
    }

    /** Mean over frames of the smaller knee angle in each frame. */
    public double meanMinKneeAngle(Window window) {
        double sum = 0.0;
        for (Frame f : window.frames()) {
            sum += Math.min(leftKneeAngle(f), rightKneeAngle(f));
        }
        return sum / window.size();
    }

    /** Max minus min over frames of the vertical gap between ankle and hip midpoints. */
    public double hipAnkleGapRange(Window window) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Frame f : window.frames()) {
            double gap = f.ankleMid().y() - f.hipMid().y();
            min = Math.min(min, gap);
            max = Math.max(max, gap);
        }
        return max - min;
    }

    /** Mean absolute depth difference between the two ankles. */
    public double meanAnkleDepthDifference(Window window) {
        double sum = 0.0;
        for (Frame f : window.frames()) {
            sum += Math.abs(f.joint(LEFT_ANKLE).z() - f.joint(RIGHT_ANKLE).z());
        }
        return sum / window.size();
    }
}
