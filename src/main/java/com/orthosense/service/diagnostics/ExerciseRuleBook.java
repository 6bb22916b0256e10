package com.orthosense.service.diagnostics;

import com.orthosense.config.properties.DiagnosticsProperties;
import com.orthosense.domain.ExerciseLabel;
import com.orthosense.domain.Frame;
import com.orthosense.domain.Joint;
import com.orthosense.service.geometry.PoseMetrics;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.orthosense.domain.PoseLandmark.LEFT_ANKLE;
import static com.orthosense.domain.PoseLandmark.LEFT_ELBOW;
import static com.orthosense.domain.PoseLandmark.LEFT_FOOT_INDEX;
import static com.orthosense.domain.PoseLandmark.LEFT_HEEL;
import static com.orthosense.domain.PoseLandmark.LEFT_SHOULDER;
import static com.orthosense.domain.PoseLandmark.RIGHT_ANKLE;
import static com.orthosense.domain.PoseLandmark.RIGHT_ELBOW;
import static com.orthosense.domain.PoseLandmark.RIGHT_FOOT_INDEX;
import static com.orthosense.domain.PoseLandmark.RIGHT_HEEL;
import static com.orthosense.domain.PoseLandmark.RIGHT_SHOULDER;

/**
 * Per-exercise tables of {@link FrameRule}s.
 *
 * <p>Deep Squat is evaluated temporally by {@link BiomechanicalEvaluator} and has no per-frame table;
 * "No Exercise Detected" has none either. Thresholds come from {@link DiagnosticsProperties} and are
 * read on every evaluation. Stateless and thread-safe.
 */
@Component
public class ExerciseRuleBook {

    private final PoseMetrics metrics;
    private final DiagnosticsProperties props;

    public ExerciseRuleBook(PoseMetrics metrics, DiagnosticsProperties props) {
        this.metrics = metrics;
        this.props = props;
    }

    public PoseMetrics metrics() {
        return metrics;
    }

    public DiagnosticsProperties properties() {
        return props;
    }

    /**
     * Returns the per-frame rules for an exercise, in reporting order.
     */
    public List<FrameRule> rulesFor(ExerciseLabel label) {
        return switch (label) {
            case HURDLE_STEP, INLINE_LUNGE -> List.of(torsoInstability(), pelvicTilt());
            case SIDE_LUNGE -> List.of(heelsRising(), trunkLean());
            case SIT_TO_STAND -> List.of(pelvicTilt(), kneesTooNarrow());
            case STANDING_ACTIVE_STRAIGHT_LEG_RAISE -> List.of(torsoInstability(), bentKnee());
            case STANDING_SHOULDER_ABDUCTION, STANDING_SHOULDER_SCAPTION ->
                    List.of(torsoInstability(), shrugging(), armAsymmetry());
            case STANDING_SHOULDER_EXTENSION -> List.of(torsoInstability(), shrugging(), bentElbow());
            case STANDING_SHOULDER_INT_EXT_ROTATION -> List.of(shrugging(), elbowDrift());
            case DEEP_SQUAT, NO_EXERCISE_DETECTED -> List.of();
        };
    }

    private FrameRule torsoInstability() {
        return new FrameRule(Violations.TORSO_INSTABILITY,
                f -> metrics.lateralTorsoShift(f) > props.getTorsoShift());
    }

    private FrameRule pelvicTilt() {
        return new FrameRule(Violations.PELVIC_TILT,
                f -> metrics.pelvicTilt(f) > props.getPelvicTilt());
    }

    private FrameRule heelsRising() {
        return new FrameRule(Violations.HEELS_RISING,
                f -> heelRaised(f, LEFT_HEEL, LEFT_FOOT_INDEX) || heelRaised(f, RIGHT_HEEL, RIGHT_FOOT_INDEX));
    }

    private FrameRule trunkLean() {
        return new FrameRule(Violations.EXCESSIVE_TRUNK_LEAN,
                f -> metrics.leanRatio(f) > props.getTrunkLeanRatio());
    }

    private FrameRule kneesTooNarrow() {
        return new FrameRule(Violations.KNEES_TOO_NARROW,
                f -> metrics.kneeDistance(f) < props.getKneeWidthRatio() * metrics.ankleDistance(f));
    }

    private FrameRule bentKnee() {
        return new FrameRule(Violations.BENT_KNEE, this::raisedLegBent);
    }

    private FrameRule shrugging() {
        return new FrameRule(Violations.SHRUGGING,
                f -> metrics.earShoulderDistance(f) < props.getEarShoulderDistance());
    }

    private FrameRule armAsymmetry() {
        return new FrameRule(Violations.ARM_ASYMMETRY,
                f -> metrics.wristHeightAsymmetry(f) > props.getWristHeightAsymmetry());
    }

    private FrameRule bentElbow() {
        return new FrameRule(Violations.BENT_ELBOW,
                f -> Math.min(metrics.leftElbowAngle(f), metrics.rightElbowAngle(f)) < props.getStraightElbowAngle());
    }

    private FrameRule elbowDrift() {
        return new FrameRule(Violations.ELBOW_DRIFT,
                f -> elbowDrifted(f, LEFT_ELBOW, LEFT_SHOULDER) || elbowDrifted(f, RIGHT_ELBOW, RIGHT_SHOULDER));
    }

    private boolean heelRaised(Frame f, int heel, int footIndex) {
        return f.joint(heel).y() < f.joint(footIndex).y() - props.getHeelRise();
    }

    private boolean elbowDrifted(Frame f, int elbow, int shoulder) {
        return Math.abs(f.joint(elbow).x() - f.joint(shoulder).x()) > props.getElbowDrift();
    }

    // y grows downward, so the raised ankle has the smaller y
    private boolean raisedLegBent(Frame f) {
        Joint left = f.joint(LEFT_ANKLE);
        Joint right = f.joint(RIGHT_ANKLE);
        double lift = props.getRaisedLegLift();
        if (left.y() <= right.y() - lift) {
            return metrics.leftKneeAngle(f) < props.getStraightKneeAngle();
        }
        if (right.y() <= left.y() - lift) {
            return metrics.rightKneeAngle(f) < props.getStraightKneeAngle();
        }
        return false;
    }
}
