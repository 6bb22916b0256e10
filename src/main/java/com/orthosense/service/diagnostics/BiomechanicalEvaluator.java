package com.orthosense.service.diagnostics;

import com.orthosense.config.properties.DiagnosticsProperties;
import com.orthosense.domain.DiagnosticResult;
import com.orthosense.domain.ExerciseLabel;
import com.orthosense.domain.Frame;
import com.orthosense.domain.Window;
import com.orthosense.service.geometry.PoseMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks a window against the clinical movement pattern of an exercise.
 *
 * <p>Two strategies:
 * <ul>
 *   <li><b>Per-frame</b>: every {@link FrameRule} of the exercise is tested on every frame and the
 *       violations are unioned.</li>
 *   <li><b>Deep Squat (temporal)</b>: the frame with the smallest mean knee angle is the deepest
 *       point of the repetition. Depth and knee width are judged on that frame; the trunk lean ratio
 *       is pushed into the {@link SmoothingBuffer} and only its running mean is compared with the
 *       limit.</li>
 * </ul>
 *
 * <p>One instance per session: it owns the smoothing buffer, which is cleared whenever the evaluated
 * exercise changes to another detected exercise. A "No Exercise Detected" window leaves it untouched.
 * Not thread-safe.
 */
public final class BiomechanicalEvaluator {

    private static final Logger LOG = LogManager.getLogger(BiomechanicalEvaluator.class);

    private final ExerciseRuleBook ruleBook;
    private final PoseMetrics metrics;
    private final DiagnosticsProperties props;
    private final SmoothingBuffer leanBuffer;
    private ExerciseLabel lastLabel;

    public BiomechanicalEvaluator(ExerciseRuleBook ruleBook, SmoothingBuffer leanBuffer) {
        this.ruleBook = Objects.requireNonNull(ruleBook, "ruleBook");
        this.leanBuffer = Objects.requireNonNull(leanBuffer, "leanBuffer");
        this.metrics = ruleBook.metrics();
        this.props = ruleBook.properties();
    }

    /**
     * Evaluates a window for the given exercise.
     *
     * @param window frames to check (never empty)
     * @param label  exercise the frames are judged against
     * @return correctness and the set of violation names
     */
    public DiagnosticResult evaluate(Window window, ExerciseLabel label) {
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(label, "label");
        if (label.isDetected() && label != lastLabel) {
            if (lastLabel != null) {
                LOG.debug("Exercise changed from {} to {}; clearing lean smoothing", lastLabel, label);
            }
            leanBuffer.reset();
            lastLabel = label;
        }
        return switch (label) {
            case NO_EXERCISE_DETECTED -> new DiagnosticResult(false, Set.of(Violations.NO_ACTIVE_EXERCISE));
            case DEEP_SQUAT -> evaluateDeepSquat(window);
            case HURDLE_STEP, INLINE_LUNGE, SIDE_LUNGE, SIT_TO_STAND,
                    STANDING_ACTIVE_STRAIGHT_LEG_RAISE, STANDING_SHOULDER_ABDUCTION,
                    STANDING_SHOULDER_EXTENSION, STANDING_SHOULDER_INT_EXT_ROTATION,
                    STANDING_SHOULDER_SCAPTION -> evaluatePerFrame(window, ruleBook.rulesFor(label));
        };
    }

    /** Clears smoothing state; the next evaluation starts fresh. */
    public void reset() {
        leanBuffer.reset();
        lastLabel = null;
    }

    SmoothingBuffer leanBuffer() {
        return leanBuffer;
    }

    private DiagnosticResult evaluatePerFrame(Window window, List<FrameRule> rules) {
        Set<String> violations = new LinkedHashSet<>();
        for (Frame frame : window.frames()) {
            for (FrameRule rule : rules) {
                if (!violations.contains(rule.violation()) && rule.test(frame)) {
                    violations.add(rule.violation());
                }
            }
        }
        return DiagnosticResult.of(violations);
    }

    private DiagnosticResult evaluateDeepSquat(Window window) {
        DiagnosticsProperties.SquatThresholds squat = props.getSquat();
        Frame deepest = window.frame(0);
        double minAngle = metrics.meanKneeAngle(deepest);
        for (Frame frame : window.frames()) {
            double angle = metrics.meanKneeAngle(frame);
            if (angle < minAngle) {
                minAngle = angle;
                deepest = frame;
            }
        }

        Set<String> violations = new LinkedHashSet<>();
        if (minAngle > squat.getShallowKneeAngle()) {
            violations.add(Violations.TOO_SHALLOW);
        }
        if (metrics.kneeDistance(deepest) < squat.getKneeWidthRatio() * metrics.ankleDistance(deepest)) {
            violations.add(Violations.KNEES_TOO_NARROW);
        }
        leanBuffer.push(metrics.leanRatio(deepest));
        double smoothedLean = leanBuffer.mean();
        if (smoothedLean > squat.getMaxLean()) {
            violations.add(Violations.EXCESSIVE_LEAN);
        }
        LOG.trace("Deep squat: min knee angle={} smoothed lean={}", minAngle, smoothedLean);
        return DiagnosticResult.of(violations);
    }
}
