package com.orthosense.service.classify;

import com.orthosense.domain.ClassificationResult;
import com.orthosense.domain.ExerciseLabel;
import com.orthosense.domain.SourceModel;
import com.orthosense.domain.Window;
import com.orthosense.service.classify.fusion.ModelFusion;
import com.orthosense.service.classify.override.ClassificationOverride;
import com.orthosense.service.metrics.AnalysisMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Fuses the legs and arms models into one decision per window.
 *
 * <p>Decision pipeline for an unforced window:
 * <ol>
 *   <li>run both models; an unavailable or failing model contributes no candidate</li>
 *   <li>{@link ModelFusion} picks a candidate</li>
 *   <li>each {@link ClassificationOverride} is applied in order</li>
 *   <li>a confidence below the gate threshold yields "No Exercise Detected" at zero confidence</li>
 * </ol>
 *
 * <p>A forced label skips inference entirely. This class holds no per-session state and never throws
 * for a valid window.
 */
public final class EnsembleClassifier {

    private static final Logger LOG = LogManager.getLogger(EnsembleClassifier.class);

    private final ExerciseModel legsModel;
    private final ExerciseModel armsModel;
    private final ModelFusion fusion;
    private final List<ClassificationOverride> overrides;
    private final double gateThreshold;
    private final AnalysisMetricsPublisher metrics;

    public EnsembleClassifier(ExerciseModel legsModel,
                              ExerciseModel armsModel,
                              ModelFusion fusion,
                              List<ClassificationOverride> overrides,
                              double gateThreshold,
                              AnalysisMetricsPublisher metrics) {
        this.legsModel = Objects.requireNonNull(legsModel, "legsModel");
        this.armsModel = Objects.requireNonNull(armsModel, "armsModel");
        this.fusion = Objects.requireNonNull(fusion, "fusion");
        this.overrides = List.copyOf(Objects.requireNonNull(overrides, "overrides"));
        if (gateThreshold < 0.0 || gateThreshold > 1.0) {
            throw new IllegalArgumentException("gateThreshold must be in [0,1], got: " + gateThreshold);
        }
        this.gateThreshold = gateThreshold;
        this.metrics = metrics == null ? AnalysisMetricsPublisher.NOOP : metrics;
    }

    public ClassificationResult classify(Window window) {
        return classify(window, null);
    }

    /**
     * Classifies one window.
     *
     * @param window      window to classify
     * @param forcedLabel exercise supplied by the caller (may be null)
     * @return decision for the window
     */
    public ClassificationResult classify(Window window, ExerciseLabel forcedLabel) {
        Objects.requireNonNull(window, "window");
        if (forcedLabel != null) {
            return record(ClassificationResult.locked(forcedLabel));
        }

        ClassificationResult legs = candidate(legsModel, SourceModel.LEGS, window);
        ClassificationResult arms = candidate(armsModel, SourceModel.ARMS, window);
        ClassificationResult decision = fusion.fuse(legs, arms);

        for (ClassificationOverride override : overrides) {
            ClassificationResult corrected = override.apply(window, decision);
            if (!corrected.equals(decision)) {
                LOG.debug("Override {} relabelled {} as {}", override.name(), decision.label(), corrected.label());
                metrics.recordOverride(override.name());
                decision = corrected;
            }
        }

        if (!decision.isDetected()) {
            decision = ClassificationResult.noExercise();
        } else if (decision.confidence() < gateThreshold) {
            LOG.debug("Confidence {} for {} below gate {}", decision.confidence(), decision.label(), gateThreshold);
            metrics.recordGateRejection();
            decision = ClassificationResult.noExercise();
        }
        return record(decision);
    }

    public ExerciseModel legsModel() {
        return legsModel;
    }

    public ExerciseModel armsModel() {
        return armsModel;
    }

    private ClassificationResult candidate(ExerciseModel model, SourceModel source, Window window) {
        if (!model.isAvailable()) {
            return null;
        }
        try {
            ModelPrediction prediction = model.predict(window);
            if (prediction == null) {
                LOG.warn("Model {} returned no prediction; treating as unavailable", model.getModelName());
                return null;
            }
            return new ClassificationResult(prediction.majorityLabel(), prediction.confidence(), source);
        } catch (RuntimeException e) {
            LOG.warn("Model {} failed to predict; treating as unavailable: {}", model.getModelName(), e.getMessage());
            return null;
        }
    }

    private ClassificationResult record(ClassificationResult result) {
        metrics.recordClassification(result.sourceModel().displayName(), result.label().displayName());
        return result;
    }
}
