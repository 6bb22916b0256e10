package com.orthosense.service.classify;

import com.orthosense.config.properties.ClassifierProperties;
import com.orthosense.domain.ClassificationResult;
import com.orthosense.domain.ExerciseFamily;
import com.orthosense.domain.ExerciseLabel;
import com.orthosense.domain.SourceModel;
import com.orthosense.domain.Window;
import com.orthosense.service.classify.fusion.ConfidenceFusion;
import com.orthosense.service.classify.override.ClassificationOverride;
import com.orthosense.service.classify.override.DeepSquatOverride;
import com.orthosense.service.classify.override.LungeSymmetryOverride;
import com.orthosense.service.geometry.GeometryKit;
import com.orthosense.service.geometry.PoseMetrics;
import com.orthosense.service.metrics.AnalysisMetrics;
import com.orthosense.service.metrics.AnalysisMetricsPublisher;
import com.orthosense.testutil.FixedExerciseModel;
import com.orthosense.testutil.PoseFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EnsembleClassifierTest {

    private static final Window STANDING = PoseFixtures.window(PoseFixtures.standing(), 60);
    private static final Window SQUATTING = PoseFixtures.window(PoseFixtures.squatRecording(60));

    private final PoseMetrics poseMetrics = new PoseMetrics(new GeometryKit());

    @Test
    void forcedLabelSkipsInference() {
        FixedExerciseModel legs = FixedExerciseModel.legs(ExerciseLabel.HURDLE_STEP, 0.99);
        FixedExerciseModel arms = FixedExerciseModel.arms(ExerciseLabel.STANDING_SHOULDER_ABDUCTION, 0.99);
        EnsembleClassifier classifier = classifier(legs, arms, List.of());

        ClassificationResult result = classifier.classify(STANDING, ExerciseLabel.SIT_TO_STAND);

        assertThat(result.label()).isEqualTo(ExerciseLabel.SIT_TO_STAND);
        assertThat(result.confidence()).isEqualTo(1.0);
        assertThat(result.sourceModel()).isEqualTo(SourceModel.LOCKED);
        assertThat(legs.calls.get()).isZero();
        assertThat(arms.calls.get()).isZero();
    }

    @Test
    void bothBelowGateMeansNoExercise() {
        EnsembleClassifier classifier = classifier(
                FixedExerciseModel.legs(ExerciseLabel.HURDLE_STEP, 0.55),
                FixedExerciseModel.arms(ExerciseLabel.STANDING_SHOULDER_ABDUCTION, 0.59),
                List.of());

        ClassificationResult result = classifier.classify(STANDING);

        assertThat(result).isEqualTo(ClassificationResult.noExercise());
    }

    @Test
    void higherConfidenceWins() {
        EnsembleClassifier classifier = classifier(
                FixedExerciseModel.legs(ExerciseLabel.HURDLE_STEP, 0.7),
                FixedExerciseModel.arms(ExerciseLabel.STANDING_SHOULDER_SCAPTION, 0.9),
                List.of());

        ClassificationResult result = classifier.classify(STANDING);

        assertThat(result.label()).isEqualTo(ExerciseLabel.STANDING_SHOULDER_SCAPTION);
        assertThat(result.sourceModel()).isEqualTo(SourceModel.ARMS);
    }

    @Test
    void tieFavorsLegs() {
        EnsembleClassifier classifier = classifier(
                FixedExerciseModel.legs(ExerciseLabel.SIDE_LUNGE, 0.8),
                FixedExerciseModel.arms(ExerciseLabel.STANDING_SHOULDER_EXTENSION, 0.8),
                List.of());

        ClassificationResult result = classifier.classify(STANDING);

        assertThat(result.label()).isEqualTo(ExerciseLabel.SIDE_LUNGE);
        assertThat(result.sourceModel()).isEqualTo(SourceModel.LEGS);
    }

    @Test
    void unavailableModelsYieldNoExercise() {
        EnsembleClassifier classifier = classifier(
                ExerciseModel.unavailable("legs", ExerciseFamily.LEGS),
                ExerciseModel.unavailable("arms", ExerciseFamily.ARMS),
                List.of());

        assertThat(classifier.classify(STANDING)).isEqualTo(ClassificationResult.noExercise());
    }

    @Test
    void nonFiniteProbabilitiesNeverPassTheGate() {
        EnsembleClassifier classifier = classifier(
                FixedExerciseModel.legs(ExerciseLabel.DEEP_SQUAT, Double.NaN),
                ExerciseModel.unavailable("arms", ExerciseFamily.ARMS),
                List.of());

        ClassificationResult result = classifier.classify(STANDING);

        assertThat(result).isEqualTo(ClassificationResult.noExercise());
    }

    @Test
    void failingModelIsTreatedAsUnavailable() {
        ExerciseModel broken = mock(ExerciseModel.class);
        when(broken.isAvailable()).thenReturn(true);
        when(broken.getModelName()).thenReturn("legs");
        when(broken.predict(any())).thenThrow(new IllegalStateException("inference crashed"));
        EnsembleClassifier classifier = classifier(
                broken, FixedExerciseModel.arms(ExerciseLabel.STANDING_SHOULDER_ABDUCTION, 0.75), List.of());

        ClassificationResult result = classifier.classify(STANDING);

        assertThat(result.label()).isEqualTo(ExerciseLabel.STANDING_SHOULDER_ABDUCTION);
        assertThat(result.sourceModel()).isEqualTo(SourceModel.ARMS);
    }

    @Test
    void confidentNoExercisePredictionStaysNoExercise() {
        EnsembleClassifier classifier = classifier(
                FixedExerciseModel.legs(ExerciseLabel.NO_EXERCISE_DETECTED, 0.95),
                ExerciseModel.unavailable("arms", ExerciseFamily.ARMS),
                List.of());

        assertThat(classifier.classify(STANDING)).isEqualTo(ClassificationResult.noExercise());
    }

    @Test
    void deepSquatOverrideRelabelsStandingWinnerAndKeepsConfidence() {
        EnsembleClassifier classifier = classifier(
                FixedExerciseModel.legs(ExerciseLabel.HURDLE_STEP, 0.6),
                FixedExerciseModel.arms(ExerciseLabel.STANDING_SHOULDER_ABDUCTION, 0.92),
                defaultOverrides());

        ClassificationResult result = classifier.classify(SQUATTING);

        assertThat(result.label()).isEqualTo(ExerciseLabel.DEEP_SQUAT);
        assertThat(result.sourceModel()).isEqualTo(SourceModel.LEGS_FORCED);
        assertThat(result.confidence()).isEqualTo(
                FixedExerciseModel.uniform(ExerciseLabel.STANDING_SHOULDER_ABDUCTION, 0.92, 60).confidence());
    }

    @Test
    void overridesDoNotFireOnStandingWindow() {
        EnsembleClassifier classifier = classifier(
                FixedExerciseModel.legs(ExerciseLabel.HURDLE_STEP, 0.6),
                FixedExerciseModel.arms(ExerciseLabel.STANDING_SHOULDER_ABDUCTION, 0.92),
                defaultOverrides());

        assertThat(classifier.classify(STANDING).label()).isEqualTo(ExerciseLabel.STANDING_SHOULDER_ABDUCTION);
    }

    @Test
    void gateAppliesAfterOverrides() {
        EnsembleClassifier classifier = classifier(
                ExerciseModel.unavailable("legs", ExerciseFamily.LEGS),
                FixedExerciseModel.arms(ExerciseLabel.STANDING_SHOULDER_ABDUCTION, 0.5),
                defaultOverrides());

        assertThat(classifier.classify(SQUATTING)).isEqualTo(ClassificationResult.noExercise());
    }

    @Test
    void recordsOverrideAndGateMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AnalysisMetricsPublisher publisher = new AnalysisMetricsPublisher(new AnalysisMetrics(registry));
        EnsembleClassifier classifier = new EnsembleClassifier(
                ExerciseModel.unavailable("legs", ExerciseFamily.LEGS),
                FixedExerciseModel.arms(ExerciseLabel.STANDING_SHOULDER_ABDUCTION, 0.5),
                new ConfidenceFusion(), defaultOverrides(), 0.60, publisher);

        classifier.classify(SQUATTING);

        assertThat(registry.get("orthosense.analysis.override").tag("rule", "deep-squat").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("orthosense.analysis.gate.rejected").counter().count()).isEqualTo(1.0);
    }

    private List<ClassificationOverride> defaultOverrides() {
        ClassifierProperties props = ClassifierProperties.defaults();
        return List.of(new DeepSquatOverride(poseMetrics, props), new LungeSymmetryOverride(poseMetrics, props));
    }

    private static EnsembleClassifier classifier(ExerciseModel legs, ExerciseModel arms,
                                                 List<ClassificationOverride> overrides) {
        return new EnsembleClassifier(legs, arms, new ConfidenceFusion(), overrides, 0.60, null);
    }
}
