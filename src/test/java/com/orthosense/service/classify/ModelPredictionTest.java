package com.orthosense.service.classify;

import com.orthosense.domain.ExerciseLabel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.orthosense.domain.ExerciseLabel.DEEP_SQUAT;
import static com.orthosense.domain.ExerciseLabel.HURDLE_STEP;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ModelPredictionTest {

    private static final List<ExerciseLabel> CLASSES = List.of(DEEP_SQUAT, HURDLE_STEP);

    @Test
    void confidenceAveragesOnlyFramesVotingForMajority() {
        ModelPrediction prediction = new ModelPrediction(CLASSES, List.of(
                new double[] {0.9, 0.1},
                new double[] {0.7, 0.3},
                new double[] {0.2, 0.8}));

        assertThat(prediction.majorityLabel()).isEqualTo(DEEP_SQUAT);
        assertThat(prediction.confidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void tiedVoteCountGoesToFirstSeenLabel() {
        ModelPrediction prediction = new ModelPrediction(CLASSES, List.of(
                new double[] {0.3, 0.7},
                new double[] {0.6, 0.4},
                new double[] {0.9, 0.1},
                new double[] {0.1, 0.9}));

        assertThat(prediction.majorityLabel()).isEqualTo(HURDLE_STEP);
        assertThat(prediction.confidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void exactTieWithinFrameGoesToLowerIndex() {
        ModelPrediction prediction = new ModelPrediction(CLASSES, List.<double[]>of(new double[] {0.5, 0.5}));

        assertThat(prediction.majorityLabel()).isEqualTo(DEEP_SQUAT);
        assertThat(prediction.confidence()).isEqualTo(0.5);
    }

    @Test
    void emptyPredictionMeansNothingDetected() {
        ModelPrediction empty = ModelPrediction.empty();

        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.majorityLabel()).isEqualTo(ExerciseLabel.NO_EXERCISE_DETECTED);
        assertThat(empty.confidence()).isZero();
    }

    @Test
    void rejectsVectorOfWrongLength() {
        assertThatThrownBy(() -> new ModelPrediction(CLASSES, List.<double[]>of(new double[] {1.0})))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2 classes");
    }

    @Test
    void rejectsNonFiniteProbabilities() {
        assertThatThrownBy(() -> new ModelPrediction(CLASSES, List.<double[]>of(new double[] {Double.NaN, 0.1})))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-finite");
        assertThatThrownBy(() -> new ModelPrediction(CLASSES,
                List.<double[]>of(new double[] {0.2, Double.POSITIVE_INFINITY})))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void vectorsAreDefensivelyCopied() {
        double[] vector = {0.9, 0.1};
        ModelPrediction prediction = new ModelPrediction(CLASSES, List.<double[]>of(vector));

        vector[0] = 0.0;

        assertThat(prediction.majorityLabel()).isEqualTo(DEEP_SQUAT);
    }

    @Test
    void unavailableModelPredictsNothing() {
        ExerciseModel model = ExerciseModel.unavailable("arms", com.orthosense.domain.ExerciseFamily.ARMS);

        assertThat(model.isAvailable()).isFalse();
        assertThat(model.getModelName()).isEqualTo("arms");
        assertThat(model.predict(null).isEmpty()).isTrue();
    }
}
