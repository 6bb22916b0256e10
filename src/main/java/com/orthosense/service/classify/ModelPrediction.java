package com.orthosense.service.classify;

import com.orthosense.domain.ExerciseLabel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw output of an {@link ExerciseModel}: the model's ordered class list and one probability
 * vector per frame.
 *
 * <p>The window label and its confidence are always derived from the vectors, never stored:
 * <ul>
 *   <li>each frame votes for its arg-max class (lowest index wins an exact tie)</li>
 *   <li>the majority label is the most voted class; the label seen first wins a tied count</li>
 *   <li>confidence is the mean top-class probability over frames that voted for the majority</li>
 * </ul>
 *
 * @param classes            labels in the order of the probability vector entries
 * @param frameProbabilities one vector per frame, each of size {@code classes.size()} with finite entries
 */
public record ModelPrediction(List<ExerciseLabel> classes, List<double[]> frameProbabilities) {

    private static final ModelPrediction EMPTY = new ModelPrediction(List.of(), List.of());

    public ModelPrediction {
        Objects.requireNonNull(classes, "classes");
        Objects.requireNonNull(frameProbabilities, "frameProbabilities");
        classes = List.copyOf(classes);
        List<double[]> copy = new ArrayList<>(frameProbabilities.size());
        for (double[] probs : frameProbabilities) {
            Objects.requireNonNull(probs, "probability vector");
            if (probs.length != classes.size()) {
                throw new IllegalArgumentException("Probability vector has " + probs.length
                        + " entries but model declares " + classes.size() + " classes");
            }
            for (double p : probs) {
                if (!Double.isFinite(p)) {
                    throw new IllegalArgumentException("Probability vector contains a non-finite entry: " + p);
                }
            }
            copy.add(probs.clone());
        }
        frameProbabilities = List.copyOf(copy);
    }

    /** Prediction without any frame; resolves to "No Exercise Detected" at zero confidence. */
    public static ModelPrediction empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return classes.isEmpty() || frameProbabilities.isEmpty();
    }

    public ExerciseLabel majorityLabel() {
        if (isEmpty()) {
            return ExerciseLabel.NO_EXERCISE_DETECTED;
        }
        return classes.get(majorityIndex());
    }

    public double confidence() {
        if (isEmpty()) {
            return 0.0;
        }
        int majority = majorityIndex();
        double sum = 0.0;
        int count = 0;
        for (double[] probs : frameProbabilities) {
            int top = argMax(probs);
            if (top == majority) {
                sum += probs[top];
                count++;
            }
        }
        double mean = sum / count;
        return Math.max(0.0, Math.min(1.0, mean));
    }

    private int majorityIndex() {
        Map<Integer, Integer> votes = new LinkedHashMap<>();
        for (double[] probs : frameProbabilities) {
            votes.merge(argMax(probs), 1, Integer::sum);
        }
        int best = -1;
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> e : votes.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    private static int argMax(double[] probs) {
        int best = 0;
        for (int i = 1; i < probs.length; i++) {
            if (probs[i] > probs[best]) {
                best = i;
            }
        }
        return best;
    }
}
