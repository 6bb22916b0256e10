package com.orthosense.domain;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Final, immutable result of analysing a whole recording.
 *
 * <p>{@code correct} and {@code feedback} mirror the last window only, while {@code textReport}
 * scores every window.
 *
 * @param lockedExercise     exercise chosen by majority vote
 * @param votingConfidence   winner votes divided by all qualifying votes
 * @param perWindowResults   locked evaluation of every window, in recording order
 * @param correct            correctness of the last window
 * @param feedback           violations of the last window
 * @param textReport         narrative summary across all windows
 */
public record SessionVerdict(
        ExerciseLabel lockedExercise,
        double votingConfidence,
        List<WindowAnalysis> perWindowResults,
        boolean correct,
        Set<String> feedback,
        String textReport
) {

    public static final String CORRECT_FEEDBACK = "Movement correct.";

    public SessionVerdict {
        Objects.requireNonNull(lockedExercise, "lockedExercise");
        Objects.requireNonNull(textReport, "textReport");
        if (votingConfidence < 0.0 || votingConfidence > 1.0) {
            throw new IllegalArgumentException(
                    "Voting confidence must be between 0.0 and 1.0, got: " + votingConfidence);
        }
        perWindowResults = perWindowResults == null ? List.of() : List.copyOf(perWindowResults);
        feedback = feedback == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(feedback));
    }

    /**
     * Serializes to the public wire shape
     * {@code {exercise, confidence, is_correct, feedback, text_report}} using plain JSON types.
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("exercise", lockedExercise.displayName());
        json.put("confidence", votingConfidence);
        json.put("is_correct", correct);
        if (feedback.isEmpty()) {
            json.put("feedback", CORRECT_FEEDBACK);
        } else {
            json.put("feedback", new JSONArray(feedback));
        }
        json.put("text_report", textReport);
        return json;
    }
}
