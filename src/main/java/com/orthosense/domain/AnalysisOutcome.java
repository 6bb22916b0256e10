package com.orthosense.domain;

import org.json.JSONObject;

import java.util.Objects;
import java.util.Optional;

/**
 * Tagged result of a recording analysis. Empty input and the absence of a confident exercise are
 * reported here instead of being thrown.
 */
public record AnalysisOutcome(Status status, SessionVerdict verdict, String message) {

    public enum Status {
        COMPLETED,
        NO_DATA,
        NO_CONFIDENT_EXERCISE
    }

    public static final String NO_DATA_MESSAGE = "No person detected";
    public static final String NO_CONFIDENT_EXERCISE_MESSAGE = "No exercise detected with sufficient confidence.";

    public AnalysisOutcome {
        Objects.requireNonNull(status, "status");
        if (status == Status.COMPLETED) {
            Objects.requireNonNull(verdict, "verdict is required for a completed analysis");
        }
    }

    public static AnalysisOutcome completed(SessionVerdict verdict) {
        return new AnalysisOutcome(Status.COMPLETED, verdict, null);
    }

    public static AnalysisOutcome noData() {
        return new AnalysisOutcome(Status.NO_DATA, null, NO_DATA_MESSAGE);
    }

    public static AnalysisOutcome noConfidentExercise() {
        return new AnalysisOutcome(Status.NO_CONFIDENT_EXERCISE, null, NO_CONFIDENT_EXERCISE_MESSAGE);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public Optional<SessionVerdict> verdictIfCompleted() {
        return Optional.ofNullable(verdict);
    }

    public JSONObject toJson() {
        if (isCompleted()) {
            return verdict.toJson();
        }
        return new JSONObject().put("error", message);
    }
}
