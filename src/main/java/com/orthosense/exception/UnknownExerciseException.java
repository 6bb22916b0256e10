package com.orthosense.exception;

/**
 * Thrown when a caller names an exercise that is not part of the catalogue.
 */
public class UnknownExerciseException extends OrthoSenseException {

    private final String requested;

    public UnknownExerciseException(String requested) {
        super("Unknown exercise: " + requested);
        this.requested = requested;
    }

    public String getRequested() {
        return requested;
    }
}
