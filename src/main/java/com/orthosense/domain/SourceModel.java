package com.orthosense.domain;

/**
 * Which decision path produced a classification.
 */
public enum SourceModel {
    LEGS("Legs"),
    ARMS("Arms"),
    LEGS_FORCED("Legs (forced)"),
    LOCKED("Locked"),
    NONE("None");

    private final String displayName;

    SourceModel(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
