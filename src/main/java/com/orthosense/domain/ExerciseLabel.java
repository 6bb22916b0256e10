package com.orthosense.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed catalogue of recognised rehabilitation exercises plus the "nothing detected" sentinel.
 */
public enum ExerciseLabel {
    DEEP_SQUAT("Deep Squat", ExerciseFamily.LEGS),
    HURDLE_STEP("Hurdle Step", ExerciseFamily.LEGS),
    INLINE_LUNGE("Inline Lunge", ExerciseFamily.LEGS),
    SIDE_LUNGE("Side Lunge", ExerciseFamily.LEGS),
    SIT_TO_STAND("Sit to Stand", ExerciseFamily.LEGS),
    STANDING_ACTIVE_STRAIGHT_LEG_RAISE("Standing Active Straight Leg Raise", ExerciseFamily.ARMS),
    STANDING_SHOULDER_ABDUCTION("Standing Shoulder Abduction", ExerciseFamily.ARMS),
    STANDING_SHOULDER_EXTENSION("Standing Shoulder Extension", ExerciseFamily.ARMS),
    STANDING_SHOULDER_INT_EXT_ROTATION("Standing Shoulder Int/Ext Rotation", ExerciseFamily.ARMS),
    STANDING_SHOULDER_SCAPTION("Standing Shoulder Scaption", ExerciseFamily.ARMS),
    NO_EXERCISE_DETECTED("No Exercise Detected", ExerciseFamily.NONE);

    private final String displayName;
    private final ExerciseFamily family;

    ExerciseLabel(String displayName, ExerciseFamily family) {
        this.displayName = displayName;
        this.family = family;
    }

    public String displayName() {
        return displayName;
    }

    public ExerciseFamily family() {
        return family;
    }

    public boolean isDetected() {
        return this != NO_EXERCISE_DETECTED;
    }

    /** Catalogue members of one family, in declaration order. */
    public static List<ExerciseLabel> ofFamily(ExerciseFamily family) {
        return Arrays.stream(values()).filter(l -> l.family == family).toList();
    }

    /**
     * Resolves a label from its enum name, display name or compact form
     * ("DEEP_SQUAT", "Deep Squat", "DeepSquat"), ignoring case.
     */
    public static Optional<ExerciseLabel> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String key = normalize(text);
        for (ExerciseLabel label : values()) {
            if (normalize(label.name()).equals(key) || normalize(label.displayName).equals(key)) {
                return Optional.of(label);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String s) {
        return s.replaceAll("[^A-Za-z]", "").toLowerCase(Locale.ROOT);
    }
}
