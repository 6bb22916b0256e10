package com.orthosense.service.diagnostics;

import java.util.Map;

/**
 * Violation names reported by the rule book and the advice sentence attached to each.
 */
public final class Violations {

    public static final String TORSO_INSTABILITY = "torso instability";
    public static final String PELVIC_TILT = "pelvic tilt";
    public static final String HEELS_RISING = "heels rising";
    public static final String EXCESSIVE_TRUNK_LEAN = "excessive trunk lean";
    public static final String KNEES_TOO_NARROW = "knees too narrow";
    public static final String BENT_KNEE = "bent knee";
    public static final String SHRUGGING = "shrugging";
    public static final String ARM_ASYMMETRY = "arm asymmetry";
    public static final String BENT_ELBOW = "bent elbow";
    public static final String ELBOW_DRIFT = "elbow drift";
    public static final String TOO_SHALLOW = "too shallow";
    public static final String EXCESSIVE_LEAN = "excessive lean";
    public static final String NO_ACTIVE_EXERCISE = "no active exercise detected";

    private static final Map<String, String> ADVICE = Map.ofEntries(
            Map.entry(TORSO_INSTABILITY,
                    "Keep your torso upright and tall. Avoid swaying side-to-side to maintain balance."),
            Map.entry(PELVIC_TILT,
                    "Engage your core and glutes to keep your pelvis stable and level."),
            Map.entry(HEELS_RISING,
                    "Keep your heels firmly planted on the ground throughout the movement."),
            Map.entry(EXCESSIVE_TRUNK_LEAN,
                    "Stand tall with a neutral spine. Avoid leaning your body to the side."),
            Map.entry(KNEES_TOO_NARROW,
                    "Focus on pushing your knees outward to align with your toes. Do not let them cave in."),
            Map.entry(BENT_KNEE,
                    "Keep the raised leg straight by tightening the front of your thigh."),
            Map.entry(SHRUGGING,
                    "Keep your shoulders down and relaxed. Avoid shrugging them up towards your ears."),
            Map.entry(ARM_ASYMMETRY,
                    "Focus on moving both arms at the same speed and height."),
            Map.entry(BENT_ELBOW,
                    "Keep your elbow straight and move the whole arm from the shoulder."),
            Map.entry(ELBOW_DRIFT,
                    "Keep your elbow tucked against your side while rotating the forearm."),
            Map.entry(TOO_SHALLOW,
                    "Try to lower your hips further until your thighs are at least parallel to the floor."),
            Map.entry(EXCESSIVE_LEAN,
                    "Keep your chest up and your back straight. Engage your core to stay more upright."),
            Map.entry(NO_ACTIVE_EXERCISE,
                    "Start one of the exercises from your plan so the movement can be assessed.")
    );

    private Violations() {
    }

    /**
     * Returns the corrective advice for a violation.
     *
     * @return advice sentence; a generic sentence naming the violation when none is registered
     */
    public static String adviceFor(String violation) {
        String advice = ADVICE.get(violation);
        return advice != null ? advice : "Focus on correcting: " + violation + ".";
    }
}
