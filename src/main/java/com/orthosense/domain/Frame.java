package com.orthosense.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable full-body joint snapshot for one instant.
 *
 * <p>Frames are validated at ingestion by
 * {@link com.orthosense.service.window.FrameValidator}; the constructor only guards the joint count.
 *
 * @param joints exactly {@link PoseLandmark#COUNT} joints in landmark order
 */
public record Frame(List<Joint> joints) {

    public Frame {
        Objects.requireNonNull(joints, "joints");
        if (joints.size() != PoseLandmark.COUNT) {
            throw new IllegalArgumentException(
                    "Frame must have " + PoseLandmark.COUNT + " joints, got: " + joints.size());
        }
        joints = List.copyOf(joints);
    }

    public Joint joint(int index) {
        return joints.get(index);
    }

    public double meanVisibility() {
        double sum = 0.0;
        for (Joint j : joints) {
            sum += j.visibility();
        }
        return sum / joints.size();
    }

    public boolean isVisible(double threshold) {
        return meanVisibility() >= threshold;
    }

    public Joint shoulderMid() {
        return Joint.midpoint(joint(PoseLandmark.LEFT_SHOULDER), joint(PoseLandmark.RIGHT_SHOULDER));
    }

    public Joint hipMid() {
        return Joint.midpoint(joint(PoseLandmark.LEFT_HIP), joint(PoseLandmark.RIGHT_HIP));
    }

    public Joint ankleMid() {
        return Joint.midpoint(joint(PoseLandmark.LEFT_ANKLE), joint(PoseLandmark.RIGHT_ANKLE));
    }
}
