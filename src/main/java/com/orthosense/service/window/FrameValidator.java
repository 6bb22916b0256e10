package com.orthosense.service.window;

import com.orthosense.domain.Frame;
import com.orthosense.domain.Joint;
import com.orthosense.domain.PoseLandmark;
import com.orthosense.exception.InvalidFrameException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates raw detector output before it becomes a {@link Frame}.
 *
 * <p>Each frame must have exactly {@link PoseLandmark#COUNT} joints; each joint is
 * {@code [x, y, z]} or {@code [x, y, z, visibility]} with finite coordinates and a visibility
 * in [0,1]. Anything else is rejected and never enters a window.
 */
@Component
public class FrameValidator {

    /**
     * Converts one raw frame into a validated {@link Frame}.
     *
     * @param frameIndex position within the recording, used in error messages
     * @param raw        joint rows in landmark order
     * @throws InvalidFrameException when the shape or values are invalid
     */
    public Frame toFrame(int frameIndex, double[][] raw) {
        if (raw == null) {
            throw new InvalidFrameException(frameIndex, "frame is null");
        }
        if (raw.length != PoseLandmark.COUNT) {
            throw new InvalidFrameException(frameIndex,
                    "expected " + PoseLandmark.COUNT + " joints, got " + raw.length);
        }
        List<Joint> joints = new ArrayList<>(raw.length);
        for (int i = 0; i < raw.length; i++) {
            joints.add(toJoint(frameIndex, i, raw[i]));
        }
        return new Frame(joints);
    }

    /**
     * Validates a whole recording.
     *
     * @throws InvalidFrameException on the first invalid frame
     */
    public List<Frame> toFrames(List<double[][]> rawFrames) {
        if (rawFrames == null) {
            throw new InvalidFrameException("recording is null");
        }
        List<Frame> frames = new ArrayList<>(rawFrames.size());
        for (int i = 0; i < rawFrames.size(); i++) {
            frames.add(toFrame(i, rawFrames.get(i)));
        }
        return frames;
    }

    private Joint toJoint(int frameIndex, int jointIndex, double[] row) {
        if (row == null || (row.length != 3 && row.length != 4)) {
            throw new InvalidFrameException(frameIndex, "joint " + jointIndex
                    + " must have 3 or 4 values, got " + (row == null ? 0 : row.length));
        }
        for (double v : row) {
            if (!Double.isFinite(v)) {
                throw new InvalidFrameException(frameIndex, "joint " + jointIndex + " has a non-finite value");
            }
        }
        double visibility = row.length == 4 ? row[3] : Joint.DEFAULT_VISIBILITY;
        if (visibility < 0.0 || visibility > 1.0) {
            throw new InvalidFrameException(frameIndex,
                    "joint " + jointIndex + " visibility out of range: " + visibility);
        }
        return new Joint(row[0], row[1], row[2], visibility);
    }
}
