package com.orthosense.service.window;

import com.orthosense.domain.ExerciseLabel;
import com.orthosense.domain.Frame;
import com.orthosense.exception.InvalidFrameException;
import com.orthosense.exception.UnknownExerciseException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses pose recordings exported by the landmark detector.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>{@code {"frames": [ frame, ... ]}}</li>
 *   <li>a bare array {@code [ frame, ... ]}</li>
 * </ul>
 * where a frame is an array of 33 joints, each {@code [x, y, z]} or {@code [x, y, z, visibility]},
 * or an object {@code {"x":..,"y":..,"z":..,"visibility":..}}.
 */
@Component
public class FrameJsonParser {

    private final FrameValidator validator;

    public FrameJsonParser(FrameValidator validator) {
        this.validator = validator;
    }

    /**
     * @throws InvalidFrameException when the document is malformed or a frame fails validation
     */
    public List<Frame> parseRecording(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidFrameException("recording body is empty");
        }
        try {
            String trimmed = json.trim();
            JSONArray frames = trimmed.startsWith("[")
                    ? new JSONArray(trimmed)
                    : new JSONObject(trimmed).getJSONArray("frames");
            return parseFrames(frames);
        } catch (JSONException e) {
            throw new InvalidFrameException("malformed recording JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a single-window request {@code {"frames": [...], "forced": "Deep Squat"}}; {@code forced}
     * is optional and accepts any form understood by {@link ExerciseLabel#parse(String)}.
     *
     * @throws InvalidFrameException     when the document is malformed or a frame fails validation
     * @throws UnknownExerciseException  when {@code forced} names no catalogue exercise
     */
    public WindowRequest parseWindowRequest(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidFrameException("window body is empty");
        }
        JSONObject body;
        try {
            body = new JSONObject(json.trim());
        } catch (JSONException e) {
            throw new InvalidFrameException("malformed window JSON: " + e.getMessage(), e);
        }
        JSONArray frames = body.optJSONArray("frames");
        if (frames == null) {
            throw new InvalidFrameException("window body has no \"frames\" array");
        }
        ExerciseLabel forced = null;
        String forcedText = body.optString("forced", "");
        if (!forcedText.isBlank()) {
            forced = ExerciseLabel.parse(forcedText).orElseThrow(() -> new UnknownExerciseException(forcedText));
        }
        return new WindowRequest(parseFrames(frames), forced);
    }

    List<Frame> parseFrames(JSONArray frames) {
        List<double[][]> raw = new ArrayList<>(frames.length());
        for (int f = 0; f < frames.length(); f++) {
            JSONArray joints = frames.optJSONArray(f);
            if (joints == null) {
                throw new InvalidFrameException(f, "frame is not an array of joints");
            }
            double[][] rows = new double[joints.length()][];
            for (int j = 0; j < joints.length(); j++) {
                rows[j] = toRow(f, j, joints.get(j));
            }
            raw.add(rows);
        }
        return validator.toFrames(raw);
    }

    private double[] toRow(int frameIndex, int jointIndex, Object joint) {
        if (joint instanceof JSONArray arr) {
            double[] row = new double[arr.length()];
            for (int i = 0; i < arr.length(); i++) {
                row[i] = arr.optDouble(i, Double.NaN);
            }
            return row;
        }
        if (joint instanceof JSONObject obj) {
            if (!obj.has("x") || !obj.has("y") || !obj.has("z")) {
                throw new InvalidFrameException(frameIndex, "joint " + jointIndex + " is missing a coordinate");
            }
            return new double[] {
                    obj.optDouble("x", Double.NaN),
                    obj.optDouble("y", Double.NaN),
                    obj.optDouble("z", Double.NaN),
                    obj.optDouble("visibility", 1.0)
            };
        }
        throw new InvalidFrameException(frameIndex, "joint " + jointIndex + " has an unsupported shape");
    }

    /**
     * Parsed single-window request.
     *
     * @param frames validated frames
     * @param forced exercise to evaluate against, or null for automatic detection
     */
    public record WindowRequest(List<Frame> frames, ExerciseLabel forced) {
    }
}
