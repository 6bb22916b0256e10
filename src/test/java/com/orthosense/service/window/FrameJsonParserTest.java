package com.orthosense.service.window;

import com.orthosense.domain.ExerciseLabel;
import com.orthosense.domain.Frame;
import com.orthosense.exception.InvalidFrameException;
import com.orthosense.exception.UnknownExerciseException;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameJsonParserTest {

    private final FrameJsonParser parser = new FrameJsonParser(new FrameValidator());

    @Test
    void parsesWrappedRecording() {
        String json = new JSONObject().put("frames", frames(3, false)).toString();

        List<Frame> frames = parser.parseRecording(json);

        assertThat(frames).hasSize(3);
    }

    @Test
    void parsesBareArray() {
        assertThat(parser.parseRecording(frames(2, false).toString())).hasSize(2);
    }

    @Test
    void parsesObjectJointsWithVisibility() {
        List<Frame> frames = parser.parseRecording(frames(1, true).toString());

        assertThat(frames.get(0).joint(0).visibility()).isEqualTo(0.9);
    }

    @Test
    void malformedJsonIsInvalidFrame() {
        assertThatThrownBy(() -> parser.parseRecording("{frames: ["))
                .isInstanceOf(InvalidFrameException.class)
                .hasMessageContaining("malformed");
    }

    @Test
    void emptyBodyIsInvalidFrame() {
        assertThatThrownBy(() -> parser.parseRecording(" ")).isInstanceOf(InvalidFrameException.class);
    }

    @Test
    void wrongJointCountIsInvalidFrame() {
        JSONArray frames = new JSONArray().put(new JSONArray().put(new JSONArray().put(0.1).put(0.2).put(0.3)));

        assertThatThrownBy(() -> parser.parseRecording(frames.toString()))
                .isInstanceOf(InvalidFrameException.class)
                .hasMessageContaining("33");
    }

    @Test
    void parsesWindowRequestWithForcedLabel() {
        String json = new JSONObject().put("frames", frames(2, false)).put("forced", "Side Lunge").toString();

        FrameJsonParser.WindowRequest request = parser.parseWindowRequest(json);

        assertThat(request.frames()).hasSize(2);
        assertThat(request.forced()).isEqualTo(ExerciseLabel.SIDE_LUNGE);
    }

    @Test
    void windowRequestWithoutForcedLabel() {
        String json = new JSONObject().put("frames", frames(1, false)).toString();

        assertThat(parser.parseWindowRequest(json).forced()).isNull();
    }

    @Test
    void unknownForcedLabelIsRejected() {
        String json = new JSONObject().put("frames", frames(1, false)).put("forced", "Burpee").toString();

        assertThatThrownBy(() -> parser.parseWindowRequest(json))
                .isInstanceOf(UnknownExerciseException.class)
                .hasMessageContaining("Burpee");
    }

    private static JSONArray frames(int count, boolean objects) {
        JSONArray frames = new JSONArray();
        for (int f = 0; f < count; f++) {
            JSONArray joints = new JSONArray();
            for (int j = 0; j < 33; j++) {
                if (objects) {
                    joints.put(new JSONObject().put("x", 0.5).put("y", 0.5).put("z", 0.0).put("visibility", 0.9));
                } else {
                    joints.put(new JSONArray().put(0.5).put(0.5).put(0.0));
                }
            }
            frames.put(joints);
        }
        return frames;
    }
}
