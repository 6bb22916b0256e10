package com.orthosense.service.window;

import com.orthosense.config.properties.AnalysisProperties;
import com.orthosense.domain.Frame;
import com.orthosense.domain.Joint;
import com.orthosense.domain.PoseLandmark;
import com.orthosense.domain.Window;
import com.orthosense.testutil.PoseFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchWindowerTest {

    private final BatchWindower windower = BatchWindower.from(AnalysisProperties.defaults());

    @Test
    void noFramesYieldNoWindows() {
        assertThat(windower.split(List.of())).isEmpty();
    }

    @Test
    void shortRecordingYieldsOneWindowOfAllFrames() {
        List<Window> windows = windower.split(indexed(42));

        assertThat(windows).hasSize(1);
        assertThat(windows.get(0).size()).isEqualTo(42);
    }

    @Test
    void recordingOfExactlyWindowSizeYieldsOneWindow() {
        assertThat(windower.split(indexed(60))).hasSize(1);
    }

    @Test
    void ninetyFramesYieldTwoWindows() {
        List<Window> windows = windower.split(indexed(90));

        assertThat(windows).hasSize(2);
        assertThat(firstIndex(windows.get(0))).isEqualTo(0.0);
        assertThat(firstIndex(windows.get(1))).isEqualTo(15.0);
    }

    @Test
    void windowsHaveFullLengthAndIncreasingOffsets() {
        for (int total = 61; total <= 200; total++) {
            List<Window> windows = windower.split(indexed(total));

            assertThat(windows).isNotEmpty();
            double previous = -1;
            for (Window w : windows) {
                assertThat(w.size()).isEqualTo(60);
                double start = firstIndex(w);
                assertThat(start).isGreaterThan(previous);
                assertThat(start + 60).isLessThanOrEqualTo(total);
                previous = start;
            }
        }
    }

    @Test
    void lastStartStaysBelowTotalMinusWindow() {
        // 196 frames: starts 0..135 step 15
        List<Window> windows = windower.split(indexed(196));

        assertThat(windows).hasSize(10);
        assertThat(firstIndex(windows.get(9))).isEqualTo(135.0);
    }

    private static List<Frame> indexed(int count) {
        return PoseFixtures.generate(count,
                i -> PoseFixtures.with(PoseFixtures.standing(), PoseLandmark.NOSE, Joint.of(i, 0, 0)));
    }

    private static double firstIndex(Window window) {
        return window.frame(0).joint(PoseLandmark.NOSE).x();
    }
}
