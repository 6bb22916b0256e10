package com.orthosense.service.window;

import com.orthosense.domain.Frame;
import com.orthosense.domain.Joint;
import com.orthosense.domain.PoseLandmark;
import com.orthosense.testutil.PoseFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameRingBufferTest {

    @Test
    void readyOnceMinimumReached() {
        FrameRingBuffer buf = new FrameRingBuffer(4, 2);
        buf.push(tagged(0));
        assertThat(buf.ready()).isFalse();
        buf.push(tagged(1));
        assertThat(buf.ready()).isTrue();
    }

    @Test
    void dropsOldestWhenOverflow() {
        FrameRingBuffer buf = new FrameRingBuffer(3, 1);
        for (int i = 0; i < 5; i++) {
            buf.push(tagged(i));
        }
        // Expect last 3 frames [2..4]
        assertThat(tags(buf.snapshot())).containsExactly(2.0, 3.0, 4.0);
        assertThat(buf.size()).isEqualTo(3);
    }

    @Test
    void snapshotDoesNotMutate() {
        FrameRingBuffer buf = new FrameRingBuffer(3, 1);
        buf.push(tagged(7));

        buf.snapshot();
        buf.snapshot();

        assertThat(buf.size()).isEqualTo(1);
        assertThat(tags(buf.snapshot())).containsExactly(7.0);
    }

    @Test
    void clearResetsState() {
        FrameRingBuffer buf = new FrameRingBuffer(3, 1);
        buf.push(tagged(1));
        buf.clear();

        assertThat(buf.snapshot()).isEmpty();
        assertThat(buf.ready()).isFalse();
        assertThatThrownBy(() -> buf.snapshotWindow(0.5, 0.7)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void snapshotWindowDerivesVisibility() {
        FrameRingBuffer buf = new FrameRingBuffer(4, 1);
        for (int i = 0; i < 4; i++) {
            buf.push(PoseFixtures.withVisibility(PoseFixtures.standing(), 0.2));
        }

        assertThat(buf.snapshotWindow(0.5, 0.7).visible()).isFalse();
    }

    @Test
    void rejectsReadyThresholdAboveCapacity() {
        assertThatThrownBy(() -> new FrameRingBuffer(10, 11)).isInstanceOf(IllegalArgumentException.class);
    }

    private static Frame tagged(int tag) {
        return PoseFixtures.with(PoseFixtures.standing(), PoseLandmark.NOSE, Joint.of(tag, 0, 0));
    }

    private static List<Double> tags(List<Frame> frames) {
        return frames.stream().map(f -> f.joint(PoseLandmark.NOSE).x()).toList();
    }
}
