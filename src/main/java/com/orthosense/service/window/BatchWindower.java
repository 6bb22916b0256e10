package com.orthosense.service.window;

import com.orthosense.config.properties.AnalysisProperties;
import com.orthosense.domain.Frame;
import com.orthosense.domain.Window;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a complete recording into overlapping windows for offline analysis.
 *
 * <p>Rules, for {@code L} frames, window size {@code W} and step {@code S}:
 * <ul>
 *   <li>{@code L == 0}: no windows</li>
 *   <li>{@code L <= W}: exactly one window holding every frame</li>
 *   <li>{@code L > W}: windows of exactly {@code W} frames starting at 0, S, 2S, ... while the
 *       start stays strictly below {@code L - W}; no trailing partial window is produced</li>
 * </ul>
 */
public final class BatchWindower {

    private final int windowSize;
    private final int step;
    private final double frameVisibilityThreshold;
    private final double windowVisibleRatio;

    public BatchWindower(int windowSize, int step, double frameVisibilityThreshold, double windowVisibleRatio) {
        if (windowSize <= 0 || step <= 0) {
            throw new IllegalArgumentException("windowSize and step must be positive");
        }
        this.windowSize = windowSize;
        this.step = step;
        this.frameVisibilityThreshold = frameVisibilityThreshold;
        this.windowVisibleRatio = windowVisibleRatio;
    }

    public static BatchWindower from(AnalysisProperties props) {
        return new BatchWindower(props.getWindowSize(), props.getStep(),
                props.getFrameVisibilityThreshold(), props.getWindowVisibleRatio());
    }

    public List<Window> split(List<Frame> frames) {
        Objects.requireNonNull(frames, "frames");
        int total = frames.size();
        List<Window> windows = new ArrayList<>();
        if (total == 0) {
            return windows;
        }
        if (total <= windowSize) {
            windows.add(window(frames));
            return windows;
        }
        for (int offset = 0; offset < total - windowSize; offset += step) {
            windows.add(window(frames.subList(offset, offset + windowSize)));
        }
        return windows;
    }

    private Window window(List<Frame> frames) {
        return Window.of(frames, frameVisibilityThreshold, windowVisibleRatio);
    }
}
