package com.orthosense.domain;

import java.util.List;
import java.util.Objects;

/**
 * Bounded ordered sequence of frames; the unit of classification and evaluation.
 *
 * @param frames  frames in capture order (never empty)
 * @param visible whether enough frames had the body in view
 */
public record Window(List<Frame> frames, boolean visible) {

    public Window {
        Objects.requireNonNull(frames, "frames");
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("Window must contain at least one frame");
        }
        frames = List.copyOf(frames);
    }

    public int size() {
        return frames.size();
    }

    public Frame frame(int index) {
        return frames.get(index);
    }

    /**
     * Builds a window, deriving visibility from the fraction of visible frames.
     *
     * @param frames           frames in order
     * @param frameThreshold   mean joint visibility a frame needs to count as visible
     * @param minVisibleRatio  fraction of visible frames required for the window
     */
    public static Window of(List<Frame> frames, double frameThreshold, double minVisibleRatio) {
        Objects.requireNonNull(frames, "frames");
        long visibleFrames = frames.stream().filter(f -> f.isVisible(frameThreshold)).count();
        boolean visible = !frames.isEmpty() && visibleFrames >= minVisibleRatio * frames.size();
        return new Window(frames, visible);
    }
}
