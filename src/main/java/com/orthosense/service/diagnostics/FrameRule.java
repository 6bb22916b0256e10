package com.orthosense.service.diagnostics;

import com.orthosense.domain.Frame;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Named per-frame predicate: when {@code fires} matches a frame, {@code violation} is reported.
 */
public record FrameRule(String violation, Predicate<Frame> fires) {

    public FrameRule {
        Objects.requireNonNull(violation, "violation");
        Objects.requireNonNull(fires, "fires");
    }

    public boolean test(Frame frame) {
        return fires.test(frame);
    }
}
