package com.orthosense.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Windowing, gating and voting parameters for session analysis.
 */
@Validated
@ConfigurationProperties(prefix = "orthosense.analysis")
public class AnalysisProperties {

    /** Target window length W in frames. */
    @Positive
    private final int windowSize;

    /** Offset S between consecutive batch windows. */
    @Positive
    private final int step;

    /** Frames the live buffer needs before the first analysis. */
    @Positive
    private final int minFramesForLiveReady;

    /** Below this confidence a classification becomes "no exercise detected". */
    @Min(0)
    @Max(1)
    private final double confidenceGateThreshold;

    /** Windows must exceed this confidence to take part in majority voting. */
    @Min(0)
    @Max(1)
    private final double voteConfidenceThreshold;

    /** Capacity of the torso-lean smoothing buffer. */
    @Positive
    private final int smoothingBufferCapacity;

    /** Mean joint visibility a frame needs to count as visible. */
    @Min(0)
    @Max(1)
    private final double frameVisibilityThreshold;

    /** Fraction of visible frames a window needs to count as visible. */
    @Min(0)
    @Max(1)
    private final double windowVisibleRatio;

    /** Frames between two live analyses once the buffer is ready. */
    @Positive
    private final int liveCadenceFrames;

    @ConstructorBinding
    public AnalysisProperties(Integer windowSize, Integer step, Integer minFramesForLiveReady,
                              Double confidenceGateThreshold, Double voteConfidenceThreshold,
                              Integer smoothingBufferCapacity, Double frameVisibilityThreshold,
                              Double windowVisibleRatio, Integer liveCadenceFrames) {
        this.windowSize = windowSize == null ? 60 : windowSize;
        this.step = step == null ? 15 : step;
        this.minFramesForLiveReady = minFramesForLiveReady == null ? 30 : minFramesForLiveReady;
        this.confidenceGateThreshold = unit(confidenceGateThreshold, 0.60, "confidence-gate-threshold");
        this.voteConfidenceThreshold = unit(voteConfidenceThreshold, 0.50, "vote-confidence-threshold");
        this.smoothingBufferCapacity = smoothingBufferCapacity == null ? 10 : smoothingBufferCapacity;
        this.frameVisibilityThreshold = unit(frameVisibilityThreshold, 0.5, "frame-visibility-threshold");
        this.windowVisibleRatio = unit(windowVisibleRatio, 0.70, "window-visible-ratio");
        this.liveCadenceFrames = liveCadenceFrames == null ? 15 : liveCadenceFrames;
        if (this.windowSize <= 0 || this.step <= 0) {
            throw new IllegalArgumentException("orthosense.analysis.window-size and step must be positive");
        }
        if (this.minFramesForLiveReady > this.windowSize) {
            throw new IllegalArgumentException(
                    "orthosense.analysis.min-frames-for-live-ready must not exceed window-size");
        }
    }

    /** All defaults; convenient for tests and manual wiring. */
    public static AnalysisProperties defaults() {
        return new AnalysisProperties(null, null, null, null, null, null, null, null, null);
    }

    private static double unit(Double value, double fallback, String name) {
        double v = value == null ? fallback : value;
        if (v < 0.0 || v > 1.0) {
            throw new IllegalArgumentException("orthosense.analysis." + name + " must be in [0,1]");
        }
        return v;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getStep() {
        return step;
    }

    public int getMinFramesForLiveReady() {
        return minFramesForLiveReady;
    }

    public double getConfidenceGateThreshold() {
        return confidenceGateThreshold;
    }

    public double getVoteConfidenceThreshold() {
        return voteConfidenceThreshold;
    }

    public int getSmoothingBufferCapacity() {
        return smoothingBufferCapacity;
    }

    public double getFrameVisibilityThreshold() {
        return frameVisibilityThreshold;
    }

    public double getWindowVisibleRatio() {
        return windowVisibleRatio;
    }

    public int getLiveCadenceFrames() {
        return liveCadenceFrames;
    }
}
