package com.orthosense.service.session;

import com.orthosense.domain.ExerciseLabel;
import com.orthosense.domain.Frame;
import com.orthosense.domain.WindowAnalysis;
import com.orthosense.service.diagnostics.Violations;
import com.orthosense.service.feedback.FeedbackChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Real-time coaching loop for one user: buffers frames, analyses the buffer at a fixed frame
 * cadence and turns violations into spoken feedback.
 *
 * <p>An invisible window asks the user to step back; otherwise the advice for the first violation
 * of a detected exercise is enqueued. Not thread-safe: frames must arrive from one producer.
 */
public final class LiveSession implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(LiveSession.class);

    public static final String STEP_BACK_MESSAGE = "Step back so your whole body is visible";

    private final SessionAggregator aggregator;
    private final FeedbackChannel feedback;
    private final int cadenceFrames;
    private ExerciseLabel lockedExercise;
    private int framesSinceAnalysis;

    public LiveSession(SessionAggregator aggregator, FeedbackChannel feedback, int cadenceFrames) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        if (cadenceFrames <= 0) {
            throw new IllegalArgumentException("cadenceFrames must be > 0, got: " + cadenceFrames);
        }
        this.cadenceFrames = cadenceFrames;
    }

    public String sessionId() {
        return aggregator.sessionId();
    }

    /**
     * Fixes the exercise for subsequent analyses; null returns to automatic detection.
     */
    public void lockExercise(ExerciseLabel label) {
        if (label != lockedExercise) {
            LOG.info("Session {}: exercise lock {} -> {}", sessionId(), lockedExercise, label);
        }
        this.lockedExercise = label;
    }

    public Optional<ExerciseLabel> lockedExercise() {
        return Optional.ofNullable(lockedExercise);
    }

    /**
     * Accepts one frame and, on cadence ticks once the buffer is ready, analyses the buffer.
     *
     * @return the analysis produced on this tick, or empty when no analysis ran
     */
    public Optional<WindowAnalysis> onFrame(Frame frame) {
        boolean ready = aggregator.pushFrame(frame);
        framesSinceAnalysis++;
        if (!ready || framesSinceAnalysis < cadenceFrames) {
            return Optional.empty();
        }
        framesSinceAnalysis = 0;
        Optional<WindowAnalysis> analysis = aggregator.analyzeBuffered(lockedExercise);
        analysis.ifPresent(this::speak);
        return analysis;
    }

    @Override
    public void close() {
        feedback.close();
        aggregator.resetLive();
    }

    private void speak(WindowAnalysis analysis) {
        if (!analysis.windowVisible()) {
            feedback.enqueue(STEP_BACK_MESSAGE);
            return;
        }
        if (!analysis.classification().isDetected()) {
            return;
        }
        analysis.diagnostic().violations().stream()
                .findFirst()
                .map(Violations::adviceFor)
                .ifPresent(feedback::enqueue);
    }
}
