package com.orthosense.service.session;

import com.orthosense.config.properties.AnalysisProperties;
import com.orthosense.domain.AnalysisOutcome;
import com.orthosense.domain.ClassificationResult;
import com.orthosense.domain.DiagnosticResult;
import com.orthosense.domain.ExerciseLabel;
import com.orthosense.domain.Frame;
import com.orthosense.domain.SessionVerdict;
import com.orthosense.domain.Window;
import com.orthosense.domain.WindowAnalysis;
import com.orthosense.service.classify.EnsembleClassifier;
import com.orthosense.service.diagnostics.BiomechanicalEvaluator;
import com.orthosense.service.metrics.AnalysisMetricsPublisher;
import com.orthosense.service.report.ReportGenerator;
import com.orthosense.service.window.BatchWindower;
import com.orthosense.service.window.FrameRingBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-session orchestrator of windowing, classification and evaluation.
 *
 * <p>Live workflow: {@link #pushFrame(Frame)} feeds the ring buffer and
 * {@link #analyzeBuffered(ExerciseLabel)} analyses its current contents once ready.
 *
 * <p>Batch workflow, {@link #analyzeRecording(List)}, runs two passes:
 * <ol>
 *   <li>Discovery: every window is classified without a forced label. Windows whose confidence
 *       exceeds the vote threshold and whose label is a catalogue exercise cast one vote; the
 *       majority becomes the locked exercise.</li>
 *   <li>Locked evaluation: every window is evaluated as the locked exercise. The verdict's
 *       correctness and feedback come from the last window while the text report scores all of
 *       them.</li>
 * </ol>
 *
 * <p>Instances are created by {@link SessionAggregatorFactory} and must never be shared between
 * sessions. Computation is synchronous and performs no I/O.
 */
public final class SessionAggregator {

    private static final Logger LOG = LogManager.getLogger(SessionAggregator.class);

    private final String sessionId;
    private final EnsembleClassifier classifier;
    private final BiomechanicalEvaluator evaluator;
    private final ReportGenerator reportGenerator;
    private final FrameRingBuffer ringBuffer;
    private final BatchWindower windower;
    private final AnalysisProperties props;
    private final AnalysisMetricsPublisher metrics;

    public SessionAggregator(String sessionId,
                             EnsembleClassifier classifier,
                             BiomechanicalEvaluator evaluator,
                             ReportGenerator reportGenerator,
                             AnalysisProperties props,
                             AnalysisMetricsPublisher metrics) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.reportGenerator = Objects.requireNonNull(reportGenerator, "reportGenerator");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = metrics == null ? AnalysisMetricsPublisher.NOOP : metrics;
        this.ringBuffer = new FrameRingBuffer(props.getWindowSize(), props.getMinFramesForLiveReady());
        this.windower = BatchWindower.from(props);
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * Classifies a window and evaluates it as the resulting (possibly forced) exercise.
     *
     * @param window      window to analyse
     * @param forcedLabel exercise chosen by the caller (may be null)
     */
    public WindowAnalysis analyzeWindow(Window window, ExerciseLabel forcedLabel) {
        ClassificationResult classification = classifier.classify(window, forcedLabel);
        DiagnosticResult diagnostic = evaluator.evaluate(window, classification.label());
        return new WindowAnalysis(classification, diagnostic, window.visible());
    }

    /**
     * Adds a live frame to the ring buffer.
     *
     * @return true once enough frames are buffered for analysis
     */
    public boolean pushFrame(Frame frame) {
        ringBuffer.push(Objects.requireNonNull(frame, "frame"));
        return ringBuffer.ready();
    }

    public boolean isReady() {
        return ringBuffer.ready();
    }

    /**
     * Analyses the current ring buffer contents.
     *
     * @param forcedLabel exercise chosen by the caller (may be null)
     * @return analysis, or empty while the buffer is not ready
     */
    public Optional<WindowAnalysis> analyzeBuffered(ExerciseLabel forcedLabel) {
        if (!ringBuffer.ready()) {
            return Optional.empty();
        }
        Window window = ringBuffer.snapshotWindow(props.getFrameVisibilityThreshold(), props.getWindowVisibleRatio());
        return Optional.of(analyzeWindow(window, forcedLabel));
    }

    /** Drops buffered live frames and smoothing state. */
    public void resetLive() {
        ringBuffer.clear();
        evaluator.reset();
    }

    /**
     * Analyses a whole recording in two passes.
     *
     * @param frames validated frames in recording order
     * @return completed verdict, or a "no data" / "no confident exercise" outcome
     */
    public AnalysisOutcome analyzeRecording(List<Frame> frames) {
        Objects.requireNonNull(frames, "frames");
        long start = System.nanoTime();
        evaluator.reset();

        List<Window> windows = windower.split(frames);
        if (windows.isEmpty()) {
            LOG.info("Session {}: recording has no frames", sessionId);
            return finish(AnalysisOutcome.noData(), start);
        }

        VoteTally tally = new VoteTally();
        for (Window window : windows) {
            ClassificationResult result = classifier.classify(window);
            if (result.isDetected() && result.confidence() > props.getVoteConfidenceThreshold()) {
                tally.add(result.label());
            }
        }
        Optional<ExerciseLabel> winner = tally.winner();
        if (winner.isEmpty()) {
            LOG.info("Session {}: no confident exercise across {} windows", sessionId, windows.size());
            return finish(AnalysisOutcome.noConfidentExercise(), start);
        }
        ExerciseLabel locked = winner.get();
        LOG.info("Session {}: locked {} with {} of {} votes over {} windows",
                sessionId, locked.displayName(), tally.votesFor(locked), tally.totalVotes(), windows.size());

        List<WindowAnalysis> perWindow = new ArrayList<>(windows.size());
        List<DiagnosticResult> diagnostics = new ArrayList<>(windows.size());
        for (Window window : windows) {
            WindowAnalysis analysis = analyzeWindow(window, locked);
            perWindow.add(analysis);
            diagnostics.add(analysis.diagnostic());
        }

        DiagnosticResult last = diagnostics.get(diagnostics.size() - 1);
        SessionVerdict verdict = new SessionVerdict(
                locked,
                tally.confidence(),
                perWindow,
                last.correct(),
                last.violations(),
                reportGenerator.generate(locked, diagnostics));
        return finish(AnalysisOutcome.completed(verdict), start);
    }

    private AnalysisOutcome finish(AnalysisOutcome outcome, long startNanos) {
        metrics.recordRecording(outcome.status().name(), System.nanoTime() - startNanos);
        return outcome;
    }
}
