package com.orthosense.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link AnalysisMetrics} used by the analysis pipeline.
 *
 * <p>Per-session objects are created outside Spring and in tests; they receive {@link #NOOP}
 * when no registry is wired.
 */
@Component
public final class AnalysisMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(AnalysisMetricsPublisher.class);

    /** Publisher that records nothing. */
    public static final AnalysisMetricsPublisher NOOP = new AnalysisMetricsPublisher(null);

    private final AnalysisMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public AnalysisMetricsPublisher(AnalysisMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("AnalysisMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordClassification(String source, String label) {
        if (metrics == null) {
            return;
        }
        metrics.incrementClassification(source, label);
    }

    public void recordOverride(String rule) {
        if (metrics == null) {
            return;
        }
        metrics.incrementOverride(rule);
    }

    public void recordGateRejection() {
        if (metrics == null) {
            return;
        }
        metrics.incrementGateRejection();
    }

    public void recordRecording(String outcome, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordRecording(outcome, durationNanos);
    }

    public void recordFeedback(String result) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFeedback(result);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
