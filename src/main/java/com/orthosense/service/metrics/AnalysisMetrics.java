package com.orthosense.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for exercise analysis.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Window classifications per decision source (legs, arms, forced, locked, none)</li>
 *   <li>Override rule activations and confidence-gate rejections</li>
 *   <li>Recording analysis latency and outcome</li>
 *   <li>Feedback announcements, debounced duplicates and failures</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class AnalysisMetrics {

    private static final String METRIC_PREFIX = "orthosense.analysis";

    private final MeterRegistry registry;

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementClassification(String source, String label) {
        Counter.builder(METRIC_PREFIX + ".classification")
                .description("Number of classified windows")
                .tag("source", source)
                .tag("label", label)
                .register(registry)
                .increment();
    }

    public void incrementOverride(String rule) {
        Counter.builder(METRIC_PREFIX + ".override")
                .description("Number of geometry override activations")
                .tag("rule", rule)
                .register(registry)
                .increment();
    }

    public void incrementGateRejection() {
        Counter.builder(METRIC_PREFIX + ".gate.rejected")
                .description("Windows discarded by the confidence gate")
                .register(registry)
                .increment();
    }

    public void recordRecording(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".recording.latency")
                .description("Time taken to analyse a whole recording")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementFeedback(String result) {
        Counter.builder("orthosense.feedback")
                .description("Feedback messages by delivery result")
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
