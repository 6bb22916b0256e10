package com.orthosense.service.session;

import com.orthosense.config.properties.AnalysisProperties;
import com.orthosense.service.classify.EnsembleClassifier;
import com.orthosense.service.diagnostics.BiomechanicalEvaluator;
import com.orthosense.service.diagnostics.ExerciseRuleBook;
import com.orthosense.service.diagnostics.SmoothingBuffer;
import com.orthosense.service.metrics.AnalysisMetricsPublisher;
import com.orthosense.service.report.ReportGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Creates one {@link SessionAggregator} per session, each with its own ring buffer and evaluator.
 *
 * <p>The classifier, rule book and report generator are stateless and shared.
 */
@Component
public class SessionAggregatorFactory {

    private final EnsembleClassifier classifier;
    private final ExerciseRuleBook ruleBook;
    private final ReportGenerator reportGenerator;
    private final AnalysisProperties props;
    private final AnalysisMetricsPublisher metrics;

    public SessionAggregatorFactory(EnsembleClassifier classifier,
                                    ExerciseRuleBook ruleBook,
                                    ReportGenerator reportGenerator,
                                    AnalysisProperties props,
                                    AnalysisMetricsPublisher metrics) {
        this.classifier = classifier;
        this.ruleBook = ruleBook;
        this.reportGenerator = reportGenerator;
        this.props = props;
        this.metrics = metrics;
    }

    public SessionAggregator create() {
        return create(UUID.randomUUID().toString());
    }

    public SessionAggregator create(String sessionId) {
        BiomechanicalEvaluator evaluator = new BiomechanicalEvaluator(
                ruleBook, new SmoothingBuffer(props.getSmoothingBufferCapacity()));
        return new SessionAggregator(sessionId, classifier, evaluator, reportGenerator, props, metrics);
    }

    public AnalysisProperties properties() {
        return props;
    }
}
