package com.orthosense.service.session;

import com.orthosense.config.properties.AnalysisProperties;
import com.orthosense.config.properties.FeedbackProperties;
import com.orthosense.service.feedback.Announcer;
import com.orthosense.service.feedback.FeedbackChannel;
import com.orthosense.service.metrics.AnalysisMetricsPublisher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Opens {@link LiveSession}s, each with a fresh aggregator and its own feedback channel.
 */
@Component
public class LiveSessionFactory {

    private final SessionAggregatorFactory aggregatorFactory;
    private final Executor feedbackExecutor;
    private final Announcer announcer;
    private final FeedbackProperties feedbackProperties;
    private final Clock clock;
    private final AnalysisMetricsPublisher metrics;

    public LiveSessionFactory(SessionAggregatorFactory aggregatorFactory,
                              @Qualifier("feedbackExecutor") Executor feedbackExecutor,
                              Announcer announcer,
                              FeedbackProperties feedbackProperties,
                              Clock clock,
                              AnalysisMetricsPublisher metrics) {
        this.aggregatorFactory = aggregatorFactory;
        this.feedbackExecutor = feedbackExecutor;
        this.announcer = announcer;
        this.feedbackProperties = feedbackProperties;
        this.clock = clock;
        this.metrics = metrics;
    }

    public LiveSession open(String sessionId) {
        AnalysisProperties props = aggregatorFactory.properties();
        FeedbackChannel channel = new FeedbackChannel(feedbackExecutor, announcer, feedbackProperties, clock, metrics);
        return new LiveSession(aggregatorFactory.create(sessionId), channel, props.getLiveCadenceFrames());
    }
}
