package com.orthosense.config;

import com.orthosense.config.properties.AnalysisProperties;
import com.orthosense.config.properties.ClassifierProperties;
import com.orthosense.domain.ExerciseFamily;
import com.orthosense.service.classify.EnsembleClassifier;
import com.orthosense.service.classify.ExerciseModel;
import com.orthosense.service.classify.fusion.ConfidenceFusion;
import com.orthosense.service.classify.fusion.ModelFusion;
import com.orthosense.service.classify.override.DeepSquatOverride;
import com.orthosense.service.classify.override.LungeSymmetryOverride;
import com.orthosense.service.feedback.Announcer;
import com.orthosense.service.feedback.LoggingAnnouncer;
import com.orthosense.service.geometry.PoseMetrics;
import com.orthosense.service.metrics.AnalysisMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wires the classification pipeline.
 *
 * <p>The two model beans ({@code legsModel}, {@code armsModel}) fall back to
 * {@link ExerciseModel#unavailable(String, ExerciseFamily)} unless the host application defines
 * beans with those names. The override order is fixed: deep-squat first, then lunge symmetry.
 */
@Configuration
public class AnalysisConfig {

    private static final Logger LOG = LogManager.getLogger(AnalysisConfig.class);

    @Bean(name = "legsModel")
    @ConditionalOnMissingBean(name = "legsModel")
    public ExerciseModel legsModel() {
        LOG.warn("No legs model configured; legs-family exercises will not be detected");
        return ExerciseModel.unavailable("legs", ExerciseFamily.LEGS);
    }

    @Bean(name = "armsModel")
    @ConditionalOnMissingBean(name = "armsModel")
    public ExerciseModel armsModel() {
        LOG.warn("No arms model configured; standing exercises will not be detected");
        return ExerciseModel.unavailable("arms", ExerciseFamily.ARMS);
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelFusion modelFusion() {
        return new ConfidenceFusion();
    }

    @Bean
    public EnsembleClassifier ensembleClassifier(@Qualifier("legsModel") ExerciseModel legsModel,
                                                 @Qualifier("armsModel") ExerciseModel armsModel,
                                                 ModelFusion fusion,
                                                 PoseMetrics poseMetrics,
                                                 ClassifierProperties classifierProperties,
                                                 AnalysisProperties analysisProperties,
                                                 AnalysisMetricsPublisher metrics) {
        LOG.info("Ensemble classifier: legs={} (available={}), arms={} (available={}), gate={}",
                legsModel.getModelName(), legsModel.isAvailable(),
                armsModel.getModelName(), armsModel.isAvailable(),
                analysisProperties.getConfidenceGateThreshold());
        return new EnsembleClassifier(
                legsModel,
                armsModel,
                fusion,
                List.of(new DeepSquatOverride(poseMetrics, classifierProperties),
                        new LungeSymmetryOverride(poseMetrics, classifierProperties)),
                analysisProperties.getConfidenceGateThreshold(),
                metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public Announcer announcer() {
        return new LoggingAnnouncer();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
