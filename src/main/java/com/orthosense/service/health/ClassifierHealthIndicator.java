package com.orthosense.service.health;

import com.orthosense.service.classify.EnsembleClassifier;
import com.orthosense.service.classify.ExerciseModel;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the legs and arms exercise models.
 *
 * <ul>
 *   <li>UP: both models available</li>
 *   <li>DEGRADED: exactly one model available</li>
 *   <li>DOWN: no model available</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class ClassifierHealthIndicator implements HealthIndicator {

    private final EnsembleClassifier classifier;

    public ClassifierHealthIndicator(EnsembleClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public Health health() {
        ExerciseModel legs = classifier.legsModel();
        ExerciseModel arms = classifier.armsModel();
        boolean legsReady = legs.isAvailable();
        boolean armsReady = arms.isAvailable();

        Health.Builder builder = new Health.Builder();
        if (legsReady && armsReady) {
            builder.up().withDetail("status", "Both models operational");
        } else if (legsReady || armsReady) {
            builder.status("DEGRADED").withDetail("status", "Partial model availability");
        } else {
            builder.down().withDetail("status", "No models available");
        }
        return builder
                .withDetail(legs.getModelName(), legsReady ? "ready" : "unavailable")
                .withDetail(arms.getModelName(), armsReady ? "ready" : "unavailable")
                .build();
    }
}
