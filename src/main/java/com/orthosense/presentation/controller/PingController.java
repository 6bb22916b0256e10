package com.orthosense.presentation.controller;

import com.orthosense.service.classify.EnsembleClassifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint. Reports which exercise models are loaded, so a client can tell whether
 * unforced analysis will find anything before uploading a recording.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    private final EnsembleClassifier classifier;
    private final Clock clock;

    PingController(EnsembleClassifier classifier, Clock clock) {
        this.classifier = classifier;
        this.clock = clock;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        boolean legs = classifier.legsModel().isAvailable();
        boolean arms = classifier.armsModel().isAvailable();
        log.info("Ping received (legs model available={}, arms model available={})", legs, arms);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", clock.instant().toString());
        body.put("models", Map.of("legs", legs, "arms", arms));
        body.put("unforcedAnalysis", legs || arms);
        return ResponseEntity.ok(body);
    }
}
