package com.orthosense.presentation.controller;

import com.orthosense.config.logging.MdcFilter;
import com.orthosense.config.properties.AnalysisProperties;
import com.orthosense.domain.AnalysisOutcome;
import com.orthosense.domain.Frame;
import com.orthosense.domain.Window;
import com.orthosense.domain.WindowAnalysis;
import com.orthosense.exception.InvalidFrameException;
import com.orthosense.service.session.SessionAggregator;
import com.orthosense.service.session.SessionAggregatorFactory;
import com.orthosense.service.window.FrameJsonParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Thin HTTP boundary over the analysis pipeline.
 *
 * <p>Every request gets its own {@link SessionAggregator}; nothing is kept between requests.
 * Empty recordings and recordings without a confident exercise answer 200 with
 * {@code {"error": ...}}; malformed frames answer 400 via the global exception handler.
 */
@RestController
@RequestMapping(path = "/api/v1/analysis", produces = MediaType.APPLICATION_JSON_VALUE)
class AnalysisController {

    private static final Logger LOG = LogManager.getLogger(AnalysisController.class);

    private final FrameJsonParser parser;
    private final SessionAggregatorFactory sessions;
    private final AnalysisProperties props;

    AnalysisController(FrameJsonParser parser, SessionAggregatorFactory sessions, AnalysisProperties props) {
        this.parser = parser;
        this.sessions = sessions;
        this.props = props;
    }

    @PostMapping(path = "/recording", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<String> analyzeRecording(@RequestBody String body) {
        List<Frame> frames = parser.parseRecording(body);
        LOG.info("Analysing recording of {} frames", frames.size());
        AnalysisOutcome outcome = newSession().analyzeRecording(frames);
        return ResponseEntity.ok(outcome.toJson().toString());
    }

    @PostMapping(path = "/window", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<String> analyzeWindow(@RequestBody String body) {
        FrameJsonParser.WindowRequest request = parser.parseWindowRequest(body);
        List<Frame> frames = request.frames();
        if (frames.isEmpty()) {
            throw new InvalidFrameException("window has no frames");
        }
        if (frames.size() > props.getWindowSize()) {
            throw new InvalidFrameException(
                    "window has " + frames.size() + " frames; at most " + props.getWindowSize() + " allowed");
        }
        Window window = Window.of(frames, props.getFrameVisibilityThreshold(), props.getWindowVisibleRatio());
        WindowAnalysis analysis = newSession().analyzeWindow(window, request.forced());
        return ResponseEntity.ok(toJson(analysis).toString());
    }

    private SessionAggregator newSession() {
        String sessionId = ThreadContext.get(MdcFilter.SESSION_ID_KEY);
        return sessionId == null ? sessions.create() : sessions.create(sessionId);
    }

    static JSONObject toJson(WindowAnalysis analysis) {
        JSONObject json = new JSONObject();
        json.put("exercise", analysis.classification().label().displayName());
        json.put("confidence", analysis.classification().confidence());
        json.put("source_model", analysis.classification().sourceModel().displayName());
        json.put("is_correct", analysis.diagnostic().correct());
        json.put("violations", new JSONArray(analysis.diagnostic().violations()));
        json.put("window_visible", analysis.windowVisible());
        return json;
    }
}
