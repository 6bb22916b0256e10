package com.orthosense.service.feedback;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Announcer that writes feedback to the application log. Used when no speech output is wired.
 */
public class LoggingAnnouncer implements Announcer {

    private static final Logger LOG = LogManager.getLogger(LoggingAnnouncer.class);

    @Override
    public void announce(String message) {
        LOG.info("Feedback: {}", message);
    }
}
