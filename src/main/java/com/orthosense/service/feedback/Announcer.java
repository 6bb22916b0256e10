package com.orthosense.service.feedback;

/**
 * Delivers one feedback message to the user (speech synthesis, on-screen banner, push message).
 *
 * <p>Called from the feedback worker thread only; a call returns once the message has been
 * fully delivered. Failures are thrown and handled by {@link FeedbackChannel}.
 */
@FunctionalInterface
public interface Announcer {

    void announce(String message);
}
