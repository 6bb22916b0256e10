/**
 * Outbound user feedback: a debounced single-worker
 * {@link com.orthosense.service.feedback.FeedbackChannel} delivering messages through a pluggable
 * {@link com.orthosense.service.feedback.Announcer}.
 */
package com.orthosense.service.feedback;
