package com.orthosense.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Feedback channel timing.
 */
@Validated
@ConfigurationProperties(prefix = "orthosense.feedback")
public class FeedbackProperties {

    /** A repeated message is dropped when enqueued again within this many seconds. */
    @Min(0)
    private final double debounceSeconds;

    /** The worker thread exits after this long without messages. */
    @Positive
    private final long idleTimeoutSeconds;

    /** Maximum pending messages; further messages are dropped. */
    @Positive
    private final int queueCapacity;

    @ConstructorBinding
    public FeedbackProperties(Double debounceSeconds, Long idleTimeoutSeconds, Integer queueCapacity) {
        this.debounceSeconds = debounceSeconds == null ? 4.0 : debounceSeconds;
        this.idleTimeoutSeconds = idleTimeoutSeconds == null ? 30L : idleTimeoutSeconds;
        this.queueCapacity = queueCapacity == null ? 32 : queueCapacity;
        if (this.debounceSeconds < 0.0) {
            throw new IllegalArgumentException("orthosense.feedback.debounce-seconds must be >= 0");
        }
    }

    public static FeedbackProperties defaults() {
        return new FeedbackProperties(null, null, null);
    }

    public double getDebounceSeconds() {
        return debounceSeconds;
    }

    public Duration getDebounce() {
        return Duration.ofMillis(Math.round(debounceSeconds * 1000));
    }

    public long getIdleTimeoutSeconds() {
        return idleTimeoutSeconds;
    }

    public Duration getIdleTimeout() {
        return Duration.ofSeconds(idleTimeoutSeconds);
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }
}
