package com.orthosense.service.feedback;

import com.orthosense.config.properties.FeedbackProperties;
import com.orthosense.service.metrics.AnalysisMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Single-consumer queue that serializes feedback announcements for one session.
 *
 * <p>{@link #enqueue(String)} never blocks. A message equal to the last accepted one is dropped
 * while the debounce interval since that acceptance has not elapsed. One worker, started on demand
 * on the supplied executor, announces messages one at a time in order and exits after the idle
 * timeout; the next accepted message starts a new worker.
 *
 * <p>Announcement failures are logged and counted; the worker moves on to the next message.
 * {@link #close()} discards pending messages and stops the worker.
 */
public final class FeedbackChannel implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(FeedbackChannel.class);

    private final Executor executor;
    private final Announcer announcer;
    private final Clock clock;
    private final Duration debounce;
    private final Duration idleTimeout;
    private final AnalysisMetricsPublisher metrics;
    private final BlockingQueue<String> queue;

    private final Object lock = new Object();
    private String lastMessage;
    private Instant lastAcceptedAt;
    private boolean workerRunning;
    private volatile boolean closed;
    private volatile Thread workerThread;

    public FeedbackChannel(Executor executor,
                           Announcer announcer,
                           FeedbackProperties props,
                           Clock clock,
                           AnalysisMetricsPublisher metrics) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.announcer = Objects.requireNonNull(announcer, "announcer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.debounce = props.getDebounce();
        this.idleTimeout = props.getIdleTimeout();
        this.metrics = metrics == null ? AnalysisMetricsPublisher.NOOP : metrics;
        this.queue = new LinkedBlockingQueue<>(props.getQueueCapacity());
    }

    /**
     * Offers a message for announcement.
     *
     * @param message text to announce (blank messages are ignored)
     * @return true if the message was queued
     */
    public boolean enqueue(String message) {
        if (message == null || message.isBlank() || closed) {
            return false;
        }
        synchronized (lock) {
            Instant now = clock.instant();
            if (message.equals(lastMessage) && lastAcceptedAt != null
                    && Duration.between(lastAcceptedAt, now).compareTo(debounce) < 0) {
                LOG.trace("Debounced repeated feedback: {}", message);
                metrics.recordFeedback("debounced");
                return false;
            }
            if (!queue.offer(message)) {
                LOG.warn("Feedback queue full; dropping message: {}", message);
                metrics.recordFeedback("dropped");
                return false;
            }
            lastMessage = message;
            lastAcceptedAt = now;
            ensureWorker();
            return true;
        }
    }

    public int pending() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        queue.clear();
        Thread worker = workerThread;
        if (worker != null) {
            worker.interrupt();
        }
    }

    // Caller holds lock
    private void ensureWorker() {
        if (workerRunning) {
            return;
        }
        workerRunning = true;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            workerRunning = false;
            queue.clear();
            LOG.warn("Feedback worker rejected by executor; pending messages discarded: {}", e.getMessage());
            metrics.recordFeedback("rejected");
        }
    }

    private void drain() {
        workerThread = Thread.currentThread();
        try {
            while (!closed) {
                String message = queue.poll(idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (message == null) {
                    synchronized (lock) {
                        if (queue.isEmpty()) {
                            LOG.debug("Feedback worker idle for {}; exiting", idleTimeout);
                            return;
                        }
                    }
                    continue;
                }
                announce(message);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Feedback worker interrupted");
        } finally {
            workerThread = null;
            synchronized (lock) {
                workerRunning = false;
                if (!closed && !queue.isEmpty()) {
                    ensureWorker();
                }
            }
        }
    }

    private void announce(String message) {
        try {
            announcer.announce(message);
            metrics.recordFeedback("announced");
        } catch (RuntimeException e) {
            LOG.warn("Feedback announcement failed for '{}': {}", message, e.getMessage(), e);
            metrics.recordFeedback("failed");
        }
    }
}
