package com.orthosense.service.feedback;

import com.orthosense.config.properties.FeedbackProperties;
import com.orthosense.service.metrics.AnalysisMetrics;
import com.orthosense.service.metrics.AnalysisMetricsPublisher;
import com.orthosense.testutil.MutableClock;
import com.orthosense.testutil.RecordingAnnouncer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class FeedbackChannelTest {

    private static final FeedbackProperties PROPS = new FeedbackProperties(4.0, 1L, 4);

    private ExecutorService executor;
    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private AnalysisMetricsPublisher metrics;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        clock = new MutableClock();
        registry = new SimpleMeterRegistry();
        metrics = new AnalysisMetricsPublisher(new AnalysisMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void repeatedMessageWithinDebounceIsAnnouncedOnce() {
        RecordingAnnouncer announcer = new RecordingAnnouncer();
        FeedbackChannel channel = channel(announcer);

        assertThat(channel.enqueue("Keep your heels down")).isTrue();
        clock.advance(Duration.ofSeconds(3));
        assertThat(channel.enqueue("Keep your heels down")).isFalse();

        await().atMost(2, TimeUnit.SECONDS).until(() -> announcer.announced.size() == 1);
        assertThat(feedbackCount("debounced")).isEqualTo(1.0);
    }

    @Test
    void repeatedMessageAfterDebounceIsAnnouncedAgain() {
        RecordingAnnouncer announcer = new RecordingAnnouncer();
        FeedbackChannel channel = channel(announcer);

        channel.enqueue("Keep your heels down");
        clock.advance(Duration.ofSeconds(4));
        assertThat(channel.enqueue("Keep your heels down")).isTrue();

        await().atMost(2, TimeUnit.SECONDS).until(() -> announcer.announced.size() == 2);
    }

    @Test
    void differentMessagesAreAnnouncedInOrder() {
        RecordingAnnouncer announcer = new RecordingAnnouncer();
        FeedbackChannel channel = channel(announcer);

        channel.enqueue("first");
        channel.enqueue("second");
        channel.enqueue("first");

        await().atMost(2, TimeUnit.SECONDS).until(() -> announcer.announced.size() == 3);
        assertThat(announcer.announced).containsExactly("first", "second", "first");
    }

    @Test
    void failedAnnouncementDoesNotStopTheWorker() {
        RecordingAnnouncer announcer = new RecordingAnnouncer("broken");
        FeedbackChannel channel = channel(announcer);

        channel.enqueue("broken");
        channel.enqueue("still delivered");

        await().atMost(2, TimeUnit.SECONDS).until(() -> announcer.announced.contains("still delivered"));
        assertThat(announcer.announced).containsExactly("still delivered");
        assertThat(feedbackCount("failed")).isEqualTo(1.0);
    }

    @Test
    void workerRestartsAfterIdleTimeout() {
        RecordingAnnouncer announcer = new RecordingAnnouncer();
        FeedbackChannel channel = channel(announcer);

        channel.enqueue("before idle");
        await().atMost(2, TimeUnit.SECONDS).until(() -> announcer.announced.size() == 1);
        await().pollDelay(1500, TimeUnit.MILLISECONDS).atMost(3, TimeUnit.SECONDS).until(() -> true);

        channel.enqueue("after idle");

        await().atMost(2, TimeUnit.SECONDS).until(() -> announcer.announced.size() == 2);
    }

    @Test
    void fullQueueDropsMessages() throws InterruptedException {
        CountDownLatch speaking = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Announcer slow = message -> {
            speaking.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        FeedbackChannel channel = new FeedbackChannel(executor, slow, new FeedbackProperties(4.0, 1L, 1), clock, metrics);

        channel.enqueue("one");
        assertThat(speaking.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(channel.enqueue("two")).isTrue();
        assertThat(channel.enqueue("three")).isFalse();
        release.countDown();

        assertThat(feedbackCount("dropped")).isEqualTo(1.0);
    }

    @Test
    void closedChannelRejectsMessages() {
        FeedbackChannel channel = channel(new RecordingAnnouncer());

        channel.close();

        assertThat(channel.isClosed()).isTrue();
        assertThat(channel.enqueue("anything")).isFalse();
        assertThat(channel.pending()).isZero();
    }

    @Test
    void rejectedWorkerDiscardsPendingMessages() {
        FeedbackChannel channel = new FeedbackChannel(task -> {
            throw new RejectedExecutionException("pool saturated");
        }, new RecordingAnnouncer(), PROPS, clock, metrics);

        channel.enqueue("lost");

        assertThat(channel.pending()).isZero();
        assertThat(feedbackCount("rejected")).isEqualTo(1.0);
    }

    @Test
    void blankMessagesAreIgnored() {
        FeedbackChannel channel = channel(new RecordingAnnouncer());

        assertThat(channel.enqueue(" ")).isFalse();
        assertThat(channel.enqueue(null)).isFalse();
    }

    private FeedbackChannel channel(Announcer announcer) {
        return new FeedbackChannel(executor, announcer, PROPS, clock, metrics);
    }

    private double feedbackCount(String result) {
        return registry.get("orthosense.feedback").tag("result", result).counter().count();
    }
}
