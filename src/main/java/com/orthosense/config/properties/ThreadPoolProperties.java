package com.orthosense.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Each live session's feedback worker occupies one thread of the feedback pool while it has
 * messages to announce; idle workers exit and release their thread.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private FeedbackPoolProperties feedback = new FeedbackPoolProperties();

    public FeedbackPoolProperties getFeedback() {
        return feedback;
    }

    public void setFeedback(FeedbackPoolProperties feedback) {
        this.feedback = feedback;
    }

    /**
     * Feedback executor pool configuration.
     */
    public static class FeedbackPoolProperties {
        private int corePoolSize = 2;
        private int maxPoolSize = 16;
        private int queueCapacity = 0;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "feedback-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
