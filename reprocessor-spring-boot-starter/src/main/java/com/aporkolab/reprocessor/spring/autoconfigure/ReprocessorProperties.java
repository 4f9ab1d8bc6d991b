package com.aporkolab.reprocessor.spring.autoconfigure;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.aporkolab.reprocessor.classification.OverlapPolicy;
import com.aporkolab.reprocessor.config.ReprocessorSettings;

/**
 * Configuration properties for the Kafka reprocessor.
 * 
 * Example application.yml:
 * <pre>
 * reprocessor:
 *   max-attempts: 3
 *   retryable-errors: SERVICE_UNAVAILABLE, HTTP:GATEWAY_TIMEOUT
 *   non-retryable-errors: VALIDATION, KAFKA:DESERIALIZATION
 *   scheduler-frequency: 30s
 *   batch-size: 100
 *   poll-timeout: 1s
 *   topics:
 *     primary: orders
 *     retry: orders.retry
 *     dlq: orders.dlq
 * </pre>
 */
@ConfigurationProperties(prefix = "reprocessor")
public class ReprocessorProperties {

    private int maxAttempts = 3;
    private Set<String> retryableErrors = new LinkedHashSet<>();
    private Set<String> nonRetryableErrors = new LinkedHashSet<>();
    private OverlapPolicy overlapPolicy = OverlapPolicy.NON_RETRYABLE_WINS;
    private Duration schedulerFrequency = Duration.ofSeconds(30);
    private int batchSize = 100;
    private Duration pollTimeout = Duration.ofSeconds(1);
    private Duration publishTimeout = Duration.ofSeconds(10);
    private String retryConsumerGroup = "reprocessor-retry";
    private TopicsProperties topics = new TopicsProperties();
    private MainFlowProperties mainFlow = new MainFlowProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    /**
     * Validated, immutable view handed to the engine.
     */
    public ReprocessorSettings toSettings() {
        return ReprocessorSettings.builder()
                .maxAttempts(maxAttempts)
                .retryableErrors(retryableErrors)
                .nonRetryableErrors(nonRetryableErrors)
                .overlapPolicy(overlapPolicy)
                .schedulerFrequency(schedulerFrequency)
                .batchSize(batchSize)
                .pollTimeout(pollTimeout)
                .publishTimeout(publishTimeout)
                .primaryTopic(topics.getPrimary())
                .retryTopic(topics.getRetry())
                .dlqTopic(topics.getDlq())
                .build();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Set<String> getRetryableErrors() {
        return retryableErrors;
    }

    public void setRetryableErrors(Set<String> retryableErrors) {
        this.retryableErrors = retryableErrors;
    }

    public Set<String> getNonRetryableErrors() {
        return nonRetryableErrors;
    }

    public void setNonRetryableErrors(Set<String> nonRetryableErrors) {
        this.nonRetryableErrors = nonRetryableErrors;
    }

    public OverlapPolicy getOverlapPolicy() {
        return overlapPolicy;
    }

    public void setOverlapPolicy(OverlapPolicy overlapPolicy) {
        this.overlapPolicy = overlapPolicy;
    }

    public Duration getSchedulerFrequency() {
        return schedulerFrequency;
    }

    public void setSchedulerFrequency(Duration schedulerFrequency) {
        this.schedulerFrequency = schedulerFrequency;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getPollTimeout() {
        return pollTimeout;
    }

    public void setPollTimeout(Duration pollTimeout) {
        this.pollTimeout = pollTimeout;
    }

    public Duration getPublishTimeout() {
        return publishTimeout;
    }

    public void setPublishTimeout(Duration publishTimeout) {
        this.publishTimeout = publishTimeout;
    }

    public String getRetryConsumerGroup() {
        return retryConsumerGroup;
    }

    public void setRetryConsumerGroup(String retryConsumerGroup) {
        this.retryConsumerGroup = retryConsumerGroup;
    }

    public TopicsProperties getTopics() {
        return topics;
    }

    public void setTopics(TopicsProperties topics) {
        this.topics = topics;
    }

    public MainFlowProperties getMainFlow() {
        return mainFlow;
    }

    public void setMainFlow(MainFlowProperties mainFlow) {
        this.mainFlow = mainFlow;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    // ==================== NESTED PROPERTIES CLASSES ====================

    public static class TopicsProperties {
        private String primary = "messages";
        private String retry = "messages.retry";
        private String dlq = "messages.dlq";

        public String getPrimary() {
            return primary;
        }

        public void setPrimary(String primary) {
            this.primary = primary;
        }

        public String getRetry() {
            return retry;
        }

        public void setRetry(String retry) {
            this.retry = retry;
        }

        public String getDlq() {
            return dlq;
        }

        public void setDlq(String dlq) {
            this.dlq = dlq;
        }
    }

    public static class MainFlowProperties {
        /** Pause before a record whose routing publish failed is delivered again. */
        private Duration redeliveryInterval = Duration.ofSeconds(1);

        public Duration getRedeliveryInterval() {
            return redeliveryInterval;
        }

        public void setRedeliveryInterval(Duration redeliveryInterval) {
            this.redeliveryInterval = redeliveryInterval;
        }
    }

    public static class SchedulerProperties {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
