package com.aporkolab.reprocessor.config;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import com.aporkolab.reprocessor.classification.OverlapPolicy;
import com.aporkolab.reprocessor.exception.ReprocessorConfigurationException;

/**
 * Process-wide reprocessor configuration.
 * 
 * Built once at startup and read-only afterwards, so every component can share
 * one instance across the main flow and the scheduler thread without locking.
 * {@link Builder#build()} validates everything and fails fast.
 */
public final class ReprocessorSettings {

    private final int maxAttempts;
    private final Set<String> retryableErrors;
    private final Set<String> nonRetryableErrors;
    private final OverlapPolicy overlapPolicy;
    private final Duration schedulerFrequency;
    private final int batchSize;
    private final Duration pollTimeout;
    private final Duration publishTimeout;
    private final String primaryTopic;
    private final String retryTopic;
    private final String dlqTopic;

    private ReprocessorSettings(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.retryableErrors = Set.copyOf(builder.retryableErrors);
        this.nonRetryableErrors = Set.copyOf(builder.nonRetryableErrors);
        this.overlapPolicy = builder.overlapPolicy;
        this.schedulerFrequency = builder.schedulerFrequency;
        this.batchSize = builder.batchSize;
        this.pollTimeout = builder.pollTimeout;
        this.publishTimeout = builder.publishTimeout;
        this.primaryTopic = builder.primaryTopic;
        this.retryTopic = builder.retryTopic;
        this.dlqTopic = builder.dlqTopic;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Set<String> getRetryableErrors() {
        return retryableErrors;
    }

    public Set<String> getNonRetryableErrors() {
        return nonRetryableErrors;
    }

    public OverlapPolicy getOverlapPolicy() {
        return overlapPolicy;
    }

    public Duration getSchedulerFrequency() {
        return schedulerFrequency;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Duration getPollTimeout() {
        return pollTimeout;
    }

    public Duration getPublishTimeout() {
        return publishTimeout;
    }

    public String getPrimaryTopic() {
        return primaryTopic;
    }

    public String getRetryTopic() {
        return retryTopic;
    }

    public String getDlqTopic() {
        return dlqTopic;
    }

    @Override
    public String toString() {
        return "ReprocessorSettings{maxAttempts=" + maxAttempts
                + ", retryableErrors=" + retryableErrors
                + ", nonRetryableErrors=" + nonRetryableErrors
                + ", overlapPolicy=" + overlapPolicy
                + ", schedulerFrequency=" + schedulerFrequency
                + ", batchSize=" + batchSize
                + ", pollTimeout=" + pollTimeout
                + ", publishTimeout=" + publishTimeout
                + ", topics=[" + primaryTopic + ", " + retryTopic + ", " + dlqTopic + "]}";
    }

    public static class Builder {
        private int maxAttempts = 3;
        private final Set<String> retryableErrors = new LinkedHashSet<>();
        private final Set<String> nonRetryableErrors = new LinkedHashSet<>();
        private OverlapPolicy overlapPolicy = OverlapPolicy.NON_RETRYABLE_WINS;
        private Duration schedulerFrequency = Duration.ofSeconds(30);
        private int batchSize = 100;
        private Duration pollTimeout = Duration.ofSeconds(1);
        private Duration publishTimeout = Duration.ofSeconds(10);
        private String primaryTopic = "messages";
        private String retryTopic = "messages.retry";
        private String dlqTopic = "messages.dlq";

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryableErrors(Collection<String> errors) {
            this.retryableErrors.clear();
            if (errors != null) {
                errors.forEach(this::retryableError);
            }
            return this;
        }

        public Builder retryableError(String error) {
            this.retryableErrors.add(normalize("retryable-errors", error));
            return this;
        }

        public Builder nonRetryableErrors(Collection<String> errors) {
            this.nonRetryableErrors.clear();
            if (errors != null) {
                errors.forEach(this::nonRetryableError);
            }
            return this;
        }

        public Builder nonRetryableError(String error) {
            this.nonRetryableErrors.add(normalize("non-retryable-errors", error));
            return this;
        }

        public Builder overlapPolicy(OverlapPolicy overlapPolicy) {
            this.overlapPolicy = overlapPolicy;
            return this;
        }

        public Builder schedulerFrequency(Duration schedulerFrequency) {
            this.schedulerFrequency = schedulerFrequency;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder pollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
            return this;
        }

        public Builder publishTimeout(Duration publishTimeout) {
            this.publishTimeout = publishTimeout;
            return this;
        }

        public Builder primaryTopic(String primaryTopic) {
            this.primaryTopic = primaryTopic;
            return this;
        }

        public Builder retryTopic(String retryTopic) {
            this.retryTopic = retryTopic;
            return this;
        }

        public Builder dlqTopic(String dlqTopic) {
            this.dlqTopic = dlqTopic;
            return this;
        }

        public ReprocessorSettings build() {
            requirePositive("max-attempts", maxAttempts);
            requirePositive("batch-size", batchSize);
            requirePositive("scheduler-frequency", schedulerFrequency);
            requirePositive("poll-timeout", pollTimeout);
            requirePositive("publish-timeout", publishTimeout);
            if (overlapPolicy == null) {
                throw new ReprocessorConfigurationException("overlap-policy", "must not be null");
            }
            requireTopic("topics.primary", primaryTopic);
            requireTopic("topics.retry", retryTopic);
            requireTopic("topics.dlq", dlqTopic);
            if (Set.of(primaryTopic, retryTopic, dlqTopic).size() != 3) {
                throw new ReprocessorConfigurationException("topics",
                        "primary, retry and dlq topics must be distinct");
            }
            return new ReprocessorSettings(this);
        }

        private static String normalize(String property, String error) {
            if (error == null || error.isBlank()) {
                throw new ReprocessorConfigurationException(property, "entries must not be blank");
            }
            String trimmed = error.trim();
            int separator = trimmed.indexOf(':');
            if (separator >= 0) {
                String namespace = trimmed.substring(0, separator);
                String type = trimmed.substring(separator + 1);
                if (namespace.isBlank() || type.isBlank() || type.indexOf(':') >= 0) {
                    throw new ReprocessorConfigurationException(property,
                            "'" + error + "' is neither a bare type nor a namespace:type composite");
                }
            }
            return trimmed;
        }

        private static void requirePositive(String property, int value) {
            if (value <= 0) {
                throw new ReprocessorConfigurationException(property, "must be positive but was " + value);
            }
        }

        private static void requirePositive(String property, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new ReprocessorConfigurationException(property, "must be a positive duration but was " + value);
            }
        }

        private static void requireTopic(String property, String topic) {
            if (topic == null || topic.isBlank()) {
                throw new ReprocessorConfigurationException(property, "must not be blank");
            }
        }
    }
}
