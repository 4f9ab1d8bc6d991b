package com.aporkolab.reprocessor.spring.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import org.apache.kafka.clients.consumer.ConsumerRecord;

import com.aporkolab.reprocessor.headers.MessageMetadata;
import com.aporkolab.reprocessor.routing.RoutingDecision;
import com.aporkolab.reprocessor.routing.RoutingListener;

/**
 * Micrometer meters for retry/DLQ routing.
 * 
 * Provides the following metrics:
 * - reprocessor_routed_total: routed messages by destination, failure reason and source topic
 * - reprocessor_dead_lettered_total: messages sent to the DLQ by full error type
 * - reprocessor_retry_count: retry count carried by routed messages
 */
public class RoutingMetrics implements RoutingListener {

    private static final String METRIC_PREFIX = "reprocessor";

    private final MeterRegistry registry;
    private final Tags baseTags;
    private final DistributionSummary retryCountSummary;

    public RoutingMetrics(MeterRegistry registry) {
        this(registry, Tags.empty());
    }

    public RoutingMetrics(MeterRegistry registry, Tags tags) {
        this.registry = registry;
        this.baseTags = tags;

        this.retryCountSummary = DistributionSummary.builder(METRIC_PREFIX + "_retry_count")
                .description("Retry count carried by routed messages")
                .tags(baseTags)
                .register(registry);
    }

    @Override
    public void onRouted(ConsumerRecord<String, String> source, RoutingDecision decision, MessageMetadata metadata) {
        Counter.builder(METRIC_PREFIX + "_routed_total")
                .description("Failed messages routed to the retry topic or DLQ")
                .tags(baseTags.and(
                        "destination", decision.destination().name(),
                        "failure_reason", decision.failureReason().name(),
                        "source_topic", source.topic()))
                .register(registry)
                .increment();

        if (decision.isDeadLetter()) {
            Counter.builder(METRIC_PREFIX + "_dead_lettered_total")
                    .description("Messages sent to the DLQ by error type")
                    .tags(baseTags.and("error_type", metadata.fullErrorType()))
                    .register(registry)
                    .increment();
        }

        retryCountSummary.record(metadata.retryCount());
    }
}
