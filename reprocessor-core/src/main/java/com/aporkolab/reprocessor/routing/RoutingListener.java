package com.aporkolab.reprocessor.routing;

import org.apache.kafka.clients.consumer.ConsumerRecord;

import com.aporkolab.reprocessor.headers.MessageMetadata;

/**
 * Callback invoked after a failed message has been durably re-published.
 * Hook for metrics or alerting; the engine ships only the no-op.
 */
@FunctionalInterface
public interface RoutingListener {

    RoutingListener NOOP = (source, decision, metadata) -> { };

    void onRouted(ConsumerRecord<String, String> source, RoutingDecision decision, MessageMetadata metadata);
}
