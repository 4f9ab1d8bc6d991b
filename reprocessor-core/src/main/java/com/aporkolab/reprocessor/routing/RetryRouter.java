package com.aporkolab.reprocessor.routing;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import com.aporkolab.reprocessor.classification.ErrorClassification;
import com.aporkolab.reprocessor.config.ReprocessorSettings;
import com.aporkolab.reprocessor.exception.BrokerException;
import com.aporkolab.reprocessor.headers.MessageMetadata;
import com.aporkolab.reprocessor.headers.RetryHeaders;

/**
 * Picks the retry or dead-letter topic for a failed message and publishes it there.
 * 
 * Design decisions:
 * - Key and payload are re-published unchanged so ordering per key survives
 * - Upstream headers are preserved, the engine's own headers are replaced
 * - Publishing is synchronous; the caller commits the source offset only after it returns
 * - A failed publish is NOT retried here, it surfaces as {@link BrokerException}
 */
public class RetryRouter {

    private static final Logger log = LoggerFactory.getLogger(RetryRouter.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ReprocessorSettings settings;
    private final RoutingListener listener;

    public RetryRouter(KafkaTemplate<String, String> kafkaTemplate, ReprocessorSettings settings) {
        this(kafkaTemplate, settings, RoutingListener.NOOP);
    }

    public RetryRouter(KafkaTemplate<String, String> kafkaTemplate, ReprocessorSettings settings,
                       RoutingListener listener) {
        this.kafkaTemplate = kafkaTemplate;
        this.settings = settings;
        this.listener = listener;
    }

    /**
     * Decide without publishing.
     */
    public RoutingDecision decide(ErrorClassification classification, int retryCount) {
        return RoutingDecision.decide(classification, retryCount, settings.getMaxAttempts());
    }

    /**
     * Decide and publish {@code source} to the chosen topic with the stamped headers.
     *
     * @throws BrokerException if the broker does not acknowledge the publish
     */
    public RoutingDecision route(ConsumerRecord<String, String> source, ErrorClassification classification,
                                 MessageMetadata metadata) {
        RoutingDecision decision = decide(classification, metadata.retryCount());
        String topic = topicFor(decision.destination());

        ProducerRecord<String, String> outgoing = buildRecord(topic, source, metadata, decision.failureReason());
        SendResult<String, String> result = send(topic, outgoing);

        if (decision.isDeadLetter()) {
            log.warn("Message key={} sent to DLQ {}: reason={}, error={}, retryCount={}, offset={}",
                    source.key(), topic, decision.failureReason(), metadata.fullErrorType(),
                    metadata.retryCount(), offsetOf(result));
        } else {
            log.info("Message key={} scheduled for retry on {}: error={}, retryCount={}/{}, offset={}",
                    source.key(), topic, metadata.fullErrorType(), metadata.retryCount(),
                    settings.getMaxAttempts(), offsetOf(result));
        }

        listener.onRouted(source, decision, metadata);
        return decision;
    }

    public String topicFor(Destination destination) {
        return destination == Destination.RETRY_TOPIC ? settings.getRetryTopic() : settings.getDlqTopic();
    }

    private ProducerRecord<String, String> buildRecord(String topic, ConsumerRecord<String, String> source,
                                                       MessageMetadata metadata, FailureReason reason) {
        ProducerRecord<String, String> outgoing = new ProducerRecord<>(topic, source.key(), source.value());

        for (Header header : source.headers()) {
            if (!RetryHeaders.isOwned(header.key())) {
                outgoing.headers().add(header.key(), header.value());
            }
        }
        metadata.asHeaders().forEach((name, value) -> RetryHeaders.put(outgoing.headers(), name, value));
        RetryHeaders.put(outgoing.headers(), RetryHeaders.FAILURE_REASON, reason.name());
        return outgoing;
    }

    private SendResult<String, String> send(String topic, ProducerRecord<String, String> outgoing) {
        try {
            return kafkaTemplate.send(outgoing)
                    .get(settings.getPublishTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw BrokerException.publish(topic, e);
        } catch (ExecutionException e) {
            throw BrokerException.publish(topic, e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException | KafkaException e) {
            throw BrokerException.publish(topic, e);
        }
    }

    private static Object offsetOf(SendResult<String, String> result) {
        if (result == null || result.getRecordMetadata() == null) {
            return "n/a";
        }
        return result.getRecordMetadata().offset();
    }
}
