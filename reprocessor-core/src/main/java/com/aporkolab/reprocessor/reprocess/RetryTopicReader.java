package com.aporkolab.reprocessor.reprocess;

import java.time.Duration;
import java.util.Optional;

import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Single-record view of the retry topic used by {@link BatchReprocessor}.
 * Only ever called from the one active tick, never concurrently.
 */
public interface RetryTopicReader extends AutoCloseable {

    /**
     * Next record, waiting at most {@code timeout}. Empty when nothing arrived in time.
     */
    Optional<ConsumerRecord<String, String>> poll(Duration timeout);

    /**
     * Marks {@code record} as handled; its offset is committed.
     */
    void acknowledge(ConsumerRecord<String, String> record);

    /**
     * Leaves {@code record} uncommitted and makes it the first record read from its
     * partition in the next tick. Nothing else from that partition is returned this tick.
     */
    void defer(ConsumerRecord<String, String> record);

    /**
     * Called once when a tick ends, whatever the outcome.
     */
    void endTick();

    @Override
    void close();
}
