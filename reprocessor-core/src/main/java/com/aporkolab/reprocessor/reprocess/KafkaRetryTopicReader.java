package com.aporkolab.reprocessor.reprocess;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.reprocessor.exception.BrokerException;

/**
 * {@link RetryTopicReader} over a plain Kafka {@link Consumer} with auto-commit disabled.
 * 
 * Works best with {@code max.poll.records=1}; larger polls are buffered and handed out one at a time.
 * Deferred records are rewound with {@code seek} and their partition paused until the tick ends.
 */
public class KafkaRetryTopicReader implements RetryTopicReader {

    private static final Logger log = LoggerFactory.getLogger(KafkaRetryTopicReader.class);

    private final Consumer<String, String> consumer;
    private final String topic;
    private final Deque<ConsumerRecord<String, String>> buffer = new ArrayDeque<>();
    private final Set<TopicPartition> deferred = new HashSet<>();

    public KafkaRetryTopicReader(Consumer<String, String> consumer, String topic) {
        this.consumer = consumer;
        this.topic = topic;
        this.consumer.subscribe(List.of(topic));
    }

    @Override
    public Optional<ConsumerRecord<String, String>> poll(Duration timeout) {
        if (buffer.isEmpty()) {
            ConsumerRecords<String, String> records;
            try {
                records = consumer.poll(timeout);
            } catch (KafkaException e) {
                throw BrokerException.poll(topic, e);
            }
            records.forEach(buffer::add);
        }
        return Optional.ofNullable(buffer.poll());
    }

    @Override
    public void acknowledge(ConsumerRecord<String, String> record) {
        TopicPartition partition = new TopicPartition(record.topic(), record.partition());
        try {
            consumer.commitSync(Map.of(partition, new OffsetAndMetadata(record.offset() + 1)));
        } catch (KafkaException e) {
            throw BrokerException.commit(topic, e);
        }
    }

    @Override
    public void defer(ConsumerRecord<String, String> record) {
        TopicPartition partition = new TopicPartition(record.topic(), record.partition());
        buffer.removeIf(buffered -> buffered.partition() == record.partition()
                && buffered.topic().equals(record.topic()));
        try {
            consumer.seek(partition, record.offset());
            consumer.pause(List.of(partition));
        } catch (IllegalStateException e) {
            // partition revoked by a rebalance; the new owner starts from the committed offset anyway
            log.debug("Could not rewind {} to offset {}: {}", partition, record.offset(), e.getMessage());
            return;
        }
        deferred.add(partition);
    }

    @Override
    public void endTick() {
        if (deferred.isEmpty()) {
            return;
        }
        Set<TopicPartition> assigned = consumer.assignment();
        List<TopicPartition> resumable = deferred.stream().filter(assigned::contains).toList();
        consumer.resume(resumable);
        deferred.clear();
    }

    @Override
    public void close() {
        consumer.close();
    }
}
