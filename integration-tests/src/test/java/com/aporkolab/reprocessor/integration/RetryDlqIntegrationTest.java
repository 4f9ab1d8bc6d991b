package com.aporkolab.reprocessor.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.aporkolab.reprocessor.classification.ErrorClassifier;
import com.aporkolab.reprocessor.config.ReprocessorSettings;
import com.aporkolab.reprocessor.exception.ProcessingFailureException;
import com.aporkolab.reprocessor.flow.FailurePipeline;
import com.aporkolab.reprocessor.flow.MainConsumptionFlow;
import com.aporkolab.reprocessor.flow.MessageProcessor;
import com.aporkolab.reprocessor.headers.MessageMetadataManager;
import com.aporkolab.reprocessor.headers.RetryHeaders;
import com.aporkolab.reprocessor.reprocess.BatchReprocessor;
import com.aporkolab.reprocessor.reprocess.KafkaRetryTopicReader;
import com.aporkolab.reprocessor.routing.RetryRouter;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Retry and DLQ routing against a real broker.
 *
 * Covers the complete path:
 * 1. Message fails on the primary topic and is routed by error classification
 * 2. Batch reprocessor drains the retry topic tick by tick
 * 3. DLQ receives the message with its full failure metadata
 */
@Testcontainers(disabledWithoutDocker = true)
class RetryDlqIntegrationTest {

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.4.0"));

    private static final String PRIMARY_TOPIC = "orders";
    private static final String RETRY_TOPIC = "orders.retry";
    private static final String DLQ_TOPIC = "orders.dlq";

    /** Keys whose processing keeps failing until the key is removed. */
    private static final Map<String, String> FAILING = new ConcurrentHashMap<>();
    private static final AtomicInteger PROCESSED = new AtomicInteger();
    /** Keys the main flow routed instead of processing. */
    private static final Set<String> ROUTED = ConcurrentHashMap.newKeySet();

    private static KafkaTemplate<String, String> kafkaTemplate;
    private static KafkaConsumer<String, String> primaryConsumer;
    private static KafkaConsumer<String, String> dlqConsumer;
    private static KafkaRetryTopicReader retryReader;
    private static MainConsumptionFlow flow;
    private static BatchReprocessor reprocessor;

    private static final List<ConsumerRecord<String, String>> dlqRecords = new CopyOnWriteArrayList<>();

    @BeforeAll
    static void setupInfrastructure() throws Exception {
        Properties adminProps = new Properties();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        try (AdminClient admin = AdminClient.create(adminProps)) {
            admin.createTopics(List.of(
                    new NewTopic(PRIMARY_TOPIC, 1, (short) 1),
                    new NewTopic(RETRY_TOPIC, 1, (short) 1),
                    new NewTopic(DLQ_TOPIC, 1, (short) 1)
            )).all().get();
        }

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        kafkaTemplate = new KafkaTemplate<>(new DefaultKafkaProducerFactory<>(producerProps));

        ReprocessorSettings settings = ReprocessorSettings.builder()
                .maxAttempts(3)
                .retryableError("SERVICE_UNAVAILABLE")
                .nonRetryableError("VALIDATION")
                .batchSize(10)
                .pollTimeout(Duration.ofMillis(500))
                .primaryTopic(PRIMARY_TOPIC)
                .retryTopic(RETRY_TOPIC)
                .dlqTopic(DLQ_TOPIC)
                .build();

        MessageProcessor processor = (key, payload) -> {
            String type = FAILING.get(key);
            if (type != null) {
                throw new ProcessingFailureException("HTTP", type, "Simulated " + type);
            }
            PROCESSED.incrementAndGet();
        };
        flow = new MainConsumptionFlow(processor, new FailurePipeline(new ErrorClassifier(settings),
                new MessageMetadataManager(new ObjectMapper()), new RetryRouter(kafkaTemplate, settings)));

        Properties retryProps = consumerProps("retry-group");
        retryProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 1);
        retryReader = new KafkaRetryTopicReader(new KafkaConsumer<>(retryProps), RETRY_TOPIC);
        reprocessor = new BatchReprocessor(retryReader, flow, settings);

        primaryConsumer = new KafkaConsumer<>(consumerProps("primary-group"));
        primaryConsumer.subscribe(List.of(PRIMARY_TOPIC));
        dlqConsumer = new KafkaConsumer<>(consumerProps("dlq-group"));
        dlqConsumer.subscribe(List.of(DLQ_TOPIC));
    }

    private static Properties consumerProps(String groupId) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId + "-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        return props;
    }

    @AfterAll
    static void cleanup() {
        if (primaryConsumer != null) primaryConsumer.close();
        if (dlqConsumer != null) dlqConsumer.close();
        if (retryReader != null) retryReader.close();
    }

    @Test
    @DisplayName("non-retryable failure should go straight to the DLQ")
    void nonRetryableGoesToDlq() throws Exception {
        String key = uniqueKey("invalid");
        FAILING.put(key, "VALIDATION");

        kafkaTemplate.send(PRIMARY_TOPIC, key, "{\"orderId\":\"" + key + "\"}").get();

        await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> {
            consumePrimary();
            assertThat(dlqRecord(key)).isPresent();
        });

        ConsumerRecord<String, String> dead = dlqRecord(key).orElseThrow();
        assertThat(dead.value()).isEqualTo("{\"orderId\":\"" + key + "\"}");
        assertThat(header(dead, RetryHeaders.RETRY_COUNT)).isEqualTo("1");
        assertThat(header(dead, RetryHeaders.FAILURE_REASON)).isEqualTo("NON_RETRYABLE_ERROR");
        assertThat(header(dead, RetryHeaders.FULL_ERROR_TYPE)).isEqualTo("HTTP:VALIDATION");
        assertThat(header(dead, RetryHeaders.ORIGINAL_ERROR)).isEqualTo("Simulated VALIDATION");
    }

    @Test
    @DisplayName("retryable failure should be retried until attempts run out, then dead-lettered")
    void retryableExhaustsIntoDlq() throws Exception {
        String key = uniqueKey("flaky");
        FAILING.put(key, "SERVICE_UNAVAILABLE");

        ProducerRecord<String, String> original =
                new ProducerRecord<>(PRIMARY_TOPIC, key, "{\"orderId\":\"" + key + "\"}");
        original.headers().add(RetryHeaders.CORRELATION_ID, "corr-1".getBytes(StandardCharsets.UTF_8));
        original.headers().add("X-Tenant", "acme".getBytes(StandardCharsets.UTF_8));
        kafkaTemplate.send(original).get();

        await().atMost(Duration.ofSeconds(60)).pollInterval(Duration.ofMillis(500)).untilAsserted(() -> {
            consumePrimary();
            reprocessor.runTick();
            assertThat(dlqRecord(key)).isPresent();
        });

        ConsumerRecord<String, String> dead = dlqRecord(key).orElseThrow();
        assertThat(header(dead, RetryHeaders.RETRY_COUNT)).isEqualTo("3");
        assertThat(header(dead, RetryHeaders.FAILURE_REASON)).isEqualTo("MAX_RETRIES_EXCEEDED");
        assertThat(header(dead, RetryHeaders.CORRELATION_ID)).isEqualTo("corr-1");
        assertThat(header(dead, "X-Tenant")).isEqualTo("acme");
    }

    @Test
    @DisplayName("message recovering during reprocessing should never reach the DLQ")
    void recoversDuringReprocessing() throws Exception {
        String key = uniqueKey("recovering");
        FAILING.put(key, "SERVICE_UNAVAILABLE");
        int processedBefore = PROCESSED.get();

        kafkaTemplate.send(PRIMARY_TOPIC, key, "{\"orderId\":\"" + key + "\"}").get();
        await().atMost(Duration.ofSeconds(30)).until(() -> {
            consumePrimary();
            return ROUTED.contains(key);
        });

        FAILING.remove(key);
        await().atMost(Duration.ofSeconds(30)).pollInterval(Duration.ofMillis(500)).until(() -> {
            reprocessor.runTick();
            return PROCESSED.get() > processedBefore;
        });

        pollDlq();
        assertThat(dlqRecord(key)).isEmpty();
    }

    /** Plays the role of the listener container: handle, then commit. */
    private void consumePrimary() {
        for (ConsumerRecord<String, String> record : primaryConsumer.poll(Duration.ofMillis(500))) {
            if (!flow.handle(record).isSuccess()) {
                ROUTED.add(record.key());
            }
            primaryConsumer.commitSync();
        }
    }

    private Optional<ConsumerRecord<String, String>> dlqRecord(String key) {
        pollDlq();
        return dlqRecords.stream().filter(r -> key.equals(r.key())).findFirst();
    }

    private void pollDlq() {
        dlqConsumer.poll(Duration.ofMillis(300)).forEach(dlqRecords::add);
    }

    private static String header(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }

    private static String uniqueKey(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
