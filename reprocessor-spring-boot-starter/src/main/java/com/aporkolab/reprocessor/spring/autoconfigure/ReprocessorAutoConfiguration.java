package com.aporkolab.reprocessor.spring.autoconfigure;

import java.util.Properties;

import io.micrometer.core.instrument.MeterRegistry;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

import com.aporkolab.reprocessor.classification.ErrorClassifier;
import com.aporkolab.reprocessor.config.ReprocessorSettings;
import com.aporkolab.reprocessor.flow.FailurePipeline;
import com.aporkolab.reprocessor.flow.MainConsumptionFlow;
import com.aporkolab.reprocessor.flow.MessageProcessor;
import com.aporkolab.reprocessor.headers.MessageMetadataManager;
import com.aporkolab.reprocessor.reprocess.BatchReprocessor;
import com.aporkolab.reprocessor.reprocess.KafkaRetryTopicReader;
import com.aporkolab.reprocessor.reprocess.RetryTopicReader;
import com.aporkolab.reprocessor.routing.RetryRouter;
import com.aporkolab.reprocessor.routing.RoutingListener;
import com.aporkolab.reprocessor.spring.metrics.RoutingMetrics;
import com.aporkolab.reprocessor.spring.scheduling.ReprocessorScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Spring Boot Auto-Configuration for the Kafka reprocessor.
 * 
 * Automatically configures:
 * - Error classifier, header stamping and retry/DLQ routing
 * - Main consumption flow (needs a {@link MessageProcessor} bean)
 * - Retry-topic reader, batch reprocessor and its scheduler
 * - Listener error handler that redelivers records whose routing publish failed
 * - Routing metrics when a MeterRegistry is available
 * 
 * The scheduler can be switched off with reprocessor.scheduler.enabled=false.
 */
@AutoConfiguration(after = KafkaAutoConfiguration.class)
@EnableConfigurationProperties(ReprocessorProperties.class)
public class ReprocessorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ReprocessorSettings reprocessorSettings(ReprocessorProperties properties) {
        return properties.toSettings();
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier(ReprocessorSettings settings) {
        return new ErrorClassifier(settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageMetadataManager messageMetadataManager(ObjectProvider<ObjectMapper> objectMapper) {
        return new MessageMetadataManager(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public RoutingListener routingListener(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        return registry != null ? new RoutingMetrics(registry) : RoutingListener.NOOP;
    }

    // ==================== ROUTING & FLOW ====================

    @Configuration
    @ConditionalOnBean(KafkaTemplate.class)
    static class RoutingAutoConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RetryRouter retryRouter(KafkaTemplate<String, String> kafkaTemplate, ReprocessorSettings settings,
                                       RoutingListener routingListener) {
            return new RetryRouter(kafkaTemplate, settings, routingListener);
        }

        @Bean
        @ConditionalOnMissingBean
        public FailurePipeline failurePipeline(ErrorClassifier classifier, MessageMetadataManager metadataManager,
                                               RetryRouter retryRouter) {
            return new FailurePipeline(classifier, metadataManager, retryRouter);
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(MessageProcessor.class)
        public MainConsumptionFlow mainConsumptionFlow(MessageProcessor processor, FailurePipeline failurePipeline) {
            return new MainConsumptionFlow(processor, failurePipeline);
        }

        @Bean
        @ConditionalOnMissingBean(CommonErrorHandler.class)
        public DefaultErrorHandler reprocessorErrorHandler(ReprocessorProperties properties) {
            long intervalMs = properties.getMainFlow().getRedeliveryInterval().toMillis();
            return new DefaultErrorHandler(new FixedBackOff(intervalMs, FixedBackOff.UNLIMITED_ATTEMPTS));
        }
    }

    // ==================== RETRY TOPIC REPROCESSING ====================

    @Configuration
    @ConditionalOnBean({ConsumerFactory.class, KafkaTemplate.class, MessageProcessor.class})
    static class ReprocessingAutoConfiguration {

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean
        public RetryTopicReader retryTopicReader(ConsumerFactory<String, String> consumerFactory,
                                                 ReprocessorProperties properties, ReprocessorSettings settings) {
            Properties overrides = new Properties();
            overrides.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "1");
            overrides.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
            overrides.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
            Consumer<String, String> consumer = consumerFactory.createConsumer(
                    properties.getRetryConsumerGroup(), null, "-retry", overrides);
            return new KafkaRetryTopicReader(consumer, settings.getRetryTopic());
        }

        @Bean
        @ConditionalOnMissingBean
        public BatchReprocessor batchReprocessor(RetryTopicReader retryTopicReader, MainConsumptionFlow flow,
                                                 ReprocessorSettings settings) {
            return new BatchReprocessor(retryTopicReader, flow, settings);
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(prefix = "reprocessor.scheduler", name = "enabled", havingValue = "true",
                matchIfMissing = true)
        public ReprocessorScheduler reprocessorScheduler(BatchReprocessor batchReprocessor,
                                                         ReprocessorSettings settings) {
            return new ReprocessorScheduler(batchReprocessor, settings.getSchedulerFrequency());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "reprocessor.scheduler", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    static class SchedulingConfiguration {
    }
}
