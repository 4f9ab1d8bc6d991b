package com.aporkolab.reprocessor.flow;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.reprocessor.exception.BrokerException;
import com.aporkolab.reprocessor.logging.ReprocessingContext;
import com.aporkolab.reprocessor.routing.RoutingDecision;

/**
 * Handles one consumed record: process it, and on failure route it.
 * 
 * RECEIVED -> PROCESSING -> SUCCESS
 *                        -> FAILED -> ROUTED (once the retry/DLQ publish is acknowledged)
 * 
 * The caller commits the source offset only after this method returns. A
 * {@link BrokerException} from routing escapes, leaving the offset uncommitted
 * so the broker redelivers the record and the flow restarts at RECEIVED.
 */
public class MainConsumptionFlow {

    private static final Logger log = LoggerFactory.getLogger(MainConsumptionFlow.class);

    public static final String MAIN_FLOW = "main";

    public enum State {
        RECEIVED,
        PROCESSING,
        SUCCESS,
        FAILED,
        ROUTED
    }

    private final MessageProcessor processor;
    private final FailurePipeline failurePipeline;

    public MainConsumptionFlow(MessageProcessor processor, FailurePipeline failurePipeline) {
        this.processor = processor;
        this.failurePipeline = failurePipeline;
    }

    /**
     * Entry point for records from the primary topic.
     */
    public ProcessingOutcome handle(ConsumerRecord<String, String> record) {
        return handle(record, MAIN_FLOW);
    }

    /**
     * @param flow label put in the MDC, distinguishes first attempts from reprocessing
     */
    public ProcessingOutcome handle(ConsumerRecord<String, String> record, String flow) {
        try (ReprocessingContext ctx = ReprocessingContext.open(record, flow)) {
            log.debug("{} {}-{}@{}", State.RECEIVED, record.topic(), record.partition(), record.offset());

            Exception failure = invoke(record);
            if (failure == null) {
                log.debug("{} key={}", State.SUCCESS, record.key());
                return ProcessingOutcome.success();
            }

            log.debug("{} key={}: {}", State.FAILED, record.key(), failure.toString());
            RoutingDecision decision = failurePipeline.handle(record, failure, ctx);
            return ProcessingOutcome.routed(decision);
        }
    }

    private Exception invoke(ConsumerRecord<String, String> record) {
        log.debug("{} key={}", State.PROCESSING, record.key());
        try {
            processor.process(record.key(), record.value());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        } catch (Exception e) {
            return e;
        }
    }
}
