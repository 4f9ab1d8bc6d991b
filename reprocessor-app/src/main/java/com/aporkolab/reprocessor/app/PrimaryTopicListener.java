package com.aporkolab.reprocessor.app;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import com.aporkolab.reprocessor.flow.MainConsumptionFlow;
import com.aporkolab.reprocessor.flow.ProcessingOutcome;

/**
 * Feeds the primary topic into the main consumption flow.
 * 
 * The container commits the offset once this method returns (ack-mode RECORD).
 * A broker failure while routing propagates, so the error handler seeks back
 * and the record is delivered again.
 */
@Component
public class PrimaryTopicListener {

    private static final Logger log = LoggerFactory.getLogger(PrimaryTopicListener.class);

    private final MainConsumptionFlow flow;

    public PrimaryTopicListener(MainConsumptionFlow flow) {
        this.flow = flow;
    }

    @KafkaListener(topics = "${reprocessor.topics.primary}", groupId = "${spring.kafka.consumer.group-id}")
    public void onMessage(ConsumerRecord<String, String> record) {
        ProcessingOutcome outcome = flow.handle(record);
        if (outcome.isSuccess()) {
            log.debug("Processed key={} from {}", record.key(), record.topic());
        }
    }
}
