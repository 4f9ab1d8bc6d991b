package com.aporkolab.reprocessor.flow;

import org.apache.kafka.clients.consumer.ConsumerRecord;

import com.aporkolab.reprocessor.classification.ErrorClassification;
import com.aporkolab.reprocessor.classification.ErrorClassifier;
import com.aporkolab.reprocessor.classification.FailureDetails;
import com.aporkolab.reprocessor.headers.MessageMetadata;
import com.aporkolab.reprocessor.headers.MessageMetadataManager;
import com.aporkolab.reprocessor.logging.ReprocessingContext;
import com.aporkolab.reprocessor.routing.RetryRouter;
import com.aporkolab.reprocessor.routing.RoutingDecision;

/**
 * classify, stamp, route. Shared by the main flow and the batch reprocessor.
 * 
 * The previous retry count is always read from the record's own headers, so
 * handling a redelivered record again yields the same decision.
 */
public class FailurePipeline {

    private final ErrorClassifier classifier;
    private final MessageMetadataManager metadataManager;
    private final RetryRouter router;

    public FailurePipeline(ErrorClassifier classifier, MessageMetadataManager metadataManager, RetryRouter router) {
        this.classifier = classifier;
        this.metadataManager = metadataManager;
        this.router = router;
    }

    /**
     * @param context logging scope of the record; its retry count is moved to the stamped value before routing
     * @throws com.aporkolab.reprocessor.exception.BrokerException if the routed record could not be published
     */
    public RoutingDecision handle(ConsumerRecord<String, String> record, Throwable failure,
                                  ReprocessingContext context) {
        FailureDetails details = FailureDetails.from(failure);
        ErrorClassification classification = classifier.classify(details);
        int previousRetryCount = metadataManager.retryCountOf(record.headers());
        MessageMetadata metadata = metadataManager.stamp(details, previousRetryCount);
        context.withRetryCount(metadata.retryCount());
        return router.route(record, classification, metadata);
    }
}
