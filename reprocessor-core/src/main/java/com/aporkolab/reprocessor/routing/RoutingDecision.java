package com.aporkolab.reprocessor.routing;

import com.aporkolab.reprocessor.classification.ErrorClassification;

/**
 * Destination and reason picked for one failed message.
 */
public record RoutingDecision(Destination destination, FailureReason failureReason) {

    /**
     * Evaluated in order:
     * <ol>
     *   <li>NON_RETRYABLE or UNKNOWN: DLQ, NON_RETRYABLE_ERROR</li>
     *   <li>RETRYABLE below the limit: retry topic, RETRYABLE_ERROR</li>
     *   <li>RETRYABLE at or over the limit: DLQ, MAX_RETRIES_EXCEEDED</li>
     * </ol>
     *
     * @param retryCount the count the message will carry after this failure
     */
    public static RoutingDecision decide(ErrorClassification classification, int retryCount, int maxAttempts) {
        if (classification != ErrorClassification.RETRYABLE) {
            return new RoutingDecision(Destination.DLQ_TOPIC, FailureReason.NON_RETRYABLE_ERROR);
        }
        if (retryCount < maxAttempts) {
            return new RoutingDecision(Destination.RETRY_TOPIC, FailureReason.RETRYABLE_ERROR);
        }
        return new RoutingDecision(Destination.DLQ_TOPIC, FailureReason.MAX_RETRIES_EXCEEDED);
    }

    public boolean isDeadLetter() {
        return destination == Destination.DLQ_TOPIC;
    }
}
