package com.aporkolab.reprocessor.routing;

/**
 * Value of the X-Failure-Reason header.
 */
public enum FailureReason {

    /** Transient failure, sent to the retry topic */
    RETRYABLE_ERROR,

    /** Permanent or unclassified failure, sent to the DLQ */
    NON_RETRYABLE_ERROR,

    /** Transient failure that used up its attempts, sent to the DLQ */
    MAX_RETRIES_EXCEEDED
}
