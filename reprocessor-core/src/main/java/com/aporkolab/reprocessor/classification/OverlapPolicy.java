package com.aporkolab.reprocessor.classification;

/**
 * Tie-break when an error key is registered as both retryable and non-retryable.
 */
public enum OverlapPolicy {

    /** Permanent failure wins; the message goes to the DLQ */
    NON_RETRYABLE_WINS,

    /** Transient failure wins; the message is retried */
    RETRYABLE_WINS
}
