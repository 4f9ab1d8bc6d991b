package com.aporkolab.reprocessor.classification;

/**
 * Outcome of classifying a processing failure.
 */
public enum ErrorClassification {

    /** Likely transient; eligible for reprocessing up to the attempt limit */
    RETRYABLE,

    /** Permanent; goes straight to the DLQ */
    NON_RETRYABLE,

    /** Matched no configured rule; routed like NON_RETRYABLE */
    UNKNOWN
}
