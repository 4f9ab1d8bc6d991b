package com.aporkolab.reprocessor.routing;

/**
 * Where a failed message is re-published.
 */
public enum Destination {
    RETRY_TOPIC,
    DLQ_TOPIC
}
