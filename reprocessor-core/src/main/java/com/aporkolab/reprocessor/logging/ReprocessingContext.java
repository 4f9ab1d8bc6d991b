package com.aporkolab.reprocessor.logging;

import java.util.Map;
import java.util.UUID;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;

import com.aporkolab.reprocessor.headers.RetryHeaders;

/**
 * MDC scope for handling a single record.
 * 
 * The correlation ID is taken from the X-Correlation-ID header, so log lines of the
 * original attempt, every retry and the final DLQ routing share one ID.
 * 
 * Usage:
 * <pre>
 * try (var ctx = ReprocessingContext.open(record, "reprocess")) {
 *     log.info("Reprocessing"); // Logs include correlationId, messageKey, flow
 * }
 * </pre>
 */
public class ReprocessingContext implements AutoCloseable {

    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String MESSAGE_KEY = "messageKey";
    public static final String FLOW_KEY = "flow";
    public static final String RETRY_COUNT_KEY = "retryCount";

    private final Map<String, String> previousContext;

    private ReprocessingContext(Map<String, String> previousContext) {
        this.previousContext = previousContext;
    }

    /**
     * Opens a context for {@code record}, continuing its correlation ID or creating one.
     */
    public static ReprocessingContext open(ConsumerRecord<?, ?> record, String flow) {
        Map<String, String> previous = MDC.getCopyOfContextMap();

        String correlationId = RetryHeaders.lastValue(record.headers(), RetryHeaders.CORRELATION_ID)
                .filter(id -> !id.isBlank())
                .orElseGet(ReprocessingContext::generateId);

        MDC.put(CORRELATION_ID_KEY, correlationId);
        MDC.put(FLOW_KEY, flow);
        if (record.key() != null) {
            MDC.put(MESSAGE_KEY, String.valueOf(record.key()));
        }
        RetryHeaders.lastValue(record.headers(), RetryHeaders.RETRY_COUNT)
                .ifPresent(count -> MDC.put(RETRY_COUNT_KEY, count));

        return new ReprocessingContext(previous);
    }

    public static String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    public ReprocessingContext withRetryCount(int retryCount) {
        MDC.put(RETRY_COUNT_KEY, String.valueOf(retryCount));
        return this;
    }

    @Override
    public void close() {
        if (previousContext != null) {
            MDC.setContextMap(previousContext);
        } else {
            MDC.clear();
        }
    }

    private static String generateId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
