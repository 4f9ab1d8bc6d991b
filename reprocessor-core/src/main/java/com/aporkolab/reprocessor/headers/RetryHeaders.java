package com.aporkolab.reprocessor.headers;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;

/**
 * Header names owned by the reprocessor, plus UTF-8 read/write helpers.
 */
public final class RetryHeaders {

    public static final String RETRY_COUNT = "X-Retry-Count";
    public static final String ORIGINAL_ERROR = "X-Original-Error";
    public static final String ERROR_TYPE = "X-Error-Type";
    public static final String ERROR_NAMESPACE = "X-Error-Namespace";
    public static final String FULL_ERROR_TYPE = "X-Full-Error-Type";
    public static final String FAILURE_REASON = "X-Failure-Reason";
    public static final String TIMESTAMP = "X-Timestamp";

    public static final String CORRELATION_ID = "X-Correlation-ID";

    /** Every header the engine writes; anything else on a record is passed through untouched. */
    public static final List<String> OWNED = List.of(
            RETRY_COUNT, ORIGINAL_ERROR, ERROR_TYPE, ERROR_NAMESPACE,
            FULL_ERROR_TYPE, FAILURE_REASON, TIMESTAMP);

    private RetryHeaders() {
    }

    public static Optional<String> lastValue(Headers headers, String name) {
        if (headers == null) {
            return Optional.empty();
        }
        Header header = headers.lastHeader(name);
        if (header == null || header.value() == null) {
            return Optional.empty();
        }
        return Optional.of(new String(header.value(), StandardCharsets.UTF_8));
    }

    /** Replaces any existing values of {@code name} with a single UTF-8 value. */
    public static void put(Headers headers, String name, String value) {
        headers.remove(name);
        headers.add(name, value.getBytes(StandardCharsets.UTF_8));
    }

    public static boolean isOwned(String name) {
        return OWNED.contains(name);
    }
}
