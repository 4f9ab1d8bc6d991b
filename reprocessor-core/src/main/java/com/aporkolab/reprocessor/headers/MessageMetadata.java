package com.aporkolab.reprocessor.headers;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Header values stamped on a failed message before it is re-routed.
 * The failure reason is added by the router once the destination is known.
 */
public record MessageMetadata(
        int retryCount,
        String originalError,
        String errorType,
        String errorNamespace,
        String fullErrorType,
        Instant timestamp) {

    public Map<String, String> asHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(RetryHeaders.RETRY_COUNT, String.valueOf(retryCount));
        headers.put(RetryHeaders.ORIGINAL_ERROR, originalError);
        headers.put(RetryHeaders.ERROR_TYPE, errorType);
        headers.put(RetryHeaders.ERROR_NAMESPACE, errorNamespace);
        headers.put(RetryHeaders.FULL_ERROR_TYPE, fullErrorType);
        headers.put(RetryHeaders.TIMESTAMP, timestamp.toString());
        return headers;
    }
}
