package com.aporkolab.reprocessor.headers;

import java.time.Clock;
import java.util.regex.Pattern;

import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.reprocessor.classification.FailureDetails;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds the header set carried by a failed message.
 * 
 * Never publishes; the router attaches the result to the outgoing record.
 * Stateless apart from the clock, safe to share between the main flow and the scheduler.
 */
public class MessageMetadataManager {

    private static final Logger log = LoggerFactory.getLogger(MessageMetadataManager.class);

    public static final int MAX_ERROR_LENGTH = 300;

    private static final Pattern UNSIGNED_DIGITS = Pattern.compile("\\+?\\d+");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MessageMetadataManager(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    public MessageMetadataManager(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Stamp a failure on top of the retry count the message carried so far.
     *
     * @param previousRetryCount attempts recorded before this failure, 0 when absent
     * @return metadata whose count is one higher, saturating at {@link Integer#MAX_VALUE}
     */
    public MessageMetadata stamp(FailureDetails failure, int previousRetryCount) {
        int previous = Math.max(previousRetryCount, 0);
        int retryCount = previous == Integer.MAX_VALUE ? Integer.MAX_VALUE : previous + 1;
        return new MessageMetadata(
                retryCount,
                truncate(describe(failure), MAX_ERROR_LENGTH),
                failure.errorType(),
                failure.errorNamespace(),
                failure.fullErrorType(),
                clock.instant());
    }

    /**
     * Reads X-Retry-Count. Absent or malformed values count as 0; numbers too large
     * for an int count as {@link Integer#MAX_VALUE}.
     */
    public int retryCountOf(Headers headers) {
        return RetryHeaders.lastValue(headers, RetryHeaders.RETRY_COUNT)
                .map(MessageMetadataManager::parseRetryCount)
                .orElse(0);
    }

    /**
     * Cuts {@code value} to at most {@code maxLength} chars without splitting a surrogate pair.
     */
    public static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        if (value.length() <= maxLength) {
            return value;
        }
        int end = maxLength;
        if (Character.isHighSurrogate(value.charAt(end - 1)) && Character.isLowSurrogate(value.charAt(end))) {
            end--;
        }
        return value.substring(0, end);
    }

    private String describe(FailureDetails failure) {
        if (failure.payload() == null) {
            return failure.description();
        }
        return failure.description() + "\n" + serialize(failure.payload());
    }

    private String serialize(Object payload) {
        if (payload instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.debug("Failure payload of type {} is not JSON serializable, using toString()",
                    payload.getClass().getName());
            return String.valueOf(payload);
        }
    }

    private static int parseRetryCount(String raw) {
        String trimmed = raw.trim();
        try {
            int value = Integer.parseInt(trimmed);
            if (value >= 0) {
                return value;
            }
        } catch (NumberFormatException e) {
            if (UNSIGNED_DIGITS.matcher(trimmed).matches()) {
                log.warn("{} header '{}' exceeds the counter range, treating as {}",
                        RetryHeaders.RETRY_COUNT, raw, Integer.MAX_VALUE);
                return Integer.MAX_VALUE;
            }
            log.warn("Malformed {} header '{}', treating as 0", RetryHeaders.RETRY_COUNT, raw);
            return 0;
        }
        log.warn("Negative {} header '{}', treating as 0", RetryHeaders.RETRY_COUNT, raw);
        return 0;
    }
}
