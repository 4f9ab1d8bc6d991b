package com.aporkolab.reprocessor.logging;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.record.TimestampType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import com.aporkolab.reprocessor.headers.RetryHeaders;

class ReprocessingContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("should continue the correlation ID carried by the record")
    void continuesCorrelationId() {
        ConsumerRecord<String, String> record = record("order-1");
        RetryHeaders.put(record.headers(), RetryHeaders.CORRELATION_ID, "abc123");
        RetryHeaders.put(record.headers(), RetryHeaders.RETRY_COUNT, "2");

        try (ReprocessingContext ignored = ReprocessingContext.open(record, "reprocess")) {
            assertThat(ReprocessingContext.getCurrentCorrelationId()).isEqualTo("abc123");
            assertThat(MDC.get(ReprocessingContext.MESSAGE_KEY)).isEqualTo("order-1");
            assertThat(MDC.get(ReprocessingContext.FLOW_KEY)).isEqualTo("reprocess");
            assertThat(MDC.get(ReprocessingContext.RETRY_COUNT_KEY)).isEqualTo("2");
        }
    }

    @Test
    @DisplayName("should generate a correlation ID when the record has none")
    void generatesCorrelationId() {
        try (ReprocessingContext ignored = ReprocessingContext.open(record(null), "main")) {
            assertThat(ReprocessingContext.getCurrentCorrelationId()).hasSize(16);
            assertThat(MDC.get(ReprocessingContext.MESSAGE_KEY)).isNull();
        }
    }

    @Test
    @DisplayName("close should restore the enclosing MDC")
    void restoresPreviousContext() {
        MDC.put("requestId", "outer");
        MDC.put(ReprocessingContext.CORRELATION_ID_KEY, "outer-correlation");

        try (ReprocessingContext ctx = ReprocessingContext.open(record("k"), "main")) {
            ctx.withRetryCount(3);
            assertThat(MDC.get(ReprocessingContext.RETRY_COUNT_KEY)).isEqualTo("3");
        }

        assertThat(MDC.get("requestId")).isEqualTo("outer");
        assertThat(MDC.get(ReprocessingContext.CORRELATION_ID_KEY)).isEqualTo("outer-correlation");
        assertThat(MDC.get(ReprocessingContext.RETRY_COUNT_KEY)).isNull();
    }

    @Test
    @DisplayName("close without enclosing MDC should leave it empty")
    void clearsWhenNoPreviousContext() {
        try (ReprocessingContext ignored = ReprocessingContext.open(record("k"), "main")) {
            assertThat(ReprocessingContext.getCurrentCorrelationId()).isNotNull();
        }

        assertThat(ReprocessingContext.getCurrentCorrelationId()).isNull();
    }

    private static ConsumerRecord<String, String> record(String key) {
        return new ConsumerRecord<>("orders", 0, 0L, 0L, TimestampType.CREATE_TIME,
                -1, -1, key, "{}", new RecordHeaders(), Optional.empty());
    }
}
