package com.aporkolab.reprocessor.spring.scheduling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.SimpleTriggerContext;

class SkippingFixedRateTriggerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final SkippingFixedRateTrigger trigger = new SkippingFixedRateTrigger(Duration.ofSeconds(30));

    @Test
    @DisplayName("first tick should fire one period after scheduling")
    void firstTickAfterOnePeriod() {
        SimpleTriggerContext context = new SimpleTriggerContext(Clock.fixed(T0, ZoneOffset.UTC));

        assertThat(trigger.nextExecution(context)).isEqualTo(T0.plusSeconds(30));
    }

    @Test
    @DisplayName("tick finishing in time should keep the fixed rate")
    void keepsFixedRate() {
        SimpleTriggerContext context = new SimpleTriggerContext(T0, T0, T0.plusSeconds(5));

        assertThat(trigger.nextExecution(context)).isEqualTo(T0.plusSeconds(30));
    }

    @Test
    @DisplayName("overrunning tick should drop the missed slots instead of catching up")
    void dropsMissedSlots() {
        SimpleTriggerContext context = new SimpleTriggerContext(T0, T0, T0.plusSeconds(75));

        assertThat(trigger.nextExecution(context)).isEqualTo(T0.plusSeconds(90));
    }

    @Test
    @DisplayName("tick completing exactly on the next slot should skip that slot")
    void completionOnSlotBoundary() {
        SimpleTriggerContext context = new SimpleTriggerContext(T0, T0, T0.plusSeconds(30));

        assertThat(trigger.nextExecution(context)).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    @DisplayName("should reject a non-positive period")
    void rejectsNonPositivePeriod() {
        assertThatThrownBy(() -> new SkippingFixedRateTrigger(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
