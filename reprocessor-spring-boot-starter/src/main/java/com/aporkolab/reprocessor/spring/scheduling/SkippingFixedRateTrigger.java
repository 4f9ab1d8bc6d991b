package com.aporkolab.reprocessor.spring.scheduling;

import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

/**
 * Fixed-rate trigger that drops the slots missed while the previous execution was still running.
 * 
 * Spring's plain fixed-rate scheduling fires a late execution as soon as the previous one
 * completes. Here the next execution is the first slot of the original grid that lies after
 * the last completion, so an overrunning tick never produces a catch-up tick.
 */
public class SkippingFixedRateTrigger implements Trigger {

    private static final Logger log = LoggerFactory.getLogger(SkippingFixedRateTrigger.class);

    private final Duration period;

    public SkippingFixedRateTrigger(Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive but was " + period);
        }
        this.period = period;
    }

    @Override
    public Instant nextExecution(TriggerContext triggerContext) {
        Instant lastScheduled = triggerContext.lastScheduledExecution();
        if (lastScheduled == null) {
            return triggerContext.getClock().instant().plus(period);
        }

        Instant next = lastScheduled.plus(period);
        Instant lastCompletion = triggerContext.lastCompletion();
        if (lastCompletion != null && !next.isAfter(lastCompletion)) {
            long missed = Duration.between(next, lastCompletion).toNanos() / period.toNanos() + 1;
            log.debug("Previous reprocessing tick overran by {} slot(s), skipping them", missed);
            next = next.plus(period.multipliedBy(missed));
        }
        return next;
    }

    public Duration getPeriod() {
        return period;
    }
}
