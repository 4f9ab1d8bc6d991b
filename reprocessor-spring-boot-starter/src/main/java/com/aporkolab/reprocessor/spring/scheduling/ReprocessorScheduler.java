package com.aporkolab.reprocessor.spring.scheduling;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import com.aporkolab.reprocessor.exception.BrokerException;
import com.aporkolab.reprocessor.reprocess.BatchReprocessor;

/**
 * Registers the reprocessing tick with Spring's scheduler.
 * 
 * Ticks fire every {@code reprocessor.scheduler-frequency}. A firing that falls due while a
 * tick is still running is dropped, not queued. Needs {@code @EnableScheduling}.
 */
public class ReprocessorScheduler implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(ReprocessorScheduler.class);

    private final BatchReprocessor reprocessor;
    private final Duration frequency;

    public ReprocessorScheduler(BatchReprocessor reprocessor, Duration frequency) {
        this.reprocessor = reprocessor;
        this.frequency = frequency;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.addTriggerTask(this::tick, new SkippingFixedRateTrigger(frequency));
        log.info("Reprocessing tick scheduled, frequency={}", frequency);
    }

    /**
     * One scheduled tick. Failures are logged; the schedule keeps running.
     */
    public void tick() {
        try {
            reprocessor.runTick();
        } catch (BrokerException e) {
            log.warn("Reprocessing tick aborted, unacknowledged record will be read again next tick: {}",
                    e.getMessage());
        } catch (RuntimeException e) {
            log.error("Reprocessing tick failed", e);
        }
    }
}
