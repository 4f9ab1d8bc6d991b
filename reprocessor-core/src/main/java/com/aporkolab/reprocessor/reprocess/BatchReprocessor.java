package com.aporkolab.reprocessor.reprocess;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.reprocessor.config.ReprocessorSettings;
import com.aporkolab.reprocessor.flow.MainConsumptionFlow;
import com.aporkolab.reprocessor.flow.ProcessingOutcome;
import com.aporkolab.reprocessor.routing.Destination;

/**
 * Drains the retry topic in bounded batches, one tick at a time.
 * 
 * Design decisions:
 * - The tick's start time is captured before the first poll. Records created at or after it
 *   were routed during this tick (by itself or by the main flow) and are left for the next one,
 *   so a failing message is never reprocessed twice in the same tick
 * - An empty poll ends the tick early instead of burning the remaining batch slots
 * - Each record goes through the same processing and failure pipeline as the main flow
 * - Offsets are committed per record, after success or after the routing publish is acknowledged
 * - At most one tick runs at a time; a concurrent call returns {@link TickResult#notRun()}
 */
public class BatchReprocessor {

    private static final Logger log = LoggerFactory.getLogger(BatchReprocessor.class);

    public static final String REPROCESS_FLOW = "reprocess";

    private final RetryTopicReader reader;
    private final MainConsumptionFlow flow;
    private final ReprocessorSettings settings;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public BatchReprocessor(RetryTopicReader reader, MainConsumptionFlow flow, ReprocessorSettings settings) {
        this(reader, flow, settings, Clock.systemUTC());
    }

    public BatchReprocessor(RetryTopicReader reader, MainConsumptionFlow flow, ReprocessorSettings settings,
                            Clock clock) {
        this.reader = reader;
        this.flow = flow;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Run one tick.
     *
     * @throws com.aporkolab.reprocessor.exception.BrokerException if polling, routing or committing fails;
     *         the record being handled stays uncommitted and is read again next tick
     */
    public TickResult runTick() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Previous reprocessing tick still active, skipping");
            return TickResult.notRun();
        }
        try {
            return drain();
        } finally {
            reader.endTick();
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private TickResult drain() {
        long executionTimestamp = clock.millis();
        int polled = 0;
        int skipped = 0;
        int succeeded = 0;
        int retried = 0;
        int deadLettered = 0;
        boolean topicEmpty = false;

        for (int slot = 0; slot < settings.getBatchSize(); slot++) {
            Optional<ConsumerRecord<String, String>> next = reader.poll(settings.getPollTimeout());
            if (next.isEmpty()) {
                topicEmpty = true;
                break;
            }

            ConsumerRecord<String, String> record = next.get();
            polled++;

            if (record.timestamp() >= executionTimestamp) {
                log.debug("Skipping key={} offset={}: created at {} after tick start {}",
                        record.key(), record.offset(), record.timestamp(), executionTimestamp);
                reader.defer(record);
                skipped++;
                continue;
            }

            ProcessingOutcome outcome;
            try {
                outcome = flow.handle(record, REPROCESS_FLOW);
            } catch (RuntimeException e) {
                reader.defer(record);
                throw e;
            }
            reader.acknowledge(record);

            if (outcome.isSuccess()) {
                succeeded++;
            } else if (outcome.decision().destination() == Destination.RETRY_TOPIC) {
                retried++;
            } else {
                deadLettered++;
            }
        }

        TickResult result = new TickResult(executionTimestamp, polled, skipped, succeeded, retried,
                deadLettered, topicEmpty, false);
        if (result.polled() > 0) {
            log.info("Reprocessing tick finished: polled={}, succeeded={}, retried={}, deadLettered={}, "
                            + "skipped={}, topicEmpty={}",
                    polled, succeeded, retried, deadLettered, skipped, topicEmpty);
        } else {
            log.debug("Reprocessing tick finished: retry topic {} empty", settings.getRetryTopic());
        }
        return result;
    }
}
