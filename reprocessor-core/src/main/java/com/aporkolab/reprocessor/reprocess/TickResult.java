package com.aporkolab.reprocessor.reprocess;

/**
 * Summary of one scheduler tick.
 *
 * @param polled       records returned by the retry topic
 * @param skipped      records left for the next tick because they were produced after the tick began
 * @param succeeded    records that processed successfully
 * @param retried      records re-routed to the retry topic
 * @param deadLettered records routed to the DLQ
 * @param topicEmpty   the tick ended early because a poll came back empty
 * @param tickSkipped  the tick did not run because another one was still active
 */
public record TickResult(
        long executionTimestamp,
        int polled,
        int skipped,
        int succeeded,
        int retried,
        int deadLettered,
        boolean topicEmpty,
        boolean tickSkipped) {

    public static TickResult notRun() {
        return new TickResult(-1L, 0, 0, 0, 0, 0, false, true);
    }

    public int reprocessed() {
        return succeeded + retried + deadLettered;
    }
}
