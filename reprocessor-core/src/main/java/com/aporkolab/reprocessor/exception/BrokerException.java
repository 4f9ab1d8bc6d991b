package com.aporkolab.reprocessor.exception;

/**
 * Broker I/O failure while publishing, polling or committing.
 * 
 * Never retried by the engine. Whoever catches it must leave the source
 * offset uncommitted so the broker redelivers the original record.
 */
public class BrokerException extends ReprocessorException {

    public static final String PUBLISH_FAILED = "BROKER_PUBLISH_FAILED";
    public static final String POLL_FAILED = "BROKER_POLL_FAILED";
    public static final String COMMIT_FAILED = "BROKER_COMMIT_FAILED";

    private BrokerException(String code, String topic, String operation, Throwable cause) {
        super(
            code,
            String.format("Broker %s on topic '%s' failed: %s", operation, topic, describe(cause)),
            cause
        );
        with("topic", topic);
        with("operation", operation);
    }

    public static BrokerException publish(String topic, Throwable cause) {
        return new BrokerException(PUBLISH_FAILED, topic, "publish", cause);
    }

    public static BrokerException poll(String topic, Throwable cause) {
        return new BrokerException(POLL_FAILED, topic, "poll", cause);
    }

    public static BrokerException commit(String topic, Throwable cause) {
        return new BrokerException(COMMIT_FAILED, topic, "commit", cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
