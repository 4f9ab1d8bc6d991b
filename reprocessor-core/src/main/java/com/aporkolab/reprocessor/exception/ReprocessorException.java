package com.aporkolab.reprocessor.exception;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Base class for all reprocessor exceptions.
 * 
 * Provides:
 * - Error code for operators and log filtering
 * - Structured context for debugging
 * - Timestamp for correlation
 */
public abstract class ReprocessorException extends RuntimeException {

    private final String code;
    private final Map<String, Object> context;
    private final Instant timestamp;

    protected ReprocessorException(String code, String message) {
        super(message);
        this.code = code;
        this.context = new HashMap<>();
        this.timestamp = Instant.now();
    }

    protected ReprocessorException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = new HashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add contextual information for debugging.
     * Fluent API for chaining.
     */
    public ReprocessorException with(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Map.copyOf(context);
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
