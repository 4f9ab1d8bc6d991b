package com.aporkolab.reprocessor.exception;

import java.util.Objects;

/**
 * Typed failure raised by a {@link com.aporkolab.reprocessor.flow.MessageProcessor}.
 * 
 * The error type and namespace drive classification; the description and
 * payload end up, truncated, in the X-Original-Error header.
 */
public class ProcessingFailureException extends ReprocessorException {

    private final String errorType;
    private final String errorNamespace;
    private final String description;
    private final transient Object payload;

    public ProcessingFailureException(String errorNamespace, String errorType, String description) {
        this(errorNamespace, errorType, description, null, null);
    }

    public ProcessingFailureException(String errorNamespace, String errorType, String description, Object payload) {
        this(errorNamespace, errorType, description, payload, null);
    }

    public ProcessingFailureException(String errorNamespace, String errorType, String description,
                                      Object payload, Throwable cause) {
        super(errorType, String.format("%s:%s - %s", errorNamespace, errorType, description), cause);
        this.errorNamespace = requireText(errorNamespace, "errorNamespace");
        this.errorType = requireText(errorType, "errorType");
        this.description = Objects.requireNonNullElse(description, "");
        this.payload = payload;
        with("errorNamespace", errorNamespace);
        with("errorType", errorType);
    }

    public static ProcessingFailureException http(String errorType, String description, Object payload) {
        return new ProcessingFailureException("HTTP", errorType, description, payload);
    }

    public static ProcessingFailureException kafka(String errorType, String description, Object payload) {
        return new ProcessingFailureException("KAFKA", errorType, description, payload);
    }

    public String getErrorType() {
        return errorType;
    }

    public String getErrorNamespace() {
        return errorNamespace;
    }

    public String getDescription() {
        return description;
    }

    public Object getPayload() {
        return payload;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }
}
