package com.aporkolab.reprocessor.classification;

import java.util.Objects;

import com.aporkolab.reprocessor.exception.ProcessingFailureException;

/**
 * What went wrong while processing a message, in the shape the classifier and
 * the header stamping need.
 */
public record FailureDetails(String errorType, String errorNamespace, String description, Object payload) {

    /** Namespace given to failures that did not come as a {@link ProcessingFailureException}. */
    public static final String UNCLASSIFIED_NAMESPACE = "UNCLASSIFIED";

    public FailureDetails {
        Objects.requireNonNull(errorType, "errorType must not be null");
        Objects.requireNonNull(errorNamespace, "errorNamespace must not be null");
        description = Objects.requireNonNullElse(description, "");
    }

    /**
     * Describes any failure raised by a processing operation. Typed failures keep
     * their own type and namespace; anything else is named after its exception class.
     */
    public static FailureDetails from(Throwable failure) {
        if (failure instanceof ProcessingFailureException typed) {
            return new FailureDetails(typed.getErrorType(), typed.getErrorNamespace(),
                    typed.getDescription(), typed.getPayload());
        }
        String message = failure.getMessage() != null ? failure.getMessage() : failure.toString();
        return new FailureDetails(failure.getClass().getSimpleName(), UNCLASSIFIED_NAMESPACE, message, null);
    }

    /** The {@code namespace:type} composite key. */
    public String fullErrorType() {
        return errorNamespace + ":" + errorType;
    }
}
