package com.aporkolab.reprocessor.classification;

import java.util.Set;

import com.aporkolab.reprocessor.config.ReprocessorSettings;

/**
 * Maps a failure onto {@link ErrorClassification} using the configured error sets.
 * 
 * Rules may be registered at two granularities: a bare type ({@code SERVICE_UNAVAILABLE})
 * or a composite ({@code HTTP:SERVICE_UNAVAILABLE}). Both keys are checked against both sets.
 * When a failure matches both sets the {@link OverlapPolicy} decides.
 * 
 * Stateless and thread-safe.
 */
public class ErrorClassifier {

    private final Set<String> retryableErrors;
    private final Set<String> nonRetryableErrors;
    private final OverlapPolicy overlapPolicy;

    public ErrorClassifier(ReprocessorSettings settings) {
        this(settings.getRetryableErrors(), settings.getNonRetryableErrors(), settings.getOverlapPolicy());
    }

    public ErrorClassifier(Set<String> retryableErrors, Set<String> nonRetryableErrors, OverlapPolicy overlapPolicy) {
        this.retryableErrors = Set.copyOf(retryableErrors);
        this.nonRetryableErrors = Set.copyOf(nonRetryableErrors);
        this.overlapPolicy = overlapPolicy;
    }

    public ErrorClassification classify(FailureDetails failure) {
        return classify(failure.errorType(), failure.errorNamespace(), failure.fullErrorType());
    }

    public ErrorClassification classify(String errorType, String errorNamespace, String fullErrorType) {
        boolean nonRetryable = matches(nonRetryableErrors, errorType, fullErrorType);
        boolean retryable = matches(retryableErrors, errorType, fullErrorType);

        if (nonRetryable && retryable) {
            return overlapPolicy == OverlapPolicy.RETRYABLE_WINS
                    ? ErrorClassification.RETRYABLE
                    : ErrorClassification.NON_RETRYABLE;
        }
        if (nonRetryable) {
            return ErrorClassification.NON_RETRYABLE;
        }
        if (retryable) {
            return ErrorClassification.RETRYABLE;
        }
        return ErrorClassification.UNKNOWN;
    }

    private static boolean matches(Set<String> rules, String errorType, String fullErrorType) {
        return (fullErrorType != null && rules.contains(fullErrorType))
                || (errorType != null && rules.contains(errorType));
    }
}
