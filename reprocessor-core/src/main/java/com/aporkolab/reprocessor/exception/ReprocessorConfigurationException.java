package com.aporkolab.reprocessor.exception;

/**
 * Invalid reprocessor configuration. Fatal at startup.
 */
public class ReprocessorConfigurationException extends ReprocessorException {

    public ReprocessorConfigurationException(String property, String message) {
        super("INVALID_CONFIGURATION", String.format("Invalid value for '%s': %s", property, message));
        with("property", property);
    }
}
