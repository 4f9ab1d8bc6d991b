package com.aporkolab.reprocessor.flow;

/**
 * The business operation applied to every consumed message.
 * 
 * Implemented by the consuming service. Returning normally means success.
 * Throwing a {@link com.aporkolab.reprocessor.exception.ProcessingFailureException}
 * reports a typed failure; any other exception is an unclassified failure.
 * The same implementation runs for first attempts and for every retry.
 */
@FunctionalInterface
public interface MessageProcessor {

    void process(String key, String payload) throws Exception;
}
