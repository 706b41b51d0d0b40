package com.influxlog.collection.core.writer;

import org.slf4j.Logger;

/**
 * Error channel of the host logging framework. Writers report dropped records and batches here
 * instead of throwing into application code.
 */
@FunctionalInterface
public interface ErrorReporter {

    void report(String message, Throwable error);

    /** Reports through an SLF4J logger at WARN, for hosts without a dedicated error channel. */
    static ErrorReporter logging(Logger log) {
        return (message, error) -> log.warn(message, error);
    }
}
