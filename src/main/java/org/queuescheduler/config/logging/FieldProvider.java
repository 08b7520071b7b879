package org.queuescheduler.config.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;

/**
 * Computes one field of a JSON log record when the record is written.
 */
@FunctionalInterface
public interface FieldProvider {
    Object valueFor(ILoggingEvent event);

    static FieldProvider constant(Object value) {
        return event -> value;
    }
}
