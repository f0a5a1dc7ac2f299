package org.hpcbench.obs;

import java.util.Collections;
import java.util.Map;

/**
 * Structured logger that writes one JSON object per line.
 */
public interface JsonLinesLogger extends AutoCloseable {
    JsonLinesLogger NOOP = new JsonLinesLogger() {
        @Override
        public void log(String level, String message, CorrelationContext correlationContext, Map<String, ?> fields) {
            // discard
        }

        @Override
        public void close() {
            // nothing to release
        }
    };

    void log(String level, String message, CorrelationContext correlationContext, Map<String, ?> fields);

    default void info(String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        log("INFO", message, correlationContext, fields);
    }

    default void info(String message, CorrelationContext correlationContext) {
        info(message, correlationContext, Collections.emptyMap());
    }

    default void warn(String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        log("WARN", message, correlationContext, fields);
    }

    default void warn(String message, CorrelationContext correlationContext) {
        warn(message, correlationContext, Collections.emptyMap());
    }

    default void error(String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        log("ERROR", message, correlationContext, fields);
    }

    default void error(String message, CorrelationContext correlationContext) {
        error(message, correlationContext, Collections.emptyMap());
    }

    @Override
    void close();
}
