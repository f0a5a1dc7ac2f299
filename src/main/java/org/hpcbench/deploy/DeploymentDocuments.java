package org.hpcbench.deploy;

import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import org.bson.Document;

/**
 * Field conversions shared by the persisted deployment records.
 */
final class DeploymentDocuments {
    private DeploymentDocuments() {}

    static Date date(final Instant instant) {
        return instant == null ? null : Date.from(instant);
    }

    static Instant instant(final Document document, final String key) {
        Object value = document.get(key);
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof String && !((String) value).isBlank()) {
            return Instant.parse((String) value);
        }
        return null;
    }

    static String text(final Document document, final String key) {
        Object value = document.get(key);
        return value == null ? null : String.valueOf(value);
    }

    static Integer integer(final Document document, final String key) {
        Object value = document.get(key);
        return value instanceof Number ? ((Number) value).intValue() : null;
    }

    static JobState state(final Document document) {
        Object value = document.get("state");
        if (value == null) {
            return JobState.UNKNOWN;
        }
        try {
            return JobState.valueOf(String.valueOf(value));
        } catch (IllegalArgumentException ignored) {
            return JobState.parse(String.valueOf(value));
        }
    }

    static Map<String, Object> metadata(final Document document) {
        Object value = document.get("metadata");
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (value instanceof Map<?, ?>) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                metadata.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return metadata;
    }
}
