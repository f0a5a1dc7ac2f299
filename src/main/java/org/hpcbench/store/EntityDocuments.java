package org.hpcbench.store;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;

/**
 * Normalizes entity attribute maps into storable documents.
 *
 * <p>Nested maps become documents, collections and arrays become lists, enums their names, and
 * temporal values {@link Date} with millisecond resolution. The result shares no mutable state
 * with its source.
 */
public final class EntityDocuments {
    private EntityDocuments() {}

    public static Document normalize(final Map<String, ?> source) {
        Objects.requireNonNull(source, "source");

        final Document copy = new Document();
        for (final Map.Entry<String, ?> entry : source.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("attribute names must not be null");
            }
            copy.put(entry.getKey(), normalizeValue(entry.getValue()));
        }
        return copy;
    }

    static Document copy(final Document source) {
        return normalize(source);
    }

    private static Object normalizeValue(final Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            final Document nested = new Document();
            for (final Map.Entry<?, ?> entry : map.entrySet()) {
                nested.put(String.valueOf(entry.getKey()), normalizeValue(entry.getValue()));
            }
            return nested;
        }
        if (value instanceof Collection<?> collection) {
            final List<Object> output = new ArrayList<>(collection.size());
            for (final Object item : collection) {
                output.add(normalizeValue(item));
            }
            return output;
        }
        if (value instanceof Object[] array) {
            final List<Object> output = new ArrayList<>(array.length);
            for (final Object item : array) {
                output.add(normalizeValue(item));
            }
            return output;
        }
        if (value instanceof Date date) {
            return new Date(date.getTime());
        }
        if (value instanceof Instant instant) {
            return Date.from(instant);
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return Date.from(offsetDateTime.toInstant());
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return Date.from(zonedDateTime.toInstant());
        }
        if (value instanceof Enum<?> enumValue) {
            return enumValue.name();
        }
        if (value instanceof byte[] bytes) {
            return bytes.clone();
        }
        return value;
    }
}
