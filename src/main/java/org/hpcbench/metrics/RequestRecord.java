package org.hpcbench.metrics;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.bson.Document;

/**
 * One per-operation record emitted by a running client. Read-only view over the parsed JSON
 * object; fields are looked up leniently because upstream writers differ in what they emit.
 */
public final class RequestRecord {
    public static final String UNEXPANDED_CAMPAIGN_PLACEHOLDER = "$BENCHMARK_ID";

    private final Document fields;

    public RequestRecord(final Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        this.fields = new Document();
        fields.forEach(this.fields::put);
    }

    public static RequestRecord of(final Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must contain key/value pairs");
        }
        final Document document = new Document();
        for (int i = 0; i < keyValues.length; i += 2) {
            document.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new RequestRecord(document);
    }

    /**
     * Whether the record carries a request id or operation type and a resolved campaign id.
     */
    public boolean isIdentifiable() {
        return (fields.containsKey("request_id") || fields.containsKey("operation_type"))
                && !UNEXPANDED_CAMPAIGN_PLACEHOLDER.equals(fields.get("benchmark_id"));
    }

    /**
     * True only when the success flag is present and truthy.
     */
    public boolean succeeded() {
        return isTruthy(fields.get("success"));
    }

    /**
     * Latency in seconds, 0 when absent or not numeric.
     */
    public double latencySeconds() {
        return number("latency_s").orElse(0.0d);
    }

    /**
     * Start timestamp in seconds; absent when missing or zero.
     */
    public OptionalDouble timestampStart() {
        return nonZero("timestamp_start");
    }

    /**
     * End timestamp, falling back to the start timestamp.
     */
    public OptionalDouble timestampEnd() {
        final OptionalDouble end = nonZero("timestamp_end");
        return end.isPresent() ? end : timestampStart();
    }

    public String serviceType() {
        final Object value = fields.get("service_type");
        return value == null ? "unknown" : String.valueOf(value);
    }

    public String operationType() {
        final Object value = fields.get("operation_type");
        return value == null ? "unknown" : String.valueOf(value);
    }

    public String errorType() {
        final Object value = fields.get("error");
        return value == null ? "unknown" : String.valueOf(value);
    }

    public OptionalDouble number(final String field) {
        final Object value = fields.get(field);
        if (value instanceof Number number) {
            return OptionalDouble.of(number.doubleValue());
        }
        return OptionalDouble.empty();
    }

    /**
     * Raw field value if it is truthy: non-null, non-zero, non-empty.
     */
    public Optional<Object> truthy(final String field) {
        final Object value = fields.get(field);
        return isTruthy(value) ? Optional.of(value) : Optional.empty();
    }

    public Document fields() {
        return new Document(fields);
    }

    private OptionalDouble nonZero(final String field) {
        final OptionalDouble value = number(field);
        return value.isPresent() && value.getAsDouble() != 0.0d ? value : OptionalDouble.empty();
    }

    static boolean isTruthy(final Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0d;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    @Override
    public String toString() {
        return "RequestRecord" + fields.toJson();
    }
}
