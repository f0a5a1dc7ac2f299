package org.hpcbench.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import org.bson.Document;

/**
 * Immutable aggregate of one campaign's request records.
 *
 * <p>The all-zero summary returned for campaigns without usable records is flagged by
 * {@link #isEmpty()} and persisted with {@code "empty": true}, so it is never confused with a run
 * that legitimately measured zeros.
 */
public final class Summary {
    static final Set<String> CORE_FIELDS = Set.of(
            "total_requests",
            "successful_requests",
            "failed_requests",
            "success_rate",
            "service_type",
            "latency_s",
            "requests_per_second",
            "error_summary",
            "test_duration_s",
            "test_start_time",
            "test_end_time",
            "parametric",
            "empty");

    private static final Summary EMPTY = builder()
            .serviceType("unknown")
            .testDurationSeconds(0.0d)
            .empty(true)
            .build();

    private final long totalRequests;
    private final long successfulRequests;
    private final long failedRequests;
    private final double successRate;
    private final String serviceType;
    private final LatencyDistribution latency;
    private final double requestsPerSecond;
    private final Map<String, Long> errorSummary;
    private final Document extensions;
    private final Double testDurationSeconds;
    private final Double testStartTime;
    private final Double testEndTime;
    private final Map<String, Object> parametric;
    private final boolean empty;

    private Summary(final Builder builder) {
        if (builder.totalRequests < 0 || builder.successfulRequests < 0 || builder.failedRequests < 0) {
            throw new IllegalArgumentException("request counts must be >= 0");
        }
        if (builder.totalRequests != builder.successfulRequests + builder.failedRequests) {
            throw new IllegalArgumentException("total_requests must equal successful_requests + failed_requests");
        }
        this.totalRequests = builder.totalRequests;
        this.successfulRequests = builder.successfulRequests;
        this.failedRequests = builder.failedRequests;
        this.successRate = builder.successRate;
        this.serviceType = Objects.requireNonNull(builder.serviceType, "serviceType");
        this.latency = Objects.requireNonNull(builder.latency, "latency");
        this.requestsPerSecond = builder.requestsPerSecond;
        this.errorSummary = Collections.unmodifiableMap(new TreeMap<>(builder.errorSummary));
        this.extensions = (Document) deepCopy(builder.extensions);
        this.testDurationSeconds = builder.testDurationSeconds;
        this.testStartTime = builder.testStartTime;
        this.testEndTime = builder.testEndTime;
        this.parametric = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parametric));
        this.empty = builder.empty;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The documented all-zero summary for campaigns without usable records.
     */
    public static Summary empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return empty;
    }

    public long totalRequests() {
        return totalRequests;
    }

    public long successfulRequests() {
        return successfulRequests;
    }

    public long failedRequests() {
        return failedRequests;
    }

    /**
     * Percentage of successful requests, 0 when there were none.
     */
    public double successRate() {
        return successRate;
    }

    public String serviceType() {
        return serviceType;
    }

    public LatencyDistribution latency() {
        return latency;
    }

    public double requestsPerSecond() {
        return requestsPerSecond;
    }

    public Map<String, Long> errorSummary() {
        return errorSummary;
    }

    /**
     * Service-specific fields added by a {@link ServiceExtension}.
     */
    public Document extensions() {
        return (Document) deepCopy(extensions);
    }

    public OptionalDouble testDurationSeconds() {
        return optional(testDurationSeconds);
    }

    public OptionalDouble testStartTime() {
        return optional(testStartTime);
    }

    public OptionalDouble testEndTime() {
        return optional(testEndTime);
    }

    /**
     * Sweep parameters of the run, such as {@code concurrent_requests} or {@code payload_size_bytes}.
     */
    public Map<String, Object> parametric() {
        return parametric;
    }

    public OptionalDouble parametricNumber(final String key) {
        final Object value = parametric.get(key);
        return value instanceof Number number ? OptionalDouble.of(number.doubleValue()) : OptionalDouble.empty();
    }

    /**
     * Numeric value at a dotted path of the persisted form, e.g. {@code latency_s.p95}.
     */
    public OptionalDouble valueAt(final String dottedPath) {
        Object current = toDocument();
        for (String key : dottedPath.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return OptionalDouble.empty();
            }
            current = map.get(key);
        }
        return current instanceof Number number ? OptionalDouble.of(number.doubleValue()) : OptionalDouble.empty();
    }

    public Document toDocument() {
        final Document document = new Document();
        document.put("total_requests", totalRequests);
        document.put("successful_requests", successfulRequests);
        document.put("failed_requests", failedRequests);
        document.put("success_rate", successRate);
        document.put("service_type", serviceType);
        document.put("latency_s", latency.toDocument());
        document.put("requests_per_second", requestsPerSecond);
        document.put("error_summary", new Document(new LinkedHashMap<>(errorSummary)));
        for (Map.Entry<String, Object> entry : extensions().entrySet()) {
            document.put(entry.getKey(), entry.getValue());
        }
        if (testDurationSeconds != null) {
            document.put("test_duration_s", testDurationSeconds);
        }
        if (testStartTime != null) {
            document.put("test_start_time", testStartTime);
        }
        if (testEndTime != null) {
            document.put("test_end_time", testEndTime);
        }
        if (!parametric.isEmpty()) {
            document.put("parametric", new Document(new LinkedHashMap<>(parametric)));
        }
        document.put("empty", empty);
        return document;
    }

    public static Summary fromDocument(final Map<String, ?> document) {
        Objects.requireNonNull(document, "document");
        final Builder builder = builder()
                .counts(longValue(document.get("total_requests")),
                        longValue(document.get("successful_requests")),
                        longValue(document.get("failed_requests")))
                .successRate(doubleValue(document.get("success_rate")))
                .serviceType(document.get("service_type") == null ? "unknown" : String.valueOf(document.get("service_type")))
                .latency(LatencyDistribution.fromDocument(document.get("latency_s")))
                .requestsPerSecond(doubleValue(document.get("requests_per_second")))
                .testDurationSeconds(nullableDouble(document.get("test_duration_s")))
                .testStartTime(nullableDouble(document.get("test_start_time")))
                .testEndTime(nullableDouble(document.get("test_end_time")))
                .empty(Boolean.TRUE.equals(document.get("empty")));
        if (document.get("error_summary") instanceof Map<?, ?> errors) {
            errors.forEach((key, value) -> builder.error(String.valueOf(key), longValue(value)));
        }
        if (document.get("parametric") instanceof Map<?, ?> parametric) {
            parametric.forEach((key, value) -> builder.parametric(String.valueOf(key), value));
        }
        for (Map.Entry<String, ?> entry : document.entrySet()) {
            if (!CORE_FIELDS.contains(entry.getKey())) {
                builder.extension(entry.getKey(), entry.getValue());
            }
        }
        return builder.build();
    }

    private static Object deepCopy(final Object value) {
        if (value instanceof Map<?, ?> map) {
            final Document copy = new Document();
            map.forEach((key, nested) -> copy.put(String.valueOf(key), deepCopy(nested)));
            return copy;
        }
        if (value instanceof List<?> list) {
            final List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(deepCopy(item)));
            return copy;
        }
        return value;
    }

    private static OptionalDouble optional(final Double value) {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    private static long longValue(final Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static double doubleValue(final Object value) {
        return value instanceof Number number ? number.doubleValue() : 0.0d;
    }

    private static Double nullableDouble(final Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Summary)) {
            return false;
        }
        return toDocument().equals(((Summary) other).toDocument());
    }

    @Override
    public int hashCode() {
        return toDocument().hashCode();
    }

    @Override
    public String toString() {
        return "Summary" + toDocument().toJson();
    }

    public static final class Builder {
        private long totalRequests;
        private long successfulRequests;
        private long failedRequests;
        private double successRate;
        private String serviceType = "unknown";
        private LatencyDistribution latency = LatencyDistribution.ZERO;
        private double requestsPerSecond;
        private final Map<String, Long> errorSummary = new TreeMap<>();
        private final Document extensions = new Document();
        private Double testDurationSeconds;
        private Double testStartTime;
        private Double testEndTime;
        private final Map<String, Object> parametric = new LinkedHashMap<>();
        private boolean empty;

        private Builder() {}

        public Builder counts(final long total, final long successful, final long failed) {
            this.totalRequests = total;
            this.successfulRequests = successful;
            this.failedRequests = failed;
            return this;
        }

        public Builder successRate(final double successRate) {
            this.successRate = successRate;
            return this;
        }

        public Builder serviceType(final String serviceType) {
            this.serviceType = serviceType;
            return this;
        }

        public Builder latency(final LatencyDistribution latency) {
            this.latency = latency;
            return this;
        }

        public Builder requestsPerSecond(final double requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
            return this;
        }

        public Builder error(final String errorType, final long count) {
            this.errorSummary.merge(errorType, count, Long::sum);
            return this;
        }

        public Builder extension(final String key, final Object value) {
            if (CORE_FIELDS.contains(key)) {
                throw new IllegalArgumentException("extension field collides with summary field: " + key);
            }
            this.extensions.put(key, value);
            return this;
        }

        public Builder extensions(final Map<String, ?> fields) {
            fields.forEach(this::extension);
            return this;
        }

        public Builder testDurationSeconds(final Double testDurationSeconds) {
            this.testDurationSeconds = testDurationSeconds;
            return this;
        }

        public Builder testStartTime(final Double testStartTime) {
            this.testStartTime = testStartTime;
            return this;
        }

        public Builder testEndTime(final Double testEndTime) {
            this.testEndTime = testEndTime;
            return this;
        }

        public Builder parametric(final String key, final Object value) {
            this.parametric.put(key, value);
            return this;
        }

        public Builder empty(final boolean empty) {
            this.empty = empty;
            return this;
        }

        public Summary build() {
            return new Summary(this);
        }
    }
}
