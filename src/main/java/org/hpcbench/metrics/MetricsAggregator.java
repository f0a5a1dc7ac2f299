package org.hpcbench.metrics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.hpcbench.obs.CorrelationContext;
import org.hpcbench.obs.JsonLinesLogger;

/**
 * Turns one campaign's request records into a {@link Summary}.
 *
 * <p>Aggregation is deterministic: the same record set always yields an equal summary. Records
 * without a request id or operation type, or still carrying the unexpanded campaign placeholder,
 * are dropped before anything is counted.
 */
public final class MetricsAggregator {
    /**
     * Duration floor in seconds. Timestamps are floating-point seconds with an assumed resolution
     * of one microsecond.
     */
    static final double MIN_DURATION_SECONDS = 1e-6d;

    private final ServiceExtensionRegistry extensions;
    private final JsonLinesLogger logger;

    public MetricsAggregator() {
        this(ServiceExtensionRegistry.defaults(), JsonLinesLogger.NOOP);
    }

    public MetricsAggregator(final ServiceExtensionRegistry extensions, final JsonLinesLogger logger) {
        this.extensions = Objects.requireNonNull(extensions, "extensions");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public Summary aggregate(final String campaignId, final Collection<RequestRecord> records) {
        Objects.requireNonNull(records, "records");
        final CorrelationContext context = CorrelationContext.of(campaignId, "aggregate");
        if (records.isEmpty()) {
            logger.warn("no request records; returning empty summary", context);
            return Summary.empty();
        }

        final List<RequestRecord> usable = new ArrayList<>(records.size());
        for (RequestRecord record : records) {
            if (record.isIdentifiable()) {
                usable.add(record);
            }
        }
        if (usable.size() < records.size()) {
            logger.warn("dropped unidentifiable request records", context,
                    Map.of("dropped", records.size() - usable.size(), "kept", usable.size()));
        }
        if (usable.isEmpty()) {
            return Summary.empty();
        }

        final List<RequestRecord> successful = new ArrayList<>();
        final List<RequestRecord> failed = new ArrayList<>();
        final List<Double> latencies = new ArrayList<>();
        for (RequestRecord record : usable) {
            if (record.succeeded()) {
                successful.add(record);
                final double latency = record.latencySeconds();
                if (latency > 0.0d) {
                    latencies.add(latency);
                }
            } else {
                failed.add(record);
            }
        }

        final long total = usable.size();
        final LatencyDistribution latency = LatencyDistribution.of(latencies);
        final double successRate = 100.0d * successful.size() / total;

        final TimeRange range = TimeRange.of(usable);
        final double effectiveDuration;
        final double requestsPerSecond;
        if (range.isPresent()) {
            effectiveDuration = Math.max(Math.max(range.span(), latency.max()), MIN_DURATION_SECONDS);
            requestsPerSecond = total / effectiveDuration;
        } else {
            effectiveDuration = 0.0d;
            requestsPerSecond = 0.0d;
        }

        final String serviceType = usable.get(0).serviceType();
        final Summary.Builder builder = Summary.builder()
                .counts(total, successful.size(), failed.size())
                .successRate(successRate)
                .serviceType(serviceType)
                .latency(latency)
                .requestsPerSecond(requestsPerSecond);
        extensions.find(serviceType)
                .map(extension -> extension.extend(successful, effectiveDuration, requestsPerSecond))
                .ifPresent(builder::extensions);
        for (RequestRecord record : failed) {
            builder.error(record.errorType(), 1L);
        }
        if (range.isPresent()) {
            builder.testDurationSeconds(effectiveDuration)
                    .testStartTime(range.start)
                    .testEndTime(range.end);
        }
        addParametric(usable.get(0), builder);
        return builder.build();
    }

    private static void addParametric(final RequestRecord first, final Summary.Builder builder) {
        firstTruthy(first, "concurrent_requests", "num_clients")
                .ifPresent(value -> builder.parametric("concurrent_requests", value));
        firstTruthy(first, "payload_size_bytes", "data_size")
                .ifPresent(value -> builder.parametric("payload_size_bytes", value));
        for (String key : List.of("prompt_length", "max_tokens", "model", "pipeline")) {
            first.truthy(key).ifPresent(value -> builder.parametric(key, value));
        }
    }

    private static Optional<Object> firstTruthy(final RequestRecord record, final String... keys) {
        for (String key : keys) {
            final Optional<Object> value = record.truthy(key);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static final class TimeRange {
        private final Double start;
        private final Double end;

        private TimeRange(final Double start, final Double end) {
            this.start = start;
            this.end = end;
        }

        static TimeRange of(final List<RequestRecord> records) {
            Double start = null;
            Double end = null;
            for (RequestRecord record : records) {
                final OptionalDouble recordStart = record.timestampStart();
                if (recordStart.isPresent() && (start == null || recordStart.getAsDouble() < start)) {
                    start = recordStart.getAsDouble();
                }
                final OptionalDouble recordEnd = record.timestampEnd();
                if (recordEnd.isPresent() && (end == null || recordEnd.getAsDouble() > end)) {
                    end = recordEnd.getAsDouble();
                }
            }
            return new TimeRange(start, end);
        }

        boolean isPresent() {
            return start != null && end != null;
        }

        double span() {
            return end - start;
        }
    }
}
