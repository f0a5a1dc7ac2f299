package org.hpcbench.metrics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import org.bson.Document;

/**
 * Per-operation-type breakdown for database and key-value services.
 */
public final class OperationBreakdownExtension implements ServiceExtension {
    private final boolean keyValue;

    private OperationBreakdownExtension(final boolean keyValue) {
        this.keyValue = keyValue;
    }

    /**
     * Operation count with average and p95 latency per operation.
     */
    public static OperationBreakdownExtension relational() {
        return new OperationBreakdownExtension(false);
    }

    /**
     * Upper-cased operation names with the full latency percentile set, per-operation throughput and
     * payload size statistics.
     */
    public static OperationBreakdownExtension keyValue() {
        return new OperationBreakdownExtension(true);
    }

    @Override
    public Map<String, Object> extend(
            final List<RequestRecord> successful,
            final double effectiveDurationSeconds,
            final double requestsPerSecond) {
        final Map<String, List<Double>> latenciesByOperation = new LinkedHashMap<>();
        final Map<String, Long> counts = new LinkedHashMap<>();
        final List<Double> payloadSizes = new ArrayList<>();
        for (RequestRecord record : successful) {
            final String operation = keyValue
                    ? record.operationType().toUpperCase(Locale.ROOT)
                    : record.operationType();
            counts.merge(operation, 1L, Long::sum);
            final List<Double> latencies = latenciesByOperation.computeIfAbsent(operation, ignored -> new ArrayList<>());
            final double latency = record.latencySeconds();
            if (latency > 0.0d) {
                latencies.add(latency);
            }
            if (keyValue) {
                record.truthy("payload_size_bytes")
                        .filter(Number.class::isInstance)
                        .map(value -> ((Number) value).doubleValue())
                        .ifPresent(payloadSizes::add);
            }
        }

        final Document operations = new Document();
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            final List<Double> latencies = latenciesByOperation.get(entry.getKey());
            final Document operation = new Document("count", entry.getValue());
            if (keyValue) {
                operation.put("throughput", 0.0d);
            }
            if (!latencies.isEmpty()) {
                final LatencyDistribution distribution = LatencyDistribution.of(latencies);
                operation.put("avg_latency", distribution.avg());
                if (keyValue) {
                    operation.put("min_latency", distribution.min());
                    operation.put("max_latency", distribution.max());
                    operation.put("p50_latency", distribution.p50());
                    operation.put("p95_latency", distribution.p95());
                    operation.put("p99_latency", distribution.p99());
                    if (effectiveDurationSeconds > 0.0d) {
                        operation.put("throughput", entry.getValue() / effectiveDurationSeconds);
                    }
                } else {
                    operation.put("p95_latency", distribution.p95());
                }
            }
            operations.put(entry.getKey(), operation);
        }

        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("operations", operations);
        fields.put("transactions_per_second", requestsPerSecond);
        if (!payloadSizes.isEmpty()) {
            double total = 0.0d;
            for (double size : payloadSizes) {
                total += size;
            }
            fields.put("avg_payload_size_bytes", total / payloadSizes.size());
            final List<Long> distinct = new ArrayList<>();
            for (double size : new TreeSet<>(payloadSizes)) {
                distinct.add(Math.round(size));
            }
            fields.put("payload_sizes_used", distinct);
        }
        return fields;
    }
}
