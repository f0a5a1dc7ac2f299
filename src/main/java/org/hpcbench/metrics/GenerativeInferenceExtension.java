package org.hpcbench.metrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Token throughput and average token counts for LLM inference services.
 */
public final class GenerativeInferenceExtension implements ServiceExtension {
    @Override
    public Map<String, Object> extend(
            final List<RequestRecord> successful,
            final double effectiveDurationSeconds,
            final double requestsPerSecond) {
        final Map<String, Object> fields = new LinkedHashMap<>();
        if (successful.isEmpty()) {
            return fields;
        }
        final double[] outputTokens = new double[successful.size()];
        final double[] inputTokens = new double[successful.size()];
        double totalOutput = 0.0d;
        for (int i = 0; i < successful.size(); i++) {
            outputTokens[i] = successful.get(i).number("output_tokens").orElse(0.0d);
            inputTokens[i] = successful.get(i).number("input_tokens").orElse(0.0d);
            totalOutput += outputTokens[i];
        }
        fields.put("tokens_per_second", effectiveDurationSeconds > 0.0d ? totalOutput / effectiveDurationSeconds : 0.0d);
        fields.put("avg_output_tokens", Percentiles.mean(outputTokens));
        fields.put("avg_input_tokens", Percentiles.mean(inputTokens));
        return fields;
    }
}
