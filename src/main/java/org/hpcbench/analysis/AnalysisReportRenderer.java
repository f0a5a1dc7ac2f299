package org.hpcbench.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * Renders analysis results as markdown report sections and JSON records.
 */
public final class AnalysisReportRenderer {
    private static final JsonWriterSettings JSON_SETTINGS =
        JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).indent(true).build();

    public String toMarkdown(SaturationReport report) {
        Objects.requireNonNull(report, "report");
        StringBuilder sb = new StringBuilder();
        sb.append("## Saturation Analysis\n\n");
        sb.append("### Data Points Analyzed\n\n");
        double[] xRange = report.xRange();
        double[] throughputRange = report.throughputRange();
        double[] p99Range = report.p99LatencyRange();
        sb.append("- **").append(title(report.parameter())).append(" Range:** ")
            .append(SaturationAnalyzer.formatX(xRange[0])).append(" - ")
            .append(SaturationAnalyzer.formatX(xRange[1])).append('\n');
        sb.append("- **Throughput Range:** ").append(fixed(1, throughputRange[0])).append(" - ")
            .append(fixed(1, throughputRange[1])).append(" RPS\n");
        sb.append("- **P99 Latency Range:** ").append(fixed(1, p99Range[0] * 1000.0d)).append(" - ")
            .append(fixed(1, p99Range[1] * 1000.0d)).append(" ms\n\n");

        sb.append("### Key Findings\n\n");
        report.latencyKnee().ifPresent(knee -> sb.append("- **Latency Knee Point:** ")
            .append(title(report.parameter())).append(' ').append(SaturationAnalyzer.formatX(knee.x()))
            .append(" (P99 = ").append(fixed(1, knee.p99Latency() * 1000.0d)).append("ms)\n"));
        report.throughputSaturation().ifPresent(saturation -> sb.append("- **Throughput Saturation:** ")
            .append(title(report.parameter())).append(' ').append(SaturationAnalyzer.formatX(saturation.x()))
            .append(" (").append(fixed(1, saturation.throughput())).append(" RPS, efficiency = ")
            .append(fixed(2, saturation.efficiency())).append(" RPS/unit)\n"));
        report.sloLimit().ifPresent(slo -> {
            if (slo.met()) {
                sb.append("- **SLO Limit (P99 < ").append(fixed(0, slo.threshold() * 1000.0d)).append("ms):** ")
                    .append("Max ").append(report.parameter()).append(' ')
                    .append(SaturationAnalyzer.formatX(slo.maxX()))
                    .append(" (headroom = ").append(fixed(1, slo.headroomPercent())).append("%)\n");
            } else {
                sb.append("- **SLO Limit:** ").append(slo.unmetMessage()).append('\n');
            }
        });
        sb.append('\n');

        SaturationRecommendation recommendation = report.recommendation();
        sb.append("### Recommendation\n\n");
        sb.append("**").append(recommendation.summary()).append("**\n\n");
        if (!recommendation.reasoning().isEmpty()) {
            sb.append("Reasoning:\n");
            for (String reason : recommendation.reasoning()) {
                sb.append("- ").append(reason).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public String toMarkdown(BottleneckVerdict verdict) {
        Objects.requireNonNull(verdict, "verdict");
        StringBuilder sb = new StringBuilder();
        sb.append("## Bottleneck Analysis\n\n");
        sb.append("**Classification:** ").append(title(verdict.classification().key())).append('\n');
        sb.append("**Confidence:** ").append(title(verdict.confidence().key())).append("\n\n");
        sb.append("### Summary\n\n").append(verdict.summary()).append("\n\n");
        if (!verdict.evidence().isEmpty()) {
            sb.append("### Supporting Evidence\n\n");
            for (String item : verdict.evidence()) {
                sb.append("- ").append(item).append('\n');
            }
            sb.append('\n');
        }
        if (!verdict.recommendations().isEmpty()) {
            sb.append("### Recommended Actions\n\n");
            int index = 1;
            for (String recommendation : verdict.recommendations()) {
                sb.append(index++).append(". ").append(recommendation).append('\n');
            }
            sb.append('\n');
        }
        sb.append("### Analysis Scores\n\n");
        sb.append("| Category | Score |\n");
        sb.append("|----------|-------|\n");
        List<Map.Entry<BottleneckCategory, Integer>> ranked = new ArrayList<>(verdict.scores().entrySet());
        ranked.sort((left, right) -> Integer.compare(right.getValue(), left.getValue()));
        for (Map.Entry<BottleneckCategory, Integer> entry : ranked) {
            sb.append("| ").append(title(entry.getKey().key())).append(" | ").append(entry.getValue()).append(" |\n");
        }
        sb.append('\n');
        return sb.toString();
    }

    public String toMarkdown(RegressionVerdict verdict) {
        Objects.requireNonNull(verdict, "verdict");
        StringBuilder sb = new StringBuilder();
        sb.append("## Regression Check\n\n");
        sb.append("- verdict: ").append(verdict.verdict().name()).append('\n');
        sb.append("- baseline: ").append(verdict.baselineLabel()).append('\n');
        sb.append("- current: ").append(verdict.currentLabel()).append("\n\n");
        sb.append("| Metric | Baseline | Current | Change | Status |\n");
        sb.append("|--------|----------|---------|--------|--------|\n");
        for (MetricComparison comparison : verdict.comparisons()) {
            sb.append("| ").append(comparison.metric().label())
                .append(" | ").append(fixed(4, comparison.baseline()))
                .append(" | ").append(fixed(4, comparison.current()))
                .append(" | ").append(comparison.formattedChange())
                .append(" | ").append(status(comparison))
                .append(" |\n");
        }
        sb.append('\n');
        return sb.toString();
    }

    public String toJson(SaturationReport report) {
        return toJson(Objects.requireNonNull(report, "report").toMap());
    }

    public String toJson(BottleneckVerdict verdict) {
        return toJson(Objects.requireNonNull(verdict, "verdict").toMap());
    }

    /**
     * Comparison record JSON.
     */
    public String toJson(RegressionVerdict verdict) {
        return toJson(Objects.requireNonNull(verdict, "verdict").toMap());
    }

    private static String toJson(Map<String, Object> root) {
        return ((Document) toDocumentValue(root)).toJson(JSON_SETTINGS);
    }

    private static Object toDocumentValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Document document = new Document();
            for (Map.Entry<?, ?> entry : new LinkedHashMap<>(map).entrySet()) {
                document.put(String.valueOf(entry.getKey()), toDocumentValue(entry.getValue()));
            }
            return document;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object item : collection) {
                list.add(toDocumentValue(item));
            }
            return list;
        }
        if (value instanceof Double number && !Double.isFinite(number)) {
            return null;
        }
        return value;
    }

    private static String status(MetricComparison comparison) {
        if (comparison.regression()) {
            return "REGRESSION";
        }
        if (comparison.improvement()) {
            return "IMPROVED";
        }
        return "OK";
    }

    private static String fixed(int decimals, double value) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }

    static String title(String key) {
        String[] words = key.replace('_', ' ').split(" ");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
