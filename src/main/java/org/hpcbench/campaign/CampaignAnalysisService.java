package org.hpcbench.campaign;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.bson.Document;
import org.hpcbench.analysis.BottleneckClassifier;
import org.hpcbench.analysis.BottleneckVerdict;
import org.hpcbench.analysis.RegressionComparator;
import org.hpcbench.analysis.RegressionVerdict;
import org.hpcbench.analysis.ResourceTelemetry;
import org.hpcbench.analysis.SaturationAnalyzer;
import org.hpcbench.analysis.SaturationReport;
import org.hpcbench.analysis.SweepPoint;
import org.hpcbench.metrics.MetricsAggregator;
import org.hpcbench.metrics.RequestRecordReader;
import org.hpcbench.metrics.Summary;
import org.hpcbench.metrics.SummaryCodec;
import org.hpcbench.obs.CorrelationContext;
import org.hpcbench.obs.JsonLinesLogger;

/**
 * Runs aggregation and the offline analyses against the artifacts of collected campaigns.
 */
public final class CampaignAnalysisService {
    static final String CONCURRENCY_FIELD = "concurrent_requests";

    private final ResultsLayout layout;
    private final RunMetadataStore runMetadata;
    private final RequestRecordReader reader;
    private final MetricsAggregator aggregator;
    private final SaturationAnalyzer saturationAnalyzer;
    private final BottleneckClassifier classifier;
    private final RegressionComparator comparator;
    private final JsonLinesLogger logger;

    public CampaignAnalysisService(
        ResultsLayout layout,
        MetricsAggregator aggregator,
        RegressionComparator comparator,
        JsonLinesLogger logger
    ) {
        this(
            layout,
            new RequestRecordReader(logger),
            aggregator,
            new SaturationAnalyzer(),
            new BottleneckClassifier(),
            comparator,
            logger);
    }

    public CampaignAnalysisService(
        ResultsLayout layout,
        RequestRecordReader reader,
        MetricsAggregator aggregator,
        SaturationAnalyzer saturationAnalyzer,
        BottleneckClassifier classifier,
        RegressionComparator comparator,
        JsonLinesLogger logger
    ) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.runMetadata = new RunMetadataStore(layout);
        this.reader = Objects.requireNonNull(reader, "reader");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.saturationAnalyzer = Objects.requireNonNull(saturationAnalyzer, "saturationAnalyzer");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Aggregates {@code requests.jsonl} into {@code summary.json}, replacing any previous summary.
     * A campaign without records gets the empty summary.
     */
    public Summary aggregate(String campaignId) {
        RequestRecordReader.ReadResult read = reader.read(campaignId, layout.requestsFile(campaignId));
        Summary summary = aggregator.aggregate(campaignId, read.records());
        SummaryCodec.write(layout.summaryFile(campaignId), summary);
        return summary;
    }

    public Optional<Summary> loadSummary(String campaignId) {
        Path file = layout.summaryFile(campaignId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(SummaryCodec.read(file));
    }

    /**
     * Builds one sweep point per campaign that has a summary. Campaigns without one are skipped
     * with a warning.
     *
     * @throws IllegalArgumentException when none of the campaigns has a summary
     */
    public SaturationReport analyzeSaturation(List<String> campaignIds, Double sloThreshold) {
        List<SweepPoint> points = new ArrayList<>();
        for (String campaignId : campaignIds) {
            Optional<Summary> summary = loadSummary(campaignId);
            if (summary.isEmpty()) {
                logger.warn("campaign skipped in sweep: no summary", CorrelationContext.of(campaignId, "saturation"));
                continue;
            }
            points.add(SweepPoint.fromSummary(campaignId, concurrencyOf(campaignId, summary.get()), summary.get()));
        }
        if (points.isEmpty()) {
            throw new IllegalArgumentException("no summaries found for campaigns " + campaignIds);
        }
        return saturationAnalyzer.analyze(points, sloThreshold);
    }

    /**
     * Uses the {@code telemetry} sections of {@code metrics.json} when present.
     */
    public BottleneckVerdict classifyBottleneck(String campaignId) {
        Optional<Summary> summary = loadSummary(campaignId);
        if (summary.isEmpty()) {
            return BottleneckClassifier.unknown("No summary available for campaign " + campaignId);
        }
        ResourceTelemetry telemetry = JsonFiles.read(layout.telemetryFile(campaignId))
            .map(ResourceTelemetry::fromMap)
            .orElse(ResourceTelemetry.none());
        BottleneckVerdict verdict = classifier.classify(summary.get(), telemetry);
        logger.info("bottleneck classified", CorrelationContext.of(campaignId, "bottleneck"), Map.of(
            "classification", verdict.classification().key(),
            "confidence", verdict.confidence().key()));
        return verdict;
    }

    /**
     * Compares two collected campaigns and writes {@code comparison_<baseline>_vs_<current>.json}
     * into the current campaign's directory.
     *
     * @return empty when either campaign has no summary
     */
    public Optional<RegressionVerdict> compare(String baselineId, String currentId, Map<String, ?> thresholdOverrides) {
        CorrelationContext ctx = CorrelationContext.of(currentId, "compare");
        Optional<Summary> baseline = loadSummary(baselineId);
        Optional<Summary> current = loadSummary(currentId);
        if (baseline.isEmpty() || current.isEmpty()) {
            logger.warn("comparison skipped: missing summary", ctx, Map.of(
                "baseline", baselineId,
                "baselineFound", baseline.isPresent(),
                "currentFound", current.isPresent()));
            return Optional.empty();
        }
        RegressionVerdict verdict = comparator.compare(
            baseline.get(),
            current.get(),
            thresholdOverrides == null ? Map.of() : thresholdOverrides);
        Document document = new Document(verdict.toMap());
        document.put("baseline_id", baselineId);
        document.put("current_id", currentId);
        JsonFiles.write(layout.comparisonFile(baselineId, currentId), document);
        logger.info("campaigns compared", ctx, Map.of(
            "baseline", baselineId,
            "verdict", verdict.verdict().name(),
            "regressions", verdict.regressions().size()));
        return Optional.of(verdict);
    }

    /**
     * Sweep coordinate of a campaign: the {@code concurrent_requests} parameter recorded by the
     * clients, else the client count from run.json, else 1.
     */
    double concurrencyOf(String campaignId, Summary summary) {
        OptionalDouble recorded = summary.parametricNumber(CONCURRENCY_FIELD);
        if (recorded.isPresent()) {
            return recorded.getAsDouble();
        }
        return runMetadata.read(campaignId)
            .map(run -> run.clients().size())
            .filter(count -> count > 0)
            .map(Integer::doubleValue)
            .orElse(1.0d);
    }
}
