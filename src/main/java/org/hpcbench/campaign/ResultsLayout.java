package org.hpcbench.campaign;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Local artifact locations under {@code <resultsDir>/<campaign>/}.
 */
public final class ResultsLayout {
    static final String REQUESTS_FILE = "requests.jsonl";
    static final String REQUESTS_PART_PREFIX = "requests_";
    static final String SUMMARY_FILE = "summary.json";
    static final String RUN_FILE = "run.json";
    static final String TELEMETRY_FILE = "metrics.json";
    static final String LOCK_FILE = ".collecting";

    private static final Pattern CAMPAIGN_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path root;

    public ResultsLayout(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path root() {
        return root;
    }

    public Path campaignDir(String campaignId) {
        if (campaignId == null || !CAMPAIGN_ID.matcher(campaignId).matches()) {
            throw new IllegalArgumentException("campaignId must be a single path segment: " + campaignId);
        }
        return root.resolve(campaignId);
    }

    /**
     * Merged per-operation record stream.
     */
    public Path requestsFile(String campaignId) {
        return campaignDir(campaignId).resolve(REQUESTS_FILE);
    }

    public Path summaryFile(String campaignId) {
        return campaignDir(campaignId).resolve(SUMMARY_FILE);
    }

    public Path runFile(String campaignId) {
        return campaignDir(campaignId).resolve(RUN_FILE);
    }

    /**
     * Optional hardware telemetry with {@code gpu} and {@code slurm} sections.
     */
    public Path telemetryFile(String campaignId) {
        return campaignDir(campaignId).resolve(TELEMETRY_FILE);
    }

    public Path logsDir(String campaignId) {
        return campaignDir(campaignId).resolve("logs");
    }

    public Path lockFile(String campaignId) {
        return campaignDir(campaignId).resolve(LOCK_FILE);
    }

    public Path comparisonFile(String baselineId, String currentId) {
        campaignDir(baselineId);
        return campaignDir(currentId).resolve("comparison_" + baselineId + "_vs_" + currentId + ".json");
    }
}
