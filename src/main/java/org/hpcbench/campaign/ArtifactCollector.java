package org.hpcbench.campaign;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.BSONException;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.hpcbench.obs.CorrelationContext;
import org.hpcbench.obs.JsonLinesLogger;
import org.hpcbench.remote.CommandResult;
import org.hpcbench.remote.RemoteExecutor;

/**
 * Pulls per-client request streams and job logs from the campaign working directory and merges
 * the streams into {@code requests.jsonl}.
 */
public final class ArtifactCollector {
    static final String NO_FILES = "NO_FILES";

    private final RemoteExecutor executor;
    private final ResultsLayout layout;
    private final JsonLinesLogger logger;

    public ArtifactCollector(RemoteExecutor executor, ResultsLayout layout, JsonLinesLogger logger) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * @param remoteWorkingDirectory absolute campaign working directory on the cluster
     */
    public CollectionReport collect(String campaignId, String remoteWorkingDirectory) {
        CorrelationContext ctx = CorrelationContext.of(campaignId, "collect");
        Path campaignDir = layout.campaignDir(campaignId);
        createDirectories(campaignDir);

        List<String> failures = new ArrayList<>();
        List<String> metricFiles = new ArrayList<>();
        for (String remoteFile : listRemote("ls " + remoteWorkingDirectory + "/metrics/*.jsonl 2>/dev/null || echo " + NO_FILES)) {
            String localName = partName(baseName(remoteFile));
            if (executor.download(remoteFile, campaignDir.resolve(localName))) {
                metricFiles.add(remoteFile);
            } else {
                failures.add(remoteFile);
                logger.warn("request stream download failed", ctx, Map.of("remotePath", remoteFile));
            }
        }
        if (metricFiles.isEmpty()) {
            logger.warn("no request streams found", ctx, Map.of("remotePath", remoteWorkingDirectory + "/metrics"));
        }
        MergeCounts merged = mergeRequestStreams(campaignId);

        Path logsDir = layout.logsDir(campaignId);
        createDirectories(logsDir);
        List<String> logFiles = new ArrayList<>();
        String logsPath = remoteWorkingDirectory + "/logs";
        for (String remoteFile : listRemote("ls " + logsPath + "/*.out " + logsPath + "/*.err 2>/dev/null || echo " + NO_FILES)) {
            String localName = simplifiedLogName(baseName(remoteFile));
            if (executor.download(remoteFile, logsDir.resolve(localName))) {
                logFiles.add(localName);
            } else {
                failures.add(remoteFile);
                logger.warn("log download failed", ctx, Map.of("remotePath", remoteFile));
            }
        }

        logger.info("artifacts collected", ctx, Map.of(
            "metricFiles", metricFiles.size(),
            "mergedLines", merged.written(),
            "foreignLines", merged.foreign(),
            "logFiles", logFiles.size(),
            "failures", failures.size()));
        return new CollectionReport(metricFiles, merged.written(), merged.foreign(), logFiles, failures);
    }

    /**
     * Rebuilds {@code requests.jsonl} from the downloaded {@code requests_*.jsonl} parts in name
     * order, dropping blank lines and lines whose {@code benchmark_id} names a different campaign.
     * Lines that do not parse are kept so the reader can count them. The parts are deleted.
     */
    MergeCounts mergeRequestStreams(String campaignId) {
        Path campaignDir = layout.campaignDir(campaignId);
        Path merged = layout.requestsFile(campaignId);
        List<Path> parts = new ArrayList<>();
        try {
            Files.deleteIfExists(merged);
            if (!Files.isDirectory(campaignDir)) {
                return new MergeCounts(0, 0);
            }
            try (DirectoryStream<Path> stream =
                     Files.newDirectoryStream(campaignDir, ResultsLayout.REQUESTS_PART_PREFIX + "*.jsonl")) {
                stream.forEach(parts::add);
            }
            if (parts.isEmpty()) {
                return new MergeCounts(0, 0);
            }
            parts.sort(null);
            int written = 0;
            int foreign = 0;
            try (BufferedWriter writer = Files.newBufferedWriter(merged, StandardCharsets.UTF_8)) {
                for (Path part : parts) {
                    for (String line : Files.readAllLines(part, StandardCharsets.UTF_8)) {
                        String trimmed = line.strip();
                        if (trimmed.isEmpty()) {
                            continue;
                        }
                        if (belongsToOtherCampaign(trimmed, campaignId)) {
                            foreign++;
                            continue;
                        }
                        writer.write(trimmed);
                        writer.newLine();
                        written++;
                    }
                }
            }
            for (Path part : parts) {
                Files.delete(part);
            }
            return new MergeCounts(written, foreign);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to merge request streams in " + campaignDir, e);
        }
    }

    static String partName(String remoteBaseName) {
        return remoteBaseName.startsWith(ResultsLayout.REQUESTS_PART_PREFIX)
            ? remoteBaseName
            : ResultsLayout.REQUESTS_PART_PREFIX + remoteBaseName;
    }

    /**
     * {@code redis_3940121.out} becomes {@code redis_service.out}; names containing "client"
     * get a {@code _client} suffix instead. The job id is dropped.
     */
    static String simplifiedLogName(String fileName) {
        int underscore = fileName.lastIndexOf('_');
        if (underscore < 0) {
            return fileName;
        }
        String namePart = fileName.substring(0, underscore);
        int dot = fileName.lastIndexOf('.');
        String extension = dot >= 0 ? fileName.substring(dot) : "";
        String role = namePart.toLowerCase(Locale.ROOT).contains("client") ? "_client" : "_service";
        return namePart + role + extension;
    }

    private List<String> listRemote(String command) {
        CommandResult result = executor.execute(command);
        List<String> paths = new ArrayList<>();
        if (!result.succeeded() || result.stdout().contains(NO_FILES)) {
            return paths;
        }
        for (String line : result.stdout().split("\n")) {
            String path = line.strip();
            if (!path.isEmpty()) {
                paths.add(path);
            }
        }
        return paths;
    }

    private static boolean belongsToOtherCampaign(String line, String campaignId) {
        try {
            Object id = Document.parse(line).get("benchmark_id");
            return id instanceof String text && !text.isEmpty() && !text.equals(campaignId);
        } catch (JsonParseException | BSONException e) {
            return false;
        }
    }

    private static String baseName(String remotePath) {
        int slash = remotePath.lastIndexOf('/');
        return slash >= 0 ? remotePath.substring(slash + 1) : remotePath;
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to create " + dir, e);
        }
    }

    record MergeCounts(int written, int foreign) {
    }
}
