package org.hpcbench.metrics;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.BSONException;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.hpcbench.obs.CorrelationContext;
import org.hpcbench.obs.JsonLinesLogger;

/**
 * Reads a newline-delimited JSON record stream. Lines that are not valid UTF-8 JSON objects are
 * skipped with a warning and counted; a missing file reads as an empty stream.
 */
public final class RequestRecordReader {
    private final JsonLinesLogger logger;

    public RequestRecordReader() {
        this(JsonLinesLogger.NOOP);
    }

    public RequestRecordReader(final JsonLinesLogger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public ReadResult read(final String campaignId, final Path path) {
        Objects.requireNonNull(path, "path");
        final CorrelationContext context = CorrelationContext.of(campaignId, "readRecords");
        if (!Files.isRegularFile(path)) {
            logger.warn("record stream not found", context, Map.of("path", path.toString()));
            return new ReadResult(List.of(), 0);
        }
        final List<RequestRecord> records = new ArrayList<>();
        int skipped = 0;
        int lineNumber = 0;
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            boolean more = true;
            while (more) {
                more = readLine(in, buffer);
                if (!more && buffer.size() == 0) {
                    break;
                }
                lineNumber++;
                final String line;
                try {
                    line = decoder.reset().decode(ByteBuffer.wrap(buffer.toByteArray())).toString();
                } catch (CharacterCodingException e) {
                    skipped++;
                    logger.warn("skipping undecodable record", context, Map.of(
                            "path", path.toString(),
                            "line", lineNumber,
                            "error", String.valueOf(e)));
                    continue;
                } finally {
                    buffer.reset();
                }
                final String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try {
                    records.add(new RequestRecord(Document.parse(trimmed)));
                } catch (JsonParseException | BSONException e) {
                    skipped++;
                    logger.warn("skipping malformed record", context, Map.of(
                            "path", path.toString(),
                            "line", lineNumber,
                            "error", String.valueOf(e.getMessage())));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read record stream: " + path, e);
        }
        return new ReadResult(records, skipped);
    }

    /** Copies the next line, without its terminator, into {@code buffer}; false at end of stream. */
    private static boolean readLine(final InputStream in, final ByteArrayOutputStream buffer) throws IOException {
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                return true;
            }
            buffer.write(b);
        }
        return false;
    }

    public record ReadResult(List<RequestRecord> records, int skippedLines) {
        public ReadResult {
            records = List.copyOf(Objects.requireNonNull(records, "records"));
            if (skippedLines < 0) {
                throw new IllegalArgumentException("skippedLines must be >= 0");
            }
        }
    }
}
