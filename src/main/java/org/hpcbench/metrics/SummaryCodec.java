package org.hpcbench.metrics;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * JSON persistence of summaries. Writing replaces the previous file atomically where the file
 * system allows it.
 */
public final class SummaryCodec {
    static final JsonWriterSettings JSON_SETTINGS =
            JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).indent(true).build();

    private SummaryCodec() {}

    public static String toJson(final Summary summary) {
        return Objects.requireNonNull(summary, "summary").toDocument().toJson(JSON_SETTINGS);
    }

    public static Summary fromJson(final String json) {
        return Summary.fromDocument(Document.parse(json));
    }

    public static Path write(final Path file, final Summary summary) {
        Objects.requireNonNull(file, "file");
        final String json = toJson(summary) + System.lineSeparator();
        try {
            final Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            final Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write summary: " + file, e);
        }
    }

    public static Summary read(final Path file) {
        try {
            return fromJson(Files.readString(Objects.requireNonNull(file, "file"), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read summary: " + file, e);
        }
    }
}
