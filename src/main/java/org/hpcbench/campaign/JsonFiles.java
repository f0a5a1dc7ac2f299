package org.hpcbench.campaign;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonParseException;
import org.bson.json.JsonWriterSettings;

final class JsonFiles {
    static final JsonWriterSettings SETTINGS =
        JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).indent(true).build();

    private JsonFiles() {
    }

    static Path write(Path file, Document document) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(temp, document.toJson(SETTINGS) + System.lineSeparator(), StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write " + file, e);
        }
    }

    /**
     * Empty when the file does not exist.
     *
     * @throws IllegalStateException when the file exists but is not a JSON object
     */
    static Optional<Document> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Document.parse(Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + file, e);
        } catch (JsonParseException e) {
            throw new IllegalStateException("malformed JSON in " + file, e);
        }
    }
}
