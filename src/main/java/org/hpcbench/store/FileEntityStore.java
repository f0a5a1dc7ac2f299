package org.hpcbench.store;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.BsonBinaryReader;
import org.bson.BsonBinaryWriter;
import org.bson.BsonSerializationException;
import org.bson.Document;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.DocumentCodec;
import org.bson.codecs.EncoderContext;
import org.bson.io.BasicOutputBuffer;
import org.hpcbench.obs.CorrelationContext;
import org.hpcbench.obs.JsonLinesLogger;

/**
 * File-backed entity store: one BSON file per container at {@code <root>/<campaign>/<kind>.bson}.
 *
 * <p>The file holds a single document {@code {"entities": [...]}} that is rewritten in full on
 * every save and delete. BSON keeps nested documents, arrays, 64-bit integers and dates intact.
 */
public final class FileEntityStore implements EntityStore {
    static final String FILE_SUFFIX = ".bson";
    private static final String ENTITIES_FIELD = "entities";
    private static final DocumentCodec CODEC = new DocumentCodec();

    private final Path root;
    private final JsonLinesLogger logger;

    public FileEntityStore(final Path root) {
        this(root, JsonLinesLogger.NOOP);
    }

    public FileEntityStore(final Path root, final JsonLinesLogger logger) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean save(final String campaignId, final String kind, final String id, final Map<String, ?> attributes) {
        Objects.requireNonNull(attributes, "attributes");
        final ContainerKey key = ContainerKey.of(campaignId, kind);
        final String entityId = InMemoryEntityStore.requireId(id);
        final Document entity = new Document(ID_FIELD, entityId);
        final Document normalized = EntityDocuments.normalize(attributes);
        normalized.remove(ID_FIELD);
        entity.putAll(normalized);

        try {
            final List<Document> rewritten = new ArrayList<>();
            for (final Document existing : readContainer(key)) {
                if (!entityId.equals(existing.getString(ID_FIELD))) {
                    rewritten.add(existing);
                }
            }
            rewritten.add(entity);
            writeContainer(key, rewritten);
            return true;
        } catch (IOException | RuntimeException e) {
            logFailure("store.save", key, entityId, e);
            return false;
        }
    }

    @Override
    public Optional<Document> load(final String campaignId, final String kind, final String id) {
        final ContainerKey key = ContainerKey.of(campaignId, kind);
        final String entityId = InMemoryEntityStore.requireId(id);
        try {
            for (final Document existing : readContainer(key)) {
                if (entityId.equals(existing.getString(ID_FIELD))) {
                    existing.remove(ID_FIELD);
                    return Optional.of(existing);
                }
            }
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            logFailure("store.load", key, entityId, e);
            return Optional.empty();
        }
    }

    @Override
    public List<Document> loadAll(final String campaignId, final String kind) {
        final ContainerKey key = ContainerKey.of(campaignId, kind);
        try {
            return readContainer(key);
        } catch (IOException | RuntimeException e) {
            logFailure("store.loadAll", key, null, e);
            return List.of();
        }
    }

    @Override
    public boolean delete(final String campaignId, final String kind, final String id) {
        final ContainerKey key = ContainerKey.of(campaignId, kind);
        final String entityId = InMemoryEntityStore.requireId(id);
        try {
            final List<Document> existing = readContainer(key);
            final List<Document> remaining = new ArrayList<>(existing.size());
            for (final Document document : existing) {
                if (!entityId.equals(document.getString(ID_FIELD))) {
                    remaining.add(document);
                }
            }
            if (remaining.size() == existing.size()) {
                return false;
            }
            writeContainer(key, remaining);
            return true;
        } catch (IOException | RuntimeException e) {
            logFailure("store.delete", key, entityId, e);
            return false;
        }
    }

    @Override
    public List<String> listCampaigns() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        final List<String> campaigns = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (final Path entry : entries) {
                campaigns.add(entry.getFileName().toString());
            }
        } catch (IOException e) {
            reportError("failed to list campaigns", CorrelationContext.of("*", "store.listCampaigns"),
                    Map.of("root", root.toString(), "error", String.valueOf(e.getMessage())));
            return List.of();
        }
        campaigns.sort(String::compareTo);
        return campaigns;
    }

    Path containerPath(final ContainerKey key) {
        return root.resolve(key.campaignId()).resolve(key.kind() + FILE_SUFFIX);
    }

    private List<Document> readContainer(final ContainerKey key) throws IOException {
        final Path path = containerPath(key);
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        final byte[] bytes = Files.readAllBytes(path);
        final Document container;
        try (BsonBinaryReader reader = new BsonBinaryReader(ByteBuffer.wrap(bytes))) {
            container = CODEC.decode(reader, DecoderContext.builder().build());
        } catch (BsonSerializationException e) {
            throw new IOException("corrupt container file " + path + ": " + e.getMessage(), e);
        }
        final List<Document> entities = container.getList(ENTITIES_FIELD, Document.class);
        return entities == null ? new ArrayList<>() : new ArrayList<>(entities);
    }

    private void writeContainer(final ContainerKey key, final List<Document> entities) throws IOException {
        final Path path = containerPath(key);
        Files.createDirectories(path.getParent());

        final BasicOutputBuffer buffer = new BasicOutputBuffer();
        try (BsonBinaryWriter writer = new BsonBinaryWriter(buffer)) {
            CODEC.encode(writer, new Document(ENTITIES_FIELD, entities), EncoderContext.builder().build());
        }

        final Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.write(temp, buffer.toByteArray());
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void logFailure(final String operation, final ContainerKey key, final String entityId, final Exception error) {
        reportError(
                "entity store operation failed",
                CorrelationContext.builder(key.campaignId(), operation).entity(entityId).build(),
                Map.of(
                        "kind", key.kind(),
                        "path", containerPath(key).toString(),
                        "error", error.getClass().getSimpleName() + ": " + error.getMessage()));
    }

    private void reportError(final String message, final CorrelationContext context, final Map<String, ?> fields) {
        try {
            logger.error(message, context, fields);
        } catch (final RuntimeException loggingFailure) {
            // Failures surface as return values even when the logger is closed.
            System.err.println("hpcbench " + context.operation() + ": " + message + " " + fields
                    + " (logger unavailable: " + loggingFailure.getMessage() + ")");
        }
    }
}
