package org.hpcbench.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.bson.Document;

/**
 * In-memory implementation of the entity store.
 *
 * <p>Each save replaces the container's whole entity map, mirroring the file-backed rewrite.
 */
public final class InMemoryEntityStore implements EntityStore {
    private final Map<ContainerKey, Map<String, Document>> containers = new LinkedHashMap<>();

    @Override
    public synchronized boolean save(
            final String campaignId, final String kind, final String id, final Map<String, ?> attributes) {
        Objects.requireNonNull(attributes, "attributes");
        final ContainerKey key = ContainerKey.of(campaignId, kind);
        final String entityId = requireId(id);

        final Map<String, Document> rewritten = new LinkedHashMap<>(containers.getOrDefault(key, Map.of()));
        rewritten.remove(entityId);
        final Document normalized = EntityDocuments.normalize(attributes);
        normalized.remove(ID_FIELD);
        rewritten.put(entityId, normalized);
        containers.put(key, rewritten);
        return true;
    }

    @Override
    public synchronized Optional<Document> load(final String campaignId, final String kind, final String id) {
        final Map<String, Document> container = containers.get(ContainerKey.of(campaignId, kind));
        if (container == null) {
            return Optional.empty();
        }
        final Document stored = container.get(requireId(id));
        return stored == null ? Optional.empty() : Optional.of(EntityDocuments.copy(stored));
    }

    @Override
    public synchronized List<Document> loadAll(final String campaignId, final String kind) {
        final Map<String, Document> container = containers.get(ContainerKey.of(campaignId, kind));
        if (container == null) {
            return List.of();
        }
        final List<Document> result = new ArrayList<>(container.size());
        for (final Map.Entry<String, Document> entry : container.entrySet()) {
            final Document withId = new Document(ID_FIELD, entry.getKey());
            withId.putAll(EntityDocuments.copy(entry.getValue()));
            result.add(withId);
        }
        return result;
    }

    @Override
    public synchronized boolean delete(final String campaignId, final String kind, final String id) {
        final ContainerKey key = ContainerKey.of(campaignId, kind);
        final Map<String, Document> container = containers.get(key);
        if (container == null || !container.containsKey(requireId(id))) {
            return false;
        }
        final Map<String, Document> rewritten = new LinkedHashMap<>(container);
        rewritten.remove(id.trim());
        containers.put(key, rewritten);
        return true;
    }

    @Override
    public synchronized List<String> listCampaigns() {
        final Set<String> campaigns = new LinkedHashSet<>();
        for (final ContainerKey key : containers.keySet()) {
            campaigns.add(key.campaignId());
        }
        return List.copyOf(campaigns);
    }

    static String requireId(final String id) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        return id.trim();
    }
}
