package org.hpcbench.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.Document;

/**
 * Keyed persistence for deployment-state records, partitioned by (campaign id, entity kind).
 *
 * <p>{@code save} upserts by id through a read-all/replace-all rewrite of the whole container.
 * Concurrent writers to the same container are not serialized and may lose updates. I/O failures
 * are logged and reported as {@code false}, empty or absent results; they never propagate.
 */
public interface EntityStore {
    String ID_FIELD = "_id";

    boolean save(String campaignId, String kind, String id, Map<String, ?> attributes);

    /**
     * Attributes of one entity, without the {@value #ID_FIELD} field.
     */
    Optional<Document> load(String campaignId, String kind, String id);

    /**
     * All entities of a container in last-write order: a re-saved entity moves to the end. Each
     * carries its id under {@value #ID_FIELD}.
     */
    List<Document> loadAll(String campaignId, String kind);

    boolean delete(String campaignId, String kind, String id);

    List<String> listCampaigns();
}
