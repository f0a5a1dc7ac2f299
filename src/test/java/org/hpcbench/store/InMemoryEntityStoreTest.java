package org.hpcbench.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class InMemoryEntityStoreTest {
    @Test
    void saveUpsertsByIdAndLoadOmitsId() {
        InMemoryEntityStore store = new InMemoryEntityStore();

        assertTrue(store.save("bench-1", "service", "vllm", Map.of("state", "PENDING", "job_id", "100")));
        assertTrue(store.save("bench-1", "service", "vllm", Map.of("state", "RUNNING", "job_id", "100")));

        Document loaded = store.load("bench-1", "service", "vllm").orElseThrow();
        assertEquals("RUNNING", loaded.getString("state"));
        assertFalse(loaded.containsKey(EntityStore.ID_FIELD));
        assertEquals(1, store.loadAll("bench-1", "service").size());
    }

    @Test
    void loadAllCarriesIdsAndKeepsContainersApart() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        store.save("bench-1", "client", "c-0", Map.of("service_name", "vllm"));
        store.save("bench-1", "client", "c-1", Map.of("service_name", "vllm"));
        store.save("bench-1", "service", "vllm", Map.of());
        store.save("bench-2", "client", "c-0", Map.of());

        List<Document> clients = store.loadAll("bench-1", "client");
        assertEquals(List.of("c-0", "c-1"), clients.stream().map(doc -> doc.getString(EntityStore.ID_FIELD)).toList());
        assertEquals(List.of("bench-1", "bench-2"), store.listCampaigns());
        assertTrue(store.loadAll("bench-3", "client").isEmpty());
    }

    @Test
    void storedCopiesAreIsolatedFromCallers() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("model", "llama");
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("metadata", metadata);
        attributes.put("submit_time", Instant.parse("2026-01-01T00:00:00Z"));
        store.save("bench-1", "service", "vllm", attributes);

        metadata.put("model", "mutated");
        Document loaded = store.load("bench-1", "service", "vllm").orElseThrow();
        loaded.get("metadata", Document.class).put("model", "mutated-again");

        Document reloaded = store.load("bench-1", "service", "vllm").orElseThrow();
        assertEquals("llama", reloaded.get("metadata", Document.class).getString("model"));
        assertEquals(Date.from(Instant.parse("2026-01-01T00:00:00Z")), reloaded.getDate("submit_time"));
    }

    @Test
    void loadAllListsEntitiesInLastWriteOrder() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        store.save("bench-1", "client", "c-0", Map.of("state", "PENDING"));
        store.save("bench-1", "client", "c-1", Map.of("state", "PENDING"));
        store.save("bench-1", "client", "c-2", Map.of("state", "PENDING"));
        store.save("bench-1", "client", "c-0", Map.of("state", "RUNNING"));

        List<Document> all = store.loadAll("bench-1", "client");

        assertEquals(List.of("c-1", "c-2", "c-0"),
            all.stream().map(entity -> entity.getString(EntityStore.ID_FIELD)).collect(Collectors.toList()));
    }

    @Test
    void deleteReportsWhetherAnythingWasRemoved() {
        InMemoryEntityStore store = new InMemoryEntityStore();
        store.save("bench-1", "client", "c-0", Map.of());

        assertTrue(store.delete("bench-1", "client", "c-0"));
        assertFalse(store.delete("bench-1", "client", "c-0"));
        assertFalse(store.delete("bench-9", "client", "c-0"));
        assertTrue(store.load("bench-1", "client", "c-0").isEmpty());
    }

    @Test
    void blankIdsAreRejected() {
        InMemoryEntityStore store = new InMemoryEntityStore();

        assertThrows(IllegalArgumentException.class, () -> store.save("bench-1", "client", " ", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> store.load("bench-1", "client", null));
    }
}
