package org.hpcbench.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.hpcbench.obs.RecordingLogger;
import org.hpcbench.obs.StructuredJsonLinesLogger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileEntityStoreTest {
    @TempDir
    Path tempDir;

    @Test
    void entitiesSurviveAcrossStoreInstances() {
        FileEntityStore writer = new FileEntityStore(tempDir);
        writer.save("bench-1", "service", "vllm", Map.of(
            "state", "RUNNING",
            "port", 8000,
            "submit_time", Instant.parse("2026-03-01T12:00:00Z"),
            "metadata", Map.of("gpus", List.of(0, 1))));
        writer.save("bench-1", "client", "c-0", Map.of("service_name", "vllm"));

        FileEntityStore reader = new FileEntityStore(tempDir);
        Document service = reader.load("bench-1", "service", "vllm").orElseThrow();

        assertEquals("RUNNING", service.getString("state"));
        assertEquals(8000, service.getInteger("port"));
        assertEquals(Date.from(Instant.parse("2026-03-01T12:00:00Z")), service.getDate("submit_time"));
        assertEquals(List.of(0, 1), service.get("metadata", Document.class).getList("gpus", Integer.class));
        assertTrue(Files.exists(tempDir.resolve("bench-1").resolve("service" + FileEntityStore.FILE_SUFFIX)));
        assertEquals(List.of("bench-1"), reader.listCampaigns());
    }

    @Test
    void saveReplacesAndDeleteRewritesContainer() {
        FileEntityStore store = new FileEntityStore(tempDir);
        store.save("bench-1", "client", "c-0", Map.of("state", "PENDING"));
        store.save("bench-1", "client", "c-1", Map.of("state", "PENDING"));
        store.save("bench-1", "client", "c-0", Map.of("state", "COMPLETED"));

        List<Document> all = store.loadAll("bench-1", "client");
        assertEquals(2, all.size());
        assertEquals("c-1", all.get(0).getString(EntityStore.ID_FIELD));
        assertEquals("c-0", all.get(1).getString(EntityStore.ID_FIELD));
        assertEquals("COMPLETED", store.load("bench-1", "client", "c-0").orElseThrow().getString("state"));

        assertTrue(store.delete("bench-1", "client", "c-1"));
        assertFalse(store.delete("bench-1", "client", "c-1"));
        assertEquals(1, store.loadAll("bench-1", "client").size());
    }

    @Test
    void corruptContainerIsLoggedAndReportedAsEmpty() throws IOException {
        RecordingLogger logger = new RecordingLogger();
        FileEntityStore store = new FileEntityStore(tempDir, logger);
        Path container = tempDir.resolve("bench-1").resolve("service" + FileEntityStore.FILE_SUFFIX);
        Files.createDirectories(container.getParent());
        Files.write(container, new byte[] {1, 2, 3});

        assertTrue(store.loadAll("bench-1", "service").isEmpty());
        assertTrue(store.load("bench-1", "service", "vllm").isEmpty());
        assertFalse(store.save("bench-1", "service", "vllm", Map.of()));
        assertEquals(3, logger.eventsAt("ERROR").size());
    }

    @Test
    void closedLoggerDoesNotTurnFailuresIntoExceptions() throws IOException {
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(new ByteArrayOutputStream());
        logger.close();
        FileEntityStore store = new FileEntityStore(tempDir, logger);
        Path container = tempDir.resolve("bench-1").resolve("client" + FileEntityStore.FILE_SUFFIX);
        Files.createDirectories(container.getParent());
        Files.write(container, new byte[] {9, 9, 9});

        assertFalse(store.save("bench-1", "client", "c-0", Map.of("state", "PENDING")));
        assertTrue(store.loadAll("bench-1", "client").isEmpty());
        assertTrue(store.load("bench-1", "client", "c-0").isEmpty());
        assertFalse(store.delete("bench-1", "client", "c-0"));
    }

    @Test
    void missingRootListsNoCampaigns() {
        assertTrue(new FileEntityStore(tempDir.resolve("absent")).listCampaigns().isEmpty());
    }
}
