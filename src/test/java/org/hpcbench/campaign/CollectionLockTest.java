package org.hpcbench.campaign;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CollectionLockTest {
    @TempDir
    Path resultsDir;

    @Test
    void secondAcquireFailsUntilReleased() throws IOException {
        Instant now = Instant.parse("2026-06-01T09:00:00Z");
        ResultsLayout layout = new ResultsLayout(resultsDir);
        CollectionLock lock = new CollectionLock(layout, Clock.fixed(now, ZoneOffset.UTC));

        Optional<CollectionLock.Held> first = lock.tryAcquire("bench-1");
        assertTrue(first.isPresent());
        assertTrue(lock.isHeld("bench-1"));
        assertEquals(now.toString(), Files.readString(first.get().marker()));
        assertFalse(lock.tryAcquire("bench-1").isPresent());
        assertTrue(lock.tryAcquire("bench-2").isPresent());

        first.get().close();

        assertFalse(lock.isHeld("bench-1"));
        try (CollectionLock.Held again = lock.tryAcquire("bench-1").orElseThrow()) {
            assertEquals(layout.lockFile("bench-1"), again.marker());
        }
        assertFalse(lock.isHeld("bench-1"));
    }
}
