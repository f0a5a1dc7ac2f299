package org.hpcbench.campaign;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Marker file that serializes artifact collection per campaign across processes.
 */
public final class CollectionLock {
    private final ResultsLayout layout;
    private final Clock clock;

    public CollectionLock(ResultsLayout layout, Clock clock) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates the marker atomically.
     *
     * @return empty when another collection already holds it
     */
    public Optional<Held> tryAcquire(String campaignId) {
        Path marker = layout.lockFile(campaignId);
        try {
            Files.createDirectories(marker.getParent());
            Files.writeString(
                Files.createFile(marker),
                clock.instant().toString(),
                StandardCharsets.UTF_8);
            return Optional.of(new Held(marker));
        } catch (FileAlreadyExistsException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to create collection marker " + marker, e);
        }
    }

    public boolean isHeld(String campaignId) {
        return Files.exists(layout.lockFile(campaignId));
    }

    public static final class Held implements AutoCloseable {
        private final Path marker;

        private Held(Path marker) {
            this.marker = marker;
        }

        public Path marker() {
            return marker;
        }

        @Override
        public void close() {
            try {
                Files.deleteIfExists(marker);
            } catch (IOException e) {
                throw new UncheckedIOException("failed to remove collection marker " + marker, e);
            }
        }
    }
}
