package com.example.bucketbrowser;

import com.example.bucketbrowser.metadata.MetricsSnapshot;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Persists metrics snapshots to a single JSON file. Each write goes to its own uniquely named sibling
 * temporary file that is then moved over the canonical path, so readers see either the old file or the new
 * one and concurrent writers never share a temporary file.
 */
public final class MetricsSnapshotStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsSnapshotStore.class);

    private final ObjectMapper mapper;
    private final Path snapshotPath;

    public MetricsSnapshotStore(Path snapshotPath) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.snapshotPath = snapshotPath;
    }

    /**
     * Returns the persisted snapshot. A missing, unreadable or {@code null} document yields empty, as does
     * a document followed by anything but whitespace.
     */
    public Optional<MetricsSnapshot> load() {
        if (!Files.exists(snapshotPath)) {
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(snapshotPath)) {
            MetricsSnapshot snapshot = mapper.readValue(reader, MetricsSnapshot.class);
            if (snapshot == null) {
                LOGGER.warn("Ignoring null metrics snapshot {}", snapshotPath);
            }
            return Optional.ofNullable(snapshot);
        } catch (IOException ex) {
            LOGGER.warn("Ignoring unreadable metrics snapshot {}", snapshotPath, ex);
            return Optional.empty();
        }
    }

    public void save(MetricsSnapshot snapshot) throws IOException {
        Path parent = snapshotPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, snapshotPath.getFileName() + ".", ".tmp");
        boolean moved = false;
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            Files.move(temp, snapshotPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            moved = true;
        } finally {
            if (!moved) {
                deleteQuietly(temp);
            }
        }
    }

    public Path path() {
        return snapshotPath;
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            LOGGER.warn("Failed to remove temporary snapshot {}", temp, ex);
        }
    }
}
