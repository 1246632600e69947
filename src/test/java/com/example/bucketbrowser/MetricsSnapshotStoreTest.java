package com.example.bucketbrowser;

import com.example.bucketbrowser.metadata.MetricsSnapshot;
import org.junit.jupiter.api.Test;

import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsSnapshotStoreTest {
    @Test
    void reloadReproducesEveryPrefix() throws Exception {
        Path dir = Files.createTempDirectory("snapshot-store");
        MetricsSnapshotStore store = new MetricsSnapshotStore(dir.resolve("metrics.json"));
        MetricsSnapshot snapshot = MetricsSnapshot.of(
                Instant.parse("2024-05-01T10:15:30Z"),
                "translator-ingests",
                Map.of(
                        "a/", new DirectoryStatsSnapshot(3_221_225_472L, 12L, Instant.parse("2024-04-30T08:00:00Z")),
                        "a/b/", new DirectoryStatsSnapshot(17L, 1L, Instant.parse("2024-04-29T08:00:00.123456789Z"))
                ));

        store.save(snapshot);
        Optional<MetricsSnapshot> loaded = store.load();

        assertTrue(loaded.isPresent());
        assertEquals(snapshot, loaded.get());
        assertEquals(2, loaded.get().folderCount());
        assertEquals(List.of("metrics.json"), fileNames(dir));
    }

    @Test
    void writesTimestampsAsIsoStrings() throws Exception {
        Path file = Files.createTempDirectory("snapshot-store").resolve("metrics.json");
        new MetricsSnapshotStore(file).save(MetricsSnapshot.of(
                Instant.parse("2024-05-01T10:15:30Z"),
                "bucket",
                Map.of("a/", new DirectoryStatsSnapshot(1L, 1L, Instant.parse("2024-04-30T08:00:00Z")))));

        String json = Files.readString(file);

        assertTrue(json.contains("\"computedAt\" : \"2024-05-01T10:15:30Z\""), json);
        assertTrue(json.contains("\"modified\" : \"2024-04-30T08:00:00Z\""), json);
    }

    @Test
    void missingFileLoadsAsEmpty() throws Exception {
        Path dir = Files.createTempDirectory("snapshot-store");

        assertTrue(new MetricsSnapshotStore(dir.resolve("absent.json")).load().isEmpty());
    }

    @Test
    void corruptFileLoadsAsEmpty() throws Exception {
        Path file = Files.createTempDirectory("snapshot-store").resolve("metrics.json");
        MetricsSnapshotStore store = new MetricsSnapshotStore(file);

        Files.writeString(file, "{\"computedAt\": \"2024-05-01T10:15:30Z\", \"metrics\": {\"a/\": ");
        assertTrue(store.load().isEmpty());

        Files.writeString(file, "null");
        assertTrue(store.load().isEmpty());

        Files.writeString(file, "");
        assertTrue(store.load().isEmpty());
    }

    @Test
    void documentWithTrailingContentLoadsAsEmpty() throws Exception {
        Path file = Files.createTempDirectory("snapshot-store").resolve("metrics.json");
        MetricsSnapshotStore store = new MetricsSnapshotStore(file);
        store.save(MetricsSnapshot.of(Instant.EPOCH, "bucket", Map.of()));

        Files.writeString(file, " \"new/\" : {\"size\" : 2} } }", StandardOpenOption.APPEND);

        assertTrue(store.load().isEmpty());
    }

    @Test
    void unfinishedForeignTemporaryFileDoesNotLeakIntoTheSnapshot() throws Exception {
        Path dir = Files.createTempDirectory("snapshot-store");
        Path file = dir.resolve("metrics.json");
        MetricsSnapshotStore store = new MetricsSnapshotStore(file);
        MetricsSnapshot saved = MetricsSnapshot.of(Instant.EPOCH, "bucket",
                Map.of("new/", new DirectoryStatsSnapshot(2L, 1L, Instant.EPOCH)));

        try (Writer other = Files.newBufferedWriter(dir.resolve("metrics.json.tmp"))) {
            other.write("{\"computedAt\" : null,");
            other.flush();
            store.save(saved);
            other.write(" \"metrics\" : { } }");
        }

        assertEquals(saved, store.load().orElseThrow());
    }

    @Test
    void concurrentWritersLeaveOneCompleteSnapshot() throws Exception {
        Path dir = Files.createTempDirectory("snapshot-store");
        Path file = dir.resolve("metrics.json");
        MetricsSnapshot first = MetricsSnapshot.of(Instant.EPOCH, "bucket",
                Map.of("first/", new DirectoryStatsSnapshot(1L, 1L, Instant.EPOCH)));
        MetricsSnapshot second = MetricsSnapshot.of(Instant.EPOCH, "bucket",
                Map.of("second/", new DirectoryStatsSnapshot(2L, 2L, Instant.EPOCH),
                        "second/deeper/", new DirectoryStatsSnapshot(1L, 1L, Instant.EPOCH)));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> a = executor.submit(() -> saveRepeatedly(new MetricsSnapshotStore(file), first));
            Future<?> b = executor.submit(() -> saveRepeatedly(new MetricsSnapshotStore(file), second));
            a.get();
            b.get();
        } finally {
            executor.shutdownNow();
        }

        MetricsSnapshot loaded = new MetricsSnapshotStore(file).load().orElseThrow();
        assertTrue(loaded.equals(first) || loaded.equals(second), loaded.toString());
        assertEquals(List.of("metrics.json"), fileNames(dir));
    }

    @Test
    void saveReplacesPreviousSnapshot() throws Exception {
        Path file = Files.createTempDirectory("snapshot-store").resolve("nested").resolve("metrics.json");
        MetricsSnapshotStore store = new MetricsSnapshotStore(file);
        store.save(MetricsSnapshot.of(Instant.EPOCH, "bucket", Map.of("old/", new DirectoryStatsSnapshot(1L, 1L, Instant.EPOCH))));
        store.save(MetricsSnapshot.of(Instant.EPOCH, "bucket", Map.of("new/", new DirectoryStatsSnapshot(2L, 1L, Instant.EPOCH))));

        MetricsSnapshot loaded = store.load().orElseThrow();

        assertEquals(Map.of("new/", new DirectoryStatsSnapshot(2L, 1L, Instant.EPOCH)), loaded.metrics());
    }

    private static Void saveRepeatedly(MetricsSnapshotStore store, MetricsSnapshot snapshot) throws Exception {
        for (int i = 0; i < 50; i++) {
            store.save(snapshot);
            assertTrue(store.load().isPresent());
        }
        return null;
    }

    private static List<String> fileNames(Path dir) throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(path -> path.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }
}
