package com.example.bucketbrowser;

import com.example.bucketbrowser.metadata.MetricsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Read path for directory statistics. Serves lookups from the current snapshot and falls back to a live
 * aggregation for prefixes the snapshot does not cover.
 */
public final class MetricsCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsCache.class);

    private final MetricsSnapshotStore snapshotStore;
    private final StatsAggregator fallback;
    private final AtomicReference<MetricsSnapshot> current;

    private MetricsCache(MetricsSnapshotStore snapshotStore, StatsAggregator fallback, MetricsSnapshot initial) {
        this.snapshotStore = snapshotStore;
        this.fallback = fallback;
        this.current = new AtomicReference<>(initial);
    }

    /**
     * Loads the persisted snapshot if there is a readable one, otherwise starts empty.
     */
    public static MetricsCache open(MetricsSnapshotStore snapshotStore, StatsAggregator fallback, String source) {
        MetricsSnapshot initial = snapshotStore.load().orElseGet(() -> {
            LOGGER.info("No metrics snapshot at {}; directory stats will be computed live", snapshotStore.path());
            return MetricsSnapshot.empty(source);
        });
        return new MetricsCache(snapshotStore, fallback, initial);
    }

    /**
     * Cached stats for {@code prefix}, or a live aggregation when the snapshot has no entry for it.
     */
    public DirectoryStatsSnapshot statsFor(String prefix) {
        return statsFor(current.get(), prefix);
    }

    /**
     * Same as {@link #statsFor(String)} against a snapshot the caller already holds.
     */
    public DirectoryStatsSnapshot statsFor(MetricsSnapshot snapshot, String prefix) {
        Optional<DirectoryStatsSnapshot> cached = snapshot.statsFor(prefix);
        if (cached.isPresent()) {
            return cached.get();
        }
        LOGGER.debug("Metrics cache miss for {}; aggregating live", prefix);
        return fallback.aggregate(prefix);
    }

    public MetricsSnapshot snapshot() {
        return current.get();
    }

    /**
     * Re-reads the persisted snapshot and swaps it in. Keeps the current snapshot if the file is missing
     * or unreadable.
     *
     * @return true if a new snapshot was installed
     */
    public boolean reload() {
        Optional<MetricsSnapshot> loaded = snapshotStore.load();
        if (loaded.isEmpty()) {
            LOGGER.warn("Metrics reload found no readable snapshot at {}; keeping the current one", snapshotStore.path());
            return false;
        }
        current.set(loaded.get());
        LOGGER.info("Loaded metrics snapshot computed at {} ({} prefixes)",
                loaded.get().computedAt(), loaded.get().folderCount());
        return true;
    }
}
