package com.example.bucketbrowser.metadata;

import com.example.bucketbrowser.DirectoryStatsSnapshot;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Point-in-time directory statistics for a whole namespace. Never mutated after construction.
 */
public record MetricsSnapshot(
        Instant computedAt,
        String source,
        int folderCount,
        Map<String, DirectoryStatsSnapshot> metrics
) {
    public MetricsSnapshot {
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metrics));
    }

    public static MetricsSnapshot of(Instant computedAt, String source, Map<String, DirectoryStatsSnapshot> metrics) {
        return new MetricsSnapshot(computedAt, source, metrics.size(), metrics);
    }

    public static MetricsSnapshot empty(String source) {
        return new MetricsSnapshot(null, source, 0, Map.of());
    }

    public Optional<DirectoryStatsSnapshot> statsFor(String prefix) {
        return Optional.ofNullable(metrics.get(prefix));
    }
}
