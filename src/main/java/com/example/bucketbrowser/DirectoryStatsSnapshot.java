package com.example.bucketbrowser;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Recursive size, object count and latest modification time for a prefix.
 * {@code modified} is null when no object lives under the prefix.
 */
public record DirectoryStatsSnapshot(
        long size,
        long count,
        Instant modified
) {
    public static final DirectoryStatsSnapshot EMPTY = new DirectoryStatsSnapshot(0L, 0L, null);

    /**
     * Creates an immutable snapshot of the running totals.
     */
    public static DirectoryStatsSnapshot from(DirectoryStats stats) {
        return new DirectoryStatsSnapshot(stats.totalBytes(), stats.totalFiles(), stats.latestModified());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return count == 0;
    }
}
