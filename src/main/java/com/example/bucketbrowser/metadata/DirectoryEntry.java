package com.example.bucketbrowser.metadata;

import com.example.bucketbrowser.DirectoryStatsSnapshot;

/**
 * A child directory in a {@link DirectoryView}, with its recursive statistics.
 */
public record DirectoryEntry(
        String name,
        String prefix,
        DirectoryStatsSnapshot stats
) {
}
