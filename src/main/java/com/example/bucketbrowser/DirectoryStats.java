package com.example.bucketbrowser;

import java.time.Instant;

/**
 * Running totals for the objects under one prefix. Not thread-safe; each aggregation owns its own instance.
 */
public final class DirectoryStats {
    private long totalFiles;
    private long totalBytes;
    private Instant latestModified;

    public DirectoryStats() {
    }

    public void addFile(long size, Instant lastModified) {
        totalFiles++;
        totalBytes = Math.addExact(totalBytes, size);
        if (lastModified != null && (latestModified == null || lastModified.isAfter(latestModified))) {
            latestModified = lastModified;
        }
    }

    public long totalFiles() {
        return totalFiles;
    }

    public long totalBytes() {
        return totalBytes;
    }

    public Instant latestModified() {
        return latestModified;
    }
}
