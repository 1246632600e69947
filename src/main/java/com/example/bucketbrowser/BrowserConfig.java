package com.example.bucketbrowser;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Immutable runtime settings for the browser and its metrics job.
 */
public record BrowserConfig(
        StoreType storeType,
        Optional<String> bucket,
        Optional<String> region,
        Optional<Path> localRoot,
        Path snapshotFile,
        String source,
        int maxDepth,
        int threadCount,
        int listPageSize,
        Duration downloadUrlTtl,
        Duration storeCallTimeout,
        String inlineMarker,
        List<String> reservedSegments
) {
    public enum StoreType {
        S3,
        LOCAL
    }
}
