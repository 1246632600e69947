package com.example.bucketbrowser;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class ConfigLoader {
    private static final int DEFAULT_MAX_DEPTH = 4;
    private static final int DEFAULT_LIST_PAGE_SIZE = 1000;
    private static final long DEFAULT_DOWNLOAD_URL_TTL_SECONDS = 3600;
    private static final long DEFAULT_STORE_CALL_TIMEOUT_SECONDS = 30;
    private static final String DEFAULT_SNAPSHOT_FILE = "metrics.json";
    private static final String DEFAULT_INLINE_MARKER = "view";
    // Top-level names taken by non-browsing routes.
    private static final List<String> DEFAULT_RESERVED_SEGMENTS = List.of(
            "docs",
            "public",
            "view",
            "download"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public BrowserConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        BrowserConfig.StoreType storeType = parseStoreType(raw.storeType);
        Optional<String> bucket = Optional.ofNullable(raw.bucket).filter(value -> !value.isBlank());
        Optional<String> region = Optional.ofNullable(raw.region).filter(value -> !value.isBlank());
        Optional<Path> localRoot = Optional.ofNullable(raw.localRoot).filter(value -> !value.isBlank()).map(Path::of);
        if (storeType == BrowserConfig.StoreType.S3 && bucket.isEmpty()) {
            throw new IllegalArgumentException("bucket is required when storeType is s3.");
        }
        if (storeType == BrowserConfig.StoreType.LOCAL && localRoot.isEmpty()) {
            throw new IllegalArgumentException("localRoot is required when storeType is local.");
        }

        Path snapshotFile = Path.of(optionalString(raw.snapshotFile, DEFAULT_SNAPSHOT_FILE));
        String defaultSource = storeType == BrowserConfig.StoreType.S3
                ? bucket.orElseThrow()
                : localRoot.orElseThrow().toAbsolutePath().normalize().toString();
        String source = optionalString(raw.source, defaultSource);
        int maxDepth = raw.maxDepth != null && raw.maxDepth > 0
                ? raw.maxDepth
                : DEFAULT_MAX_DEPTH;
        int threadCount = raw.threadCount != null && raw.threadCount > 0
                ? raw.threadCount
                : Math.max(1, Runtime.getRuntime().availableProcessors());
        int listPageSize = raw.listPageSize != null && raw.listPageSize > 0
                ? raw.listPageSize
                : DEFAULT_LIST_PAGE_SIZE;
        Duration downloadUrlTtl = Duration.ofSeconds(raw.downloadUrlTtlSeconds != null && raw.downloadUrlTtlSeconds > 0
                ? raw.downloadUrlTtlSeconds
                : DEFAULT_DOWNLOAD_URL_TTL_SECONDS);
        Duration storeCallTimeout = Duration.ofSeconds(raw.storeCallTimeoutSeconds != null && raw.storeCallTimeoutSeconds > 0
                ? raw.storeCallTimeoutSeconds
                : DEFAULT_STORE_CALL_TIMEOUT_SECONDS);
        String inlineMarker = optionalString(raw.inlineMarker, DEFAULT_INLINE_MARKER);
        List<String> reservedSegments = mergeSegments(DEFAULT_RESERVED_SEGMENTS, raw.reservedSegments);

        return new BrowserConfig(
                storeType,
                bucket,
                region,
                localRoot,
                snapshotFile,
                source,
                maxDepth,
                threadCount,
                listPageSize,
                downloadUrlTtl,
                storeCallTimeout,
                inlineMarker,
                reservedSegments
        );
    }

    private BrowserConfig.StoreType parseStoreType(String value) {
        if (value == null || value.isBlank()) {
            return BrowserConfig.StoreType.S3;
        }
        try {
            return BrowserConfig.StoreType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported storeType: " + value, ex);
        }
    }

    private List<String> mergeSegments(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String segment : overrides) {
                if (segment == null || segment.isBlank() || merged.contains(segment)) {
                    continue;
                }
                merged.add(segment);
            }
        }
        return List.copyOf(merged);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String storeType;
        public String bucket;
        public String region;
        public String localRoot;
        public String snapshotFile;
        public String source;
        public Integer maxDepth;
        public Integer threadCount;
        public Integer listPageSize;
        public Long downloadUrlTtlSeconds;
        public Long storeCallTimeoutSeconds;
        public String inlineMarker;
        public List<String> reservedSegments;
    }
}
