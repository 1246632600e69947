package com.example.bucketbrowser.metadata;

import java.time.Instant;

/**
 * Metadata describing a single stored object, as reported by the object store.
 */
public record ObjectMeta(
        String key,
        long size,
        Instant lastModified,
        String contentType
) {
    public ObjectMeta(String key, long size, Instant lastModified) {
        this(key, size, lastModified, null);
    }

    /**
     * Returns the last path segment of the key.
     */
    public String name() {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(slash + 1);
    }
}
