package com.example.bucketbrowser;

import com.example.bucketbrowser.store.ObjectStore;

/**
 * Computes recursive statistics for a prefix by streaming the flat listing of every object below it.
 */
public final class StatsAggregator {
    private final ObjectStore store;

    public StatsAggregator(ObjectStore store) {
        this.store = store;
    }

    /**
     * Walks every object whose key starts with {@code prefix}; the empty prefix covers the whole namespace.
     *
     * @throws com.example.bucketbrowser.store.ObjectStoreException if any page of the listing fails
     */
    public DirectoryStatsSnapshot aggregate(String prefix) {
        DirectoryStats stats = new DirectoryStats();
        store.forEachObject(prefix, object -> stats.addFile(object.size(), object.lastModified()));
        return DirectoryStatsSnapshot.from(stats);
    }
}
