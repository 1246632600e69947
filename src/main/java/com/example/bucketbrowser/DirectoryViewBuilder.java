package com.example.bucketbrowser;

import com.example.bucketbrowser.metadata.DirectoryEntry;
import com.example.bucketbrowser.metadata.DirectoryView;
import com.example.bucketbrowser.metadata.FileEntry;
import com.example.bucketbrowser.metadata.MetricsSnapshot;
import com.example.bucketbrowser.metadata.ObjectMeta;
import com.example.bucketbrowser.store.ObjectStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds one level of the directory tree from a delimited listing, joined with cached statistics for
 * each child directory. The subtree is never walked here; recursive numbers come from {@link MetricsCache}.
 */
public final class DirectoryViewBuilder {
    private static final Comparator<String> BY_NAME = String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    private final ObjectStore store;
    private final MetricsCache metricsCache;

    public DirectoryViewBuilder(ObjectStore store, MetricsCache metricsCache) {
        this.store = store;
        this.metricsCache = metricsCache;
    }

    public DirectoryView view(String prefix) {
        MetricsSnapshot snapshot = metricsCache.snapshot();
        ObjectStore.ChildListing listing = store.listAllChildren(prefix);

        List<DirectoryEntry> directories = new ArrayList<>();
        long totalSize = 0L;
        long totalFiles = 0L;
        for (String childPrefix : listing.prefixes()) {
            DirectoryStatsSnapshot stats = metricsCache.statsFor(snapshot, childPrefix);
            directories.add(new DirectoryEntry(Prefixes.nameOf(childPrefix), childPrefix, stats));
            totalSize += stats.size();
            totalFiles += stats.count();
        }

        List<FileEntry> files = new ArrayList<>();
        for (ObjectMeta object : listing.objects()) {
            if (object.key().equals(prefix)) {
                // Marker some tools create for "folders": hidden from the files, still counted in the totals.
                totalSize += object.size();
                totalFiles++;
                continue;
            }
            String name = object.key().substring(prefix.length());
            if (name.contains(ObjectStore.DELIMITER)) {
                continue;
            }
            files.add(new FileEntry(name, object));
            totalSize += object.size();
            totalFiles++;
        }

        directories.sort(Comparator.comparing(DirectoryEntry::name, BY_NAME));
        files.sort(Comparator.comparing(FileEntry::name, BY_NAME));
        return new DirectoryView(
                prefix,
                Prefixes.parentOf(prefix),
                Prefixes.breadcrumbs(prefix),
                directories,
                files,
                totalSize,
                totalFiles
        );
    }
}
