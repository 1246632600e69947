package com.example.bucketbrowser.metadata;

/**
 * A child file in a {@link DirectoryView}.
 */
public record FileEntry(
        String name,
        ObjectMeta meta
) {
}
