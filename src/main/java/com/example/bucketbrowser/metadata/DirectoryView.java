package com.example.bucketbrowser.metadata;

import java.util.List;

/**
 * One level of the virtual directory tree, ready for display.
 * Totals combine the recursive stats of child directories with the sizes of child files.
 */
public record DirectoryView(
        String prefix,
        String parent,
        List<Breadcrumb> breadcrumbs,
        List<DirectoryEntry> directories,
        List<FileEntry> files,
        long totalSize,
        long totalFiles
) {
    public DirectoryView {
        breadcrumbs = List.copyOf(breadcrumbs);
        directories = List.copyOf(directories);
        files = List.copyOf(files);
    }

    public int folderCount() {
        return directories.size();
    }

    public int fileCount() {
        return files.size();
    }
}
