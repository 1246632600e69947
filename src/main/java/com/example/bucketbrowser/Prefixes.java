package com.example.bucketbrowser;

import com.example.bucketbrowser.metadata.Breadcrumb;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * String helpers for prefixes and their display.
 */
public final class Prefixes {
    private static final long KB = 1024L;
    private static final long MB = KB * 1024L;
    private static final long GB = MB * 1024L;

    private Prefixes() {
    }

    /**
     * Parent prefix of a key or prefix; empty for top-level entries and null for the root itself.
     */
    public static String parentOf(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        String trimmed = stripTrailingDelimiter(path);
        int slash = trimmed.lastIndexOf('/');
        return slash < 0 ? "" : trimmed.substring(0, slash + 1);
    }

    /**
     * Display name of a child prefix or key relative to its parent, without the trailing delimiter. A prefix
     * such as {@code a//} is the empty-named child of {@code a/}.
     */
    public static String nameOf(String path) {
        String trimmed = stripTrailingDelimiter(path);
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    public static List<Breadcrumb> breadcrumbs(String prefix) {
        List<Breadcrumb> crumbs = new ArrayList<>();
        if (prefix == null || prefix.isEmpty()) {
            return crumbs;
        }
        StringBuilder current = new StringBuilder();
        for (String part : stripTrailingDelimiter(prefix).split("/", -1)) {
            current.append(part).append('/');
            crumbs.add(new Breadcrumb(part, current.toString()));
        }
        return crumbs;
    }

    public static String formatSize(long bytes) {
        if (bytes < KB) {
            return bytes + " B";
        } else if (bytes < MB) {
            return String.format(Locale.ROOT, "%.1f KB", bytes / (double) KB);
        } else if (bytes < GB) {
            return String.format(Locale.ROOT, "%.1f MB", bytes / (double) MB);
        }
        return String.format(Locale.ROOT, "%.2f GB", bytes / (double) GB);
    }

    private static String stripTrailingDelimiter(String path) {
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
