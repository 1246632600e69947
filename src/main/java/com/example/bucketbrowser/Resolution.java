package com.example.bucketbrowser;

import com.example.bucketbrowser.metadata.DirectoryView;
import com.example.bucketbrowser.metadata.ObjectMeta;

/**
 * Outcome of resolving a browse request. Only the fields relevant to {@link #kind()} are set.
 */
public record Resolution(
        Kind kind,
        String path,
        ObjectMeta meta,
        DirectoryView view,
        String redirectTarget,
        boolean permanent
) {
    public enum Kind {
        /** Serve the object (content passthrough or a temporary download URL). */
        FILE,
        /** Render a JSON object inline. */
        INLINE_JSON,
        DIRECTORY,
        REDIRECT,
        NOT_FOUND
    }

    public static Resolution file(String path, ObjectMeta meta) {
        return new Resolution(Kind.FILE, path, meta, null, null, false);
    }

    public static Resolution inlineJson(String path, ObjectMeta meta) {
        return new Resolution(Kind.INLINE_JSON, path, meta, null, null, false);
    }

    public static Resolution directory(String path, DirectoryView view) {
        return new Resolution(Kind.DIRECTORY, path, null, view, null, false);
    }

    public static Resolution redirect(String path, String target, boolean permanent) {
        return new Resolution(Kind.REDIRECT, path, null, null, target, permanent);
    }

    public static Resolution notFound(String path) {
        return new Resolution(Kind.NOT_FOUND, path, null, null, null, false);
    }
}
