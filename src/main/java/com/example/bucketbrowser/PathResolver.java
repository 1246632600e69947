package com.example.bucketbrowser;

import com.example.bucketbrowser.metadata.ObjectMeta;
import com.example.bucketbrowser.store.ContentTypeDetector;
import com.example.bucketbrowser.store.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides what a request path denotes and where the client should go.
 *
 * <p>Paths ending with the delimiter are directories, empty or not. Other paths are probed as an exact key
 * first; only when no such object exists is the path tried as a directory, which then has to be redirected
 * to its delimited form. An object stored under the exact key therefore shadows a directory of the same
 * name.
 *
 * <p>Store failures propagate as {@link com.example.bucketbrowser.store.ObjectStoreException}; a missing
 * path is a {@link Resolution.Kind#NOT_FOUND} result.
 */
public final class PathResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(PathResolver.class);
    static final String LEGACY_PATH_PARAMETER = "path";

    private final ObjectStore store;
    private final DirectoryViewBuilder viewBuilder;
    private final Set<String> reservedSegments;
    private final String inlineMarker;
    private final Duration downloadUrlTtl;

    public PathResolver(ObjectStore store,
                        DirectoryViewBuilder viewBuilder,
                        List<String> reservedSegments,
                        String inlineMarker,
                        Duration downloadUrlTtl) {
        this.store = store;
        this.viewBuilder = viewBuilder;
        this.reservedSegments = Set.copyOf(reservedSegments);
        this.inlineMarker = inlineMarker;
        this.downloadUrlTtl = downloadUrlTtl;
    }

    public Resolution resolve(BrowseRequest request) {
        String path = stripLeadingDelimiter(request.path());

        if (path.isEmpty()) {
            String legacy = request.query().get(LEGACY_PATH_PARAMETER);
            if (legacy != null && !stripLeadingDelimiter(legacy).isEmpty()) {
                return Resolution.redirect(path, stripLeadingDelimiter(legacy), true);
            }
        }

        if (isReserved(path)) {
            return Resolution.notFound(path);
        }

        if (path.isEmpty() || path.endsWith(ObjectStore.DELIMITER)) {
            return Resolution.directory(path, viewBuilder.view(path));
        }

        Optional<ObjectMeta> object = store.probeObject(path);
        if (object.isPresent()) {
            return resolveFile(path, object.get(), request.hasParameter(inlineMarker));
        }

        if (isNonEmptyPrefix(path + ObjectStore.DELIMITER)) {
            return Resolution.redirect(path, path + ObjectStore.DELIMITER, true);
        }
        return Resolution.notFound(path);
    }

    /**
     * Classifies {@code path} without building a directory view.
     */
    public PathState classify(String rawPath) {
        String path = stripLeadingDelimiter(rawPath);
        if (isReserved(path)) {
            return PathState.NOT_FOUND;
        }
        if (path.isEmpty() || path.endsWith(ObjectStore.DELIMITER)) {
            return PathState.IS_DIR;
        }
        if (store.probeObject(path).isPresent()) {
            return PathState.IS_FILE;
        }
        if (isNonEmptyPrefix(path + ObjectStore.DELIMITER)) {
            return PathState.IS_DIR_NO_SLASH;
        }
        return PathState.NOT_FOUND;
    }

    /**
     * Temporary download URL for an object, valid for the configured TTL.
     */
    public URL temporaryUrlFor(String key) {
        return store.issueTemporaryUrl(key, downloadUrlTtl);
    }

    private Resolution resolveFile(String path, ObjectMeta meta, boolean inlineRequested) {
        if (!inlineRequested) {
            return Resolution.file(path, meta);
        }
        if (ContentTypeDetector.isJson(meta)) {
            return Resolution.inlineJson(path, meta);
        }
        LOGGER.debug("Inline rendering not available for {} ({}); redirecting to the file", path, meta.contentType());
        return Resolution.redirect(path, path, false);
    }

    private boolean isNonEmptyPrefix(String prefix) {
        return !store.listChildren(prefix, null).isEmpty();
    }

    private boolean isReserved(String path) {
        int slash = path.indexOf('/');
        String first = slash < 0 ? path : path.substring(0, slash);
        return reservedSegments.contains(first);
    }

    private static String stripLeadingDelimiter(String path) {
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            start++;
        }
        return path.substring(start);
    }
}
