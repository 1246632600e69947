package com.example.bucketbrowser.store;

import com.example.bucketbrowser.metadata.ObjectMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link ObjectStore} over a local directory tree. Each regular file is an object whose key is its path
 * relative to the root, with {@code /} separators. Directories only appear as prefixes when they hold at
 * least one file, the same way a bucket never reports an empty prefix.
 *
 * <p>One-level listings page by offset; recursive listings resume after the last key returned. Symbolic
 * links are ignored.
 */
public final class LocalDirectoryObjectStore implements ObjectStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalDirectoryObjectStore.class);

    private final Path root;
    private final int pageSize;
    private final ContentTypeDetector detector;

    public LocalDirectoryObjectStore(Path root, int pageSize, ContentTypeDetector detector) {
        this.root = root.toAbsolutePath().normalize();
        this.pageSize = pageSize;
        this.detector = detector;
    }

    @Override
    public ChildListing listChildren(String prefix, String continuationToken) {
        Path directory = parentDirectoryOf(prefix);
        List<Node> entries = new ArrayList<>();
        if (directory != null && Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
            for (Node node : sortedChildren(directory)) {
                if (node.key().startsWith(prefix) && (!node.directory() || containsFile(node.path()))) {
                    entries.add(node);
                }
            }
        }

        int start = offsetOf(continuationToken);
        int end = Math.min(entries.size(), start + pageSize);
        List<String> prefixes = new ArrayList<>();
        List<ObjectMeta> objects = new ArrayList<>();
        for (Node node : entries.subList(Math.min(start, end), end)) {
            if (node.directory()) {
                prefixes.add(node.key());
            } else {
                objects.add(metaFor(node.path(), node.key(), false));
            }
        }
        return new ChildListing(prefixes, objects, end < entries.size() ? String.valueOf(end) : null);
    }

    /**
     * Walks the tree depth-first in key order and stops after one page. The continuation token is the last
     * key returned, and subtrees that sort entirely at or before it are skipped without being opened.
     */
    @Override
    public ObjectPage listRecursive(String prefix, String continuationToken) {
        Path directory = parentDirectoryOf(prefix);
        if (directory == null || !Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
            return new ObjectPage(List.of(), null);
        }
        String startAfter = continuationToken == null || continuationToken.isEmpty() ? null : continuationToken;
        List<ObjectMeta> objects = new ArrayList<>();
        boolean truncated = collectPage(directory, prefix, startAfter, objects);
        return new ObjectPage(objects, truncated ? objects.get(objects.size() - 1).key() : null);
    }

    @Override
    public Optional<ObjectMeta> probeObject(String key) {
        Path path = resolveKey(key);
        if (path == null || key.endsWith(DELIMITER) || !Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
            return Optional.empty();
        }
        return Optional.of(metaFor(path, key, true));
    }

    @Override
    public InputStream openObject(String key) {
        Path path = resolveKey(key);
        if (path == null) {
            throw new ObjectStoreException("Key escapes the store root: " + key);
        }
        try {
            return Files.newInputStream(path);
        } catch (IOException ex) {
            throw new ObjectStoreException("Failed to open " + key, ex);
        }
    }

    @Override
    public URL issueTemporaryUrl(String key, Duration ttl) {
        Path path = resolveKey(key);
        if (path == null) {
            throw new ObjectStoreException("Key escapes the store root: " + key);
        }
        try {
            // Local files carry no expiring credentials; the ttl does not apply.
            return path.toUri().toURL();
        } catch (MalformedURLException ex) {
            throw new ObjectStoreException("Failed to build URL for " + key, ex);
        }
    }

    private ObjectMeta metaFor(Path path, String key, boolean inspectContent) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            String contentType = inspectContent ? detector.detect(path) : detector.detect(path.getFileName().toString());
            return new ObjectMeta(key, attrs.size(), attrs.lastModifiedTime().toInstant(), contentType);
        } catch (IOException ex) {
            throw new ObjectStoreException("Failed to read attributes for " + key, ex);
        }
    }

    /**
     * Fills {@code page} with the keys under {@code prefix} that sort after {@code startAfter}. Returns true
     * when the page filled up before the walk ran out of keys.
     */
    private boolean collectPage(Path directory, String prefix, String startAfter, List<ObjectMeta> page) {
        for (Node node : sortedChildren(directory)) {
            String key = node.key();
            if (node.directory()) {
                boolean overlapsPrefix = key.startsWith(prefix) || prefix.startsWith(key);
                boolean alreadyListed = startAfter != null && startAfter.compareTo(key) > 0 && !startAfter.startsWith(key);
                if (overlapsPrefix && !alreadyListed && collectPage(node.path(), prefix, startAfter, page)) {
                    return true;
                }
            } else if (key.startsWith(prefix) && (startAfter == null || key.compareTo(startAfter) > 0)) {
                if (page.size() == pageSize) {
                    return true;
                }
                page.add(metaFor(node.path(), key, false));
            }
        }
        return false;
    }

    // Directories carry their trailing delimiter, so sorting by key matches the order of the keys inside them.
    private List<Node> sortedChildren(Path directory) {
        List<Node> nodes = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path child : stream) {
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    nodes.add(new Node(child, keyOf(child) + DELIMITER, true));
                } else if (Files.isRegularFile(child, LinkOption.NOFOLLOW_LINKS)) {
                    nodes.add(new Node(child, keyOf(child), false));
                }
            }
        } catch (IOException ex) {
            throw new ObjectStoreException("Failed to list " + directory, ex);
        }
        nodes.sort((left, right) -> left.key().compareTo(right.key()));
        return nodes;
    }

    private boolean containsFile(Path directory) {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.anyMatch(path -> Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS));
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.warn("Failed to inspect {}", directory, ex);
            return false;
        }
    }

    private Path parentDirectoryOf(String prefix) {
        int slash = prefix.lastIndexOf('/');
        return slash < 0 ? root : resolveKey(prefix.substring(0, slash));
    }

    private Path resolveKey(String key) {
        Path resolved = root.resolve(key).normalize();
        return resolved.startsWith(root) ? resolved : null;
    }

    private String keyOf(Path path) {
        return root.relativize(path.toAbsolutePath().normalize()).toString().replace("\\", "/");
    }

    private int offsetOf(String continuationToken) {
        if (continuationToken == null || continuationToken.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(continuationToken);
        } catch (NumberFormatException ex) {
            throw new ObjectStoreException("Invalid continuation token: " + continuationToken, ex);
        }
    }

    private record Node(Path path, String key, boolean directory) {
    }
}
