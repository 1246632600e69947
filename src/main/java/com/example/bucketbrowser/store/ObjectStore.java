package com.example.bucketbrowser.store;

import com.example.bucketbrowser.metadata.ObjectMeta;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Read-only view of a flat, prefix-addressed object store.
 *
 * <p>Delimited (one level) and recursive listings are separate operations. Browsing code only ever
 * calls {@link #listChildren}; {@link #listRecursive} walks every key under a prefix and is reserved for
 * statistics aggregation.
 *
 * <p>All methods throw {@link ObjectStoreException} when the store cannot be reached or rejects the call.
 */
public interface ObjectStore {
    String DELIMITER = "/";

    record ChildListing(List<String> prefixes, List<ObjectMeta> objects, String nextContinuationToken) {
        public ChildListing {
            prefixes = List.copyOf(prefixes);
            objects = List.copyOf(objects);
        }

        public boolean isEmpty() {
            return prefixes.isEmpty() && objects.isEmpty();
        }
    }

    record ObjectPage(List<ObjectMeta> objects, String nextContinuationToken) {
        public ObjectPage {
            objects = List.copyOf(objects);
        }
    }

    /**
     * Lists the immediate child prefixes and objects of {@code prefix} using {@link #DELIMITER}.
     * A null continuation token requests the first page.
     */
    ChildListing listChildren(String prefix, String continuationToken);

    /**
     * Lists every object whose key starts with {@code prefix}, at any depth.
     */
    ObjectPage listRecursive(String prefix, String continuationToken);

    /**
     * Returns the metadata of the object stored under exactly {@code key}, or empty if there is none.
     */
    Optional<ObjectMeta> probeObject(String key);

    /**
     * Opens the content of an object. The caller closes the stream.
     */
    InputStream openObject(String key);

    /**
     * Issues a URL granting temporary read access to an object.
     */
    URL issueTemporaryUrl(String key, Duration ttl);

    /**
     * Streams every object under {@code prefix} to {@code action}, one page at a time.
     */
    default void forEachObject(String prefix, Consumer<ObjectMeta> action) {
        String token = null;
        do {
            ObjectPage page = listRecursive(prefix, token);
            page.objects().forEach(action);
            token = page.nextContinuationToken();
        } while (token != null);
    }

    /**
     * Collects every page of the one-level listing of {@code prefix}.
     */
    default ChildListing listAllChildren(String prefix) {
        List<String> prefixes = new ArrayList<>();
        List<ObjectMeta> objects = new ArrayList<>();
        String token = null;
        do {
            ChildListing page = listChildren(prefix, token);
            prefixes.addAll(page.prefixes());
            objects.addAll(page.objects());
            token = page.nextContinuationToken();
        } while (token != null);
        return new ChildListing(prefixes, objects, null);
    }
}
