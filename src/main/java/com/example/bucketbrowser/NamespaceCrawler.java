package com.example.bucketbrowser;

import com.example.bucketbrowser.store.ObjectStore;
import com.example.bucketbrowser.store.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Breadth-first discovery of every prefix in the namespace, down to a fixed depth.
 */
public final class NamespaceCrawler {
    private static final Logger LOGGER = LoggerFactory.getLogger(NamespaceCrawler.class);
    private static final String ROOT = "";

    private final ObjectStore store;

    public NamespaceCrawler(ObjectStore store) {
        this.store = store;
    }

    /**
     * Returns every prefix whose depth (number of delimiters) is at most {@code maxDepth}. Prefixes at
     * {@code maxDepth} are reported but not expanded. A listing failure below the root abandons that
     * branch only.
     *
     * @throws MetricsRebuildException if the root itself cannot be listed
     */
    public SortedSet<String> discover(int maxDepth) {
        SortedSet<String> discovered = new TreeSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.addLast(ROOT);

        while (!pending.isEmpty()) {
            String current = pending.removeFirst();
            if (depthOf(current) >= maxDepth) {
                continue;
            }

            ObjectStore.ChildListing listing;
            try {
                listing = store.listAllChildren(current);
            } catch (ObjectStoreException ex) {
                if (ROOT.equals(current)) {
                    throw new MetricsRebuildException("Cannot enumerate the namespace root", ex);
                }
                LOGGER.warn("Failed to discover prefixes under {}", current, ex);
                continue;
            }

            for (String child : listing.prefixes()) {
                if (discovered.add(child)) {
                    pending.addLast(child);
                }
            }
        }
        return discovered;
    }

    static int depthOf(String prefix) {
        int depth = 0;
        for (int i = 0; i < prefix.length(); i++) {
            if (prefix.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }
}
