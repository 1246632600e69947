package com.example.bucketbrowser;

import com.example.bucketbrowser.metadata.DirectoryEntry;
import com.example.bucketbrowser.store.InMemoryObjectStore;
import com.example.bucketbrowser.store.ObjectStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathResolverTest {
    private static final Instant T1 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryObjectStore store;
    private PathResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryObjectStore()
                .put("a/b/c.txt", 12, T1)
                .put("a/b/d.txt", 8, T1)
                .put("a/file", 3, T1)
                .put("docs/guide.md", 1, T1)
                .put("docs", 1, T1)
                .put("file.json", "{\"name\":\"kgx\",\"edges\":[1,2]}", "application/json", T1)
                .put("notes.txt", "plain", "text/plain", T1)
                .put("data.bin", "xx", null, T1);
        MetricsSnapshotStore snapshotStore = new MetricsSnapshotStore(Files.createTempDirectory("resolver").resolve("metrics.json"));
        MetricsCache cache = MetricsCache.open(snapshotStore, new StatsAggregator(store), "bucket");
        resolver = new PathResolver(
                store,
                new DirectoryViewBuilder(store, cache),
                List.of("docs", "public", "view", "download"),
                "view",
                Duration.ofHours(1)
        );
    }

    @Test
    void trailingSlashResolvesToDirectory() {
        Resolution resolution = resolver.resolve(BrowseRequest.of("a/b/"));

        assertEquals(Resolution.Kind.DIRECTORY, resolution.kind());
        assertEquals(2, resolution.view().files().size());
        assertEquals(20L, resolution.view().totalSize());
        assertEquals(PathState.IS_DIR, resolver.classify("a/b/"));
    }

    @Test
    void exactKeyResolvesToFile() {
        Resolution resolution = resolver.resolve(BrowseRequest.of("a/b/c.txt"));

        assertEquals(Resolution.Kind.FILE, resolution.kind());
        assertEquals(12L, resolution.meta().size());
        assertEquals(PathState.IS_FILE, resolver.classify("a/file"));
    }

    @Test
    void directoryWithoutSlashRedirectsToCanonicalForm() {
        Resolution resolution = resolver.resolve(new BrowseRequest("a/b", Map.of("sort", "name")));

        assertEquals(Resolution.Kind.REDIRECT, resolution.kind());
        assertEquals("a/b/", resolution.redirectTarget());
        assertTrue(resolution.permanent());
        assertEquals(PathState.IS_DIR_NO_SLASH, resolver.classify("a/b"));
    }

    @Test
    void missingPathIsNotFound() {
        assertEquals(Resolution.Kind.NOT_FOUND, resolver.resolve(BrowseRequest.of("a/zzz")).kind());
        assertEquals(PathState.NOT_FOUND, resolver.classify("a/zzz"));
    }

    @Test
    void emptyDirectoryWithSlashIsStillADirectory() {
        Resolution resolution = resolver.resolve(BrowseRequest.of("a/zzz/"));

        assertEquals(Resolution.Kind.DIRECTORY, resolution.kind());
        assertTrue(resolution.view().files().isEmpty());
        assertTrue(resolution.view().directories().isEmpty());
    }

    @Test
    void reservedSegmentIsNotFoundWithoutProbingTheStore() {
        store.resetCounters();

        assertEquals(Resolution.Kind.NOT_FOUND, resolver.resolve(BrowseRequest.of("docs")).kind());
        assertEquals(Resolution.Kind.NOT_FOUND, resolver.resolve(BrowseRequest.of("docs/")).kind());
        assertEquals(Resolution.Kind.NOT_FOUND, resolver.resolve(BrowseRequest.of("docs/guide.md")).kind());
        assertEquals(PathState.NOT_FOUND, resolver.classify("docs"));
        assertEquals(0, store.probes());
        assertEquals(0, store.childListings());
    }

    @Test
    void inlineMarkerOnJsonRendersInline() {
        Resolution resolution = resolver.resolve(BrowseRequest.parse("file.json?view"));

        assertEquals(Resolution.Kind.INLINE_JSON, resolution.kind());
        assertEquals("file.json", resolution.meta().key());
    }

    @Test
    void inlineMarkerOnOtherFilesRedirectsWithoutTheMarker() {
        Resolution text = resolver.resolve(BrowseRequest.parse("notes.txt?view"));
        Resolution binary = resolver.resolve(BrowseRequest.parse("data.bin?view"));

        assertEquals(Resolution.Kind.REDIRECT, text.kind());
        assertEquals("notes.txt", text.redirectTarget());
        assertFalse(text.permanent());
        assertEquals("data.bin", binary.redirectTarget());
    }

    @Test
    void inlineMarkerIsIgnoredForDirectories() {
        Resolution resolution = resolver.resolve(BrowseRequest.parse("a/b?view"));

        assertEquals(Resolution.Kind.REDIRECT, resolution.kind());
        assertEquals("a/b/", resolution.redirectTarget());
    }

    @Test
    void jsonWithoutMarkerIsServedAsFile() {
        assertEquals(Resolution.Kind.FILE, resolver.resolve(BrowseRequest.of("file.json")).kind());
    }

    @Test
    void legacyQueryAddressingRedirectsPermanently() {
        Resolution resolution = resolver.resolve(BrowseRequest.parse("?path=a%2Fb%2F"));

        assertEquals(Resolution.Kind.REDIRECT, resolution.kind());
        assertEquals("a/b/", resolution.redirectTarget());
        assertTrue(resolution.permanent());
    }

    @Test
    void rootIsADirectory() {
        Resolution resolution = resolver.resolve(BrowseRequest.parse("/?path="));

        assertEquals(Resolution.Kind.DIRECTORY, resolution.kind());
        assertEquals("", resolution.path());
        assertEquals(List.of("a", "docs"), resolution.view().directories().stream()
                .map(DirectoryEntry::name).collect(Collectors.toList()));
    }

    @Test
    void exactKeyWinsOverPrefixOfTheSameName() {
        store.put("a/b", 5, T1);

        assertEquals(PathState.IS_FILE, resolver.classify("a/b"));
        assertEquals(Resolution.Kind.FILE, resolver.resolve(BrowseRequest.of("a/b")).kind());
    }

    @Test
    void leadingDelimiterIsIgnored() {
        assertEquals(Resolution.Kind.FILE, resolver.resolve(BrowseRequest.of("/a/file")).kind());
    }

    @Test
    void storeFailureIsNotReportedAsNotFound() {
        store.failListingsOf("a/zzz/");

        assertThrows(ObjectStoreException.class, () -> resolver.resolve(BrowseRequest.of("a/zzz")));
    }

    @Test
    void issuesTemporaryUrlsWithConfiguredTtl() {
        assertNotNull(resolver.temporaryUrlFor("file.json"));
        assertTrue(resolver.temporaryUrlFor("file.json").toString().endsWith("expires=3600"));
    }
}
