package com.example.bucketbrowser;

import com.example.bucketbrowser.store.ObjectStore;
import com.example.bucketbrowser.store.ObjectStoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE = "Usage: java -jar bucket-browser.jar rebuild <config.json>\n"
            + "       java -jar bucket-browser.jar resolve <config.json> <path[?query]>";

    private App() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            LOGGER.error(USAGE);
            System.exit(1);
        }
        BrowserConfig config = new ConfigLoader().load(Path.of(args[1]));
        ObjectStore store = ObjectStores.fromConfig(config);
        int exitCode;
        try {
            exitCode = run(args, config, store);
        } finally {
            if (store instanceof AutoCloseable) {
                ((AutoCloseable) store).close();
            }
        }
        System.exit(exitCode);
    }

    private static int run(String[] args, BrowserConfig config, ObjectStore store) throws Exception {
        switch (args[0]) {
            case "rebuild":
                return rebuild(config, store);
            case "resolve":
                if (args.length < 3) {
                    LOGGER.error(USAGE);
                    return 1;
                }
                return resolve(config, store, args[2]);
            default:
                LOGGER.error("Unknown command {}\n{}", args[0], USAGE);
                return 1;
        }
    }

    static int rebuild(BrowserConfig config, ObjectStore store) throws InterruptedException {
        MetricsRebuilder rebuilder = new MetricsRebuilder(
                new NamespaceCrawler(store),
                new StatsAggregator(store),
                new MetricsSnapshotStore(config.snapshotFile()),
                config.source(),
                config.maxDepth(),
                config.threadCount(),
                Clock.systemUTC()
        );
        try {
            rebuilder.rebuild();
            return 0;
        } catch (MetricsRebuildException ex) {
            LOGGER.error("Metrics rebuild failed; the previous snapshot stays in effect", ex);
            return 2;
        }
    }

    static int resolve(BrowserConfig config, ObjectStore store, String target) throws Exception {
        BrowseRequest request;
        try {
            request = BrowseRequest.parse(target);
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Bad request target {}: {}\n{}", target, ex.getMessage(), USAGE);
            return 1;
        }
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        StatsAggregator aggregator = new StatsAggregator(store);
        MetricsCache metricsCache = MetricsCache.open(new MetricsSnapshotStore(config.snapshotFile()), aggregator, config.source());
        PathResolver resolver = new PathResolver(
                store,
                new DirectoryViewBuilder(store, metricsCache),
                config.reservedSegments(),
                config.inlineMarker(),
                config.downloadUrlTtl()
        );

        Map<String, Object> output = new LinkedHashMap<>();
        try {
            Resolution resolution = resolver.resolve(request);
            output.put("resolution", resolution);
            if (resolution.kind() == Resolution.Kind.FILE) {
                output.put("downloadUrl", resolver.temporaryUrlFor(resolution.meta().key()).toString());
            } else if (resolution.kind() == Resolution.Kind.INLINE_JSON) {
                output.put("document", new JsonPreview(store, mapper).render(resolution.meta()));
            }
        } catch (ObjectStoreException ex) {
            LOGGER.error("Failed to resolve {}", target, ex);
            System.out.println("Internal error");
            return 3;
        }
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(output));
        return 0;
    }
}
