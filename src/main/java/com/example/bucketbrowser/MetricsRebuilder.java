package com.example.bucketbrowser;

import com.example.bucketbrowser.metadata.MetricsSnapshot;
import com.example.bucketbrowser.store.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rebuilds the metrics snapshot: discovers every prefix, aggregates each one on a worker pool, and
 * persists the result atomically.
 */
public final class MetricsRebuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsRebuilder.class);
    private static final int PROGRESS_INTERVAL = 10;

    private final NamespaceCrawler crawler;
    private final StatsAggregator aggregator;
    private final MetricsSnapshotStore snapshotStore;
    private final String source;
    private final int maxDepth;
    private final int threadCount;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean();

    public MetricsRebuilder(NamespaceCrawler crawler,
                            StatsAggregator aggregator,
                            MetricsSnapshotStore snapshotStore,
                            String source,
                            int maxDepth,
                            int threadCount,
                            Clock clock) {
        this.crawler = crawler;
        this.aggregator = aggregator;
        this.snapshotStore = snapshotStore;
        this.source = source;
        this.maxDepth = maxDepth;
        this.threadCount = threadCount;
        this.clock = clock;
    }

    /**
     * Runs one rebuild. Returns empty without doing anything if another rebuild is already running in
     * this process.
     *
     * @throws MetricsRebuildException if the namespace cannot be enumerated or the snapshot cannot be written
     */
    public Optional<MetricsSnapshot> rebuild() throws InterruptedException {
        if (!running.compareAndSet(false, true)) {
            LOGGER.info("Metrics rebuild already in progress; skipping.");
            return Optional.empty();
        }
        try {
            return Optional.of(runRebuild());
        } finally {
            running.set(false);
        }
    }

    private MetricsSnapshot runRebuild() throws InterruptedException {
        Instant started = clock.instant();
        LOGGER.info("Starting metrics computation for {}", source);

        SortedSet<String> prefixes = crawler.discover(maxDepth);
        LOGGER.info("Found {} prefixes to process", prefixes.size());

        Map<String, DirectoryStatsSnapshot> metrics = aggregateAll(List.copyOf(prefixes));
        MetricsSnapshot snapshot = MetricsSnapshot.of(clock.instant(), source, metrics);
        try {
            snapshotStore.save(snapshot);
        } catch (IOException ex) {
            throw new MetricsRebuildException("Failed to write metrics snapshot " + snapshotStore.path(), ex);
        }

        Duration elapsed = Duration.between(started, clock.instant());
        LOGGER.info("Metrics saved to {}: {} prefixes in {} s",
                snapshotStore.path(), snapshot.folderCount(), elapsed.toSeconds());
        return snapshot;
    }

    private Map<String, DirectoryStatsSnapshot> aggregateAll(List<String> prefixes) throws InterruptedException {
        Map<String, DirectoryStatsSnapshot> metrics = new ConcurrentHashMap<>();
        AtomicInteger completed = new AtomicInteger();
        int total = prefixes.size();

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        try {
            for (String prefix : prefixes) {
                executor.submit(() -> {
                    try {
                        DirectoryStatsSnapshot stats = aggregator.aggregate(prefix);
                        if (!stats.isEmpty()) {
                            metrics.put(prefix, stats);
                        }
                    } catch (ObjectStoreException ex) {
                        LOGGER.warn("Failed to aggregate {}; omitting it from the snapshot", prefix, ex);
                    } catch (RuntimeException ex) {
                        LOGGER.error("Unexpected failure aggregating {}; omitting it from the snapshot", prefix, ex);
                    }
                    int done = completed.incrementAndGet();
                    if (done % PROGRESS_INTERVAL == 0) {
                        LOGGER.info("Progress: {}/{} ({}%)", done, total, done * 100 / total);
                    }
                });
            }
        } finally {
            executor.shutdown();
        }
        boolean finished;
        try {
            finished = executor.awaitTermination(1, TimeUnit.HOURS);
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw ex;
        }
        if (!finished) {
            executor.shutdownNow();
            throw new MetricsRebuildException("Timed out aggregating " + total + " prefixes");
        }
        return metrics;
    }
}
