package com.libragraph.inventory.core.query;

import com.libragraph.inventory.core.config.InventoryDestination;
import com.libragraph.inventory.core.manifest.InventoryConfig;
import com.libragraph.inventory.core.manifest.Manifest;
import com.libragraph.inventory.core.manifest.ManifestDiscovery;
import com.libragraph.inventory.core.manifest.ManifestLocation;
import com.libragraph.inventory.core.manifest.ManifestResolver;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.smallrye.mutiny.subscription.MultiEmitter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for the surrounding application: resolves the manifest of an
 * inventory and runs a search or aggregation over it.
 *
 * <p>Manifest failures fail the returned stream before any match is emitted;
 * per-file failures only show up in the {@link ScanSummary}. Cancelling the
 * subscription, or the caller's {@link QueryCancellation}, stops the scan.
 */
@ApplicationScoped
public class InventoryQueryService {

    private static final Logger log = Logger.getLogger(InventoryQueryService.class);

    private static final long DEMAND_POLL_MILLIS = 20;

    @Inject
    ManifestResolver resolver;

    @Inject
    ManifestDiscovery discovery;

    @Inject
    SearchEngine searchEngine;

    @Inject
    PathDepthAggregator aggregator;

    @Inject
    InventoryDestination destination;

    public InventoryConfig configFor(String sourceBucket, String inventoryId) {
        return destination.configFor(sourceBucket, inventoryId);
    }

    public Uni<Manifest> resolve(InventoryConfig config, Optional<String> date) {
        return Uni.createFrom().item(() -> resolver.resolve(config, date));
    }

    /** Forgets cached reports of the inventory and resolves the newest one again. */
    public Uni<Manifest> refresh(InventoryConfig config) {
        return Uni.createFrom().item(() -> resolver.refresh(config));
    }

    /** Latest report of every inventory delivered to the configured destination. */
    public Uni<List<ManifestLocation>> discover() {
        return discover(destination.bucket(), destination.prefix());
    }

    public Uni<List<ManifestLocation>> discover(String destinationBucket, String prefix) {
        return Uni.createFrom().item(() -> discovery.discover(destinationBucket, prefix));
    }

    public Multi<SearchEvent> search(String sourceBucket, String inventoryId, SearchQuery query, Optional<String> date) {
        return search(configFor(sourceBucket, inventoryId), query, date, new QueryCancellation());
    }

    /**
     * Streams matches in manifest file order followed by one
     * {@link SearchEvent.Completed} carrying the scan summary. Matches are only
     * emitted against outstanding demand, so a slow subscriber holds the scan
     * back instead of letting matches pile up.
     */
    public Multi<SearchEvent> search(InventoryConfig config, SearchQuery query, Optional<String> date,
                                     QueryCancellation cancellation) {
        return Multi.createFrom().<SearchEvent>emitter(emitter -> {
            QueryCancellation scan = QueryCancellation.linkedTo(cancellation);
            emitter.onTermination(scan::cancel);
            try {
                Manifest manifest = resolver.resolve(config, date);
                ScanSummary summary = searchEngine.search(manifest, query,
                        match -> emitOnDemand(emitter, match, scan), scan);
                log.infof("Search '%s' over %s/%s: %d record(s) scanned, %d malformed, %d file(s) failed%s",
                        query.text(), config.sourceBucket(), manifest.date(), summary.recordsScanned(),
                        summary.malformedRows(), summary.filesFailed(), summary.cancelled() ? ", cancelled" : "");
                emitter.emit(new SearchEvent.Completed(summary));
                emitter.complete();
            } catch (RuntimeException e) {
                emitter.fail(e);
            }
        }).runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    public Uni<FolderSearchResult> searchFolders(InventoryConfig config, String text, boolean caseSensitive,
                                                 Optional<String> date, QueryCancellation cancellation) {
        return Uni.createFrom().<FolderSearchResult>emitter(emitter -> {
            QueryCancellation scan = QueryCancellation.linkedTo(cancellation);
            emitter.onTermination(scan::cancel);
            try {
                Manifest manifest = resolver.resolve(config, date);
                emitter.complete(searchEngine.searchFolders(manifest, text, caseSensitive, scan));
            } catch (RuntimeException e) {
                emitter.fail(e);
            }
        }).runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    public Uni<AggregationResult> aggregateByDepth(String sourceBucket, String inventoryId, int depth,
                                                   Optional<String> date) {
        return aggregateByDepth(configFor(sourceBucket, inventoryId), depth, date, new QueryCancellation());
    }

    /**
     * Totals by path prefix. The result is partial, and says so in its
     * summary, when cancelled or when some data file failed.
     */
    public Uni<AggregationResult> aggregateByDepth(InventoryConfig config, int depth, Optional<String> date,
                                                   QueryCancellation cancellation) {
        if (depth < 0) {
            return Uni.createFrom().failure(new IllegalArgumentException("depth must be >= 0, got: " + depth));
        }
        return Uni.createFrom().<AggregationResult>emitter(emitter -> {
            QueryCancellation scan = QueryCancellation.linkedTo(cancellation);
            emitter.onTermination(scan::cancel);
            try {
                Manifest manifest = resolver.resolve(config, date);
                AggregationResult result = aggregator.aggregate(manifest, depth, scan);
                log.infof("Aggregated %s/%s at depth %d: %d bucket(s), %d object(s)%s",
                        config.sourceBucket(), manifest.date(), depth, result.buckets().size(),
                        result.objectCount(), result.partial() ? " (partial)" : "");
                emitter.complete(result);
            } catch (RuntimeException e) {
                emitter.fail(e);
            }
        }).runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    /** Blocks the scan until the subscriber asks for more, or the query ends. */
    private static void emitOnDemand(MultiEmitter<? super SearchEvent> emitter, SearchEvent event,
                                     QueryCancellation scan) {
        while (emitter.requested() == 0) {
            if (emitter.isCancelled() || scan.isCancelled()) {
                return;
            }
            try {
                Thread.sleep(DEMAND_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scan.cancel();
                return;
            }
        }
        emitter.emit(event);
    }
}
