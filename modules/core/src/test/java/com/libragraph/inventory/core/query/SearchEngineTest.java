package com.libragraph.inventory.core.query;

import com.libragraph.inventory.core.manifest.Manifest;
import com.libragraph.inventory.core.testing.InMemoryObjectStore;
import com.libragraph.inventory.core.testing.TestEngines;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.libragraph.inventory.core.testing.InventoryFixtures.csv;
import static com.libragraph.inventory.core.testing.InventoryFixtures.row;
import static org.assertj.core.api.Assertions.*;

class SearchEngineTest {

    private InMemoryObjectStore store;
    private ExecutorService executor;
    private SearchEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
        executor = Executors.newFixedThreadPool(4);
        engine = new SearchEngine(TestEngines.reader(store), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private List<String> keys(List<SearchEvent.Match> matches) {
        return matches.stream().map(m -> m.record().key()).collect(Collectors.toList());
    }

    @Test
    void substringSearchFindsOnlyMatchingKeys() {
        Manifest manifest = ScanTestSupport.publish(store,
                csv(row("b1", "a/b/c.txt", 100)),
                csv(row("b1", "a/d.txt", 50)));
        List<SearchEvent.Match> matches = new ArrayList<>();

        ScanSummary summary = engine.search(manifest, SearchQuery.substring("b"), matches::add, new QueryCancellation());

        assertThat(keys(matches)).containsExactly("a/b/c.txt");
        assertThat(summary.filesTotal()).isEqualTo(2);
        assertThat(summary.filesScanned()).isEqualTo(2);
        assertThat(summary.recordsScanned()).isEqualTo(2);
        assertThat(summary.cancelled()).isFalse();
        assertThat(summary.complete()).isTrue();
    }

    @Test
    void exactFolderSearchReportsFolderPath() {
        Manifest manifest = ScanTestSupport.publish(store, csv(
                row("b1", "a/logs/b.txt", 1),
                row("b1", "a/logsarchive/b.txt", 1),
                row("b1", "logs/x/y.txt", 1)));
        List<SearchEvent.Match> matches = new ArrayList<>();

        engine.search(manifest, SearchQuery.exactFolder("logs"), matches::add, new QueryCancellation());

        assertThat(matches).extracting(m -> m.record().key(), SearchEvent.Match::folderPath)
                .containsExactly(tuple("a/logs/b.txt", "a/logs"), tuple("logs/x/y.txt", "logs"));
    }

    @Test
    void matchesArriveInManifestFileOrder() {
        String[] files = IntStream.range(0, 12)
                .mapToObj(f -> csv(IntStream.range(0, 200)
                        .mapToObj(r -> row("b1", "f" + f + "/obj-" + r, r))
                        .toArray(String[]::new)))
                .toArray(String[]::new);
        Manifest manifest = ScanTestSupport.publish(store, files);
        List<SearchEvent.Match> matches = new ArrayList<>();

        ScanSummary summary = engine.search(manifest, SearchQuery.substring("obj"), matches::add,
                new QueryCancellation());

        List<String> expected = new ArrayList<>();
        for (int f = 0; f < 12; f++) {
            for (int r = 0; r < 200; r++) {
                expected.add("f" + f + "/obj-" + r);
            }
        }
        assertThat(keys(matches)).containsExactlyElementsOf(expected);
        assertThat(summary.recordsScanned()).isEqualTo(2400);
    }

    @Test
    void failedFileIsRecordedAndSearchContinues() {
        Manifest manifest = ScanTestSupport.publish(store,
                csv(row("b1", "x/1", 1)),
                csv(row("b1", "x/2", 1)),
                csv(row("b1", "x/3", 1)));
        store.delete("dest", manifest.files().get(1).key());
        List<SearchEvent.Match> matches = new ArrayList<>();

        ScanSummary summary = engine.search(manifest, SearchQuery.prefix("x/"), matches::add, new QueryCancellation());

        assertThat(keys(matches)).containsExactly("x/1", "x/3");
        assertThat(summary.filesFailed()).isEqualTo(1);
        assertThat(summary.filesScanned()).isEqualTo(2);
        assertThat(summary.failures()).singleElement()
                .satisfies(f -> assertThat(f.key()).isEqualTo(manifest.files().get(1).key()));
        assertThat(summary.complete()).isFalse();
    }

    @Test
    void unavailableFileAfterRetriesIsRecorded() {
        Manifest manifest = ScanTestSupport.publish(store, csv(row("b1", "x/1", 1)));
        store.failTimes("dest", manifest.files().get(0).key(), 10);

        ScanSummary summary = engine.search(manifest, SearchQuery.substring("x"), m -> { }, new QueryCancellation());

        assertThat(summary.filesFailed()).isEqualTo(1);
        assertThat(summary.failures().get(0).reason()).contains("Source unavailable");
    }

    @Test
    void malformedRowsAreCountedNotFatal() {
        Manifest manifest = ScanTestSupport.publish(store, csv(
                row("b1", "k1", 1), "broken", row("b1", "k2", 2)));
        List<SearchEvent.Match> matches = new ArrayList<>();

        ScanSummary summary = engine.search(manifest, SearchQuery.substring("k"), matches::add, new QueryCancellation());

        assertThat(keys(matches)).containsExactly("k1", "k2");
        assertThat(summary.malformedRows()).isEqualTo(1);
        assertThat(summary.recordsScanned()).isEqualTo(3);
        assertThat(summary.validRecords()).isEqualTo(2);
    }

    @Test
    void cancellationStopsEarlyWithPartialResults() {
        String big = csv(IntStream.range(0, 5000)
                .mapToObj(r -> row("b1", "big/" + r, 1))
                .toArray(String[]::new));
        Manifest manifest = ScanTestSupport.publish(store, big, big);
        QueryCancellation cancellation = new QueryCancellation();
        List<SearchEvent.Match> matches = new CopyOnWriteArrayList<>();

        ScanSummary summary = engine.search(manifest, SearchQuery.prefix("big/"), match -> {
            matches.add(match);
            cancellation.cancel();
        }, cancellation);

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).record().key()).isEqualTo("big/0");
        assertThat(summary.cancelled()).isTrue();
        assertThat(summary.filesScanned()).isLessThan(2);
    }

    @Test
    void alreadyCancelledQueryScansNothing() {
        Manifest manifest = ScanTestSupport.publish(store, csv(row("b1", "a", 1)));
        QueryCancellation cancellation = new QueryCancellation();
        cancellation.cancel();

        ScanSummary summary = engine.search(manifest, SearchQuery.substring("a"), m -> fail("no match expected"),
                cancellation);

        assertThat(summary.cancelled()).isTrue();
        assertThat(summary.recordsScanned()).isZero();
    }

    @Test
    void sinkFailurePropagates() {
        Manifest manifest = ScanTestSupport.publish(store, csv(row("b1", "a", 1)));

        assertThatThrownBy(() -> engine.search(manifest, SearchQuery.substring("a"), m -> {
            throw new IllegalStateException("downstream gone");
        }, new QueryCancellation())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void folderSearchGroupsByMatchingFolder() {
        Manifest manifest = ScanTestSupport.publish(store,
                csv(row("b1", "proj/Logs/2024/a.log", 10), row("b1", "proj/Logs/2023/b.log", 5)),
                csv(row("b1", "old/backlog/c.txt", 1), row("b1", "catalog.txt", 99)));

        FolderSearchResult result = engine.searchFolders(manifest, "log", false, new QueryCancellation());

        assertThat(result.query()).isEqualTo("log");
        assertThat(result.folders()).containsExactly(
                new AggregationBucket("old/backlog", 1, 1, true),
                new AggregationBucket("proj/Logs", 15, 2, true));
        assertThat(result.summary().recordsScanned()).isEqualTo(4);
    }
}
