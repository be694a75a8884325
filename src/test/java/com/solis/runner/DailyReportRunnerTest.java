package com.solis.runner;

import com.solis.alert.AlertChannel;
import com.solis.alert.AlertNotifier;
import com.solis.analysis.SignalAnalyzer;
import com.solis.cache.CacheStore;
import com.solis.data.SignalCollector;
import com.solis.delta.DeltaEngine;
import com.solis.model.RepoSignal;
import com.solis.model.SignalReport;
import com.solis.model.SignalSet;
import com.solis.report.JsonReportStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DailyReportRunnerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T08:00:03Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void runShouldWriteFirstReportWithoutDeltas() throws Exception {
        JsonReportStore store = new JsonReportStore(tempDir.resolve("reports"));
        DailyReportRunner runner = runner(date -> repos(100, 200, 300), store, null, false);

        Optional<Path> written = runner.run(LocalDate.parse("2026-03-01"));

        assertEquals(store.pathFor(LocalDate.parse("2026-03-01")), written.orElseThrow());
        SignalReport saved = store.loadPrevious(LocalDate.parse("2026-03-02")).orElseThrow();
        assertNull(saved.signals().repos().get(0).getStarsDelta());
        assertEquals(Instant.parse("2026-03-02T08:00:03Z"), saved.generatedAt());
        assertEquals(0.0, saved.signals().repos().get(2).getStarsZScore(), 1e-9);
        assertTrue(saved.anomalies().isEmpty());
    }

    @Test
    void runShouldDiffAgainstPreviousDayAndFlagOutliers() throws Exception {
        JsonReportStore store = new JsonReportStore(tempDir.resolve("reports"));
        runner(date -> repos(10, 10, 10, 10, 10, 10, 10, 10, 10, 10), store, null, false)
                .run(LocalDate.parse("2026-03-01"));

        runner(date -> repos(12, 10, 10, 10, 10, 10, 10, 10, 10, 500), store, null, false)
                .run(LocalDate.parse("2026-03-02"));

        SignalReport today = store.loadPrevious(LocalDate.parse("2026-03-03")).orElseThrow();
        assertEquals(LocalDate.parse("2026-03-02"), today.date());
        assertEquals(2L, today.signals().repos().get(0).getStarsDelta());
        assertEquals(490L, today.signals().repos().get(9).getStarsDelta());
        assertEquals(1, today.anomalies().size());
        assertEquals("org/repo9", today.anomalies().get(0).key());
        assertEquals("stars", today.anomalies().get(0).metric());
    }

    @Test
    void runShouldSendAlertAfterReportIsSaved() throws Exception {
        JsonReportStore store = new JsonReportStore(tempDir.resolve("reports"));
        runner(date -> repos(10, 10, 10, 10, 10, 10, 10, 10, 10, 10), store, null, false)
                .run(LocalDate.parse("2026-03-01"));
        List<String> sent = new ArrayList<>();
        List<Boolean> savedFirst = new ArrayList<>();
        AlertChannel channel = new AlertChannel() {
            @Override
            public String name() {
                return "recording";
            }

            @Override
            public void send(String text) {
                savedFirst.add(Files.exists(store.pathFor(LocalDate.parse("2026-03-02"))));
                sent.add(text);
            }
        };

        runner(date -> repos(10, 10, 10, 10, 10, 10, 10, 10, 10, 500), store, null, false,
                new AlertNotifier(true, channel, 2.0)).run(LocalDate.parse("2026-03-02"));

        assertEquals(1, sent.size());
        assertEquals(List.of(true), savedFirst);
        assertTrue(sent.get(0).contains("org/repo9 stars z-score"));
    }

    @Test
    void runShouldSkipReportWhenNothingWasCollected() throws Exception {
        JsonReportStore store = new JsonReportStore(tempDir.resolve("reports"));

        Optional<Path> written = runner(date -> SignalSet.empty(), store, null, false).run(LocalDate.parse("2026-03-01"));

        assertTrue(written.isEmpty());
        assertFalse(Files.exists(store.pathFor(LocalDate.parse("2026-03-01"))));
    }

    @Test
    void runShouldPurgeExpiredCacheWhenEnabled() throws Exception {
        CacheStore cache = new CacheStore(tempDir.resolve("cache"));
        cache.set("repos", "2026-02-01", "stale", -1.0);
        cache.set("repos", "2026-03-01", "fresh", 12.0);

        runner(date -> repos(1, 2), new JsonReportStore(tempDir.resolve("reports")), cache, true)
                .run(LocalDate.parse("2026-03-01"));

        assertFalse(Files.exists(tempDir.resolve("cache").resolve("repos").resolve("2026-02-01.json")));
        assertTrue(cache.has("repos", "2026-03-01"));
    }

    private static DailyReportRunner runner(
            SignalCollector collector,
            JsonReportStore store,
            CacheStore cache,
            boolean purge
    ) {
        return runner(collector, store, cache, purge, null);
    }

    private static DailyReportRunner runner(
            SignalCollector collector,
            JsonReportStore store,
            CacheStore cache,
            boolean purge,
            AlertNotifier alerts
    ) {
        return new DailyReportRunner(collector, store, store, new DeltaEngine(), new SignalAnalyzer(2.0), cache, purge, alerts, CLOCK);
    }

    private static SignalSet repos(long... stars) {
        List<RepoSignal> repos = new ArrayList<>();
        for (int i = 0; i < stars.length; i++) {
            repos.add(RepoSignal.builder().repo("org/repo" + i).stars(stars[i]).forks(1).contributors(1).language("Rust").build());
        }
        return new SignalSet(repos, null, null, null);
    }
}
