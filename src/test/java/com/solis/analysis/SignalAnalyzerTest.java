package com.solis.analysis;

import com.solis.model.DexVolumeSignal;
import com.solis.model.RepoSignal;
import com.solis.model.ReportAnomaly;
import com.solis.model.SignalFamily;
import com.solis.model.SignalSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalAnalyzerTest {

    @Test
    void annotateShouldScoreRepoDeltasWithoutTouchingThem() {
        List<RepoSignal> repos = List.of(
                repo("a/one", 1, 5L, 10L),
                repo("a/two", 2, null, 20L),
                repo("a/three", 3, null, 30L));

        SignalSet annotated = new SignalAnalyzer().annotate(new SignalSet(repos, null, null, null));

        RepoSignal first = annotated.repos().get(0);
        assertEquals(-1.0, first.getCommitsZScore(), 1e-9);
        assertEquals(1.0, annotated.repos().get(2).getCommitsZScore(), 1e-9);
        // stars deltas 5, 0, 0
        assertEquals(2.0 / Math.sqrt(3.0), first.getStarsZScore(), 1e-9);
        assertEquals(0.0, first.getForksZScore(), 1e-9);
        assertEquals(5L, first.getStarsDelta());
        assertNull(annotated.repos().get(1).getStarsDelta());
        assertEquals(0.0, repos.get(0).getCommitsZScore(), 1e-9);
    }

    @Test
    void findAnomaliesShouldReportEachRepoOnceUnderItsStrongestMetric() {
        List<RepoSignal> repos = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            repos.add(repo("org/r" + i, 10, 1L + i % 2, 5L + i % 3));
        }
        // hot: stars z ~3.47 and commits z ~1.33; busy: commits z ~3.10
        repos.add(repo("org/hot", 10, 400L, 150L));
        repos.add(repo("org/busy", 10, 1L, 300L));

        List<ReportAnomaly> anomalies = new SignalAnalyzer(1.2).findAnomalies(new SignalSet(repos, null, null, null));

        assertEquals(2, anomalies.size());
        ReportAnomaly hot = anomalies.get(0);
        assertEquals(SignalFamily.REPOS, hot.family());
        assertEquals("org/hot", hot.key());
        assertEquals("stars", hot.metric());
        assertEquals("org/busy", anomalies.get(1).key());
        assertEquals("commits", anomalies.get(1).metric());
        assertTrue(Math.abs(hot.zScore()) >= Math.abs(anomalies.get(1).zScore()));
    }

    @Test
    void findAnomaliesShouldReportFamilyAndKey() {
        List<DexVolumeSignal> dex = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            dex.add(DexVolumeSignal.builder().protocol("p" + i).volume24h(1_000.0).build());
        }
        dex.add(DexVolumeSignal.builder().protocol("whale").volume24h(90_000.0).build());

        List<ReportAnomaly> anomalies = new SignalAnalyzer(2.0).findAnomalies(new SignalSet(null, null, dex, null));

        assertEquals(1, anomalies.size());
        assertEquals(SignalFamily.DEX, anomalies.get(0).family());
        assertEquals("whale", anomalies.get(0).key());
        assertEquals("volume24h", anomalies.get(0).metric());
        assertTrue(anomalies.get(0).zScore() >= 2.0);
    }

    @Test
    void constructorShouldRejectNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new SignalAnalyzer(0.0));
        assertThrows(IllegalArgumentException.class, () -> new SignalAnalyzer(Double.NaN));
    }

    private static RepoSignal repo(String name, long stars, Long starsDelta, long commitsDelta) {
        return RepoSignal.builder()
                .repo(name)
                .stars(stars)
                .language("Rust")
                .starsDelta(starsDelta)
                .commitsDelta(commitsDelta)
                .build();
    }
}
