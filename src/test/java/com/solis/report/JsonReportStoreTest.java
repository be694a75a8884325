package com.solis.report;

import com.solis.model.DexVolumeSignal;
import com.solis.model.OnchainSignal;
import com.solis.model.RepoSignal;
import com.solis.model.ReportAnomaly;
import com.solis.model.SignalFamily;
import com.solis.model.SignalReport;
import com.solis.model.SignalSet;
import com.solis.model.TokenSignal;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonReportStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void saveShouldWriteDatedFileThatLoadsBack() throws Exception {
        JsonReportStore store = new JsonReportStore(tempDir.resolve("reports"));
        SignalReport report = sampleReport("2026-03-01");

        Path written = store.save(report);

        assertEquals(tempDir.resolve("reports").resolve("2026-03-01.json"), written);
        SignalReport loaded = store.loadPrevious(LocalDate.parse("2026-03-02")).orElseThrow();
        assertEquals(report, loaded);
    }

    @Test
    void saveShouldRemoveTempFileWhenMoveFails() throws Exception {
        JsonReportStore store = new JsonReportStore(tempDir);
        Path blocker = store.pathFor(LocalDate.parse("2026-03-01"));
        Files.createDirectories(blocker);
        Files.writeString(blocker.resolve("keep.txt"), "x", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> store.save(sampleReport("2026-03-01")));

        assertFalse(Files.exists(tempDir.resolve("2026-03-01.json.tmp")));
        assertTrue(Files.isDirectory(blocker));
    }

    @Test
    void loadPreviousShouldPickNewestOtherThanExcludedDate() throws Exception {
        JsonReportStore store = new JsonReportStore(tempDir);
        store.save(sampleReport("2026-02-27"));
        store.save(sampleReport("2026-02-28"));
        store.save(sampleReport("2026-03-01"));
        Files.writeString(tempDir.resolve("notes.json"), "{}", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("2026-03-09.json.bak"), "{}", StandardCharsets.UTF_8);

        Optional<SignalReport> previous = store.loadPrevious(LocalDate.parse("2026-03-01"));

        assertEquals(LocalDate.parse("2026-02-28"), previous.orElseThrow().date());
    }

    @Test
    void loadPreviousShouldBeEmptyOnFirstRun() {
        JsonReportStore store = new JsonReportStore(tempDir.resolve("missing"));

        assertTrue(store.loadPrevious(LocalDate.parse("2026-03-01")).isEmpty());
    }

    @Test
    void loadPreviousShouldBeEmptyWhenNewestFileIsCorrupt() throws Exception {
        JsonReportStore store = new JsonReportStore(tempDir);
        Files.writeString(tempDir.resolve("2026-03-01.json"), "{broken", StandardCharsets.UTF_8);

        assertTrue(store.loadPrevious(LocalDate.parse("2026-03-02")).isEmpty());
    }

    @Test
    void codecShouldOmitUnsetDeltas() {
        SignalReport report = sampleReport("2026-03-01");

        JSONObject json = SignalReportJson.toJson(report);
        JSONObject repo = json.getJSONObject("signals").getJSONArray("repos").getJSONObject(0);
        JSONObject dex = json.getJSONObject("signals").getJSONArray("dex").getJSONObject(0);

        assertEquals(SignalReport.VERSION, json.getString("version"));
        assertEquals(12L, repo.getLong("starsDelta"));
        assertFalse(repo.has("forksDelta"));
        assertFalse(dex.has("volumeDelta"));
        assertNull(SignalReportJson.fromJson(json).signals().dexVolumes().get(0).getVolumeDelta());
        assertEquals("dex", json.getJSONArray("anomalies").getJSONObject(0).getString("family"));
    }

    private static SignalReport sampleReport(String date) {
        SignalSet signals = new SignalSet(
                List.of(RepoSignal.builder().repo("solana-labs/solana").stars(12_000).forks(3_000)
                        .contributors(400).commits(55).language("Rust").starsDelta(12L).starsZScore(1.5).build()),
                List.of(OnchainSignal.builder().programId("JUP6").programName("Jupiter").txCount(900_000)
                        .uniqueSigners(50_000).txDelta(-100L).txZScore(0.25).build()),
                List.of(DexVolumeSignal.builder().protocol("orca").volume24h(1.25e8).volumeZScore(-0.5).build()),
                List.of(TokenSignal.builder().id("solana").symbol("SOL").name("Solana").price(142.5)
                        .volume24h(2.0e9).marketCap(6.5e10).category("l1").volumeDelta(3.5).build()));
        List<ReportAnomaly> anomalies = List.of(
                new ReportAnomaly(SignalFamily.DEX, "orca", "volume24h", 1.25e8, 4.0e7, 2.0e7, 4.25));
        return new SignalReport(LocalDate.parse(date), Instant.parse(date + "T08:00:01Z"), signals, anomalies);
    }
}
