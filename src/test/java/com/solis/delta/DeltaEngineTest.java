package com.solis.delta;

import com.solis.model.DexVolumeSignal;
import com.solis.model.OnchainSignal;
import com.solis.model.RepoSignal;
import com.solis.model.SignalReport;
import com.solis.model.SignalSet;
import com.solis.model.TokenSignal;
import com.solis.report.SignalCodec;
import org.json.JSONArray;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class DeltaEngineTest {
    private final DeltaEngine engine = new DeltaEngine();

    @Test
    void applyDeltasShouldLeaveDeltasUnsetWithoutPreviousReport() {
        SignalSet current = new SignalSet(List.of(repo("a/b", 10, 2, 1)), null, null, null);

        SignalSet result = engine.applyDeltas(current, Optional.empty());

        assertEquals(current, result);
        assertNull(result.repos().get(0).getStarsDelta());
    }

    @Test
    void applyDeltasShouldDropDeltasCarriedInByFetchedPayload() {
        List<TokenSignal> tokens = SignalCodec.TOKENS.fromJsonArray(
                new JSONArray("[{\"id\":\"sol\",\"volume24h\":100,\"volumeDelta\":42.5}]"));
        List<RepoSignal> repos = SignalCodec.REPOS.fromJsonArray(
                new JSONArray("[{\"repo\":\"fresh/repo\",\"stars\":9,\"starsDelta\":7,\"forksDelta\":2}]"));
        List<OnchainSignal> onchain = SignalCodec.ONCHAIN.fromJsonArray(
                new JSONArray("[{\"programId\":\"JUP\",\"txCount\":10,\"txDelta\":3}]"));
        SignalSet fetched = new SignalSet(repos, onchain, null, tokens);
        assertEquals(42.5, fetched.tokens().get(0).getVolumeDelta(), 1e-9);

        SignalSet firstRun = engine.applyDeltas(fetched, Optional.empty());

        assertNull(firstRun.tokens().get(0).getVolumeDelta());
        assertNull(firstRun.repos().get(0).getStarsDelta());
        assertNull(firstRun.repos().get(0).getForksDelta());
        assertNull(firstRun.onchain().get(0).getTxDelta());

        SignalSet previous = new SignalSet(List.of(repo("other/repo", 1, 1, 1)), null, null,
                List.of(token("btc", 50.0)));
        SignalSet unmatched = engine.applyDeltas(fetched, Optional.of(report(previous)));

        assertNull(unmatched.tokens().get(0).getVolumeDelta());
        assertNull(unmatched.repos().get(0).getStarsDelta());
        assertNull(unmatched.onchain().get(0).getTxDelta());
    }

    @Test
    void applyDeltasShouldComputeAbsoluteRepoAndOnchainDeltas() {
        SignalSet previous = new SignalSet(
                List.of(repo("a/b", 100, 10, 4)),
                List.of(program("JUP", 1_000)),
                null, null);
        SignalSet current = new SignalSet(
                List.of(repo("a/b", 130, 8, 4), repo("new/repo", 5, 0, 1)),
                List.of(program("JUP", 1_500), program("NEW", 10)),
                null, null);

        SignalSet result = engine.applyDeltas(current, Optional.of(report(previous)));

        RepoSignal matched = result.repos().get(0);
        assertEquals(30L, matched.getStarsDelta());
        assertEquals(-2L, matched.getForksDelta());
        assertEquals(0L, matched.getContributorsDelta());
        assertNull(result.repos().get(1).getStarsDelta());
        assertEquals(500L, result.onchain().get(0).getTxDelta());
        assertNull(result.onchain().get(1).getTxDelta());
    }

    @Test
    void applyDeltasShouldComputePercentChangeForVolumes() {
        SignalSet previous = new SignalSet(null, null,
                List.of(dex("orca", 200.0), dex("zero", 0.0)),
                List.of(token("sol", 1_000.0)));
        SignalSet current = new SignalSet(null, null,
                List.of(dex("orca", 250.0), dex("zero", 40.0), dex("fresh", 1.0)),
                List.of(token("sol", 900.0)));

        SignalSet result = engine.applyDeltas(current, Optional.of(report(previous)));

        assertEquals(25.0, result.dexVolumes().get(0).getVolumeDelta(), 1e-9);
        assertNull(result.dexVolumes().get(1).getVolumeDelta());
        assertNull(result.dexVolumes().get(2).getVolumeDelta());
        assertEquals(-10.0, result.tokens().get(0).getVolumeDelta(), 1e-9);
    }

    @Test
    void applyDeltasShouldNotModifyInputs() {
        RepoSignal original = repo("a/b", 10, 1, 1);
        SignalSet current = new SignalSet(List.of(original), null, null, null);
        SignalSet previous = new SignalSet(List.of(repo("a/b", 3, 1, 1)), null, null, null);

        SignalSet result = engine.applyDeltas(current, Optional.of(report(previous)));

        assertNull(current.repos().get(0).getStarsDelta());
        assertEquals(7L, result.repos().get(0).getStarsDelta());
        assertEquals(original, current.repos().get(0));
    }

    @Test
    void percentChangeShouldBeNullForZeroBaseline() {
        assertNull(DeltaEngine.percentChange(5.0, 0.0));
        assertEquals(100.0, DeltaEngine.percentChange(2.0, 1.0), 1e-9);
    }

    @Test
    void percentChangeShouldBeNullWhenResultIsNotFinite() {
        assertNull(DeltaEngine.percentChange(1.0e300, Double.MIN_VALUE));
        assertNull(DeltaEngine.percentChange(-1.0e300, Double.MIN_VALUE));
    }

    private static SignalReport report(SignalSet signals) {
        return new SignalReport(LocalDate.parse("2026-02-28"), Instant.parse("2026-02-28T08:00:00Z"), signals, List.of());
    }

    private static RepoSignal repo(String name, long stars, long forks, long contributors) {
        return RepoSignal.builder().repo(name).stars(stars).forks(forks).contributors(contributors).build();
    }

    private static OnchainSignal program(String id, long txCount) {
        return OnchainSignal.builder().programId(id).programName(id).txCount(txCount).build();
    }

    private static DexVolumeSignal dex(String protocol, double volume) {
        return DexVolumeSignal.builder().protocol(protocol).volume24h(volume).build();
    }

    private static TokenSignal token(String id, double volume) {
        return TokenSignal.builder().id(id).symbol(id.toUpperCase()).volume24h(volume).build();
    }
}
