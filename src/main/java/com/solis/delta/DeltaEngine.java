package com.solis.delta;

import com.solis.model.DexVolumeSignal;
import com.solis.model.OnchainSignal;
import com.solis.model.RepoSignal;
import com.solis.model.SignalReport;
import com.solis.model.SignalSet;
import com.solis.model.TokenSignal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Period-over-period change between the current signal set and the previous report.
 * <p>
 * Returns new records; inputs are not modified. A delta is only set when the previous
 * report has a record with the same natural key, so {@code null} always means "no baseline".
 * Delta values that arrive with the current records (for example from an upstream payload)
 * are cleared rather than passed through.
 */
public final class DeltaEngine {
    private static final Logger LOG = LogManager.getLogger(DeltaEngine.class);

    public SignalSet applyDeltas(SignalSet current, Optional<SignalReport> previousReport) {
        if (current == null) {
            return SignalSet.empty();
        }
        if (previousReport == null || previousReport.isEmpty()) {
            LOG.info("[DELTA] no previous report, skipping delta calculation");
            return withoutDeltas(current);
        }
        SignalSet previous = previousReport.get().signals();

        Map<String, RepoSignal> prevRepos = index(previous.repos(), RepoSignal::getRepo);
        List<RepoSignal> repos = new ArrayList<>(current.repos().size());
        for (RepoSignal repo : current.repos()) {
            RepoSignal prev = prevRepos.get(repo.getRepo());
            if (prev == null) {
                repos.add(clearDeltas(repo));
                continue;
            }
            repos.add(repo.toBuilder()
                    .starsDelta(repo.getStars() - prev.getStars())
                    .forksDelta(repo.getForks() - prev.getForks())
                    .contributorsDelta(repo.getContributors() - prev.getContributors())
                    .build());
        }

        Map<String, OnchainSignal> prevOnchain = index(previous.onchain(), OnchainSignal::getProgramId);
        List<OnchainSignal> onchain = new ArrayList<>(current.onchain().size());
        for (OnchainSignal signal : current.onchain()) {
            OnchainSignal prev = prevOnchain.get(signal.getProgramId());
            onchain.add(signal.toBuilder()
                    .txDelta(prev == null ? null : signal.getTxCount() - prev.getTxCount())
                    .build());
        }

        Map<String, DexVolumeSignal> prevDex = index(previous.dexVolumes(), DexVolumeSignal::getProtocol);
        List<DexVolumeSignal> dex = new ArrayList<>(current.dexVolumes().size());
        for (DexVolumeSignal protocol : current.dexVolumes()) {
            DexVolumeSignal prev = prevDex.get(protocol.getProtocol());
            Double delta = prev == null ? null : percentChange(protocol.getVolume24h(), prev.getVolume24h());
            dex.add(protocol.toBuilder().volumeDelta(delta).build());
        }

        Map<String, TokenSignal> prevTokens = index(previous.tokens(), TokenSignal::getId);
        List<TokenSignal> tokens = new ArrayList<>(current.tokens().size());
        for (TokenSignal token : current.tokens()) {
            TokenSignal prev = prevTokens.get(token.getId());
            Double delta = prev == null ? null : percentChange(token.getVolume24h(), prev.getVolume24h());
            tokens.add(token.toBuilder().volumeDelta(delta).build());
        }

        LOG.info("[DELTA] complete repos={} onchain={} dex={} tokens={} baseline_date={}",
                repos.size(), onchain.size(), dex.size(), tokens.size(), previousReport.get().date());
        return new SignalSet(repos, onchain, dex, tokens);
    }

    /**
     * Percent change, or {@code null} when the baseline is zero or the result is not finite.
     */
    static Double percentChange(double current, double previous) {
        if (previous == 0.0) {
            return null;
        }
        double change = (current - previous) / previous * 100.0;
        return Double.isFinite(change) ? change : null;
    }

    static SignalSet withoutDeltas(SignalSet signals) {
        List<RepoSignal> repos = new ArrayList<>(signals.repos().size());
        for (RepoSignal repo : signals.repos()) {
            repos.add(clearDeltas(repo));
        }
        List<OnchainSignal> onchain = new ArrayList<>(signals.onchain().size());
        for (OnchainSignal signal : signals.onchain()) {
            onchain.add(signal.toBuilder().txDelta(null).build());
        }
        List<DexVolumeSignal> dex = new ArrayList<>(signals.dexVolumes().size());
        for (DexVolumeSignal protocol : signals.dexVolumes()) {
            dex.add(protocol.toBuilder().volumeDelta(null).build());
        }
        List<TokenSignal> tokens = new ArrayList<>(signals.tokens().size());
        for (TokenSignal token : signals.tokens()) {
            tokens.add(token.toBuilder().volumeDelta(null).build());
        }
        return new SignalSet(repos, onchain, dex, tokens);
    }

    private static RepoSignal clearDeltas(RepoSignal repo) {
        return repo.toBuilder()
                .starsDelta(null)
                .forksDelta(null)
                .contributorsDelta(null)
                .build();
    }

    private static <T> Map<String, T> index(List<T> records, Function<T, String> key) {
        Map<String, T> out = new HashMap<>();
        for (T record : records) {
            String k = key.apply(record);
            if (k != null) {
                out.put(k, record);
            }
        }
        return out;
    }
}
