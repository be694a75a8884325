package com.solis.analysis;

import com.solis.model.DexVolumeSignal;
import com.solis.model.OnchainSignal;
import com.solis.model.RepoSignal;
import com.solis.model.ReportAnomaly;
import com.solis.model.SignalFamily;
import com.solis.model.SignalSet;
import com.solis.model.TokenSignal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Annotates each signal family with z-scores and collects the cohort outliers for a report.
 * <p>
 * Repos are scored on period change (commits, stars, forks); a missing delta counts as 0.
 * A repo flagged on several metrics is reported once, under its strongest metric.
 */
public final class SignalAnalyzer {
    private static final Logger LOG = LogManager.getLogger(SignalAnalyzer.class);

    static final List<Metric<RepoSignal>> REPO_METRICS = List.of(
            Metric.of("commits", RepoSignal::getCommitsDelta),
            Metric.of("stars", (RepoSignal r) -> orZero(r.getStarsDelta())),
            Metric.of("forks", (RepoSignal r) -> orZero(r.getForksDelta())));

    private final double threshold;

    public SignalAnalyzer() {
        this(AnomalyDetector.DEFAULT_THRESHOLD);
    }

    public SignalAnalyzer(double threshold) {
        if (!(threshold > 0.0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("anomaly threshold must be a positive number, got " + threshold);
        }
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    public SignalSet annotate(SignalSet signals) {
        if (signals == null) {
            return SignalSet.empty();
        }
        List<RepoSignal> repos = withZScores(signals.repos(), RepoSignal::getCommitsDelta,
                (r, z) -> r.toBuilder().commitsZScore(z).build());
        repos = withZScores(repos, r -> orZero(r.getStarsDelta()),
                (r, z) -> r.toBuilder().starsZScore(z).build());
        repos = withZScores(repos, r -> orZero(r.getForksDelta()),
                (r, z) -> r.toBuilder().forksZScore(z).build());
        return new SignalSet(
                repos,
                withZScores(signals.onchain(), OnchainSignal::getTxCount,
                        (s, z) -> s.toBuilder().txZScore(z).build()),
                withZScores(signals.dexVolumes(), DexVolumeSignal::getVolume24h,
                        (d, z) -> d.toBuilder().volumeZScore(z).build()),
                withZScores(signals.tokens(), TokenSignal::getVolume24h,
                        (t, z) -> t.toBuilder().volumeZScore(z).build())
        );
    }

    /**
     * Outliers across all families, each family ordered by descending |z|.
     */
    public List<ReportAnomaly> findAnomalies(SignalSet signals) {
        List<ReportAnomaly> out = new ArrayList<>();
        if (signals == null) {
            return out;
        }
        collectRepos(out, signals.repos());
        collect(out, SignalFamily.ONCHAIN, signals.onchain(), OnchainSignal::getProgramId, OnchainSignal::getTxCount, "txCount");
        collect(out, SignalFamily.DEX, signals.dexVolumes(), DexVolumeSignal::getProtocol, DexVolumeSignal::getVolume24h, "volume24h");
        collect(out, SignalFamily.TOKENS, signals.tokens(), TokenSignal::getId, TokenSignal::getVolume24h, "volume24h");
        LOG.info("[ANOMALY] threshold={} flagged={} signals={}", threshold, out.size(), signals.size());
        return out;
    }

    private <T> void collect(
            List<ReportAnomaly> out,
            SignalFamily family,
            List<T> items,
            Function<T, String> key,
            ToDoubleFunction<T> extract,
            String metric
    ) {
        for (AnomalyResult<T> hit : AnomalyDetector.detectAnomalies(items, extract, metric, threshold)) {
            out.add(toReportAnomaly(family, key.apply(hit.item()), hit));
        }
    }

    private void collectRepos(List<ReportAnomaly> out, List<RepoSignal> repos) {
        List<AnomalyResult<RepoSignal>> strongest = new ArrayList<>();
        for (ItemAnomalies<RepoSignal> group : AnomalyDetector.detectMultiMetricAnomalies(repos, REPO_METRICS, threshold)) {
            strongest.add(group.strongest());
        }
        strongest.sort(Comparator.comparingDouble(AnomalyResult<RepoSignal>::absZScore).reversed());
        for (AnomalyResult<RepoSignal> hit : strongest) {
            out.add(toReportAnomaly(SignalFamily.REPOS, hit.item().getRepo(), hit));
        }
    }

    private static <T> ReportAnomaly toReportAnomaly(SignalFamily family, String key, AnomalyResult<T> hit) {
        return new ReportAnomaly(family, key, hit.metric(), hit.value(), hit.mean(), hit.stdDev(), hit.zScore());
    }

    private static double orZero(Long value) {
        return value == null ? 0.0 : value;
    }

    private static <T> List<T> withZScores(List<T> items, ToDoubleFunction<T> extract, BiFunction<T, Double, T> rebuild) {
        List<T> out = new ArrayList<>(items);
        // Records are immutable, so score positions and rebuild in place.
        List<Integer> positions = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            positions.add(i);
        }
        AnomalyDetector.enrichWithZScores(
                positions,
                i -> extract.applyAsDouble(items.get(i)),
                (i, z) -> out.set(i, rebuild.apply(items.get(i), z)));
        return out;
    }
}
