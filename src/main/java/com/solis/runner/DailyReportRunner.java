package com.solis.runner;

import com.solis.alert.AlertNotifier;
import com.solis.analysis.SignalAnalyzer;
import com.solis.cache.CacheStore;
import com.solis.data.SignalCollector;
import com.solis.delta.DeltaEngine;
import com.solis.heartbeat.ReportPipeline;
import com.solis.model.ReportAnomaly;
import com.solis.model.SignalReport;
import com.solis.model.SignalSet;
import com.solis.report.JsonReportStore;
import com.solis.report.PreviousReportLoader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * One daily cycle: collect, diff against the previous report, score, write, alert.
 */
public final class DailyReportRunner implements ReportPipeline {
    private static final Logger LOG = LogManager.getLogger(DailyReportRunner.class);

    private final SignalCollector collector;
    private final PreviousReportLoader previousReports;
    private final JsonReportStore reportStore;
    private final DeltaEngine deltaEngine;
    private final SignalAnalyzer analyzer;
    private final CacheStore cache;
    private final boolean purgeExpiredCache;
    private final AlertNotifier alerts;
    private final Clock clock;

    public DailyReportRunner(
            SignalCollector collector,
            PreviousReportLoader previousReports,
            JsonReportStore reportStore,
            DeltaEngine deltaEngine,
            SignalAnalyzer analyzer,
            CacheStore cache,
            boolean purgeExpiredCache,
            AlertNotifier alerts,
            Clock clock
    ) {
        if (collector == null || previousReports == null || reportStore == null
                || deltaEngine == null || analyzer == null) {
            throw new IllegalArgumentException("collector, previousReports, reportStore, deltaEngine and analyzer are required");
        }
        this.collector = collector;
        this.previousReports = previousReports;
        this.reportStore = reportStore;
        this.deltaEngine = deltaEngine;
        this.analyzer = analyzer;
        this.cache = cache;
        this.purgeExpiredCache = purgeExpiredCache && cache != null;
        this.alerts = alerts == null ? AlertNotifier.disabled() : alerts;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public Optional<Path> run(LocalDate date) throws Exception {
        Instant started = clock.instant();
        LOG.info("[RUN] begin date={}", date);

        SignalSet collected = collector.collect(date);
        if (collected.size() == 0) {
            LOG.warn("[RUN] no signals collected date={}, report not written", date);
            return Optional.empty();
        }

        Optional<SignalReport> previous = previousReports.loadPrevious(date);
        SignalSet withDeltas = deltaEngine.applyDeltas(collected, previous);
        SignalSet scored = analyzer.annotate(withDeltas);
        List<ReportAnomaly> anomalies = analyzer.findAnomalies(scored);

        SignalReport report = new SignalReport(date, clock.instant(), scored, anomalies);
        Path written = reportStore.save(report);
        alerts.sendReportAlerts(report);

        if (purgeExpiredCache) {
            int purged = cache.purgeExpired();
            LOG.info("[RUN] purged expired cache entries count={}", purged);
        }
        LOG.info("[RUN] end date={} report={} baseline={} anomalies={} elapsed_ms={}",
                date,
                written,
                previous.map(r -> r.date().toString()).orElse("none"),
                anomalies.size(),
                Duration.between(started, clock.instant()).toMillis());
        return Optional.of(written);
    }
}
