package com.solis.app;

import com.solis.alert.AlertNotifier;
import com.solis.analysis.SignalAnalyzer;
import com.solis.cache.CacheStore;
import com.solis.config.Config;
import com.solis.data.CachedSignalSource;
import com.solis.data.HttpSignalSource;
import com.solis.data.SignalSource;
import com.solis.data.SourceSignalCollector;
import com.solis.data.http.HttpJsonClient;
import com.solis.delta.DeltaEngine;
import com.solis.heartbeat.DistributedLock;
import com.solis.heartbeat.HeartbeatScheduler;
import com.solis.heartbeat.PidFileLock;
import com.solis.heartbeat.RunStateStore;
import com.solis.model.SignalFamily;
import com.solis.report.JsonReportStore;
import com.solis.report.SignalCodec;
import com.solis.retry.RetryExecutor;
import com.solis.retry.RetryOptions;
import com.solis.retry.Sleeper;
import com.solis.runner.DailyReportRunner;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Agent components assembled from one {@link Config}.
 */
public final class SolisAgent {
    public final Config config;
    public final CacheStore cache;
    public final RetryExecutor retry;
    public final DistributedLock lock;
    public final RunStateStore stateStore;
    public final JsonReportStore reportStore;
    public final AlertNotifier alerts;
    public final DailyReportRunner runner;
    public final HeartbeatScheduler scheduler;

    private SolisAgent(
            Config config,
            CacheStore cache,
            RetryExecutor retry,
            DistributedLock lock,
            RunStateStore stateStore,
            JsonReportStore reportStore,
            AlertNotifier alerts,
            DailyReportRunner runner,
            HeartbeatScheduler scheduler
    ) {
        this.config = config;
        this.cache = cache;
        this.retry = retry;
        this.lock = lock;
        this.stateStore = stateStore;
        this.reportStore = reportStore;
        this.alerts = alerts;
        this.runner = runner;
        this.scheduler = scheduler;
    }

    public static SolisAgent fromConfig(Config config) {
        return assemble(
                config,
                new CacheStore(config.getPath("cache.dir")),
                new PidFileLock(config.getPath("heartbeat.lock_file")),
                new RunStateStore(config.getPath("heartbeat.state_file")),
                config.getInt("heartbeat.hour_utc", 8),
                config.getDouble("cache.ttl_hours", 12.0),
                config.getBoolean("cache.purge_expired", false),
                Clock.systemUTC(),
                Sleeper.SYSTEM
        );
    }

    static SolisAgent assemble(
            Config config,
            CacheStore cache,
            DistributedLock lock,
            RunStateStore stateStore,
            int heartbeatHourUtc,
            double cacheTtlHours,
            boolean purgeExpired,
            Clock clock,
            Sleeper sleeper
    ) {
        RetryExecutor retry = new RetryExecutor(RetryOptions.fromConfig(config), sleeper);
        int timeoutSec = config.getInt("http.timeout_sec", 20);
        HttpJsonClient http = new HttpJsonClient(timeoutSec);
        AlertNotifier alerts = AlertNotifier.fromSettings(AlertNotifier.loadSettings(config), http);

        SourceSignalCollector collector = new SourceSignalCollector(
                cached(new HttpSignalSource<>(SignalFamily.REPOS, sourceUrl(config, SignalFamily.REPOS), http, timeoutSec, SignalCodec.REPOS),
                        SignalCodec.REPOS, cache, retry, cacheTtlHours),
                cached(new HttpSignalSource<>(SignalFamily.ONCHAIN, sourceUrl(config, SignalFamily.ONCHAIN), http, timeoutSec, SignalCodec.ONCHAIN),
                        SignalCodec.ONCHAIN, cache, retry, cacheTtlHours),
                cached(new HttpSignalSource<>(SignalFamily.DEX, sourceUrl(config, SignalFamily.DEX), http, timeoutSec, SignalCodec.DEX),
                        SignalCodec.DEX, cache, retry, cacheTtlHours),
                cached(new HttpSignalSource<>(SignalFamily.TOKENS, sourceUrl(config, SignalFamily.TOKENS), http, timeoutSec, SignalCodec.TOKENS),
                        SignalCodec.TOKENS, cache, retry, cacheTtlHours)
        );

        Path reportsDir = config.getPath("reports.dir");
        JsonReportStore reportStore = new JsonReportStore(reportsDir);
        DailyReportRunner runner = new DailyReportRunner(
                collector,
                reportStore,
                reportStore,
                new DeltaEngine(),
                new SignalAnalyzer(config.getDouble("anomaly.threshold", 2.0)),
                cache,
                purgeExpired,
                alerts,
                clock
        );
        HeartbeatScheduler scheduler = new HeartbeatScheduler(
                lock, stateStore, runner, heartbeatHourUtc, clock, sleeper, alerts);
        return new SolisAgent(config, cache, retry, lock, stateStore, reportStore, alerts, runner, scheduler);
    }

    private static String sourceUrl(Config config, SignalFamily family) {
        return config.getString("sources." + family.id() + ".url", "");
    }

    private static <T> SignalSource<T> cached(
            HttpSignalSource<T> source,
            SignalCodec<T> codec,
            CacheStore cache,
            RetryExecutor retry,
            double ttlHours
    ) {
        if (!source.isEnabled()) {
            return source;
        }
        return new CachedSignalSource<>(source, codec, cache, retry, ttlHours);
    }
}
