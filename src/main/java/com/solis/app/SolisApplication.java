package com.solis.app;

import com.solis.cache.CacheStore;
import com.solis.config.Config;
import com.solis.heartbeat.CycleOutcome;
import com.solis.heartbeat.HeartbeatScheduler;
import com.solis.heartbeat.RunState;
import com.solis.heartbeat.StateLoad;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

public final class SolisApplication {
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INTERRUPTED = 130;

    private static volatile boolean LOG_ROUTE_INSTALLED = false;
    private static volatile boolean SHUTTING_DOWN = false;

    public static void main(String[] args) {
        int exit = new SolisApplication().run(args);
        if (!SHUTTING_DOWN) {
            System.exit(exit);
        }
    }

    public int run(String[] args) {
        return run(args, Path.of(".").toAbsolutePath().normalize());
    }

    int run(String[] args, Path workingDir) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("solis-agent", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("solis-agent", options);
            return EXIT_OK;
        }

        Logger log = null;
        try {
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);
            log = LogManager.getLogger(SolisApplication.class);
            logConfigSummary(log, config);

            SolisAgent agent;
            try {
                agent = SolisAgent.fromConfig(config);
            } catch (IllegalArgumentException e) {
                System.err.println("ERROR: invalid configuration: " + e.getMessage());
                return EXIT_USAGE;
            }

            if (cmd.hasOption("status")) {
                return printStatus(agent);
            }
            if (cmd.hasOption("clear-cache")) {
                return clearCache(agent.cache, cmd.getOptionValue("clear-cache"));
            }
            if (cmd.hasOption("once")) {
                CycleOutcome outcome = agent.scheduler.runCycle();
                System.out.println("ONCE completed. outcome=" + outcome + ", state=" + agent.scheduler.state());
                if (Thread.currentThread().isInterrupted()) {
                    return EXIT_INTERRUPTED;
                }
                return outcome == CycleOutcome.FAILED ? EXIT_FATAL : EXIT_OK;
            }
            return runSchedule(agent);
        } catch (IOException e) {
            System.err.println("FATAL: " + e.getMessage());
            if (log != null) {
                log.fatal("[APP] fatal error, exiting", e);
            }
            return EXIT_FATAL;
        } catch (RuntimeException e) {
            System.err.println("FATAL: " + e.getMessage());
            if (log != null) {
                log.fatal("[APP] unexpected error, exiting", e);
            }
            return EXIT_FATAL;
        }
    }

    private int runSchedule(SolisAgent agent) throws IOException {
        HeartbeatScheduler scheduler = agent.scheduler;
        Thread mainThread = Thread.currentThread();
        Thread hook = new Thread(() -> {
            SHUTTING_DOWN = true;
            System.out.println("Shutdown requested, stopping heartbeat.");
            mainThread.interrupt();
            try {
                mainThread.join(5_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            agent.lock.release();
        }, "solis-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        System.out.println("Schedule mode started. hour_utc=" + agent.config.getInt("heartbeat.hour_utc", 8)
                + ", lock=" + agent.lock.describe());
        try {
            scheduler.runForever();
        } finally {
            if (!SHUTTING_DOWN) {
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    System.out.println("Shutdown already in progress: " + e.getMessage());
                }
            }
        }
        return Thread.currentThread().isInterrupted() || SHUTTING_DOWN ? EXIT_INTERRUPTED : EXIT_OK;
    }

    private int printStatus(SolisAgent agent) {
        StateLoad load = agent.stateStore.load();
        RunState state = load.state;
        System.out.println("state_file=" + agent.stateStore.stateFile().toAbsolutePath() + " (" + load.status + ")");
        System.out.println("last_run_date=" + (state.lastRunDate().isEmpty() ? "never" : state.lastRunDate()));
        System.out.println("last_run_time=" + (state.lastRunTime() <= 0L ? "never" : Instant.ofEpochMilli(state.lastRunTime())));
        System.out.println("cycle_count=" + state.cycleCount());
        System.out.println("total_reports=" + state.totalReports());
        System.out.println("consecutive_failures=" + state.consecutiveFailures());
        System.out.println("next_run_in=" + HeartbeatScheduler.formatDuration(agent.scheduler.msUntilNextRun()));
        return EXIT_OK;
    }

    private int clearCache(CacheStore cache, String source) {
        if (source == null || source.trim().isEmpty()) {
            List<String> sources = cache.sources();
            cache.clear();
            System.out.println("Cache cleared. dir=" + cache.cacheDir().toAbsolutePath() + ", sources=" + sources);
        } else {
            cache.clear(source.trim());
            System.out.println("Cache cleared. source=" + source.trim());
        }
        return EXIT_OK;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (SolisApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.log_dir");
                Files.createDirectories(logDir);
                System.setProperty("solis.log.dir", logDir.toAbsolutePath().toString());
                System.setProperty("solis.log.level", config.getString("log.level", "info"));

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(SolisApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (IOException | SecurityException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private void logConfigSummary(Logger log, Config config) {
        for (Config.ResolvedValue value : config.summary()) {
            log.debug("[CONFIG] {}={} source={}", value.key, value.value, value.source);
        }
        log.info("[CONFIG] hour_utc={} reports_dir={} cache_dir={} threshold={} alerts={}",
                config.getInt("heartbeat.hour_utc", 8),
                config.getPath("reports.dir"),
                config.getPath("cache.dir"),
                config.getDouble("anomaly.threshold", 2.0),
                config.getBoolean("alerts.enabled", false) ? config.getString("alerts.channel") : "off");
    }

    static Options buildOptions() {
        Options options = new Options();
        OptionGroup modes = new OptionGroup();
        modes.addOption(Option.builder().longOpt("once").desc("run one heartbeat cycle now, then exit").build());
        modes.addOption(Option.builder().longOpt("schedule").desc("run the daily heartbeat loop (default)").build());
        modes.addOption(Option.builder().longOpt("status").desc("print persisted run state, then exit").build());
        modes.addOption(Option.builder()
                .longOpt("clear-cache")
                .hasArg()
                .optionalArg(true)
                .argName("source")
                .desc("clear one cache namespace, or all of them when no source is given")
                .build());
        modes.addOption(Option.builder("h").longOpt("help").desc("show help").build());
        options.addOptionGroup(modes);
        return options;
    }
}
