package com.solis.heartbeat;

import com.solis.retry.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Daily single-instance run loop.
 * <p>
 * Per cycle: acquire the run lock, execute the pipeline, persist counters, release the lock.
 * Those steps never overlap or reorder. A held lock skips the cycle. A failed pipeline bumps
 * {@code consecutiveFailures} and is reported to the {@link CycleFailureListener} once the
 * counters are saved; the loop then waits for the next day. Lock backend and state write
 * errors are fatal and propagate to the caller.
 */
public final class HeartbeatScheduler {
    private static final Logger LOG = LogManager.getLogger(HeartbeatScheduler.class);

    private final DistributedLock lock;
    private final RunStateStore stateStore;
    private final ReportPipeline pipeline;
    private final int heartbeatHourUtc;
    private final Clock clock;
    private final Sleeper sleeper;
    private final CycleFailureListener failureListener;

    private volatile SchedulerPhase phase = SchedulerPhase.IDLE;
    private volatile RunState state;

    public HeartbeatScheduler(
            DistributedLock lock,
            RunStateStore stateStore,
            ReportPipeline pipeline,
            int heartbeatHourUtc
    ) {
        this(lock, stateStore, pipeline, heartbeatHourUtc, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public HeartbeatScheduler(
            DistributedLock lock,
            RunStateStore stateStore,
            ReportPipeline pipeline,
            int heartbeatHourUtc,
            Clock clock,
            Sleeper sleeper
    ) {
        this(lock, stateStore, pipeline, heartbeatHourUtc, clock, sleeper, CycleFailureListener.NONE);
    }

    public HeartbeatScheduler(
            DistributedLock lock,
            RunStateStore stateStore,
            ReportPipeline pipeline,
            int heartbeatHourUtc,
            Clock clock,
            Sleeper sleeper,
            CycleFailureListener failureListener
    ) {
        if (lock == null || stateStore == null || pipeline == null) {
            throw new IllegalArgumentException("lock, stateStore and pipeline are required");
        }
        checkHour(heartbeatHourUtc);
        this.lock = lock;
        this.stateStore = stateStore;
        this.pipeline = pipeline;
        this.heartbeatHourUtc = heartbeatHourUtc;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.failureListener = failureListener == null ? CycleFailureListener.NONE : failureListener;
        this.state = loadState();
    }

    public SchedulerPhase phase() {
        return phase;
    }

    public RunState state() {
        return state;
    }

    public long msUntilNextRun() {
        return msUntilNextRun(heartbeatHourUtc, clock.instant());
    }

    /**
     * Millis from {@code now} until the next {@code hourUtc}:00:00Z. A target equal to or
     * before {@code now} moves to the following day.
     */
    public static long msUntilNextRun(int hourUtc, Instant now) {
        checkHour(hourUtc);
        ZonedDateTime nowUtc = now.atZone(ZoneOffset.UTC);
        ZonedDateTime target = nowUtc.toLocalDate().atTime(hourUtc, 0).atZone(ZoneOffset.UTC);
        if (!now.isBefore(target.toInstant())) {
            target = target.plusDays(1);
        }
        return Duration.between(now, target.toInstant()).toMillis();
    }

    public static String formatDuration(long ms) {
        long safe = Math.max(0L, ms);
        long hours = safe / 3_600_000L;
        long minutes = (safe % 3_600_000L) / 60_000L;
        return String.format(Locale.ROOT, "%dh %dm", hours, minutes);
    }

    /**
     * Sleeps until each scheduled hour and runs a cycle, until the thread is interrupted.
     *
     * @throws IOException when the lock backend or the state file cannot be written
     */
    public void runForever() throws IOException {
        Instant started = clock.instant();
        LOG.info("[HEARTBEAT] started target_hour_utc={} lock={} state_file={} last_run_date={} total_reports={}",
                heartbeatHourUtc,
                lock.describe(),
                stateStore.stateFile(),
                state.lastRunDate().isEmpty() ? "never" : state.lastRunDate(),
                state.totalReports());
        while (!Thread.currentThread().isInterrupted()) {
            long sleepMs = msUntilNextRun();
            LOG.info("[HEARTBEAT] sleeping next_run_in={} target={}:00 UTC", formatDuration(sleepMs), heartbeatHourUtc);
            try {
                sleeper.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            CycleOutcome outcome = runCycle();
            LOG.info("[HEARTBEAT] cycle finished outcome={} cycles={} total_reports={} consecutive_failures={}",
                    outcome, state.cycleCount(), state.totalReports(), state.consecutiveFailures());
        }
        LOG.info("[HEARTBEAT] stopping cycles={} total_reports={} uptime={}",
                state.cycleCount(),
                state.totalReports(),
                formatDuration(Duration.between(started, clock.instant()).toMillis()));
    }

    /**
     * One guarded execution of the pipeline for today's UTC date.
     */
    public CycleOutcome runCycle() throws IOException {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        phase = SchedulerPhase.ACQUIRING_LOCK;
        boolean acquired;
        try {
            acquired = lock.tryAcquire();
        } catch (IOException e) {
            phase = SchedulerPhase.FATAL;
            LOG.error("[HEARTBEAT] lock backend failure lock={} error={}", lock.describe(), e.getMessage());
            throw e;
        }
        if (!acquired) {
            phase = SchedulerPhase.IDLE;
            LOG.warn("[HEARTBEAT] another instance holds the lock, skipping cycle date={}", today);
            return CycleOutcome.SKIPPED_LOCKED;
        }

        try {
            // Another instance may have run while this one slept.
            state = loadState();
            if (state.ranOn(today)) {
                phase = SchedulerPhase.IDLE;
                LOG.info("[HEARTBEAT] already ran today, skipping date={}", today);
                return CycleOutcome.SKIPPED_ALREADY_RAN;
            }

            phase = SchedulerPhase.RUNNING;
            LOG.info("[HEARTBEAT] starting cycle={} date={}", state.cycleCount() + 1, today);
            RunState next;
            CycleOutcome outcome;
            Exception failure = null;
            boolean interrupted = false;
            try {
                Optional<Path> report = pipeline.run(today);
                next = state.recordSuccess(clock.millis(), today, report.isPresent());
                outcome = CycleOutcome.COMPLETED;
                LOG.info("[HEARTBEAT] cycle complete date={} report={}", today, report.map(Path::toString).orElse("none"));
            } catch (Exception e) {
                interrupted = e instanceof InterruptedException;
                failure = e;
                next = state.recordFailure();
                outcome = CycleOutcome.FAILED;
                LOG.error("[HEARTBEAT] cycle failed date={} consecutive_failures={}",
                        today, next.consecutiveFailures(), e);
            }
            next = next.nextCycle();

            // File channels are interruptible; hold a pending interrupt until the state is on disk.
            interrupted = Thread.interrupted() || interrupted;
            try {
                stateStore.save(next);
            } catch (IOException e) {
                phase = SchedulerPhase.FATAL;
                LOG.error("[HEARTBEAT] failed to persist run state file={} error={}", stateStore.stateFile(), e.getMessage());
                throw e;
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
            state = next;
            phase = SchedulerPhase.IDLE;
            if (failure != null && !interrupted) {
                notifyFailure(today, failure);
            }
            return outcome;
        } finally {
            lock.release();
        }
    }

    private void notifyFailure(LocalDate date, Exception failure) {
        try {
            failureListener.cycleFailed(date, failure);
        } catch (RuntimeException e) {
            LOG.warn("[HEARTBEAT] failure listener threw date={} error={}", date, e.getMessage());
        }
    }

    private RunState loadState() {
        StateLoad load = stateStore.load();
        if (load.isDefaulted()) {
            LOG.info("[HEARTBEAT] run state defaulted reason={} detail={}", load.status, load.detail);
        }
        return load.state;
    }

    private static void checkHour(int hourUtc) {
        if (hourUtc < 0 || hourUtc > 23) {
            throw new IllegalArgumentException("heartbeat hour must be within 0..23, got " + hourUtc);
        }
    }
}
