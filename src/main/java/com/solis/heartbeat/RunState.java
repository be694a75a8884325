package com.solis.heartbeat;

import java.time.LocalDate;

/**
 * Process-wide run counters, persisted after every cycle.
 *
 * @param lastRunTime epoch millis of the last successful cycle, 0 if none
 * @param lastRunDate UTC date ({@code yyyy-MM-dd}) of the last successful cycle, empty if none
 */
public record RunState(
        long lastRunTime,
        String lastRunDate,
        int consecutiveFailures,
        int cycleCount,
        int totalReports
) {
    public static final RunState DEFAULT = new RunState(0L, "", 0, 0, 0);

    public RunState {
        lastRunDate = lastRunDate == null ? "" : lastRunDate;
        consecutiveFailures = Math.max(0, consecutiveFailures);
        cycleCount = Math.max(0, cycleCount);
        totalReports = Math.max(0, totalReports);
    }

    public boolean ranOn(LocalDate date) {
        return date != null && date.toString().equals(lastRunDate);
    }

    public RunState recordSuccess(long finishedAtMillis, LocalDate date, boolean reportProduced) {
        return new RunState(
                finishedAtMillis,
                date == null ? lastRunDate : date.toString(),
                0,
                cycleCount,
                reportProduced ? totalReports + 1 : totalReports
        );
    }

    public RunState recordFailure() {
        return new RunState(lastRunTime, lastRunDate, consecutiveFailures + 1, cycleCount, totalReports);
    }

    public RunState nextCycle() {
        return new RunState(lastRunTime, lastRunDate, consecutiveFailures, cycleCount + 1, totalReports);
    }
}
