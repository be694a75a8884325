package com.solis.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * The dated output of one successful cycle.
 */
public record SignalReport(
        LocalDate date,
        Instant generatedAt,
        SignalSet signals,
        List<ReportAnomaly> anomalies
) {
    public static final String VERSION = "1.0";

    public SignalReport {
        signals = signals == null ? SignalSet.empty() : signals;
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    }
}
