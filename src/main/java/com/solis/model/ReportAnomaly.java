package com.solis.model;

/**
 * Serializable form of an anomaly: which family, which record key, which metric.
 */
public record ReportAnomaly(
        SignalFamily family,
        String key,
        String metric,
        double value,
        double mean,
        double stdDev,
        double zScore
) {
}
