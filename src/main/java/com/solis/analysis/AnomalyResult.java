package com.solis.analysis;

/**
 * One item flagged on one metric, with the cohort statistics it was measured against.
 */
public record AnomalyResult<T>(
        T item,
        String metric,
        double value,
        double mean,
        double stdDev,
        double zScore
) {
    public double absZScore() {
        return Math.abs(zScore);
    }
}
