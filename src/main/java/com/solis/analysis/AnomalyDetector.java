package com.solis.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ObjDoubleConsumer;
import java.util.function.ToDoubleFunction;

/**
 * Z-score anomaly detection over a cohort of items.
 * <p>
 * Mean is the plain average; standard deviation is the sample estimate (divisor n-1).
 * A cohort without variance never yields anomalies.
 */
public final class AnomalyDetector {
    public static final double DEFAULT_THRESHOLD = 2.0;

    private AnomalyDetector() {
    }

    public static double zScore(double value, double mean, double stdDev) {
        if (stdDev == 0.0) {
            return 0.0;
        }
        return (value - mean) / stdDev;
    }

    public static <T> List<AnomalyResult<T>> detectAnomalies(
            List<T> items,
            ToDoubleFunction<T> extract,
            String metricName
    ) {
        return detectAnomalies(items, extract, metricName, DEFAULT_THRESHOLD);
    }

    public static <T> List<AnomalyResult<T>> detectAnomalies(
            List<T> items,
            ToDoubleFunction<T> extract,
            String metricName,
            double threshold
    ) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        double[] values = extractAll(items, extract);
        double avg = mean(values);
        double sd = sampleStdDev(values, avg);
        if (sd == 0.0) {
            return List.of();
        }

        List<AnomalyResult<T>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            double z = zScore(values[i], avg, sd);
            if (Math.abs(z) >= threshold) {
                out.add(new AnomalyResult<>(items.get(i), metricName, values[i], avg, sd, z));
            }
        }
        // List.sort is stable, so equal |z| keeps input order.
        out.sort(Comparator.comparingDouble(AnomalyResult<T>::absZScore).reversed());
        return out;
    }

    public static <T> List<ItemAnomalies<T>> detectMultiMetricAnomalies(
            List<T> items,
            List<Metric<T>> metrics
    ) {
        return detectMultiMetricAnomalies(items, metrics, DEFAULT_THRESHOLD);
    }

    /**
     * Runs {@link #detectAnomalies} once per metric and groups the hits by item.
     * <p>
     * Items are grouped by identity, so two distinct items that compare equal stay separate.
     * Groups follow the order in which their item was first flagged; each group's results
     * follow metric order.
     */
    public static <T> List<ItemAnomalies<T>> detectMultiMetricAnomalies(
            List<T> items,
            List<Metric<T>> metrics,
            double threshold
    ) {
        if (metrics == null) {
            return List.of();
        }
        Map<T, List<AnomalyResult<T>>> byItem = new IdentityHashMap<>();
        List<T> order = new ArrayList<>();
        for (Metric<T> metric : metrics) {
            for (AnomalyResult<T> anomaly : detectAnomalies(items, metric.extract(), metric.name(), threshold)) {
                List<AnomalyResult<T>> hits = byItem.get(anomaly.item());
                if (hits == null) {
                    hits = new ArrayList<>();
                    byItem.put(anomaly.item(), hits);
                    order.add(anomaly.item());
                }
                hits.add(anomaly);
            }
        }
        List<ItemAnomalies<T>> out = new ArrayList<>(order.size());
        for (T item : order) {
            out.add(new ItemAnomalies<>(item, byItem.get(item)));
        }
        return out;
    }

    public static <T> void enrichWithZScores(
            List<T> items,
            ToDoubleFunction<T> extract,
            ObjDoubleConsumer<T> setter
    ) {
        if (items == null || items.isEmpty()) {
            return;
        }
        double[] values = extractAll(items, extract);
        double avg = mean(values);
        double sd = sampleStdDev(values, avg);
        for (int i = 0; i < items.size(); i++) {
            setter.accept(items.get(i), sd == 0.0 ? 0.0 : zScore(values[i], avg, sd));
        }
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double sampleStdDev(double[] values, double avg) {
        if (values.length < 2) {
            return 0.0;
        }
        double sq = 0.0;
        for (double v : values) {
            double d = v - avg;
            sq += d * d;
        }
        return Math.sqrt(sq / (values.length - 1));
    }

    private static <T> double[] extractAll(List<T> items, ToDoubleFunction<T> extract) {
        double[] values = new double[items.size()];
        for (int i = 0; i < items.size(); i++) {
            values[i] = extract.applyAsDouble(items.get(i));
        }
        return values;
    }
}
