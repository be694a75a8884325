package com.solis.analysis;

import java.util.List;

/**
 * Every metric on which one item was flagged, in metric order.
 */
public record ItemAnomalies<T>(T item, List<AnomalyResult<T>> results) {
    public ItemAnomalies {
        results = List.copyOf(results);
    }

    public AnomalyResult<T> strongest() {
        AnomalyResult<T> best = results.get(0);
        for (AnomalyResult<T> result : results) {
            if (result.absZScore() > best.absZScore()) {
                best = result;
            }
        }
        return best;
    }
}
