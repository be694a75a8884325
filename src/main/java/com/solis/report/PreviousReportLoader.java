package com.solis.report;

import com.solis.model.SignalReport;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Source of the baseline report for delta calculation.
 */
@FunctionalInterface
public interface PreviousReportLoader {

    /**
     * Most recent stored report whose date is not {@code excludeDate}. Empty when there is
     * none or it cannot be read; implementations do not throw.
     */
    Optional<SignalReport> loadPrevious(LocalDate excludeDate);
}
