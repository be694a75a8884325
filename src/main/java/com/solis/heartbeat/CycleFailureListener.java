package com.solis.heartbeat;

import java.time.LocalDate;

/**
 * Told about each failed cycle after its failure is counted. Implementations must not throw.
 */
@FunctionalInterface
public interface CycleFailureListener {
    CycleFailureListener NONE = (date, error) -> { };

    void cycleFailed(LocalDate date, Exception error);
}
