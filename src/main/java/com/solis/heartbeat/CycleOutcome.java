package com.solis.heartbeat;

public enum CycleOutcome {
    COMPLETED,
    FAILED,
    /** Another live process holds the lock. */
    SKIPPED_LOCKED,
    /** Run state already records a run for today. */
    SKIPPED_ALREADY_RAN
}
