package com.solis.heartbeat;

public enum SchedulerPhase {
    IDLE,
    ACQUIRING_LOCK,
    RUNNING,
    FATAL
}
