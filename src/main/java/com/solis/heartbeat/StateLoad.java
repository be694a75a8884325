package com.solis.heartbeat;

/**
 * Outcome of reading run state. A defaulted load still carries a usable state.
 */
public final class StateLoad {
    public enum Status {
        LOADED,
        MISSING,
        UNREADABLE
    }

    public final Status status;
    public final RunState state;
    public final String detail;

    private StateLoad(Status status, RunState state, String detail) {
        this.status = status;
        this.state = state == null ? RunState.DEFAULT : state;
        this.detail = detail == null ? "" : detail;
    }

    public static StateLoad loaded(RunState state) {
        return new StateLoad(Status.LOADED, state, "");
    }

    public static StateLoad missing() {
        return new StateLoad(Status.MISSING, RunState.DEFAULT, "state file not found");
    }

    public static StateLoad unreadable(String detail) {
        return new StateLoad(Status.UNREADABLE, RunState.DEFAULT, detail);
    }

    public boolean isDefaulted() {
        return status != Status.LOADED;
    }
}
