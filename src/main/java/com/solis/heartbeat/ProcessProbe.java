package com.solis.heartbeat;

@FunctionalInterface
public interface ProcessProbe {
    boolean isAlive(long pid);

    static long currentPid() {
        return ProcessHandle.current().pid();
    }
}
