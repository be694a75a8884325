package com.solis.heartbeat;

/**
 * Liveness check through the JDK process API; does not touch the target process.
 */
public final class OsProcessProbe implements ProcessProbe {

    @Override
    public boolean isAlive(long pid) {
        if (pid <= 0L) {
            return false;
        }
        return ProcessHandle.of(pid)
                .map(ProcessHandle::isAlive)
                .orElse(false);
    }
}
