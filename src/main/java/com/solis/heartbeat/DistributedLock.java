package com.solis.heartbeat;

import java.io.IOException;

/**
 * Single-holder run lock shared by every agent instance.
 */
public interface DistributedLock {

    /**
     * @return {@code true} when this process now holds the lock, {@code false} when a live holder exists
     * @throws IOException when the lock backend itself is unusable
     */
    boolean tryAcquire() throws IOException;

    /**
     * Best effort; never throws.
     */
    void release();

    String describe();
}
