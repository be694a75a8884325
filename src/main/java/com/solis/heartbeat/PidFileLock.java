package com.solis.heartbeat;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Lock file holding the owner's pid. A file left by a dead process is treated as stale,
 * removed, and creation is retried exactly once.
 * <p>
 * {@link #release()} is not an unconditional delete: it removes the file only while it still
 * records {@code ownerPid}, so a release from a shutdown hook or after a stale takeover never
 * drops a lock another process now holds.
 */
public final class PidFileLock implements DistributedLock {
    private static final Logger LOG = LogManager.getLogger(PidFileLock.class);

    private final Path lockFile;
    private final long ownerPid;
    private final ProcessProbe probe;

    public PidFileLock(Path lockFile) {
        this(lockFile, ProcessProbe.currentPid(), new OsProcessProbe());
    }

    public PidFileLock(Path lockFile, long ownerPid, ProcessProbe probe) {
        if (lockFile == null) {
            throw new IllegalArgumentException("lockFile must not be null");
        }
        this.lockFile = lockFile;
        this.ownerPid = ownerPid;
        this.probe = probe == null ? new OsProcessProbe() : probe;
    }

    public Path lockFile() {
        return lockFile;
    }

    @Override
    public boolean tryAcquire() throws IOException {
        if (createLockFile()) {
            return true;
        }

        long holder = readHolderPid();
        if (holder > 0L && probe.isAlive(holder)) {
            LOG.info("[LOCK] held by live process pid={} file={}", holder, lockFile);
            return false;
        }

        LOG.warn("[LOCK] removing stale lock file={} recorded_pid={}", lockFile, holder);
        try {
            Files.deleteIfExists(lockFile);
        } catch (IOException e) {
            LOG.warn("[LOCK] failed to delete stale lock file={} error={}", lockFile, e.getMessage());
        }
        try {
            return createLockFile();
        } catch (IOException e) {
            LOG.warn("[LOCK] retry after stale lock failed file={} error={}", lockFile, e.getMessage());
            return false;
        }
    }

    @Override
    public void release() {
        long holder = readHolderPid();
        if (holder != ownerPid) {
            LOG.debug("[LOCK] not released, held by pid={} file={}", holder, lockFile);
            return;
        }
        try {
            Files.deleteIfExists(lockFile);
        } catch (IOException e) {
            LOG.warn("[LOCK] release failed file={} error={}", lockFile, e.getMessage());
        }
    }

    @Override
    public String describe() {
        return "pid-file:" + lockFile.toAbsolutePath();
    }

    /**
     * @return pid recorded in the lock file, or -1 when it is missing or not a number
     */
    long readHolderPid() {
        try {
            String raw = Files.readString(lockFile, StandardCharsets.UTF_8).trim();
            return Long.parseLong(raw);
        } catch (NoSuchFileException e) {
            return -1L;
        } catch (IOException | NumberFormatException e) {
            LOG.warn("[LOCK] unreadable lock file={} error={}", lockFile, e.getMessage());
            return -1L;
        }
    }

    private boolean createLockFile() throws IOException {
        try {
            Files.writeString(
                    lockFile,
                    String.valueOf(ownerPid),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE
            );
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }
}
