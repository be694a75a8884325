package com.solis.heartbeat;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON run-state file. Loading never fails; saving goes through a pid-suffixed temp
 * file and an atomic rename, and write errors are propagated.
 */
public final class RunStateStore {
    private static final Logger LOG = LogManager.getLogger(RunStateStore.class);

    private final Path stateFile;
    private final long ownerPid;

    public RunStateStore(Path stateFile) {
        this(stateFile, ProcessProbe.currentPid());
    }

    public RunStateStore(Path stateFile, long ownerPid) {
        if (stateFile == null) {
            throw new IllegalArgumentException("stateFile must not be null");
        }
        this.stateFile = stateFile;
        this.ownerPid = ownerPid;
    }

    public Path stateFile() {
        return stateFile;
    }

    public StateLoad load() {
        String raw;
        try {
            raw = Files.readString(stateFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return StateLoad.missing();
        } catch (IOException e) {
            LOG.warn("[STATE] read failed file={} error={}, using defaults", stateFile, e.getMessage());
            return StateLoad.unreadable("read_failed: " + e.getMessage());
        }
        try {
            JSONObject root = new JSONObject(raw);
            RunState d = RunState.DEFAULT;
            return StateLoad.loaded(new RunState(
                    root.optLong("lastRunTime", d.lastRunTime()),
                    root.optString("lastRunDate", d.lastRunDate()),
                    root.optInt("consecutiveFailures", d.consecutiveFailures()),
                    root.optInt("cycleCount", d.cycleCount()),
                    root.optInt("totalReports", d.totalReports())
            ));
        } catch (JSONException e) {
            LOG.warn("[STATE] unparsable file={} error={}, using defaults", stateFile, e.getMessage());
            return StateLoad.unreadable("parse_failed: " + e.getMessage());
        }
    }

    public void save(RunState state) throws IOException {
        Path tempFile = stateFile.resolveSibling(stateFile.getFileName() + ".tmp." + ownerPid);
        try {
            Path parent = stateFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(tempFile, toJson(state).toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(tempFile, stateFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    static JSONObject toJson(RunState state) {
        JSONObject root = new JSONObject();
        root.put("lastRunTime", state.lastRunTime());
        root.put("lastRunDate", state.lastRunDate());
        root.put("consecutiveFailures", state.consecutiveFailures());
        root.put("cycleCount", state.cycleCount());
        root.put("totalReports", state.totalReports());
        return root;
    }
}
