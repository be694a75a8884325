package com.solis.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-backed cache with per-entry TTL, one directory per source.
 * <p>
 * Expiry is lazy: stale files stay on disk until overwritten or purged. Reads never throw;
 * any failure is reported as a non-hit {@link CacheLookup}. Concurrent writers to the same
 * (source, key) are not coordinated.
 */
public final class CacheStore {
    private static final Logger LOG = LogManager.getLogger(CacheStore.class);
    private static final String ENTRY_SUFFIX = ".json";

    private final Path cacheDir;
    private final Clock clock;

    public CacheStore(Path cacheDir) {
        this(cacheDir, Clock.systemUTC());
    }

    public CacheStore(Path cacheDir, Clock clock) {
        if (cacheDir == null) {
            throw new IllegalArgumentException("cacheDir must not be null");
        }
        this.cacheDir = cacheDir;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Path cacheDir() {
        return cacheDir;
    }

    public void set(String source, String key, Object data, double ttlHours) throws IOException {
        if (data == null) {
            throw new IllegalArgumentException("cache data must not be null");
        }
        Path dir = sourceDir(source);
        Files.createDirectories(dir);

        Instant now = clock.instant();
        Instant expiresAt = now.plus(Duration.ofMillis(Math.round(ttlHours * 3_600_000d)));
        CacheEntry entry = new CacheEntry(data, now, expiresAt, source);
        Files.writeString(entryPath(source, key), entry.toJson().toString(2), StandardCharsets.UTF_8);
        LOG.debug("[CACHE] write source={} key={} ttl_hours={}", source, key, ttlHours);
    }

    public CacheLookup lookup(String source, String key) {
        Path path = entryPath(source, key);
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return CacheLookup.miss();
        } catch (IOException e) {
            LOG.warn("[CACHE] read failed source={} key={} error={}", source, key, e.getMessage());
            return CacheLookup.corrupt("read_failed: " + e.getMessage());
        }

        CacheEntry entry;
        try {
            entry = CacheEntry.fromJson(new JSONObject(raw));
        } catch (JSONException | DateTimeException e) {
            LOG.warn("[CACHE] corrupt entry source={} key={} error={}", source, key, e.getMessage());
            return CacheLookup.corrupt("parse_failed: " + e.getMessage());
        }

        if (!entry.isLiveAt(clock.instant())) {
            LOG.debug("[CACHE] expired source={} key={}", source, key);
            return CacheLookup.expired(entry);
        }
        LOG.debug("[CACHE] hit source={} key={}", source, key);
        return CacheLookup.hit(entry);
    }

    public Optional<Object> get(String source, String key) {
        return lookup(source, key).value();
    }

    public Optional<JSONArray> getArray(String source, String key) {
        return get(source, key)
                .filter(JSONArray.class::isInstance)
                .map(JSONArray.class::cast);
    }

    public boolean has(String source, String key) {
        return lookup(source, key).isHit();
    }

    public void clear(String source) {
        Path target = source == null ? cacheDir : sourceDir(source);
        deleteTree(target);
        LOG.info("[CACHE] cleared source={}", source == null ? "all" : source);
    }

    public void clear() {
        clear(null);
    }

    public List<String> sources() {
        List<String> out = new ArrayList<>();
        if (!Files.isDirectory(cacheDir)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDir, Files::isDirectory)) {
            for (Path dir : stream) {
                out.add(dir.getFileName().toString());
            }
        } catch (IOException e) {
            LOG.warn("[CACHE] list sources failed dir={} error={}", cacheDir, e.getMessage());
        }
        return out;
    }

    /**
     * Deletes entry files whose TTL has passed. Unreadable entries are left alone.
     *
     * @return number of files removed
     */
    public int purgeExpired() {
        int removed = 0;
        Instant now = clock.instant();
        for (String source : sources()) {
            List<Path> files = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDir.resolve(source), "*" + ENTRY_SUFFIX)) {
                stream.forEach(files::add);
            } catch (IOException e) {
                LOG.warn("[CACHE] purge scan failed source={} error={}", source, e.getMessage());
                continue;
            }
            for (Path file : files) {
                try {
                    CacheEntry entry = CacheEntry.fromJson(new JSONObject(Files.readString(file, StandardCharsets.UTF_8)));
                    if (!entry.isLiveAt(now)) {
                        Files.deleteIfExists(file);
                        removed++;
                    }
                } catch (IOException | JSONException | DateTimeException e) {
                    LOG.debug("[CACHE] purge skipped file={} error={}", file, e.getMessage());
                }
            }
        }
        if (removed > 0) {
            LOG.info("[CACHE] purged expired entries count={}", removed);
        }
        return removed;
    }

    Path sourceDir(String source) {
        return cacheDir.resolve(safeName(source));
    }

    Path entryPath(String source, String key) {
        return sourceDir(source).resolve(safeName(key) + ENTRY_SUFFIX);
    }

    static String safeName(String raw) {
        String token = raw == null ? "" : raw.trim();
        token = token.replaceAll("[^A-Za-z0-9._-]", "_");
        if (token.isEmpty() || token.chars().allMatch(c -> c == '.')) {
            token = token.replace('.', '_') + "_";
        }
        return token;
    }

    private void deleteTree(Path target) {
        if (!Files.exists(target)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(target)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            LOG.warn("[CACHE] clear failed target={} error={}", target, e.getMessage());
        }
    }
}
