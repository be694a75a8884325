package com.solis.data;

import com.solis.cache.CacheLookup;
import com.solis.cache.CacheStore;
import com.solis.model.SignalFamily;
import com.solis.report.SignalCodec;
import com.solis.retry.RetryExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Serves a family from the cache when a live entry exists for the date, otherwise fetches
 * through the retry executor and stores the result. Cache write errors do not fail the fetch.
 */
public final class CachedSignalSource<T> implements SignalSource<T> {
    private static final Logger LOG = LogManager.getLogger(CachedSignalSource.class);

    private final SignalSource<T> delegate;
    private final SignalCodec<T> codec;
    private final CacheStore cache;
    private final RetryExecutor retry;
    private final double ttlHours;

    public CachedSignalSource(
            SignalSource<T> delegate,
            SignalCodec<T> codec,
            CacheStore cache,
            RetryExecutor retry,
            double ttlHours
    ) {
        if (delegate == null || codec == null || cache == null || retry == null) {
            throw new IllegalArgumentException("delegate, codec, cache and retry are required");
        }
        this.delegate = delegate;
        this.codec = codec;
        this.cache = cache;
        this.retry = retry;
        this.ttlHours = ttlHours;
    }

    @Override
    public SignalFamily family() {
        return delegate.family();
    }

    @Override
    public List<T> fetch(LocalDate date) throws Exception {
        String source = delegate.name();
        String key = date.toString();
        CacheLookup lookup = cache.lookup(source, key);
        if (lookup.isHit() && lookup.entry.data instanceof JSONArray) {
            List<T> cached = codec.fromJsonArray((JSONArray) lookup.entry.data);
            LOG.info("[SOURCE] cache hit family={} key={} records={}", source, key, cached.size());
            return cached;
        }
        LOG.debug("[SOURCE] cache {} family={} key={}", lookup.status, source, key);

        List<T> fresh = retry.withRetry(() -> delegate.fetch(date), "fetch:" + source);
        try {
            cache.set(source, key, codec.toJsonArray(fresh), ttlHours);
        } catch (IOException e) {
            LOG.warn("[SOURCE] cache write failed family={} key={} error={}", source, key, e.getMessage());
        }
        return fresh;
    }
}
