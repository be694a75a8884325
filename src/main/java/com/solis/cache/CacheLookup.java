package com.solis.cache;

import java.util.Optional;

/**
 * Result of reading one cache entry. Only {@link LookupStatus#HIT} carries a value;
 * the other statuses say why the caller got nothing.
 */
public final class CacheLookup {
    public final LookupStatus status;
    public final CacheEntry entry;
    public final String detail;

    private CacheLookup(LookupStatus status, CacheEntry entry, String detail) {
        this.status = status == null ? LookupStatus.MISS : status;
        this.entry = entry;
        this.detail = detail == null ? "" : detail;
    }

    public static CacheLookup hit(CacheEntry entry) {
        return new CacheLookup(LookupStatus.HIT, entry, "");
    }

    public static CacheLookup miss() {
        return new CacheLookup(LookupStatus.MISS, null, "");
    }

    public static CacheLookup expired(CacheEntry entry) {
        return new CacheLookup(LookupStatus.EXPIRED, entry, "expired_at=" + entry.expiresAt);
    }

    public static CacheLookup corrupt(String detail) {
        return new CacheLookup(LookupStatus.CORRUPT, null, detail);
    }

    public boolean isHit() {
        return status == LookupStatus.HIT;
    }

    public Optional<Object> value() {
        return isHit() ? Optional.ofNullable(entry.data) : Optional.empty();
    }
}
