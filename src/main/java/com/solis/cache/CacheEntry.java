package com.solis.cache;

import org.json.JSONObject;

import java.time.Instant;

/**
 * One cached payload. {@code data} holds an org.json value: JSONObject, JSONArray, String, Number or Boolean.
 */
public final class CacheEntry {
    public final Object data;
    public final Instant fetchedAt;
    public final Instant expiresAt;
    public final String source;

    public CacheEntry(Object data, Instant fetchedAt, Instant expiresAt, String source) {
        this.data = data;
        this.fetchedAt = fetchedAt;
        this.expiresAt = expiresAt;
        this.source = source == null ? "" : source;
    }

    public boolean isLiveAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("data", JSONObject.wrap(data));
        root.put("fetchedAt", fetchedAt.toString());
        root.put("expiresAt", expiresAt.toString());
        root.put("source", source);
        return root;
    }

    static CacheEntry fromJson(JSONObject root) {
        return new CacheEntry(
                root.get("data"),
                Instant.parse(root.getString("fetchedAt")),
                Instant.parse(root.getString("expiresAt")),
                root.optString("source", "")
        );
    }
}
