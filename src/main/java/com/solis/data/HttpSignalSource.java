package com.solis.data;

import com.solis.data.http.HttpJsonClient;
import com.solis.model.SignalFamily;
import com.solis.report.SignalCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Reads one family from a JSON endpoint. The body is either an array of records or an
 * object carrying the array under {@code data} or under the family id. A blank URL
 * disables the source.
 */
public final class HttpSignalSource<T> implements SignalSource<T> {
    private static final Logger LOG = LogManager.getLogger(HttpSignalSource.class);

    private final SignalFamily family;
    private final String url;
    private final HttpJsonClient http;
    private final int timeoutSeconds;
    private final SignalCodec<T> codec;

    public HttpSignalSource(SignalFamily family, String url, HttpJsonClient http, int timeoutSeconds, SignalCodec<T> codec) {
        if (family == null || http == null || codec == null) {
            throw new IllegalArgumentException("family, http and codec are required");
        }
        this.family = family;
        this.url = url == null ? "" : url.trim();
        this.http = http;
        this.timeoutSeconds = timeoutSeconds;
        this.codec = codec;
    }

    @Override
    public SignalFamily family() {
        return family;
    }

    public boolean isEnabled() {
        return !url.isEmpty();
    }

    @Override
    public List<T> fetch(LocalDate date) throws IOException, InterruptedException {
        if (!isEnabled()) {
            LOG.debug("[SOURCE] disabled family={}", family.id());
            return List.of();
        }
        Object body = http.getJson(url, timeoutSeconds);
        JSONArray items = extractItems(body);
        if (items == null) {
            throw new IOException("no " + family.id() + " array in response from " + url);
        }
        List<T> records = codec.fromJsonArray(items);
        LOG.info("[SOURCE] fetched family={} records={} url={}", family.id(), records.size(), url);
        return records;
    }

    private JSONArray extractItems(Object body) {
        if (body instanceof JSONArray) {
            return (JSONArray) body;
        }
        if (body instanceof JSONObject) {
            JSONObject root = (JSONObject) body;
            JSONArray data = root.optJSONArray("data");
            return data != null ? data : root.optJSONArray(family.id());
        }
        return null;
    }
}
