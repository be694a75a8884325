package com.solis.data.http;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Thin client for JSON endpoints. Non-2xx responses are reported as {@link IOException}
 * so the retry layer treats them like transport failures.
 */
public class HttpJsonClient {
    private static final String USER_AGENT = "SolisAgent/1.0";

    private final HttpClient client;

    public HttpJsonClient() {
        this(20);
    }

    public HttpJsonClient(int connectTimeoutSeconds) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(Math.max(1, connectTimeoutSeconds)))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String getText(String url, int timeoutSeconds) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .GET()
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT)
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new IOException("HTTP " + resp.statusCode() + " for " + url);
    }

    public String postJson(String url, String json, int timeoutSeconds) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .header("Content-Type", "application/json")
                .header("User-Agent", USER_AGENT)
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new IOException("HTTP " + resp.statusCode() + " for " + url + " body=" + resp.body());
    }

    /**
     * Parsed body: a {@link JSONArray} or a {@link JSONObject}.
     */
    public Object getJson(String url, int timeoutSeconds) throws IOException, InterruptedException {
        String body = getText(url, timeoutSeconds);
        try {
            Object value = new JSONTokener(body).nextValue();
            if (value instanceof JSONObject || value instanceof JSONArray) {
                return value;
            }
            throw new IOException("expected JSON object or array from " + url);
        } catch (JSONException e) {
            throw new IOException("invalid JSON from " + url + ": " + e.getMessage(), e);
        }
    }
}
