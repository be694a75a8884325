package com.solis.alert;

import com.solis.data.http.HttpJsonClient;
import org.json.JSONObject;

import java.io.IOException;

public final class DiscordChannel implements AlertChannel {
    private final HttpJsonClient http;
    private final String webhookUrl;
    private final int timeoutSec;

    public DiscordChannel(HttpJsonClient http, String webhookUrl, int timeoutSec) {
        if (webhookUrl == null || webhookUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("alerts.discord.webhook_url is required");
        }
        this.http = http;
        this.webhookUrl = webhookUrl.trim();
        this.timeoutSec = timeoutSec;
    }

    @Override
    public String name() {
        return "discord";
    }

    @Override
    public void send(String text) throws IOException, InterruptedException {
        JSONObject body = new JSONObject();
        body.put("content", text);
        http.postJson(webhookUrl, body.toString(), timeoutSec);
    }
}
