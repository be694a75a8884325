package com.solis.alert;

import com.solis.data.http.HttpJsonClient;
import org.json.JSONObject;

import java.io.IOException;

/**
 * Telegram Bot API {@code sendMessage}.
 */
public final class TelegramChannel implements AlertChannel {
    static final String API_BASE = "https://api.telegram.org";

    private final HttpJsonClient http;
    private final String apiBase;
    private final String botToken;
    private final String chatId;
    private final int timeoutSec;

    public TelegramChannel(HttpJsonClient http, String botToken, String chatId, int timeoutSec) {
        this(http, API_BASE, botToken, chatId, timeoutSec);
    }

    TelegramChannel(HttpJsonClient http, String apiBase, String botToken, String chatId, int timeoutSec) {
        if (isBlank(botToken) || isBlank(chatId)) {
            throw new IllegalArgumentException("alerts.telegram.bot_token and alerts.telegram.chat_id are required");
        }
        this.http = http;
        this.apiBase = apiBase;
        this.botToken = botToken.trim();
        this.chatId = chatId.trim();
        this.timeoutSec = timeoutSec;
    }

    @Override
    public String name() {
        return "telegram";
    }

    @Override
    public void send(String text) throws IOException, InterruptedException {
        JSONObject body = new JSONObject();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("disable_web_page_preview", true);
        http.postJson(apiBase + "/bot" + botToken + "/sendMessage", body.toString(), timeoutSec);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
