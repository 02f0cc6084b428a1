package com.crosswatch.infrastructure.notification;

import com.crosswatch.application.ports.NotifierPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Telegram Bot API sender (sendMessage). Plain text only: no parse_mode,
 * so symbols or ids containing "<" or "_" never break delivery.
 *
 * Delivery failures are logged and swallowed; notifications never stop trading.
 */
public class TelegramNotifier implements NotifierPort {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);
    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    public static final String DEFAULT_API_URL = "https://api.telegram.org";

    private final String apiUrl;
    private final String botToken;
    private final String chatId;
    private final OkHttpClient client;
    private final ObjectMapper om = new ObjectMapper();

    public TelegramNotifier(String botToken, String chatId) {
        this(DEFAULT_API_URL, botToken, chatId, new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build());
    }

    public TelegramNotifier(String apiUrl, String botToken, String chatId, OkHttpClient client) {
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.botToken = botToken;
        this.chatId = chatId;
        this.client = client;
    }

    @Override
    public void send(String text) {
        String json;
        try {
            ObjectNode body = om.createObjectNode();
            body.put("chat_id", chatId);
            body.put("text", text);
            json = om.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.error("Telegram payload serialization failed: {}", e.getMessage());
            return;
        }

        Request request = new Request.Builder()
                .url(apiUrl + "/bot" + botToken + "/sendMessage")
                .post(RequestBody.create(json, JSON))
                .build();

        try (Response resp = client.newCall(request).execute()) {
            if (!resp.isSuccessful()) {
                log.warn("Telegram sendMessage HTTP {}: {}", resp.code(),
                        resp.body() != null ? resp.body().string() : "");
            }
        } catch (IOException e) {
            log.warn("Telegram sendMessage error: {}", e.getMessage());
        }
    }
}
