package me.chatrelay.bot.adapter.outbound.messaging;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.chatrelay.bot.infrastructure.config.BotProperties;
import me.chatrelay.bot.port.outbound.MessagingPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;

/**
 * Evolution API adapter (self-hosted WhatsApp gateway).
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST {base}/message/sendText/{instance} - send a text message
 * <li>POST {base}/chat/sendPresence/{instance} - show "typing..."
 * </ul>
 * Both authenticate with the {@code apikey} header.
 *
 * @see me.chatrelay.bot.port.outbound.MessagingPort
 */
@Component
@Slf4j
public class EvolutionMessagingAdapter implements MessagingPort {

    public static final String PROVIDER_ID = "evolution";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String PRESENCE_COMPOSING = "composing";

    private final BotProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public EvolutionMessagingAdapter(BotProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isConfigured() {
        BotProperties.EvolutionProperties evolution = evolution();
        return hasText(evolution.getBaseUrl()) && hasText(evolution.getApiKey())
                && hasText(evolution.getInstanceId());
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String text) {
        if (!isConfigured()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Evolution API is not configured"));
        }

        return CompletableFuture.runAsync(() -> {
            BotProperties.EvolutionProperties evolution = evolution();
            String truncated = truncate(text, evolution.getMaxMessageChars());
            SendTextRequest payload = new SendTextRequest(chatId, truncated,
                    new SendOptions(evolution.getSendDelayMs(), PRESENCE_COMPOSING));
            String url = baseUrl() + "/message/sendText/" + evolution.getInstanceId();
            post(url, payload, "send");
            log.info("[Evolution] Message sent to {} ({} chars)", chatId, truncated.length());
        });
    }

    @Override
    public CompletableFuture<Void> sendTyping(String chatId) {
        if (!isConfigured()) {
            return CompletableFuture.completedFuture(null);
        }

        return CompletableFuture.runAsync(() -> {
            BotProperties.EvolutionProperties evolution = evolution();
            PresenceRequest payload = new PresenceRequest(chatId, PRESENCE_COMPOSING,
                    evolution.getTypingDelayMs());
            String url = baseUrl() + "/chat/sendPresence/" + evolution.getInstanceId();
            post(url, payload, "presence");
            log.debug("[Evolution] Typing indicator sent to {}", chatId);
        });
    }

    private void post(String url, Object payload, String operation) {
        try {
            String body = objectMapper.writeValueAsString(payload);
            Request request = new Request.Builder()
                    .url(url)
                    .header("apikey", evolution().getApiKey())
                    .post(RequestBody.create(body, JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    ResponseBody responseBody = response.body();
                    String error = responseBody != null ? responseBody.string() : "";
                    log.error("[Evolution] {} failed: HTTP {} {}", operation, response.code(), error);
                    throw new IllegalStateException(
                            "Evolution " + operation + " failed: HTTP " + response.code());
                }
            }
        } catch (IOException e) {
            log.error("[Evolution] {} error: {}", operation, e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    private BotProperties.EvolutionProperties evolution() {
        return properties.getMessaging().getEvolution();
    }

    private String baseUrl() {
        String base = evolution().getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    record SendTextRequest(String number, String text, SendOptions options) {
    }

    record SendOptions(int delay, String presence) {
    }

    record PresenceRequest(String number, String presence, int delay) {
    }
}
