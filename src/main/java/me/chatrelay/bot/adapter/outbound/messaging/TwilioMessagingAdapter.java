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

import lombok.extern.slf4j.Slf4j;
import me.chatrelay.bot.infrastructure.config.BotProperties;
import me.chatrelay.bot.port.outbound.MessagingPort;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;

/**
 * Twilio WhatsApp adapter using the Messages REST resource.
 *
 * <p>
 * Twilio exposes no presence API, so {@link #sendTyping(String)} keeps the
 * default no-op.
 */
@Component
@Slf4j
public class TwilioMessagingAdapter implements MessagingPort {

    public static final String PROVIDER_ID = "twilio";

    private static final String WHATSAPP_PREFIX = "whatsapp:";

    private final BotProperties properties;
    private final OkHttpClient httpClient;

    public TwilioMessagingAdapter(BotProperties properties, OkHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isConfigured() {
        BotProperties.TwilioProperties twilio = twilio();
        return hasText(twilio.getAccountSid()) && hasText(twilio.getAuthToken());
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String text) {
        if (!isConfigured()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Twilio is not configured"));
        }

        return CompletableFuture.runAsync(() -> {
            BotProperties.TwilioProperties twilio = twilio();
            String body = EvolutionMessagingAdapter.truncate(text, twilio.getMaxMessageChars());
            String url = baseUrl() + "/2010-04-01/Accounts/" + twilio.getAccountSid() + "/Messages.json";

            FormBody form = new FormBody.Builder()
                    .add("From", toWhatsAppAddress(twilio.getWhatsappNumber()))
                    .add("To", toWhatsAppAddress(chatId))
                    .add("Body", body)
                    .build();
            Request request = new Request.Builder()
                    .url(url)
                    .header("Authorization", Credentials.basic(twilio.getAccountSid(), twilio.getAuthToken()))
                    .post(form)
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    ResponseBody responseBody = response.body();
                    String error = responseBody != null ? responseBody.string() : "";
                    log.error("[Twilio] send failed: HTTP {} {}", response.code(), error);
                    throw new IllegalStateException("Twilio send failed: HTTP " + response.code());
                }
                log.info("[Twilio] Message sent to {} ({} chars)", chatId, body.length());
            } catch (IOException e) {
                log.error("[Twilio] send error: {}", e.getMessage());
                throw new UncheckedIOException(e);
            }
        });
    }

    /**
     * Formats a bare number or {@code +number} as {@code whatsapp:+number}.
     */
    static String toWhatsAppAddress(String number) {
        if (number == null) {
            return "";
        }
        String trimmed = number.trim();
        if (trimmed.startsWith(WHATSAPP_PREFIX)) {
            return trimmed;
        }
        return WHATSAPP_PREFIX + (trimmed.startsWith("+") ? trimmed : "+" + trimmed);
    }

    private BotProperties.TwilioProperties twilio() {
        return properties.getMessaging().getTwilio();
    }

    private String baseUrl() {
        String base = twilio().getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
