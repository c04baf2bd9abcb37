package me.chatrelay.bot.domain.service;

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
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Routes outbound messages to the configured WhatsApp provider.
 *
 * <p>
 * {@code bot.messaging.provider=twilio} sends through Twilio when it is
 * configured and falls back to Evolution API when the Twilio send fails. Any
 * other value sends through Evolution API.
 */
@Service
@Slf4j
public class MessagingService {

    public static final String EVOLUTION = "evolution";
    public static final String TWILIO = "twilio";

    private final BotProperties properties;
    private final Map<String, MessagingPort> ports = new LinkedHashMap<>();

    public MessagingService(BotProperties properties, List<MessagingPort> messagingPorts) {
        this.properties = properties;
        for (MessagingPort port : messagingPorts) {
            ports.put(port.getProviderId(), port);
        }
        log.info("[Messaging] providers registered: {}", ports.keySet());
    }

    public CompletableFuture<Void> sendMessage(String chatId, String text) {
        Optional<MessagingPort> twilio = port(TWILIO).filter(MessagingPort::isConfigured);
        if (isTwilioSelected() && twilio.isPresent()) {
            return twilio.get().sendMessage(chatId, text)
                    .exceptionallyCompose(e -> {
                        log.error("[Messaging] Twilio send failed, falling back to Evolution API: {}",
                                e.getMessage());
                        return sendViaEvolution(chatId, text);
                    });
        }
        return sendViaEvolution(chatId, text);
    }

    public CompletableFuture<Void> sendTyping(String chatId) {
        return activePort()
                .map(port -> port.sendTyping(chatId))
                .orElseGet(() -> CompletableFuture.completedFuture(null));
    }

    public String getActiveProviderId() {
        return isTwilioSelected() ? TWILIO : EVOLUTION;
    }

    public boolean isConfigured(String providerId) {
        return port(providerId).map(MessagingPort::isConfigured).orElse(false);
    }

    public boolean isAnyConfigured() {
        return ports.values().stream().anyMatch(MessagingPort::isConfigured);
    }

    private CompletableFuture<Void> sendViaEvolution(String chatId, String text) {
        return port(EVOLUTION)
                .map(port -> port.sendMessage(chatId, text))
                .orElseGet(() -> CompletableFuture.failedFuture(
                        new IllegalStateException("Evolution API adapter is not available")));
    }

    private Optional<MessagingPort> activePort() {
        return port(getActiveProviderId());
    }

    private Optional<MessagingPort> port(String providerId) {
        return Optional.ofNullable(ports.get(providerId));
    }

    private boolean isTwilioSelected() {
        return TWILIO.equalsIgnoreCase(properties.getMessaging().getProvider());
    }
}
