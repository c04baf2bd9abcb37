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
import me.chatrelay.bot.domain.model.InboundMessage;
import me.chatrelay.bot.domain.model.RelayOutcome;
import me.chatrelay.bot.infrastructure.config.BotProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for inbound WhatsApp messages from any provider webhook.
 *
 * <p>
 * Each message is checked against the allowlist and submitted to the
 * {@link MessageBatcher} under its chat id. The first fragment of a new turn
 * triggers a typing indicator. When the turn flushes, the combined text goes
 * through the {@link ReplyGatewayService} and the reply is sent back with
 * {@link MessagingService}. If the reply cannot be produced the user gets a
 * short apology instead.
 */
@Service
@Slf4j
public class RelayService {

    static final String FALLBACK_REPLY = "Error: Sistema de IA no disponible temporalmente";
    private static final int LOG_PREVIEW_CHARS = 80;

    private final BotProperties properties;
    private final MessageBatcher messageBatcher;
    private final ReplyGatewayService replyGatewayService;
    private final MessagingService messagingService;
    private final AccessControlService accessControlService;
    private final Executor turnHandlerExecutor;

    public RelayService(BotProperties properties,
            MessageBatcher messageBatcher,
            ReplyGatewayService replyGatewayService,
            MessagingService messagingService,
            AccessControlService accessControlService,
            @Qualifier("turnHandlerExecutor") Executor turnHandlerExecutor) {
        this.properties = properties;
        this.messageBatcher = messageBatcher;
        this.replyGatewayService = replyGatewayService;
        this.messagingService = messagingService;
        this.accessControlService = accessControlService;
        this.turnHandlerExecutor = turnHandlerExecutor;
    }

    public RelayOutcome handleInbound(InboundMessage message) {
        String chatId = message.getChatId();
        if (chatId == null || chatId.isBlank()) {
            log.warn("[Relay] {} message without chat id ignored", message.getProvider());
            return RelayOutcome.IGNORED;
        }
        if (!message.hasText()) {
            log.debug("[Relay] no text in message from {}", chatId);
            return RelayOutcome.NO_TEXT;
        }
        if (!accessControlService.isAllowed(chatId)) {
            return RelayOutcome.DENIED;
        }

        String text = message.getText();
        log.info("[Relay] {} message from {}: {}", message.getProvider(), chatId, preview(text));

        if (!properties.getBatcher().isEnabled()) {
            dispatchNow(chatId, text);
            return RelayOutcome.DISPATCHED;
        }

        boolean newTurn = !messageBatcher.hasPendingTurn(chatId);
        boolean absorbed = messageBatcher.submit(chatId, text, combined -> processTurn(chatId, combined));
        if (!absorbed) {
            return RelayOutcome.DISPATCHED;
        }
        if (newTurn) {
            sendTyping(chatId);
        }
        return RelayOutcome.QUEUED;
    }

    /**
     * Produces and sends the reply for one combined turn. Runs on a turn
     * handler thread.
     */
    void processTurn(String chatId, String combinedText) {
        String reply;
        try {
            reply = replyGatewayService.process(chatId, combinedText);
        } catch (RuntimeException e) {
            log.error("[Relay] reply generation failed for {}: {}", chatId, e.getMessage(), e);
            reply = FALLBACK_REPLY;
        }

        try {
            messagingService.sendMessage(chatId, reply).join();
            log.info("[Relay] reply sent to {}", chatId);
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Relay] failed to send reply to {}: {}", chatId, cause.getMessage());
        }
    }

    private void dispatchNow(String chatId, String text) {
        try {
            turnHandlerExecutor.execute(() -> processTurn(chatId, text));
        } catch (RejectedExecutionException e) {
            log.error("[Relay] turn rejected for {}, executor is shut down", chatId);
        }
    }

    private void sendTyping(String chatId) {
        try {
            messagingService.sendTyping(chatId).whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("[Relay] typing indicator failed for {}: {}", chatId, error.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.warn("[Relay] typing indicator failed for {}: {}", chatId, e.getMessage());
        }
    }

    private static String preview(String text) {
        return text.length() > LOG_PREVIEW_CHARS ? text.substring(0, LOG_PREVIEW_CHARS) + "..." : text;
    }
}
