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

package me.chatrelay.bot.adapter.inbound.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.chatrelay.bot.adapter.inbound.webhook.dto.EvolutionWebhookEvent;
import me.chatrelay.bot.adapter.inbound.webhook.dto.WebhookResponse;
import me.chatrelay.bot.domain.model.InboundMessage;
import me.chatrelay.bot.domain.model.RelayOutcome;
import me.chatrelay.bot.domain.service.RelayService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * Evolution API webhook ({@code POST /webhook}).
 *
 * <p>
 * Only {@code MESSAGES_UPSERT} (or {@code messages.upsert}) events for
 * messages not sent by the bot itself are relayed. The chat id is the part of
 * {@code remoteJid} before {@code @}. The endpoint always answers 200 so
 * Evolution does not retry; the reply is sent later through the messaging
 * provider.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class EvolutionWebhookController {

    private static final String MESSAGES_UPSERT = "MESSAGES_UPSERT";

    private final RelayService relayService;
    private final Clock clock;

    @PostMapping("/webhook")
    public Mono<ResponseEntity<WebhookResponse>> onEvent(@RequestBody EvolutionWebhookEvent event) {
        return Mono.fromCallable(() -> {
            String eventName = event.getEvent() != null
                    ? event.getEvent().toUpperCase(Locale.ROOT).replace('.', '_')
                    : "";
            if (!MESSAGES_UPSERT.equals(eventName)) {
                log.debug("[Webhook] Evolution event ignored: {}", event.getEvent());
                return ResponseEntity.ok(WebhookResponse.of("ignored"));
            }

            EvolutionWebhookEvent.EventData data = event.getData();
            if (data == null || data.getKey() == null || isBlank(data.getKey().getRemoteJid())) {
                log.debug("[Webhook] Evolution event without remoteJid ignored");
                return ResponseEntity.ok(WebhookResponse.of("ignored"));
            }
            if (data.getKey().isFromMe()) {
                return ResponseEntity.ok(WebhookResponse.of("ignored"));
            }

            String chatId = extractChatId(data.getKey().getRemoteJid());
            if (isBlank(chatId)) {
                log.warn("[Webhook] Evolution remoteJid without number ignored: {}", data.getKey().getRemoteJid());
                return ResponseEntity.ok(WebhookResponse.of("ignored"));
            }
            String text = extractText(data.getMessage());
            if (isBlank(text)) {
                log.info("[Webhook] no text in Evolution message from {}", chatId);
                return ResponseEntity.ok(WebhookResponse.of("no_text", chatId));
            }

            InboundMessage message = InboundMessage.builder()
                    .id(data.getKey().getId())
                    .provider("evolution")
                    .chatId(chatId)
                    .text(text)
                    .timestamp(Instant.now(clock))
                    .build();
            RelayOutcome outcome = relayService.handleInbound(message);
            return ResponseEntity.ok(WebhookResponse.of(statusOf(outcome), chatId));
        });
    }

    static String extractChatId(String remoteJid) {
        int at = remoteJid.indexOf('@');
        return at >= 0 ? remoteJid.substring(0, at) : remoteJid;
    }

    static String extractText(EvolutionWebhookEvent.MessageContent content) {
        if (content == null) {
            return null;
        }
        if (content.getConversation() != null) {
            return content.getConversation();
        }
        if (content.getExtendedTextMessage() != null) {
            return content.getExtendedTextMessage().getText();
        }
        return null;
    }

    static String statusOf(RelayOutcome outcome) {
        return switch (outcome) {
        case QUEUED -> "queued";
        case DISPATCHED -> "ok";
        case DENIED -> "denied";
        case NO_TEXT -> "no_text";
        case IGNORED -> "ignored";
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
