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
import me.chatrelay.bot.domain.model.InboundMessage;
import me.chatrelay.bot.domain.model.RelayOutcome;
import me.chatrelay.bot.domain.service.RelayService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Twilio WhatsApp webhook ({@code POST /webhook/twilio}, form encoded).
 *
 * <p>
 * The reply is not returned inline: it is produced when the turn flushes and
 * sent through the messaging provider, so the webhook answers with an empty
 * TwiML document right away.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class TwilioWebhookController {

    static final String EMPTY_TWIML = "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response/>";

    private final RelayService relayService;
    private final Clock clock;

    @PostMapping(value = "/webhook/twilio", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public Mono<ResponseEntity<String>> onMessage(ServerWebExchange exchange) {
        return exchange.getFormData().map(form -> {
            String from = form.getFirst("From");
            if (from == null || from.isBlank()) {
                log.warn("[Webhook] Twilio message without From ignored");
                return twiml();
            }

            String chatId = extractChatId(from);
            if (chatId.isEmpty()) {
                log.warn("[Webhook] Twilio sender without number ignored: {}", from);
                return twiml();
            }
            InboundMessage message = InboundMessage.builder()
                    .id(form.getFirst("MessageSid"))
                    .provider("twilio")
                    .chatId(chatId)
                    .text(form.getFirst("Body"))
                    .timestamp(Instant.now(clock))
                    .build();
            RelayOutcome outcome = relayService.handleInbound(message);
            log.debug("[Webhook] Twilio message from {} -> {}", chatId, outcome);
            return twiml();
        });
    }

    static String extractChatId(String from) {
        return from.replace("whatsapp:", "").replace("+", "").trim();
    }

    private static ResponseEntity<String> twiml() {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_XML)
                .body(EMPTY_TWIML);
    }
}
