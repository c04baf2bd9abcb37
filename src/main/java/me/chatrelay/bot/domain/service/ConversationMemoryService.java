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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.chatrelay.bot.domain.model.Message;
import me.chatrelay.bot.infrastructure.config.BotProperties;
import me.chatrelay.bot.port.outbound.MemoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Short per-chat history fed back to the model on the next turn.
 *
 * <p>
 * A completed turn keeps only the last {@code carry-over} prior messages,
 * appends the user and assistant messages, and caps the result at
 * {@code max-history}. Storage failures are logged and never fail the turn.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationMemoryService {

    private final MemoryPort memoryPort;
    private final BotProperties properties;
    private final Clock clock;

    public List<Message> getHistory(String chatId) {
        try {
            List<Message> history = memoryPort.load(chatId);
            log.debug("[Memory] {} messages loaded for {}", history.size(), chatId);
            return history;
        } catch (RuntimeException e) {
            log.error("[Memory] load failed for {}, continuing without history: {}", chatId, e.getMessage());
            return List.of();
        }
    }

    public void recordTurn(String chatId, List<Message> previousHistory, String userText, String assistantText) {
        BotProperties.MemoryProperties memory = properties.getMemory();
        List<Message> updated = new ArrayList<>(tail(previousHistory, memory.getCarryOver()));
        Instant now = clock.instant();
        updated.add(Message.user(userText, now));
        updated.add(Message.assistant(assistantText, now));
        List<Message> toSave = tail(updated, memory.getMaxHistory());

        try {
            memoryPort.save(chatId, toSave);
            log.debug("[Memory] {} messages saved for {}", toSave.size(), chatId);
        } catch (RuntimeException e) {
            log.error("[Memory] save failed for {}: {}", chatId, e.getMessage());
        }
    }

    static List<Message> tail(List<Message> messages, int count) {
        if (messages == null || count <= 0) {
            return List.of();
        }
        return messages.size() > count ? messages.subList(messages.size() - count, messages.size()) : messages;
    }
}
