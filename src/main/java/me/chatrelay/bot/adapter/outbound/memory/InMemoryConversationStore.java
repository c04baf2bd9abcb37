package me.chatrelay.bot.adapter.outbound.memory;

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
import me.chatrelay.bot.domain.model.Message;
import me.chatrelay.bot.infrastructure.config.BotProperties;
import me.chatrelay.bot.port.outbound.MemoryPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversation history held in RAM.
 *
 * <p>
 * Chats are kept in insertion order; once more than
 * {@code bot.memory.max-chats} are held, the eldest chat is evicted. Each
 * saved history is trimmed to its last {@code bot.memory.max-history}
 * messages.
 */
@Component
@Slf4j
public class InMemoryConversationStore implements MemoryPort {

    private final int maxChats;
    private final int maxHistory;
    private final Map<String, List<Message>> histories;

    public InMemoryConversationStore(BotProperties properties) {
        this.maxChats = Math.max(1, properties.getMemory().getMaxChats());
        this.maxHistory = Math.max(1, properties.getMemory().getMaxHistory());
        this.histories = new LinkedHashMap<>() {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<Message>> eldest) {
                boolean evict = size() > InMemoryConversationStore.this.maxChats;
                if (evict) {
                    log.info("[Memory] evicted oldest chat: {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public synchronized List<Message> load(String chatId) {
        List<Message> history = histories.get(chatId);
        return history != null ? history : List.of();
    }

    @Override
    public synchronized void save(String chatId, List<Message> messages) {
        List<Message> trimmed = messages.size() > maxHistory
                ? messages.subList(messages.size() - maxHistory, messages.size())
                : messages;
        histories.put(chatId, List.copyOf(trimmed));
        log.debug("[Memory] saved {} messages for {} (chats held: {})", trimmed.size(), chatId, histories.size());
    }

    @Override
    public synchronized int size() {
        return histories.size();
    }
}
