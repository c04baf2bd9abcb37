package me.chatrelay.bot.port.outbound;

import me.chatrelay.bot.domain.model.Message;

import java.util.List;

/**
 * Port for best-effort per-chat conversation memory.
 */
public interface MemoryPort {

    /**
     * Returns the stored history for the chat, oldest first. Never null.
     */
    List<Message> load(String chatId);

    /**
     * Replaces the stored history for the chat.
     */
    void save(String chatId, List<Message> messages);

    /**
     * Returns the number of chats currently held.
     */
    int size();
}
