package me.chatrelay.bot.adapter.outbound.memory;

import me.chatrelay.bot.domain.model.Message;
import me.chatrelay.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryConversationStoreTest {

    private InMemoryConversationStore store;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getMemory().setMaxChats(2);
        properties.getMemory().setMaxHistory(3);
        store = new InMemoryConversationStore(properties);
    }

    @Test
    void shouldReturnEmptyHistoryForUnknownChat() {
        assertTrue(store.load("56900000000").isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void shouldKeepOnlyLastMessages() {
        List<Message> messages = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            messages.add(Message.user("m" + i));
        }

        store.save("a", messages);

        List<Message> stored = store.load("a");
        assertEquals(List.of("m3", "m4", "m5"), stored.stream().map(Message::getContent).toList());
    }

    @Test
    void shouldNotAliasCallerList() {
        List<Message> messages = new ArrayList<>(List.of(Message.user("hola")));
        store.save("a", messages);

        messages.add(Message.user("chao"));

        assertEquals(1, store.load("a").size());
        assertThrows(UnsupportedOperationException.class, () -> store.load("a").add(Message.user("x")));
    }

    @Test
    void shouldEvictOldestChatBeyondCapacity() {
        store.save("a", List.of(Message.user("1")));
        store.save("b", List.of(Message.user("2")));
        store.save("c", List.of(Message.user("3")));

        assertEquals(2, store.size());
        assertTrue(store.load("a").isEmpty());
        assertEquals("3", store.load("c").get(0).getContent());
    }
}
