package me.chatrelay.bot.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A single inbound chat message after provider payload extraction.
 *
 * <p>
 * {@code chatId} is the conversation key: the participant's phone number
 * without provider prefixes or the {@code +} sign.
 */
@Data
@Builder
public class InboundMessage {

    private String id;
    private String provider; // evolution, twilio
    private String chatId;
    private String text;
    private Instant timestamp;

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
