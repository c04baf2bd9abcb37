package me.chatrelay.bot.port.outbound;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for a WhatsApp messaging provider (Evolution API, Twilio).
 * Implementations handle provider authentication, payload shaping and message
 * length limits.
 */
public interface MessagingPort {

    /**
     * Returns the provider identifier (e.g., "evolution", "twilio").
     */
    String getProviderId();

    /**
     * Checks if the provider has the credentials it needs to send.
     */
    boolean isConfigured();

    /**
     * Sends a text message to the given participant. The future completes
     * exceptionally when the provider rejects the message.
     */
    CompletableFuture<Void> sendMessage(String chatId, String text);

    /**
     * Displays a typing indicator to the participant while a turn is being
     * processed. Default implementation does nothing; providers override when
     * they have a presence API.
     */
    default CompletableFuture<Void> sendTyping(String chatId) {
        return CompletableFuture.completedFuture(null);
    }
}
