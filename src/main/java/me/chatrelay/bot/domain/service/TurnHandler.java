package me.chatrelay.bot.domain.service;

/**
 * Consumes one combined turn. Invoked by {@link MessageBatcher} at most once
 * per flushed turn, on the turn handler executor; failures are the handler's
 * own concern and are only logged by the batcher.
 */
@FunctionalInterface
public interface TurnHandler {

    void handle(String combinedText) throws Exception;
}
