package me.chatrelay.bot.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of a conversation's pending turn.
 *
 * @param conversationKey
 *            key of the accumulation stream
 * @param pendingCount
 *            number of fragments buffered so far
 * @param secondsSinceLastFragment
 *            age of the most recent fragment, in whole seconds
 * @param lastUpdate
 *            instant the most recent fragment arrived
 * @param fragments
 *            buffered fragments in arrival order
 */
public record TurnStatus(
        String conversationKey,
        int pendingCount,
        long secondsSinceLastFragment,
        Instant lastUpdate,
        List<String> fragments) {

    public TurnStatus {
        fragments = fragments != null ? List.copyOf(fragments) : List.of();
    }
}
