package me.chatrelay.bot.domain.component;

import java.util.List;

/**
 * Merges the fragments of one coalesced turn into a single text.
 *
 * <p>
 * Users often split one request across several quick messages ("hola", "busco
 * un kinesiólogo", "en puerto montt"). Implementations combine them into one
 * query for the reply gateway, preserving arrival order and never dropping or
 * deduplicating a fragment.
 *
 * @since 1.0
 */
public interface TurnCombinerComponent {

    /**
     * Combine fragments into one turn text.
     *
     * @param fragments
     *            fragments in arrival order
     * @return the combined turn; a single fragment is returned unchanged
     */
    String combine(List<String> fragments);
}
