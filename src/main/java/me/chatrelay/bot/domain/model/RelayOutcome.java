package me.chatrelay.bot.domain.model;

/**
 * What happened to an inbound message handed to the relay.
 */
public enum RelayOutcome {

    /** Added to a pending turn that is still accumulating. */
    QUEUED,

    /** Handed to a turn handler immediately (batch full or batching off). */
    DISPATCHED,

    /** Sender is not on the allowlist. */
    DENIED,

    /** Message carried no text. */
    NO_TEXT,

    /** Message had no usable chat id. */
    IGNORED
}
