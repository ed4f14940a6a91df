package com.example.mmocore.net;

/**
 * A reliable, ordered, per-client message channel with named event delivery.
 * The transport behind it (websocket, TCP framing, ...) is not part of the core.
 */
public interface Connection {

    /**
     * Stable identifier of this connection, used for logging and for telling
     * a stale connection apart from a newer one bound to the same player.
     */
    String getId();

    /**
     * Push one event to the client. Implementations must not block the caller.
     */
    void send(OutboundMessage message);
}
