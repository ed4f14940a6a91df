package com.example.mmocore.net;

import com.example.mmocore.GameServices;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.handlers.EventContext;
import com.example.mmocore.net.handlers.EventDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * One per client connection. The transport calls {@link #onEvent(String, Map)}
 * from its own thread; the event is handed to the simulation thread and
 * dispatched there.
 *
 * Until a join succeeds the session accepts only {@code player:join}. A session
 * whose player has since been bound to another connection is unjoined again.
 * A bad event is logged and dropped; the session stays usable.
 */
public class SessionHandler {
    private static final Logger logger = LoggerFactory.getLogger(SessionHandler.class);

    private final Connection connection;
    private final GameServices services;
    private final EventDispatcher dispatcher;

    // Touched only on the simulation thread
    private Player player;

    public SessionHandler(Connection connection, GameServices services, EventDispatcher dispatcher) {
        this.connection = connection;
        this.services = services;
        this.dispatcher = dispatcher;
    }

    public Connection getConnection() {
        return connection;
    }

    public Player getPlayer() {
        return player;
    }

    public void bindPlayer(Player player) {
        this.player = player;
    }

    public void unbindPlayer() {
        this.player = null;
    }

    /**
     * Queue an inbound event for the simulation thread.
     */
    public void onEvent(String name, Map<String, Object> payload) {
        services.scheduler.execute(() -> process(name, payload));
    }

    /**
     * Queue the disconnect of this session.
     */
    public void onDisconnect() {
        onEvent(InboundEvent.DISCONNECT.getWireName(), Map.of());
    }

    void process(String name, Map<String, Object> payload) {
        InboundEvent event = InboundEvent.fromWireName(name);
        if (event == null) {
            logger.debug("[session] {} sent unknown event '{}'", connection.getId(), name);
            return;
        }
        if (player != null && player.getConnection() != connection) {
            logger.debug("[session] {} superseded for {}, treating as unjoined", connection.getId(), player.getId());
            player = null;
        }
        if (player == null && event != InboundEvent.JOIN) {
            logger.debug("[session] {} sent '{}' before joining", connection.getId(), name);
            return;
        }
        try {
            EventContext ctx = new EventContext(event, new Payload(payload), this, services);
            if (!dispatcher.dispatch(ctx)) {
                logger.debug("[session] no handler for '{}'", name);
            }
        } catch (RuntimeException e) {
            logger.warn("[session] {} event '{}' failed: {}", connection.getId(), name, e.getMessage(), e);
        }
    }
}
