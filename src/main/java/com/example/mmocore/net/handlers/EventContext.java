package com.example.mmocore.net.handlers;

import com.example.mmocore.GameServices;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.InboundEvent;
import com.example.mmocore.net.OutboundMessage;
import com.example.mmocore.net.Payload;
import com.example.mmocore.net.SessionHandler;

/**
 * Everything a handler needs to process one inbound event. Decouples the
 * handlers from the session internals.
 */
public class EventContext {
    public final InboundEvent event;
    public final Payload payload;
    public final SessionHandler session;
    public final GameServices services;

    public EventContext(InboundEvent event, Payload payload, SessionHandler session, GameServices services) {
        this.event = event;
        this.payload = payload;
        this.session = session;
        this.services = services;
    }

    public String getEventName() {
        return event.getWireName();
    }

    /**
     * The player bound to this session, or null before a successful join.
     */
    public Player getPlayer() {
        return session.getPlayer();
    }

    public long now() {
        return services.scheduler.now();
    }

    /**
     * Send an event back to the client of this session.
     */
    public void send(OutboundMessage message) {
        session.getConnection().send(message);
    }
}
