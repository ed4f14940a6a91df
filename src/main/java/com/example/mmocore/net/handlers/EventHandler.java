package com.example.mmocore.net.handlers;

/**
 * Interface for inbound event handlers. Each handler processes one category of events.
 */
public interface EventHandler {

    /**
     * Process the event.
     *
     * @param ctx the event context containing all necessary state
     * @return true if the event was handled, false if not recognized
     */
    boolean handle(EventContext ctx);

    /**
     * Check if this handler can process the given event.
     *
     * @param eventName the inbound wire name
     * @return true if this handler supports the event
     */
    boolean supports(String eventName);
}
