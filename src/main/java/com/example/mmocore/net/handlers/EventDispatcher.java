package com.example.mmocore.net.handlers;

import com.example.mmocore.net.InboundEvent;

import java.util.EnumMap;
import java.util.Map;

/**
 * Routes inbound events to their category handler.
 */
public class EventDispatcher {

    private final Map<InboundEvent.Category, EventHandler> handlers = new EnumMap<>(InboundEvent.Category.class);

    /**
     * Dispatcher with the standard handler for every category.
     */
    public static EventDispatcher createDefault() {
        EventDispatcher dispatcher = new EventDispatcher();
        dispatcher.registerHandler(InboundEvent.Category.SYSTEM, new SystemEventHandler());
        dispatcher.registerHandler(InboundEvent.Category.MOVEMENT, new MovementEventHandler());
        dispatcher.registerHandler(InboundEvent.Category.COMBAT, new CombatEventHandler());
        dispatcher.registerHandler(InboundEvent.Category.CHAT, new ChatEventHandler());
        return dispatcher;
    }

    /**
     * Dispatch an event to its category handler.
     *
     * @return true if a handler processed the event
     */
    public boolean dispatch(EventContext ctx) {
        EventHandler handler = handlers.get(ctx.event.getCategory());
        if (handler == null || !handler.supports(ctx.getEventName())) {
            return false;
        }
        return handler.handle(ctx);
    }

    /**
     * Register a handler for a category, replacing any previous one.
     */
    public void registerHandler(InboundEvent.Category category, EventHandler handler) {
        handlers.put(category, handler);
    }
}
