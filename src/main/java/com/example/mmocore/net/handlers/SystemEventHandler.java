package com.example.mmocore.net.handlers;

import com.example.mmocore.lifecycle.JoinRequest;
import com.example.mmocore.model.Attribute;
import com.example.mmocore.model.Drop;
import com.example.mmocore.model.GameMap;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.EventType;
import com.example.mmocore.net.InboundEvent;
import com.example.mmocore.net.OutboundMessage;
import com.example.mmocore.net.Payload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles session-level events: join, stat allocation, drop pickup, disconnect.
 */
public class SystemEventHandler implements EventHandler {
    private static final Logger logger = LoggerFactory.getLogger(SystemEventHandler.class);

    @Override
    public boolean supports(String eventName) {
        InboundEvent e = InboundEvent.fromWireName(eventName);
        return e != null && e.getCategory() == InboundEvent.Category.SYSTEM;
    }

    @Override
    public boolean handle(EventContext ctx) {
        switch (ctx.event) {
            case JOIN: return handleJoin(ctx);
            case ALLOCATE_STAT: return handleAllocate(ctx);
            case DROP_PICKUP: return handlePickup(ctx);
            case DISCONNECT: return handleDisconnect(ctx);
            default: return false;
        }
    }

    private boolean handleJoin(EventContext ctx) {
        Payload p = ctx.payload;
        String email = p.getString("email");
        String mapId = p.getString("map");
        if (email == null || mapId == null) {
            logger.debug("[join] malformed join payload");
            return true;
        }

        Player current = ctx.getPlayer();
        if (current != null && !current.getId().equals(email)) {
            ctx.services.lifecycle.disconnect(current, ctx.session.getConnection());
            ctx.session.unbindPlayer();
        }

        double[] pos = p.getPosition("position");
        if (pos == null) {
            GameMap map = ctx.services.definition.getMap(mapId);
            pos = map == null ? new double[] {0, 0} : new double[] {map.getSpawnX(), map.getSpawnY()};
        }
        String name = p.getString("name");
        Integer level = p.getInt("level");
        Integer xp = p.getInt("xp");

        JoinRequest request = new JoinRequest(
                email,
                name != null ? name : email,
                p.getString("character_class"),
                level != null ? level : 1,
                xp != null ? xp : 0,
                mapId,
                pos[0],
                pos[1]);
        Player player = ctx.services.lifecycle.join(ctx.session.getConnection(), request);
        if (player != null) {
            ctx.session.bindPlayer(player);
        }
        return true;
    }

    private boolean handleAllocate(EventContext ctx) {
        Attribute attribute = Attribute.fromKey(ctx.payload.getString("stat"));
        Integer points = ctx.payload.getInt("points");
        if (attribute == null || points == null) return true;
        ctx.services.playerStats.allocate(ctx.getPlayer(), attribute, points);
        return true;
    }

    private boolean handlePickup(EventContext ctx) {
        Player player = ctx.getPlayer();
        Drop drop = ctx.services.world.getDrop(ctx.payload.getString("dropId"));
        if (drop == null || !drop.getMapId().equals(player.getMapId())) return true;

        ctx.services.world.removeDrop(drop.getId());
        ctx.services.aoi.broadcastToMap(drop.getMapId(), OutboundMessage.builder(EventType.DROP_PICKUP)
                .put("dropId", drop.getId())
                .put("email", player.getId())
                .build());
        return true;
    }

    private boolean handleDisconnect(EventContext ctx) {
        ctx.services.lifecycle.disconnect(ctx.getPlayer(), ctx.session.getConnection());
        ctx.session.unbindPlayer();
        return true;
    }
}
