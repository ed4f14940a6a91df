package com.example.mmocore.net.handlers;

import com.example.mmocore.model.Direction;
import com.example.mmocore.model.Player;
import com.example.mmocore.model.PlayerState;
import com.example.mmocore.net.InboundEvent;

/**
 * Handles movement and map transfer.
 */
public class MovementEventHandler implements EventHandler {

    @Override
    public boolean supports(String eventName) {
        InboundEvent e = InboundEvent.fromWireName(eventName);
        return e != null && e.getCategory() == InboundEvent.Category.MOVEMENT;
    }

    @Override
    public boolean handle(EventContext ctx) {
        switch (ctx.event) {
            case MOVE: return handleMove(ctx);
            case CHANGE_MAP: return handleChangeMap(ctx);
            default: return false;
        }
    }

    /**
     * Position updates are accepted at most once per throttle window; the
     * position is replicated by the player sync tick, not here.
     */
    private boolean handleMove(EventContext ctx) {
        Player player = ctx.getPlayer();
        if (player.isDead()) return true;
        double[] pos = ctx.payload.getPosition("position");
        if (pos == null) return true;
        if (!player.tryAcceptMove(ctx.now(), ctx.services.config.getMoveThrottleMs())) return true;

        player.setPosition(pos[0], pos[1]);
        player.setDirection(Direction.fromKey(ctx.payload.getString("direction")));
        PlayerState state = PlayerState.fromKey(ctx.payload.getString("state"));
        if (state != PlayerState.DEAD) {
            player.setState(state);
        }
        return true;
    }

    private boolean handleChangeMap(EventContext ctx) {
        String mapId = ctx.payload.getString("map");
        if (mapId == null) return true;
        double[] pos = ctx.payload.getPosition("position");
        ctx.services.lifecycle.changeMap(ctx.getPlayer(), mapId,
                pos == null ? null : pos[0],
                pos == null ? null : pos[1]);
        return true;
    }
}
