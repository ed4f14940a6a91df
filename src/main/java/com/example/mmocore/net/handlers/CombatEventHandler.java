package com.example.mmocore.net.handlers;

import com.example.mmocore.combat.PvpResult;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.EventType;
import com.example.mmocore.net.InboundEvent;
import com.example.mmocore.net.Messages;
import com.example.mmocore.net.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles attack animations, skills, monster hits, PvP attacks and
 * client-reported hits on the player.
 */
public class CombatEventHandler implements EventHandler {
    private static final Logger logger = LoggerFactory.getLogger(CombatEventHandler.class);

    @Override
    public boolean supports(String eventName) {
        InboundEvent e = InboundEvent.fromWireName(eventName);
        return e != null && e.getCategory() == InboundEvent.Category.COMBAT;
    }

    @Override
    public boolean handle(EventContext ctx) {
        Player player = ctx.getPlayer();
        if (player.isDead()) return true;

        switch (ctx.event) {
            case ATTACK: return handleAttack(ctx, player);
            case SKILL: return handleSkill(ctx, player);
            case MONSTER_HIT: return handleMonsterHit(ctx, player);
            case PVP_ATTACK: return handlePvpAttack(ctx, player);
            case HIT: return handleHit(ctx, player);
            default: return false;
        }
    }

    // Attack and skill are presentation only; the values are relayed unchecked.
    private boolean handleAttack(EventContext ctx, Player player) {
        ctx.services.aoi.broadcastToAOI(player.getId(), player.getX(), player.getY(), player.getMapId(),
                OutboundMessage.builder(EventType.PLAYER_ATTACKED)
                        .put("email", player.getId())
                        .put("position", Messages.position(player.getX(), player.getY()))
                        .put("direction", player.getDirection().getKey())
                        .put("damage", ctx.payload.raw("damage"))
                        .build());
        return true;
    }

    private boolean handleSkill(EventContext ctx, Player player) {
        String skillType = ctx.payload.getString("skillType");
        if (skillType == null) return true;
        ctx.services.aoi.broadcastToAOI(player.getId(), player.getX(), player.getY(), player.getMapId(),
                OutboundMessage.builder(EventType.PLAYER_SKILL)
                        .put("email", player.getId())
                        .put("skillType", skillType)
                        .put("position", Messages.position(player.getX(), player.getY()))
                        .put("direction", player.getDirection().getKey())
                        .put("data", ctx.payload.raw("data"))
                        .build());
        return true;
    }

    private boolean handleMonsterHit(EventContext ctx, Player player) {
        String monsterId = ctx.payload.getString("monsterId");
        Integer damage = ctx.payload.getInt("damage");
        if (monsterId == null || damage == null) return true;
        ctx.services.combat.hitMonster(player, monsterId, damage);
        return true;
    }

    private boolean handlePvpAttack(EventContext ctx, Player player) {
        String target = ctx.payload.getString("targetEmail");
        if (target == null) return true;
        PvpResult result = ctx.services.combat.pvpAttack(player, target);
        if (!result.isAccepted()) {
            logger.debug("[combat] pvp attack {} -> {} rejected: {}", player.getId(), target, result.getType());
        }
        return true;
    }

    private boolean handleHit(EventContext ctx, Player player) {
        Integer damage = ctx.payload.getInt("damage");
        if (damage == null) return true;
        ctx.services.combat.clientReportedHit(player, damage, ctx.payload.getString("attackerEmail"));
        return true;
    }
}
