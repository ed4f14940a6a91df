package com.example.mmocore.net;

import com.example.mmocore.model.Monster;
import com.example.mmocore.model.Player;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factories for outbound events whose payload is a view of an entity.
 */
public final class Messages {

    private Messages() {}

    public static Map<String, Object> position(double x, double y) {
        Map<String, Object> pos = new LinkedHashMap<>();
        pos.put("x", x);
        pos.put("y", y);
        return pos;
    }

    public static Map<String, Object> joinedPayload(Player p) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("email", p.getId());
        payload.put("name", p.getName());
        payload.put("character_class", p.getClassKey());
        payload.put("level", p.getLevel());
        payload.put("position", position(p.getX(), p.getY()));
        payload.put("direction", p.getDirection().getKey());
        payload.put("state", p.getState().getKey());
        return payload;
    }

    public static OutboundMessage playerJoined(Player p) {
        return new OutboundMessage(EventType.PLAYER_JOINED, joinedPayload(p));
    }

    public static OutboundMessage playerLeft(Player p) {
        return OutboundMessage.builder(EventType.PLAYER_LEFT).put("email", p.getId()).build();
    }

    public static OutboundMessage playerMoved(Player p, long timestamp) {
        return OutboundMessage.builder(EventType.PLAYER_MOVED)
                .put("email", p.getId())
                .put("name", p.getName())
                .put("character_class", p.getClassKey())
                .put("position", position(p.getX(), p.getY()))
                .put("direction", p.getDirection().getKey())
                .put("state", p.getState().getKey())
                .put("timestamp", timestamp)
                .build();
    }

    /**
     * Stat block shared by statsInitialized and statsUpdated.
     */
    public static OutboundMessage stats(EventType type, Player p) {
        return OutboundMessage.builder(type)
                .put("stats", p.getAttributeMap())
                .put("statPointsAvailable", p.getStatPoints())
                .put("hp", p.getHp())
                .put("maxHp", p.getMaxHp())
                .put("attack", p.getAttack())
                .put("speed", p.getSpeed())
                .put("extraStats", p.getExtraStats())
                .build();
    }

    public static OutboundMessage xpUpdated(Player p) {
        return OutboundMessage.builder(EventType.PLAYER_XP_UPDATED)
                .put("xp", p.getXp())
                .put("level", p.getLevel())
                .put("xpToLevel", p.getXpToLevel())
                .build();
    }

    public static OutboundMessage monsterSpawn(Monster m) {
        return OutboundMessage.builder(EventType.MONSTER_SPAWN)
                .put("id", m.getId())
                .put("type", m.getType())
                .put("mapId", m.getMapId())
                .put("x", m.getX())
                .put("y", m.getY())
                .put("hp", m.getHp())
                .put("maxHp", m.getMaxHp())
                .put("direction", m.getDirection().getKey())
                .put("state", m.getState().getKey())
                .put("spawnX", m.getSpawnX())
                .put("spawnY", m.getSpawnY())
                .put("target", m.getTargetId())
                .build();
    }

    public static OutboundMessage monsterMove(Monster m) {
        return OutboundMessage.builder(EventType.MONSTER_MOVE)
                .put("id", m.getId())
                .put("mapId", m.getMapId())
                .put("x", m.getX())
                .put("y", m.getY())
                .put("direction", m.getDirection().getKey())
                .put("state", m.getState().getKey())
                .build();
    }

    public static OutboundMessage monsterUpdate(Monster m) {
        return OutboundMessage.builder(EventType.MONSTER_UPDATE)
                .put("id", m.getId())
                .put("type", m.getType())
                .put("mapId", m.getMapId())
                .put("x", m.getX())
                .put("y", m.getY())
                .put("direction", m.getDirection().getKey())
                .put("state", m.getState().getKey())
                .put("hp", m.getHp())
                .put("maxHp", m.getMaxHp())
                .put("target", m.getTargetId())
                .build();
    }

    public static OutboundMessage error(EventType type, String message) {
        return OutboundMessage.builder(type).put("message", message).build();
    }
}
