package com.example.mmocore.net;

import java.util.List;

/**
 * Outbound event names together with the minimal set of payload fields each
 * event must carry. Additional fields are optional extensions; a missing
 * required field is a programming error (see {@link OutboundMessage}).
 * A required field may carry a null value (e.g. an unknown attacker).
 */
public enum EventType {

    // ===== player =====
    PLAYER_JOINED("player:joined", "email", "name", "character_class", "level", "position", "direction", "state"),
    PLAYER_LEFT("player:left", "email"),
    PLAYER_MOVED("player:moved", "email", "position", "direction", "state"),
    PLAYER_DAMAGED("player:damaged", "email", "damage", "attacker"),
    PLAYER_ATTACKED("player:attacked", "email", "position", "direction"),
    PLAYER_SKILL("player:skill", "email", "skillType", "position", "direction"),
    PLAYER_HP_CHANGED("player:hpChanged", "hp", "maxHp", "damage", "attacker"),
    PLAYER_DIED("player:died", "map", "x", "y"),
    PLAYER_REVIVED("player:revived", "hp", "maxHp"),
    PLAYER_LEVEL_UP("player:levelUp", "level", "hp", "maxHp", "attack", "speed", "stats", "statPointsAvailable"),
    PLAYER_XP_UPDATED("player:xpUpdated", "xp", "level", "xpToLevel"),
    PLAYER_STATS_INITIALIZED("player:statsInitialized", "stats", "statPointsAvailable", "hp", "maxHp", "attack", "speed"),
    PLAYER_STATS_UPDATED("player:statsUpdated", "stats", "statPointsAvailable", "hp", "maxHp", "attack", "speed"),
    PLAYER_ATTACK_RESULT("player:attackResult", "target", "damage", "targetHp"),
    PLAYER_PVP_HIT("player:pvpHit", "attacker", "target", "damage"),
    PLAYER_HIT_DENIED("player:hitDenied", "message"),
    PLAYER_MAP_ERROR("player:mapError", "message"),

    // ===== monster =====
    MONSTER_SPAWN("monster:spawn", "id", "type", "mapId", "x", "y", "hp", "maxHp", "direction", "state"),
    MONSTER_MOVE("monster:move", "id", "mapId", "x", "y", "direction", "state"),
    MONSTER_ATTACK("monster:attack", "id", "mapId", "targetEmail", "damage", "x", "y", "direction"),
    MONSTER_HIT("monster:hit", "id", "mapId", "hp", "damage"),
    MONSTER_DESPAWN("monster:despawn", "id", "mapId"),
    MONSTER_UPDATE("monster:update", "id", "type", "mapId", "x", "y", "direction", "state", "hp", "maxHp", "target"),
    MONSTER_KILLED("monster:killed", "monsterId", "xp", "currentXp", "level", "loot"),

    // ===== drops =====
    DROP_SPAWN("drop:spawn", "id", "mapId", "x", "y", "type"),
    DROP_PICKUP("drop:pickup", "dropId"),

    // ===== chat =====
    CHAT_MESSAGE("chat:message", "from", "message", "type", "timestamp", "senderEmail"),
    CHAT_SPAM_BLOCKED("chat:spamBlocked", "message"),
    CHAT_ERROR("chat:error", "message");

    private final String wireName;
    private final List<String> requiredFields;

    EventType(String wireName, String... requiredFields) {
        this.wireName = wireName;
        this.requiredFields = List.of(requiredFields);
    }

    public String getWireName() { return wireName; }
    public List<String> getRequiredFields() { return requiredFields; }

    public static EventType fromWireName(String name) {
        if (name == null) return null;
        for (EventType t : values()) {
            if (t.wireName.equals(name)) return t;
        }
        return null;
    }
}
