package com.example.mmocore.net;

/**
 * Events a client may send, grouped into the categories that route them to a handler.
 */
public enum InboundEvent {
    JOIN("player:join", Category.SYSTEM),
    ALLOCATE_STAT("player:allocateStat", Category.SYSTEM),
    DROP_PICKUP("drop:pickup", Category.SYSTEM),
    DISCONNECT("disconnect", Category.SYSTEM),

    MOVE("player:move", Category.MOVEMENT),
    CHANGE_MAP("player:changeMap", Category.MOVEMENT),

    ATTACK("player:attack", Category.COMBAT),
    SKILL("player:skill", Category.COMBAT),
    MONSTER_HIT("monster:hit", Category.COMBAT),
    PVP_ATTACK("player:pvpAttack", Category.COMBAT),
    HIT("player:hit", Category.COMBAT),

    SEND_CHAT("player:sendChat", Category.CHAT);

    public enum Category {
        SYSTEM,
        MOVEMENT,
        COMBAT,
        CHAT
    }

    private final String wireName;
    private final Category category;

    InboundEvent(String wireName, Category category) {
        this.wireName = wireName;
        this.category = category;
    }

    public String getWireName() { return wireName; }
    public Category getCategory() { return category; }

    public static InboundEvent fromWireName(String name) {
        if (name == null) return null;
        for (InboundEvent e : values()) {
            if (e.wireName.equals(name)) return e;
        }
        return null;
    }
}
