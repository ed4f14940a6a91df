package com.example.mmocore.model;

/**
 * Animation/state tag of a player as shown to other clients.
 */
public enum PlayerState {
    IDLE("idle"),
    MOVING("moving"),
    ATTACKING("attacking"),
    DEAD("dead");

    private final String key;

    PlayerState(String key) {
        this.key = key;
    }

    public String getKey() { return key; }

    public static PlayerState fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (PlayerState s : values()) {
            if (s.key.equals(k)) return s;
        }
        return null;
    }
}
