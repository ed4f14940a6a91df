package com.example.mmocore.model;

/**
 * Chat channels. Each channel has its own per-player cooldown.
 */
public enum ChatChannel {
    PRIVATE("private"),
    GLOBAL("global"),
    TOWN("town"),
    MAP("map");

    private final String key;

    ChatChannel(String key) {
        this.key = key;
    }

    public String getKey() { return key; }

    public static ChatChannel fromKey(String key) {
        if (key == null) return null;
        for (ChatChannel c : values()) {
            if (c.key.equals(key)) return c;
        }
        return null;
    }
}
