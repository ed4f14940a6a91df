package com.example.mmocore.model;

/**
 * States of the monster AI state machine.
 */
public enum MonsterState {
    IDLE("idle"),
    CHASING("chasing"),
    ATTACKING("attacking");

    private final String key;

    MonsterState(String key) {
        this.key = key;
    }

    public String getKey() { return key; }
}
