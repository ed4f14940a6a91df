package com.example.mmocore.model;

/**
 * Allocatable player attributes. Every attribute starts at 1 and only grows
 * through stat-point allocation.
 */
public enum Attribute {
    STR,
    AGI,
    VIT,
    INT,
    DEX,
    LUCK;

    public static final int BASE_VALUE = 1;

    /**
     * Parse an attribute from the key the client sends ("STR", "luck", ...).
     * @return the attribute, or null if the key is unknown
     */
    public static Attribute fromKey(String key) {
        if (key == null || key.isEmpty()) return null;
        try {
            return Attribute.valueOf(key.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
