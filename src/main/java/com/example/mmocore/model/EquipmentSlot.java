package com.example.mmocore.model;

/**
 * Slots an item can occupy. Each holds one bag of stat bonuses.
 */
public enum EquipmentSlot {
    HEAD,
    BODY,
    WEAPON,
    OFF_HAND,
    GLOVES,
    BOOTS,
    ACCESSORY
}
