package com.example.mmocore.model;

/**
 * How current HP is reconciled when max HP changes.
 */
public enum HpPolicy {
    /** Rescale current HP by the old hp/maxHp ratio. Used while alive. */
    PRESERVE_RATIO,
    /** Set HP to the new max. Used on first join, level-up and revive. */
    FULL_HEAL
}
