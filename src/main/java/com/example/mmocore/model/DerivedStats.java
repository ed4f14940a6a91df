package com.example.mmocore.model;

import java.util.Map;

/**
 * Output of the stat pipeline. {@code extra} holds equipment-only stats that
 * have no base value (e.g. "defense").
 */
public record DerivedStats(
        int maxHp,
        double attack,
        double speed,
        Map<String, Double> extra
) {
    public DerivedStats {
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }
}
