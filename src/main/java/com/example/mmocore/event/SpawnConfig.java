package com.example.mmocore.event;

import java.util.Collections;
import java.util.List;

/**
 * Monster population of one map: how many, which types, and the rectangle
 * spawn positions are drawn from.
 */
public class SpawnConfig {

    /** Map this population belongs to */
    public final String mapId;

    /** Population cap */
    public final int count;

    /** Monster types picked uniformly at random */
    public final List<String> types;

    public final double minX;
    public final double maxX;
    public final double minY;
    public final double maxY;

    public SpawnConfig(String mapId, int count, List<String> types,
                       double minX, double maxX, double minY, double maxY) {
        this.mapId = mapId;
        this.count = Math.max(0, count);
        this.types = types == null ? Collections.emptyList() : List.copyOf(types);
        this.minX = Math.min(minX, maxX);
        this.maxX = Math.max(minX, maxX);
        this.minY = Math.min(minY, maxY);
        this.maxY = Math.max(minY, maxY);
    }

    @Override
    public String toString() {
        return "SpawnConfig{map=" + mapId + ", count=" + count + ", types=" + types
                + ", bounds=[" + minX + ".." + maxX + "]x[" + minY + ".." + maxY + "]}";
    }
}
