package com.example.mmocore.model;

/**
 * Static map configuration. Maps are read-only once loaded.
 */
public class GameMap {
    private final String id;
    private final double spawnX;
    private final double spawnY;
    private final boolean safeZone;
    private final boolean pvp;
    private final Integer minLevel;   // null = no level gate

    public GameMap(String id, double spawnX, double spawnY, boolean safeZone, boolean pvp, Integer minLevel) {
        this.id = id;
        this.spawnX = spawnX;
        this.spawnY = spawnY;
        this.safeZone = safeZone;
        this.pvp = pvp;
        this.minLevel = minLevel;
    }

    public String getId() { return id; }
    public double getSpawnX() { return spawnX; }
    public double getSpawnY() { return spawnY; }
    public boolean isSafeZone() { return safeZone; }
    public boolean isPvp() { return pvp; }
    public Integer getMinLevel() { return minLevel; }

    /**
     * Check the level gate.
     * @return true if a player of this level may enter
     */
    public boolean allowsLevel(int level) {
        return minLevel == null || level >= minLevel;
    }

    @Override
    public String toString() {
        return "GameMap{" + id + ", spawn=(" + spawnX + "," + spawnY + ")"
                + (safeZone ? ", safe" : "") + (pvp ? ", pvp" : "")
                + (minLevel != null ? ", minLevel=" + minLevel : "") + "}";
    }
}
