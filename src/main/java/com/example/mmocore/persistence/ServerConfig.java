package com.example.mmocore.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.Map;

/**
 * Server tunables: AOI radius, tick periods, cooldowns, delays and reward ranges.
 *
 * Values come from {@code /config/server.yaml}. Any key can be overridden by a
 * system property ({@code -Dmmocore.combat.pvpCooldownMs=500}) or an environment
 * variable ({@code MMOCORE_COMBAT_PVPCOOLDOWNMS=500}); the system property wins.
 */
public class ServerConfig {
    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_RESOURCE = "/config/server.yaml";

    private double aoiRadius = 800;

    private long monsterAiIntervalMs = 100;
    private long playerSyncIntervalMs = 50;
    private long monsterSyncIntervalMs = 100;

    private long moveThrottleMs = 40;

    private long monsterMoveBroadcastMs = 100;
    private long monsterAttackRecoverMs = 400;
    private long monsterRespawnDelayMs = 5000;
    private double wanderChance = 0.01;
    private long wanderMinGapMs = 500;
    private double wanderStep = 10;

    private boolean trustClientDamage = true;
    private long pvpCooldownMs = 1000;
    private double critChancePerLuck = 0.05;

    private int bcoinsMin = 10;
    private int bcoinsMax = 30;
    private double bcoinsDropChance = 0.7;

    private int initialStatPoints = 5;
    private int statPointsPerLevel = 5;
    private int maxLevel = 99;

    private String defaultTown = "town_1";
    private long reviveDelayMs = 3000;

    private long chatCooldownMs = 5000;
    private int chatMaxLength = 200;

    private String profileDbUrl = "jdbc:h2:file:./data/profiles;DB_CLOSE_DELAY=-1";

    private ServerConfig() {}

    /**
     * Built-in defaults with no resource or override applied.
     */
    public static ServerConfig defaults() {
        return new ServerConfig();
    }

    /**
     * Load from a classpath YAML resource, then apply property/env overrides.
     * A missing resource leaves the defaults in place.
     */
    public static ServerConfig load(String resourcePath) {
        Map<String, Object> data = null;
        try (InputStream is = ServerConfig.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("[config] resource {} not found, using defaults", resourcePath);
            } else {
                data = new Yaml().load(is);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to read server config " + resourcePath, e);
        }
        ServerConfig config = fromMap(data, true);
        logger.info("[config] loaded {} (aoiRadius={}, trustClientDamage={})",
                resourcePath, config.aoiRadius, config.trustClientDamage);
        return config;
    }

    /**
     * Build from an already-parsed YAML tree, without property/env overrides.
     */
    public static ServerConfig fromMap(Map<String, Object> data) {
        return fromMap(data, false);
    }

    private static ServerConfig fromMap(Map<String, Object> data, boolean withOverrides) {
        Section root = new Section(data, "", withOverrides);
        ServerConfig c = new ServerConfig();

        Section aoi = root.section("aoi");
        c.aoiRadius = aoi.getDouble("radius", c.aoiRadius);

        Section ticks = root.section("ticks");
        c.monsterAiIntervalMs = ticks.getLong("monsterAiMs", c.monsterAiIntervalMs);
        c.playerSyncIntervalMs = ticks.getLong("playerSyncMs", c.playerSyncIntervalMs);
        c.monsterSyncIntervalMs = ticks.getLong("monsterSyncMs", c.monsterSyncIntervalMs);

        Section movement = root.section("movement");
        c.moveThrottleMs = movement.getLong("throttleMs", c.moveThrottleMs);

        Section monsters = root.section("monsters");
        c.monsterMoveBroadcastMs = monsters.getLong("moveBroadcastMs", c.monsterMoveBroadcastMs);
        c.monsterAttackRecoverMs = monsters.getLong("attackRecoverMs", c.monsterAttackRecoverMs);
        c.monsterRespawnDelayMs = monsters.getLong("respawnDelayMs", c.monsterRespawnDelayMs);
        c.wanderChance = monsters.getDouble("wanderChance", c.wanderChance);
        c.wanderMinGapMs = monsters.getLong("wanderMinGapMs", c.wanderMinGapMs);
        c.wanderStep = monsters.getDouble("wanderStep", c.wanderStep);

        Section combat = root.section("combat");
        c.trustClientDamage = combat.getBoolean("trustClientDamage", c.trustClientDamage);
        c.pvpCooldownMs = combat.getLong("pvpCooldownMs", c.pvpCooldownMs);
        c.critChancePerLuck = combat.getDouble("critChancePerLuck", c.critChancePerLuck);

        Section rewards = root.section("rewards");
        c.bcoinsMin = rewards.getInt("bcoinsMin", c.bcoinsMin);
        c.bcoinsMax = rewards.getInt("bcoinsMax", c.bcoinsMax);
        c.bcoinsDropChance = rewards.getDouble("bcoinsDropChance", c.bcoinsDropChance);
        if (c.bcoinsMax < c.bcoinsMin) {
            throw new IllegalStateException("rewards.bcoinsMax must be >= rewards.bcoinsMin");
        }

        Section progression = root.section("progression");
        c.initialStatPoints = progression.getInt("initialStatPoints", c.initialStatPoints);
        c.statPointsPerLevel = progression.getInt("statPointsPerLevel", c.statPointsPerLevel);
        c.maxLevel = progression.getInt("maxLevel", c.maxLevel);
        if (c.maxLevel < 1) {
            throw new IllegalStateException("progression.maxLevel must be >= 1");
        }

        Section lifecycle = root.section("lifecycle");
        c.defaultTown = lifecycle.getString("defaultTown", c.defaultTown);
        c.reviveDelayMs = lifecycle.getLong("reviveDelayMs", c.reviveDelayMs);

        Section chat = root.section("chat");
        c.chatCooldownMs = chat.getLong("cooldownMs", c.chatCooldownMs);
        c.chatMaxLength = chat.getInt("maxLength", c.chatMaxLength);

        Section persistence = root.section("persistence");
        c.profileDbUrl = persistence.getString("profileDbUrl", c.profileDbUrl);
        return c;
    }

    public double getAoiRadius() { return aoiRadius; }
    public long getMonsterAiIntervalMs() { return monsterAiIntervalMs; }
    public long getPlayerSyncIntervalMs() { return playerSyncIntervalMs; }
    public long getMonsterSyncIntervalMs() { return monsterSyncIntervalMs; }
    public long getMoveThrottleMs() { return moveThrottleMs; }
    public long getMonsterMoveBroadcastMs() { return monsterMoveBroadcastMs; }
    public long getMonsterAttackRecoverMs() { return monsterAttackRecoverMs; }
    public long getMonsterRespawnDelayMs() { return monsterRespawnDelayMs; }
    public double getWanderChance() { return wanderChance; }
    public long getWanderMinGapMs() { return wanderMinGapMs; }
    public double getWanderStep() { return wanderStep; }
    public boolean isTrustClientDamage() { return trustClientDamage; }
    public long getPvpCooldownMs() { return pvpCooldownMs; }
    public double getCritChancePerLuck() { return critChancePerLuck; }
    public int getBcoinsMin() { return bcoinsMin; }
    public int getBcoinsMax() { return bcoinsMax; }
    public double getBcoinsDropChance() { return bcoinsDropChance; }
    public int getInitialStatPoints() { return initialStatPoints; }
    public int getStatPointsPerLevel() { return statPointsPerLevel; }
    public int getMaxLevel() { return maxLevel; }
    public String getDefaultTown() { return defaultTown; }
    public long getReviveDelayMs() { return reviveDelayMs; }
    public long getChatCooldownMs() { return chatCooldownMs; }
    public int getChatMaxLength() { return chatMaxLength; }
    public String getProfileDbUrl() { return profileDbUrl; }

    /**
     * One level of the YAML tree, with the dotted path used for overrides.
     */
    private static final class Section {
        private final Map<String, Object> values;
        private final String path;
        private final boolean withOverrides;

        Section(Map<String, Object> values, String path, boolean withOverrides) {
            this.values = values == null ? Map.of() : values;
            this.path = path;
            this.withOverrides = withOverrides;
        }

        @SuppressWarnings("unchecked")
        Section section(String key) {
            Object v = values.get(key);
            Map<String, Object> child = v instanceof Map ? (Map<String, Object>) v : null;
            return new Section(child, path.isEmpty() ? key : path + "." + key, withOverrides);
        }

        private Object raw(String key) {
            if (withOverrides) {
                String dotted = path.isEmpty() ? key : path + "." + key;
                String prop = System.getProperty("mmocore." + dotted);
                if (prop != null && !prop.isEmpty()) return prop;
                String env = System.getenv("MMOCORE_" + dotted.replace('.', '_').toUpperCase());
                if (env != null && !env.isEmpty()) return env;
            }
            return values.get(key);
        }

        String getString(String key, String def) {
            Object v = raw(key);
            return v == null ? def : String.valueOf(v);
        }

        int getInt(String key, int def) {
            return (int) getLong(key, def);
        }

        long getLong(String key, long def) {
            Object v = raw(key);
            if (v == null) return def;
            if (v instanceof Number) return ((Number) v).longValue();
            try {
                return Long.parseLong(v.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Config value " + path + "." + key + " is not an integer: " + v, e);
            }
        }

        double getDouble(String key, double def) {
            Object v = raw(key);
            if (v == null) return def;
            if (v instanceof Number) return ((Number) v).doubleValue();
            try {
                return Double.parseDouble(v.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Config value " + path + "." + key + " is not a number: " + v, e);
            }
        }

        boolean getBoolean(String key, boolean def) {
            Object v = raw(key);
            if (v == null) return def;
            if (v instanceof Boolean) return (Boolean) v;
            return Boolean.parseBoolean(v.toString().trim());
        }
    }
}
