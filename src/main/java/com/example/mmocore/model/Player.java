package com.example.mmocore.model;

import com.example.mmocore.net.Connection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A player character, keyed by a stable identity (the account email).
 *
 * Players are created on first join and are never destroyed: a disconnect only
 * clears the connection and marks the player offline so that a later reconnect
 * restores the exact state.
 *
 * maxHp, attack and speed have no setters. They are written only by
 * {@link #applyStats(DerivedStats, HpPolicy)} with the output of the stat pipeline.
 */
public class Player {

    private final String id;
    private final String name;
    private final String classKey;

    // Progression
    private int level;
    private int xp;
    private int statPoints;
    private int bcoins;
    private final EnumMap<Attribute, Integer> attributes = new EnumMap<>(Attribute.class);

    // Position and presentation
    private double x;
    private double y;
    private Direction direction = Direction.FRONT;
    private PlayerState state = PlayerState.IDLE;
    private String mapId;

    // Session
    private Connection connection;
    private boolean online;

    // Combat stats (pipeline output)
    private int hp;
    private int maxHp;
    private double attack;
    private double speed = 1.0;
    private Map<String, Double> extraStats = Collections.emptyMap();
    private boolean dead;

    // Items
    private final EnumMap<EquipmentSlot, Map<String, Double>> equipment = new EnumMap<>(EquipmentSlot.class);
    private final List<String> inventory = new ArrayList<>();

    // Throttles and cooldowns (epoch millis of the last accepted action)
    private final EnumMap<ChatChannel, Long> lastChatAt = new EnumMap<>(ChatChannel.class);
    private long lastMoveAt;
    private long lastPvpAttackAt;

    public Player(String id, String name, String classKey, int level, int xp, String mapId, double x, double y) {
        this.id = id;
        this.name = name;
        this.classKey = classKey;
        this.level = Math.max(1, level);
        this.xp = Math.max(0, xp);
        this.mapId = mapId;
        this.x = x;
        this.y = y;
        for (Attribute a : Attribute.values()) {
            attributes.put(a, Attribute.BASE_VALUE);
        }
    }

    // ===== identity =====

    public String getId() { return id; }
    public String getName() { return name; }
    public String getClassKey() { return classKey; }

    // ===== progression =====

    public int getLevel() { return level; }
    public int getXp() { return xp; }
    public int getStatPoints() { return statPoints; }
    public int getBcoins() { return bcoins; }

    /** XP needed to advance from the current level. */
    public int getXpToLevel() {
        return xpToLevel(level);
    }

    public static int xpToLevel(int level) {
        return (int) Math.min(Integer.MAX_VALUE, level * 100L);
    }

    public void addXp(int amount) {
        if (amount > 0) xp = (int) Math.min(Integer.MAX_VALUE, (long) xp + amount);
    }

    /**
     * Consume one level's worth of XP and advance a level.
     * @return false if there was not enough XP or the level cap is reached
     */
    public boolean consumeLevelUp(int statPointAward, int maxLevel) {
        if (level >= maxLevel) return false;
        int threshold = getXpToLevel();
        if (xp < threshold) return false;
        xp -= threshold;
        level++;
        statPoints += statPointAward;
        return true;
    }

    public void grantStatPoints(int points) {
        if (points > 0) statPoints += points;
    }

    public void addBcoins(int amount) {
        if (amount > 0) bcoins += amount;
    }

    public int getAttribute(Attribute attribute) {
        return attributes.getOrDefault(attribute, Attribute.BASE_VALUE);
    }

    /**
     * Move unspent stat points into an attribute.
     * @return false (and change nothing) if the points are not available
     */
    public boolean allocate(Attribute attribute, int points) {
        if (attribute == null || points <= 0 || points > statPoints) return false;
        attributes.merge(attribute, points, Integer::sum);
        statPoints -= points;
        return true;
    }

    /** Attribute values keyed by their wire name, in declaration order. */
    public Map<String, Integer> getAttributeMap() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Map.Entry<Attribute, Integer> e : attributes.entrySet()) {
            out.put(e.getKey().name(), e.getValue());
        }
        return out;
    }

    // ===== position =====

    public double getX() { return x; }
    public double getY() { return y; }
    public Direction getDirection() { return direction; }
    public PlayerState getState() { return state; }
    public String getMapId() { return mapId; }

    public void setPosition(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public void setDirection(Direction direction) {
        if (direction != null) this.direction = direction;
    }

    public void setState(PlayerState state) {
        if (state != null) this.state = state;
    }

    /**
     * Only the state store changes the map, so the membership index stays in step.
     */
    public void setMapId(String mapId) {
        this.mapId = mapId;
    }

    // ===== session =====

    public Connection getConnection() { return connection; }
    public boolean isOnline() { return online; }

    public void bind(Connection connection) {
        this.connection = connection;
        this.online = connection != null;
    }

    public void markOffline() {
        this.connection = null;
        this.online = false;
    }

    // ===== combat stats =====

    public int getHp() { return hp; }
    public int getMaxHp() { return maxHp; }
    public double getAttack() { return attack; }
    public double getSpeed() { return speed; }
    public Map<String, Double> getExtraStats() { return extraStats; }
    public boolean isDead() { return dead; }

    /**
     * Install freshly derived stats and reconcile current HP.
     *
     * With {@link HpPolicy#PRESERVE_RATIO} the old hp/maxHp ratio is applied to the
     * new max (a dead player's HP is only clamped). {@link HpPolicy#FULL_HEAL} sets
     * HP to the new max.
     */
    public void applyStats(DerivedStats stats, HpPolicy policy) {
        int oldHp = this.hp;
        int oldMaxHp = this.maxHp;

        this.maxHp = Math.max(1, stats.maxHp());
        this.attack = stats.attack();
        this.speed = stats.speed();
        this.extraStats = stats.extra();

        if (policy == HpPolicy.FULL_HEAL || oldMaxHp <= 0) {
            this.hp = this.maxHp;
        } else if (dead) {
            this.hp = Math.min(oldHp, this.maxHp);
        } else {
            double ratio = (double) oldHp / oldMaxHp;
            this.hp = (int) Math.round(this.maxHp * ratio);
        }
        this.hp = Math.max(0, Math.min(this.hp, this.maxHp));
    }

    /**
     * Subtract damage, clamped at zero.
     * @return the new HP
     */
    public int takeDamage(int damage) {
        hp = Math.max(0, Math.min(maxHp, hp - Math.max(0, damage)));
        return hp;
    }

    public void markDead() {
        this.dead = true;
        this.state = PlayerState.DEAD;
    }

    public void markAlive() {
        this.dead = false;
        this.state = PlayerState.IDLE;
    }

    // ===== items =====

    public Map<EquipmentSlot, Map<String, Double>> getEquipment() {
        return Collections.unmodifiableMap(equipment);
    }

    public void equip(EquipmentSlot slot, Map<String, Double> bonuses) {
        if (slot == null) return;
        equipment.put(slot, bonuses == null ? Map.of() : new HashMap<>(bonuses));
    }

    public Map<String, Double> unequip(EquipmentSlot slot) {
        return equipment.remove(slot);
    }

    public List<String> getInventory() {
        return Collections.unmodifiableList(inventory);
    }

    public void addToInventory(String itemId) {
        if (itemId != null) inventory.add(itemId);
    }

    // ===== throttles =====

    /**
     * Accept a move if at least {@code throttleMs} passed since the last accepted one.
     */
    public boolean tryAcceptMove(long now, long throttleMs) {
        if (lastMoveAt != 0 && now - lastMoveAt < throttleMs) return false;
        lastMoveAt = now;
        return true;
    }

    public boolean isPvpAttackReady(long now, long cooldownMs) {
        return lastPvpAttackAt == 0 || now - lastPvpAttackAt >= cooldownMs;
    }

    public void markPvpAttack(long now) {
        this.lastPvpAttackAt = now;
    }

    public boolean isChatReady(ChatChannel channel, long now, long cooldownMs) {
        Long last = lastChatAt.get(channel);
        return last == null || now - last >= cooldownMs;
    }

    public void markChat(ChatChannel channel, long now) {
        lastChatAt.put(channel, now);
    }

    @Override
    public String toString() {
        return "Player{" + id + ", lvl " + level + ", map=" + mapId + ", hp=" + hp + "/" + maxHp
                + (dead ? ", dead" : "") + (online ? "" : ", offline") + "}";
    }
}
