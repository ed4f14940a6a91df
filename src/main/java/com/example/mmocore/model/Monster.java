package com.example.mmocore.model;

/**
 * A spawned monster instance of a {@link MonsterTemplate}.
 *
 * A monster at 0 HP is inert (skipped by the AI and the state sync) until its
 * respawn resets it at the spawn origin. Killed monsters are not destroyed;
 * only a map-empty cleanup removes them.
 */
public class Monster {

    private final String id;               // unique per spawn instance
    private final String type;
    private final String mapId;
    private final double spawnX;
    private final double spawnY;

    // Template data
    private final int maxHp;
    private final int attack;
    private final double speed;
    private final double aggroRange;
    private final double attackRange;
    private final long attackCooldownMs;

    // Live state
    private double x;
    private double y;
    private Direction direction = Direction.FRONT;
    private MonsterState state = MonsterState.IDLE;
    private int hp;
    private long lastAttackAt;
    private long lastUpdateAt;
    private String targetId;               // player identity, null when idle
    private String lastHitBy;              // last player to deal damage

    public Monster(String id, MonsterTemplate template, String mapId, double x, double y, long now) {
        this.id = id;
        this.type = template.getType();
        this.mapId = mapId;
        this.spawnX = x;
        this.spawnY = y;
        this.x = x;
        this.y = y;
        this.maxHp = template.getHp();
        this.hp = template.getHp();
        this.attack = template.getAttack();
        this.speed = template.getSpeed();
        this.aggroRange = template.getAggroRange();
        this.attackRange = template.getAttackRange();
        this.attackCooldownMs = template.getAttackCooldownMs();
        this.lastUpdateAt = now;
    }

    public String getId() { return id; }
    public String getType() { return type; }
    public String getMapId() { return mapId; }
    public double getSpawnX() { return spawnX; }
    public double getSpawnY() { return spawnY; }
    public int getMaxHp() { return maxHp; }
    public int getAttack() { return attack; }
    public double getSpeed() { return speed; }
    public double getAggroRange() { return aggroRange; }
    public double getAttackRange() { return attackRange; }
    public long getAttackCooldownMs() { return attackCooldownMs; }

    public double getX() { return x; }
    public double getY() { return y; }
    public Direction getDirection() { return direction; }
    public MonsterState getState() { return state; }
    public int getHp() { return hp; }
    public long getLastAttackAt() { return lastAttackAt; }
    public long getLastUpdateAt() { return lastUpdateAt; }
    public String getTargetId() { return targetId; }
    public String getLastHitBy() { return lastHitBy; }

    public boolean isAlive() {
        return hp > 0;
    }

    public void setPosition(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public void setDirection(Direction direction) {
        if (direction != null) this.direction = direction;
    }

    public void setState(MonsterState state) {
        this.state = state;
    }

    public void setTargetId(String targetId) {
        this.targetId = targetId;
    }

    public void markUpdated(long now) {
        this.lastUpdateAt = now;
    }

    public void markAttack(long now) {
        this.lastAttackAt = now;
    }

    /**
     * Whether the attack cooldown has elapsed.
     */
    public boolean canAttack(long now) {
        return lastAttackAt == 0 || now - lastAttackAt >= attackCooldownMs;
    }

    /**
     * Apply damage from a player, clamped at zero, and remember the attacker
     * for last-hit attribution.
     * @return the new HP
     */
    public int takeDamage(int damage, String attackerId) {
        hp = Math.max(0, hp - Math.max(0, damage));
        lastHitBy = attackerId;
        return hp;
    }

    /**
     * Reset to full health at the spawn origin.
     */
    public void respawn() {
        hp = maxHp;
        x = spawnX;
        y = spawnY;
        state = MonsterState.IDLE;
        targetId = null;
        lastHitBy = null;
    }

    @Override
    public String toString() {
        return "Monster{" + id + ", " + state.getKey() + ", hp=" + hp + "/" + maxHp + "}";
    }
}
