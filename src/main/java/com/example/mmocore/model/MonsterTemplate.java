package com.example.mmocore.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Template defining a type of monster. Instances are spawned from it.
 */
public class MonsterTemplate {

    private final String type;             // e.g. "poring"
    private final int hp;
    private final int attack;
    private final double speed;            // units per AI tick
    private final double aggroRange;
    private final double attackRange;
    private final long attackCooldownMs;
    private final int experienceValue;     // XP awarded to the killer
    private final List<String> loot;       // one entry is picked per kill

    public MonsterTemplate(String type, int hp, int attack, double speed,
                           double aggroRange, double attackRange, long attackCooldownMs,
                           int experienceValue, List<String> loot) {
        this.type = type;
        this.hp = hp;
        this.attack = attack;
        this.speed = speed;
        this.aggroRange = aggroRange;
        this.attackRange = attackRange;
        this.attackCooldownMs = attackCooldownMs;
        this.experienceValue = experienceValue;
        this.loot = loot == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(loot));
    }

    public String getType() { return type; }
    public int getHp() { return hp; }
    public int getAttack() { return attack; }
    public double getSpeed() { return speed; }
    public double getAggroRange() { return aggroRange; }
    public double getAttackRange() { return attackRange; }
    public long getAttackCooldownMs() { return attackCooldownMs; }
    public int getExperienceValue() { return experienceValue; }
    public List<String> getLoot() { return loot; }

    @Override
    public String toString() {
        return "MonsterTemplate{" + type + ", hp=" + hp + ", atk=" + attack + ", xp=" + experienceValue + "}";
    }
}
