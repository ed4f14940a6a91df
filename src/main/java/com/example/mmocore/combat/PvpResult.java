package com.example.mmocore.combat;

/**
 * Outcome of a player-versus-player attack request.
 */
public class PvpResult {

    public enum ResultType {
        HIT,
        CRITICAL_HIT,
        NOT_PVP_MAP,      // attacker or target outside a PvP map
        ATTACKER_DEAD,
        INVALID_TARGET,   // unknown, offline, self, or on another map
        TARGET_DEAD,
        ON_COOLDOWN
    }

    private final ResultType type;
    private final int damage;
    private final int targetHp;

    private PvpResult(ResultType type, int damage, int targetHp) {
        this.type = type;
        this.damage = damage;
        this.targetHp = targetHp;
    }

    public static PvpResult hit(int damage, int targetHp) {
        return new PvpResult(ResultType.HIT, damage, targetHp);
    }

    public static PvpResult criticalHit(int damage, int targetHp) {
        return new PvpResult(ResultType.CRITICAL_HIT, damage, targetHp);
    }

    public static PvpResult rejected(ResultType reason) {
        return new PvpResult(reason, 0, -1);
    }

    public ResultType getType() { return type; }
    public int getDamage() { return damage; }

    /** Target HP after the hit, -1 when rejected. */
    public int getTargetHp() { return targetHp; }

    public boolean isAccepted() {
        return type == ResultType.HIT || type == ResultType.CRITICAL_HIT;
    }

    public boolean isCritical() {
        return type == ResultType.CRITICAL_HIT;
    }

    @Override
    public String toString() {
        return isAccepted() ? type + "(" + damage + ", hp=" + targetHp + ")" : type.toString();
    }
}
