package com.example.mmocore.model;

/**
 * Per-class base stat table. Base stats for a level are
 * {@code base + perLevel * (level - 1)}.
 */
public class CharacterClass {
    public final String key;
    public final int baseHp;
    public final int hpPerLevel;
    public final int baseAttack;
    public final int attackPerLevel;

    public CharacterClass(String key, int baseHp, int hpPerLevel, int baseAttack, int attackPerLevel) {
        this.key = key;
        this.baseHp = baseHp;
        this.hpPerLevel = hpPerLevel;
        this.baseAttack = baseAttack;
        this.attackPerLevel = attackPerLevel;
    }

    /**
     * Max HP before attribute and equipment bonuses.
     */
    public int getBaseHp(int level) {
        return grow(baseHp, hpPerLevel, level);
    }

    /**
     * Attack before attribute and equipment bonuses.
     */
    public int getBaseAttack(int level) {
        return grow(baseAttack, attackPerLevel, level);
    }

    private static int grow(int base, int perLevel, int level) {
        long value = base + (long) perLevel * (Math.max(1, level) - 1);
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    @Override
    public String toString() {
        return key + " (hp " + baseHp + "+" + hpPerLevel + "/lvl, atk " + baseAttack + "+" + attackPerLevel + "/lvl)";
    }
}
