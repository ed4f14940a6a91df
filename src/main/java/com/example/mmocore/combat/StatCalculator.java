package com.example.mmocore.combat;

import com.example.mmocore.model.Attribute;
import com.example.mmocore.model.CharacterClass;
import com.example.mmocore.model.DerivedStats;
import com.example.mmocore.model.HpPolicy;
import com.example.mmocore.model.Player;
import com.example.mmocore.world.WorldDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stat pipeline: class base stats, then attribute bonuses, then equipment.
 *
 * Base:      maxHp  = baseHp + hpPerLevel * (level - 1)
 *            attack = baseAttack + attackPerLevel * (level - 1)
 * Derived:   maxHp  += 10 * (VIT - 1)
 *            attack += 2 * (STR - 1)
 *            speed   = 1 + 0.1 * (AGI - 1)
 * Equipment: every numeric bonus of every equipped item is summed and added
 *            to the derived stat of the same name; other keys become extra stats.
 *
 * This is the only code path that writes a player's maxHp, attack and speed.
 */
public class StatCalculator {

    public static final String STAT_MAX_HP = "maxHp";
    public static final String STAT_ATTACK = "attack";
    public static final String STAT_SPEED = "speed";

    /** Max HP gained per VIT point above 1 */
    public static final int HP_PER_VIT = 10;

    /** Attack gained per STR point above 1 */
    public static final int ATTACK_PER_STR = 2;

    /** Speed multiplier gained per AGI point above 1 */
    public static final double SPEED_PER_AGI = 0.1;

    private final WorldDefinition definition;

    public StatCalculator(WorldDefinition definition) {
        this.definition = definition;
    }

    /**
     * Base stats for a class and level. Unknown classes use the default class.
     *
     * @param classKey the player's class tag
     * @param level the player's level (values below 1 count as 1)
     * @return stats with speed 1.0 and no extras
     */
    public DerivedStats base(String classKey, int level) {
        CharacterClass cls = definition.getCharacterClass(classKey);
        return new DerivedStats(cls.getBaseHp(level), cls.getBaseAttack(level), 1.0, Map.of());
    }

    /**
     * Base stats plus attribute bonuses, without equipment.
     */
    public DerivedStats derived(Player player) {
        DerivedStats base = base(player.getClassKey(), player.getLevel());
        int vit = player.getAttribute(Attribute.VIT);
        int str = player.getAttribute(Attribute.STR);
        int agi = player.getAttribute(Attribute.AGI);
        return new DerivedStats(
                base.maxHp() + HP_PER_VIT * (vit - 1),
                base.attack() + ATTACK_PER_STR * (str - 1),
                1.0 + SPEED_PER_AGI * (agi - 1),
                Map.of());
    }

    /**
     * Full pipeline: derived stats with every equipment bonus applied.
     *
     * @param player the player whose class, level, attributes and equipment are read
     * @return the final stats; not yet installed on the player
     */
    public DerivedStats calculate(Player player) {
        DerivedStats derived = derived(player);

        Map<String, Double> totals = new LinkedHashMap<>();
        for (Map<String, Double> bonuses : player.getEquipment().values()) {
            for (Map.Entry<String, Double> e : bonuses.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                totals.merge(e.getKey(), e.getValue(), Double::sum);
            }
        }

        double maxHp = derived.maxHp() + totals.getOrDefault(STAT_MAX_HP, 0.0);
        double attack = derived.attack() + totals.getOrDefault(STAT_ATTACK, 0.0);
        double speed = derived.speed() + totals.getOrDefault(STAT_SPEED, 0.0);

        Map<String, Double> extra = new LinkedHashMap<>(totals);
        extra.remove(STAT_MAX_HP);
        extra.remove(STAT_ATTACK);
        extra.remove(STAT_SPEED);

        return new DerivedStats((int) Math.round(maxHp), attack, speed, extra);
    }

    /**
     * Recompute and install the player's stats, reconciling current HP with the policy.
     */
    public DerivedStats apply(Player player, HpPolicy policy) {
        DerivedStats stats = calculate(player);
        player.applyStats(stats, policy);
        return stats;
    }
}
