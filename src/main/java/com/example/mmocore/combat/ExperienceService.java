package com.example.mmocore.combat;

import com.example.mmocore.model.HpPolicy;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.EventType;
import com.example.mmocore.net.Messages;
import com.example.mmocore.net.OutboundMessage;
import com.example.mmocore.world.AreaOfInterest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * XP awards and level progression.
 *
 * The threshold to leave level L is {@code L * 100}. A single award can carry
 * a player across several levels; each level consumes its own threshold.
 * Levelling stops at the configured cap.
 */
public class ExperienceService {
    private static final Logger logger = LoggerFactory.getLogger(ExperienceService.class);

    private final StatCalculator calculator;
    private final AreaOfInterest aoi;
    private final int statPointsPerLevel;
    private final int maxLevel;

    public ExperienceService(StatCalculator calculator, AreaOfInterest aoi, int statPointsPerLevel, int maxLevel) {
        this.calculator = calculator;
        this.aoi = aoi;
        this.statPointsPerLevel = statPointsPerLevel;
        this.maxLevel = maxLevel;
    }

    /**
     * Add XP and process every level-up it pays for.
     *
     * Each level-up recomputes stats with a full heal, grants stat points and
     * sends {@code player:levelUp}. A {@code player:xpUpdated} is always sent last.
     *
     * @param player the receiving player
     * @param amount XP to add; negative amounts are ignored
     * @return number of levels gained
     */
    public int giveXp(Player player, int amount) {
        player.addXp(amount);
        int gained = 0;
        while (player.consumeLevelUp(statPointsPerLevel, maxLevel)) {
            gained++;
            calculator.apply(player, HpPolicy.FULL_HEAL);
            aoi.sendTo(player, levelUp(player));
            logger.info("[xp] {} reached level {}", player.getId(), player.getLevel());
        }
        aoi.sendTo(player, Messages.xpUpdated(player));
        return gained;
    }

    private static OutboundMessage levelUp(Player p) {
        return OutboundMessage.builder(EventType.PLAYER_LEVEL_UP)
                .put("level", p.getLevel())
                .put("hp", p.getHp())
                .put("maxHp", p.getMaxHp())
                .put("attack", p.getAttack())
                .put("speed", p.getSpeed())
                .put("stats", p.getAttributeMap())
                .put("statPointsAvailable", p.getStatPoints())
                .build();
    }
}
