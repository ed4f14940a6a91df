package com.example.mmocore.combat;

import com.example.mmocore.model.Attribute;
import com.example.mmocore.model.EquipmentSlot;
import com.example.mmocore.model.HpPolicy;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.EventType;
import com.example.mmocore.net.Messages;
import com.example.mmocore.world.AreaOfInterest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Operations that change the inputs of the stat pipeline. Each successful
 * change recomputes stats (HP ratio preserved) and sends
 * {@code player:statsUpdated} to the owner.
 */
public class PlayerStatsService {
    private static final Logger logger = LoggerFactory.getLogger(PlayerStatsService.class);

    private final StatCalculator calculator;
    private final AreaOfInterest aoi;

    public PlayerStatsService(StatCalculator calculator, AreaOfInterest aoi) {
        this.calculator = calculator;
        this.aoi = aoi;
    }

    /**
     * Spend unspent stat points on an attribute.
     * @return false (nothing changed, nothing sent) for an unknown attribute,
     *         non-positive points or an insufficient balance
     */
    public boolean allocate(Player player, Attribute attribute, int points) {
        if (!player.allocate(attribute, points)) {
            logger.debug("[stats] {} rejected allocation of {} to {}", player.getId(), points, attribute);
            return false;
        }
        refresh(player);
        return true;
    }

    public void equip(Player player, EquipmentSlot slot, Map<String, Double> bonuses) {
        if (slot == null) return;
        player.equip(slot, bonuses);
        refresh(player);
    }

    public boolean unequip(Player player, EquipmentSlot slot) {
        if (player.unequip(slot) == null) return false;
        refresh(player);
        return true;
    }

    private void refresh(Player player) {
        calculator.apply(player, HpPolicy.PRESERVE_RATIO);
        aoi.sendTo(player, Messages.stats(EventType.PLAYER_STATS_UPDATED, player));
    }
}
