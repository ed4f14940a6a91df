package com.example.mmocore.lifecycle;

import com.example.mmocore.combat.StatCalculator;
import com.example.mmocore.event.SpawnManager;
import com.example.mmocore.model.GameMap;
import com.example.mmocore.model.HpPolicy;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.EventType;
import com.example.mmocore.net.Messages;
import com.example.mmocore.net.OutboundMessage;
import com.example.mmocore.util.GameScheduler;
import com.example.mmocore.world.AreaOfInterest;
import com.example.mmocore.world.WorldDefinition;
import com.example.mmocore.world.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Player death and revive.
 *
 * PvE death moves the player to the default town at once and revives them
 * there. PvP death keeps the player in the arena and revives them at its spawn.
 * Both revive after the same delay, through a timer keyed {@code revive:<id>}.
 */
public class DeathService {
    private static final Logger logger = LoggerFactory.getLogger(DeathService.class);

    private final WorldState world;
    private final WorldDefinition definition;
    private final AreaOfInterest aoi;
    private final SpawnManager spawns;
    private final StatCalculator calculator;
    private final GameScheduler scheduler;
    private final String defaultTown;
    private final long reviveDelayMs;

    public DeathService(WorldState world, WorldDefinition definition, AreaOfInterest aoi, SpawnManager spawns,
                        StatCalculator calculator, GameScheduler scheduler, String defaultTown, long reviveDelayMs) {
        if (definition.getMap(defaultTown) == null) {
            throw new IllegalStateException("Default town '" + defaultTown + "' is not a known map");
        }
        this.world = world;
        this.definition = definition;
        this.aoi = aoi;
        this.spawns = spawns;
        this.calculator = calculator;
        this.scheduler = scheduler;
        this.defaultTown = defaultTown;
        this.reviveDelayMs = reviveDelayMs;
    }

    public static String reviveKey(String playerId) {
        return "revive:" + playerId;
    }

    /**
     * Run the death transition matching the player's current map.
     * A player who is already dead is left alone.
     */
    public void onDeath(Player player) {
        if (player.isDead()) return;
        GameMap map = definition.getMap(player.getMapId());
        if (map != null && map.isPvp()) {
            handlePvpDeath(player, map);
        } else {
            handlePveDeath(player);
        }
    }

    void handlePveDeath(Player player) {
        if (player.isDead()) return;
        player.markDead();

        String oldMap = player.getMapId();
        GameMap town = definition.getMap(defaultTown);
        if (!town.getId().equals(oldMap)) {
            if (world.removePlayerFromMap(player)) {
                aoi.broadcastToMap(oldMap, Messages.playerLeft(player));
                spawns.cleanupMapIfEmpty(oldMap);
            }
        }
        player.setPosition(town.getSpawnX(), town.getSpawnY());
        world.addPlayerToMap(player, town.getId());

        aoi.sendTo(player, OutboundMessage.builder(EventType.PLAYER_DIED)
                .put("map", town.getId())
                .put("x", player.getX())
                .put("y", player.getY())
                .build());
        logger.info("[death] {} died on {}, sent to {}", player.getId(), oldMap, town.getId());

        String id = player.getId();
        scheduler.schedule(reviveKey(id), () -> revive(id, null), reviveDelayMs);
    }

    void handlePvpDeath(Player player, GameMap arena) {
        if (player.isDead()) return;
        player.markDead();
        logger.info("[death] {} fell in PvP on {}", player.getId(), arena.getId());

        String id = player.getId();
        scheduler.schedule(reviveKey(id), () -> revive(id, arena), reviveDelayMs);
    }

    /**
     * @param arena PvP map captured at death, or null for a PvE death
     */
    private void revive(String playerId, GameMap arena) {
        Player player = world.getPlayer(playerId);
        if (player == null || !player.isDead()) return;

        calculator.apply(player, HpPolicy.FULL_HEAL);
        player.markAlive();

        OutboundMessage.Builder revived = OutboundMessage.builder(EventType.PLAYER_REVIVED)
                .put("hp", player.getHp())
                .put("maxHp", player.getMaxHp())
                .put("attack", player.getAttack())
                .put("speed", player.getSpeed());
        if (arena != null && arena.getId().equals(player.getMapId())) {
            player.setPosition(arena.getSpawnX(), arena.getSpawnY());
            revived.put("x", player.getX()).put("y", player.getY());
        }
        aoi.sendTo(player, revived.build());
        logger.debug("[death] {} revived", playerId);
    }
}
