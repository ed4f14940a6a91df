package com.example.mmocore.ai;

import com.example.mmocore.model.Monster;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.Messages;
import com.example.mmocore.util.GameScheduler;
import com.example.mmocore.world.AreaOfInterest;
import com.example.mmocore.world.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic state replication: player positions to each player's area of
 * interest, and full monster state to maps that have players.
 */
public class StateSyncService {
    private static final Logger logger = LoggerFactory.getLogger(StateSyncService.class);

    private final WorldState world;
    private final AreaOfInterest aoi;
    private final GameScheduler scheduler;
    private final long playerSyncMs;
    private final long monsterSyncMs;

    public StateSyncService(WorldState world, AreaOfInterest aoi, GameScheduler scheduler,
                            long playerSyncMs, long monsterSyncMs) {
        this.world = world;
        this.aoi = aoi;
        this.scheduler = scheduler;
        this.playerSyncMs = playerSyncMs;
        this.monsterSyncMs = monsterSyncMs;
    }

    public void initialize() {
        scheduler.scheduleAtFixedRate("player-sync", this::syncPlayers, playerSyncMs, playerSyncMs);
        scheduler.scheduleAtFixedRate("monster-sync", this::syncMonsters, monsterSyncMs, monsterSyncMs);
        logger.info("[sync] players every {}ms, monsters every {}ms", playerSyncMs, monsterSyncMs);
    }

    /**
     * Send every online player's position, facing and state to the players around it.
     */
    public void syncPlayers() {
        long now = scheduler.now();
        for (Player p : world.allPlayers()) {
            if (!p.isOnline()) continue;
            aoi.broadcastToAOI(p.getId(), p.getX(), p.getY(), p.getMapId(), Messages.playerMoved(p, now));
        }
    }

    /**
     * Send the full state of every live monster to its map. Empty maps are skipped.
     */
    public void syncMonsters() {
        for (Monster m : world.allMonsters()) {
            if (!m.isAlive()) continue;
            if (!world.mapHasPlayers(m.getMapId())) continue;
            aoi.broadcastToMap(m.getMapId(), Messages.monsterUpdate(m));
        }
    }
}
