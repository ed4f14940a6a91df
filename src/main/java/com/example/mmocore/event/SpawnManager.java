package com.example.mmocore.event;

import com.example.mmocore.model.Monster;
import com.example.mmocore.model.MonsterTemplate;
import com.example.mmocore.net.Messages;
import com.example.mmocore.util.GameScheduler;
import com.example.mmocore.world.AreaOfInterest;
import com.example.mmocore.world.WorldDefinition;
import com.example.mmocore.world.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-map monster population.
 *
 * A map's monsters are a cache: they are created when the map gains an
 * occupant and discarded, with the map's drops, as soon as it empties.
 * Killed monsters stay in place at 0 HP until their respawn timer resets them.
 */
public class SpawnManager {
    private static final Logger logger = LoggerFactory.getLogger(SpawnManager.class);

    private static final String RESPAWN_KEY_PREFIX = "respawn:";

    private final WorldState world;
    private final WorldDefinition definition;
    private final AreaOfInterest aoi;
    private final GameScheduler scheduler;
    private final Random random;
    private final long respawnDelayMs;
    private final AtomicLong sequence = new AtomicLong();

    public SpawnManager(WorldState world, WorldDefinition definition, AreaOfInterest aoi,
                        GameScheduler scheduler, Random random, long respawnDelayMs) {
        this.world = world;
        this.definition = definition;
        this.aoi = aoi;
        this.scheduler = scheduler;
        this.random = random;
        this.respawnDelayMs = respawnDelayMs;
    }

    public static String respawnKey(String monsterId) {
        return RESPAWN_KEY_PREFIX + monsterId;
    }

    /**
     * Top the map's population up to its configured count. Each new monster is
     * announced map-wide with {@code monster:spawn}. Maps without a spawn
     * configuration are left alone.
     *
     * @return number of monsters created
     */
    public int ensureMonsters(String mapId) {
        SpawnConfig config = definition.getSpawnConfig(mapId);
        if (config == null || config.types.isEmpty()) return 0;

        int created = 0;
        long now = scheduler.now();
        for (int i = world.monsterCount(mapId); i < config.count; i++) {
            String type = config.types.get(random.nextInt(config.types.size()));
            MonsterTemplate template = definition.getMonsterTemplate(type);
            double x = config.minX + random.nextDouble() * (config.maxX - config.minX);
            double y = config.minY + random.nextDouble() * (config.maxY - config.minY);
            String id = mapId + "_" + type + "_" + sequence.incrementAndGet();

            Monster monster = new Monster(id, template, mapId, x, y, now);
            world.upsertMonster(monster);
            aoi.broadcastToMap(mapId, Messages.monsterSpawn(monster));
            created++;
        }
        if (created > 0) {
            logger.info("[spawn] map {} populated ({}/{})", mapId, world.monsterCount(mapId), config.count);
        }
        return created;
    }

    /**
     * Discard the map's monsters and drops if no player is left in it.
     * Pending respawns of the discarded monsters are cancelled.
     *
     * @return true if the map was cleared
     */
    public boolean cleanupMapIfEmpty(String mapId) {
        if (mapId == null || world.mapHasPlayers(mapId)) return false;
        List<String> removed = world.removeMonstersInMap(mapId);
        for (String id : removed) {
            scheduler.cancel(respawnKey(id));
        }
        if (!removed.isEmpty()) {
            logger.info("[spawn] cleared {} monsters from empty map {}", removed.size(), mapId);
        }
        return true;
    }

    /**
     * Reset a killed monster at its spawn origin after the respawn delay.
     * Does nothing when the timer fires if the monster was discarded meanwhile.
     */
    public void scheduleRespawn(Monster monster) {
        String id = monster.getId();
        scheduler.schedule(respawnKey(id), () -> respawn(id), respawnDelayMs);
    }

    private void respawn(String monsterId) {
        Monster monster = world.getMonster(monsterId);
        if (monster == null) {
            logger.debug("[spawn] respawn of {} skipped, monster was removed", monsterId);
            return;
        }
        monster.respawn();
        monster.markUpdated(scheduler.now());
        aoi.broadcastToMap(monster.getMapId(), Messages.monsterSpawn(monster));
    }
}
