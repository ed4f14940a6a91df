package com.example.mmocore;

import com.example.mmocore.ai.MonsterAiService;
import com.example.mmocore.ai.StateSyncService;
import com.example.mmocore.combat.CombatService;
import com.example.mmocore.combat.ExperienceService;
import com.example.mmocore.combat.LootTable;
import com.example.mmocore.combat.PlayerStatsService;
import com.example.mmocore.combat.StatCalculator;
import com.example.mmocore.event.SpawnManager;
import com.example.mmocore.lifecycle.DeathService;
import com.example.mmocore.lifecycle.PlayerLifecycleService;
import com.example.mmocore.persistence.ProfileWriter;
import com.example.mmocore.persistence.ServerConfig;
import com.example.mmocore.util.GameScheduler;
import com.example.mmocore.world.AreaOfInterest;
import com.example.mmocore.world.WorldDefinition;
import com.example.mmocore.world.WorldState;

import java.util.Random;

/**
 * The simulation core wired together: one world state and the services
 * that act on it, all driven by a single scheduler.
 */
public class GameServices {
    public final ServerConfig config;
    public final WorldDefinition definition;
    public final WorldState world;
    public final GameScheduler scheduler;
    public final AreaOfInterest aoi;
    public final StatCalculator stats;
    public final PlayerStatsService playerStats;
    public final ExperienceService experience;
    public final LootTable loot;
    public final SpawnManager spawns;
    public final DeathService deaths;
    public final CombatService combat;
    public final PlayerLifecycleService lifecycle;
    public final MonsterAiService monsterAi;
    public final StateSyncService sync;
    public final ProfileWriter profiles;

    public GameServices(ServerConfig config, WorldDefinition definition, GameScheduler scheduler,
                        ProfileWriter profiles, Random random) {
        this.config = config;
        this.definition = definition;
        this.scheduler = scheduler;
        this.profiles = profiles;
        this.world = new WorldState();
        this.aoi = new AreaOfInterest(world, config.getAoiRadius());
        this.stats = new StatCalculator(definition);
        this.playerStats = new PlayerStatsService(stats, aoi);
        this.experience = new ExperienceService(stats, aoi, config.getStatPointsPerLevel(), config.getMaxLevel());
        this.loot = new LootTable(random, config.getBcoinsMin(), config.getBcoinsMax(), config.getBcoinsDropChance());
        this.spawns = new SpawnManager(world, definition, aoi, scheduler, random, config.getMonsterRespawnDelayMs());
        this.deaths = new DeathService(world, definition, aoi, spawns, stats, scheduler,
                config.getDefaultTown(), config.getReviveDelayMs());
        this.combat = new CombatService(world, definition, aoi, experience, loot, spawns, deaths, scheduler, random,
                config.isTrustClientDamage(), config.getPvpCooldownMs(), config.getCritChancePerLuck());
        this.lifecycle = new PlayerLifecycleService(world, definition, aoi, spawns, stats, profiles,
                config.getInitialStatPoints(), config.getMaxLevel());
        this.monsterAi = new MonsterAiService(world, aoi, combat, scheduler, random, config);
        this.sync = new StateSyncService(world, aoi, scheduler,
                config.getPlayerSyncIntervalMs(), config.getMonsterSyncIntervalMs());
    }

    /**
     * Register the periodic ticks (monster AI, player sync, monster sync).
     */
    public void start() {
        monsterAi.initialize();
        sync.initialize();
    }
}
