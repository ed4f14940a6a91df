package com.example.mmocore.ai;

import com.example.mmocore.combat.CombatService;
import com.example.mmocore.model.Direction;
import com.example.mmocore.model.Monster;
import com.example.mmocore.model.MonsterState;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.EventType;
import com.example.mmocore.net.Messages;
import com.example.mmocore.net.OutboundMessage;
import com.example.mmocore.persistence.ServerConfig;
import com.example.mmocore.util.GameScheduler;
import com.example.mmocore.world.AreaOfInterest;
import com.example.mmocore.world.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Monster AI state machine, run once per AI tick for every live monster on a
 * map that has at least one player.
 *
 * <pre>
 * idle      -> chasing    a living player is within aggro range
 * chasing   -> attacking  target within attack range and cooldown elapsed
 * attacking -> idle       attack recovery elapsed (monster still alive)
 * chasing/attacking -> idle   no target in aggro range
 * </pre>
 *
 * Idle monsters occasionally wander one short step in a random direction.
 */
public class MonsterAiService {
    private static final Logger logger = LoggerFactory.getLogger(MonsterAiService.class);

    private final WorldState world;
    private final AreaOfInterest aoi;
    private final CombatService combat;
    private final GameScheduler scheduler;
    private final Random random;

    private final long tickIntervalMs;
    private final long moveBroadcastMs;
    private final long attackRecoverMs;
    private final double wanderChance;
    private final long wanderMinGapMs;
    private final double wanderStep;

    public MonsterAiService(WorldState world, AreaOfInterest aoi, CombatService combat,
                            GameScheduler scheduler, Random random, ServerConfig config) {
        this.world = world;
        this.aoi = aoi;
        this.combat = combat;
        this.scheduler = scheduler;
        this.random = random;
        this.tickIntervalMs = config.getMonsterAiIntervalMs();
        this.moveBroadcastMs = config.getMonsterMoveBroadcastMs();
        this.attackRecoverMs = config.getMonsterAttackRecoverMs();
        this.wanderChance = config.getWanderChance();
        this.wanderMinGapMs = config.getWanderMinGapMs();
        this.wanderStep = config.getWanderStep();
    }

    /**
     * Register the AI tick.
     */
    public void initialize() {
        scheduler.scheduleAtFixedRate("monster-ai", this::tick, tickIntervalMs, tickIntervalMs);
        logger.info("[ai] monster AI running every {}ms", tickIntervalMs);
    }

    public static String idleKey(String monsterId) {
        return "monster-idle:" + monsterId;
    }

    public void tick() {
        long now = scheduler.now();
        for (Monster monster : world.allMonsters()) {
            if (!monster.isAlive()) continue;
            if (!world.mapHasPlayers(monster.getMapId())) continue;
            update(monster, now);
        }
    }

    void update(Monster monster, long now) {
        Player target = null;
        double closest = Double.POSITIVE_INFINITY;
        for (Player p : world.playersInMap(monster.getMapId())) {
            if (p.isDead()) continue;
            double dist = AreaOfInterest.distance(monster.getX(), monster.getY(), p.getX(), p.getY());
            if (dist <= monster.getAggroRange() && dist < closest) {
                closest = dist;
                target = p;
            }
        }

        if (target == null) {
            monster.setTargetId(null);
            monster.setState(MonsterState.IDLE);
            wander(monster, now);
            return;
        }

        monster.setTargetId(target.getId());
        if (closest > monster.getAttackRange()) {
            chase(monster, target, now);
        } else if (monster.canAttack(now)) {
            attack(monster, target, now);
        }
    }

    private void chase(Monster monster, Player target, long now) {
        double angle = Math.atan2(target.getY() - monster.getY(), target.getX() - monster.getX());
        monster.setPosition(
                monster.getX() + Math.cos(angle) * monster.getSpeed(),
                monster.getY() + Math.sin(angle) * monster.getSpeed());
        monster.setDirection(Direction.fromAngle(angle));
        monster.setState(MonsterState.CHASING);

        if (now - monster.getLastUpdateAt() >= moveBroadcastMs) {
            aoi.broadcastToMap(monster.getMapId(), Messages.monsterMove(monster));
            monster.markUpdated(now);
        }
    }

    private void attack(Monster monster, Player target, long now) {
        monster.setState(MonsterState.ATTACKING);
        monster.markAttack(now);

        aoi.broadcastToMap(monster.getMapId(), OutboundMessage.builder(EventType.MONSTER_ATTACK)
                .put("id", monster.getId())
                .put("mapId", monster.getMapId())
                .put("targetEmail", target.getId())
                .put("damage", monster.getAttack())
                .put("x", monster.getX())
                .put("y", monster.getY())
                .put("direction", monster.getDirection().getKey())
                .build());

        combat.monsterAttackPlayer(monster, target);

        String id = monster.getId();
        scheduler.schedule(idleKey(id), () -> {
            Monster m = world.getMonster(id);
            if (m != null && m.isAlive() && m.getState() == MonsterState.ATTACKING) {
                m.setState(MonsterState.IDLE);
            }
        }, attackRecoverMs);
    }

    private void wander(Monster monster, long now) {
        if (random.nextDouble() >= wanderChance) return;
        if (now - monster.getLastUpdateAt() <= wanderMinGapMs) return;

        double angle = random.nextDouble() * Math.PI * 2;
        monster.setPosition(
                monster.getX() + Math.cos(angle) * wanderStep,
                monster.getY() + Math.sin(angle) * wanderStep);
        aoi.broadcastToMap(monster.getMapId(), Messages.monsterMove(monster));
        monster.markUpdated(now);
    }
}
