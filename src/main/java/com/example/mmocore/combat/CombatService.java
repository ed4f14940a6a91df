package com.example.mmocore.combat;

import com.example.mmocore.event.SpawnManager;
import com.example.mmocore.lifecycle.DeathService;
import com.example.mmocore.model.Attribute;
import com.example.mmocore.model.Drop;
import com.example.mmocore.model.GameMap;
import com.example.mmocore.model.Monster;
import com.example.mmocore.model.MonsterTemplate;
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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Combat resolution for every damage path.
 *
 * All damage to a player goes through {@link #damagePlayer(Player, int, String)}:
 * <ol>
 *   <li>HP is reduced and clamped to [0, maxHp]</li>
 *   <li>{@code player:hpChanged} goes to the victim</li>
 *   <li>{@code player:damaged} goes to the victim's area of interest</li>
 *   <li>at 0 HP the death transition runs, once</li>
 * </ol>
 *
 * Damage to monsters comes from {@code monster:hit} reports. By default the
 * client-reported number is used as-is; with {@code combat.trustClientDamage}
 * off the attacker's own attack stat is used instead.
 */
public class CombatService {
    private static final Logger logger = LoggerFactory.getLogger(CombatService.class);

    private final WorldState world;
    private final WorldDefinition definition;
    private final AreaOfInterest aoi;
    private final ExperienceService experience;
    private final LootTable loot;
    private final SpawnManager spawns;
    private final DeathService deaths;
    private final GameScheduler scheduler;
    private final Random random;

    private final boolean trustClientDamage;
    private final long pvpCooldownMs;
    private final double critChancePerLuck;

    public CombatService(WorldState world, WorldDefinition definition, AreaOfInterest aoi,
                         ExperienceService experience, LootTable loot, SpawnManager spawns,
                         DeathService deaths, GameScheduler scheduler, Random random,
                         boolean trustClientDamage, long pvpCooldownMs, double critChancePerLuck) {
        this.world = world;
        this.definition = definition;
        this.aoi = aoi;
        this.experience = experience;
        this.loot = loot;
        this.spawns = spawns;
        this.deaths = deaths;
        this.scheduler = scheduler;
        this.random = random;
        this.trustClientDamage = trustClientDamage;
        this.pvpCooldownMs = pvpCooldownMs;
        this.critChancePerLuck = critChancePerLuck;
    }

    // ===== damage to players =====

    /**
     * Apply damage to a player and notify the victim and its surroundings.
     *
     * @param victim the player taking damage; dead players are ignored
     * @param damage raw damage, negative values count as 0
     * @param attackerId id of the monster or player dealing it (may be null)
     * @return the victim's HP afterwards, or -1 if the victim was already dead
     */
    public int damagePlayer(Player victim, int damage, String attackerId) {
        if (victim == null || victim.isDead()) return -1;
        int dealt = Math.max(0, damage);
        int hp = victim.takeDamage(dealt);

        aoi.sendTo(victim, OutboundMessage.builder(EventType.PLAYER_HP_CHANGED)
                .put("hp", hp)
                .put("maxHp", victim.getMaxHp())
                .put("damage", dealt)
                .put("attacker", attackerId)
                .build());
        aoi.broadcastToAOI(victim.getId(), victim.getX(), victim.getY(), victim.getMapId(),
                OutboundMessage.builder(EventType.PLAYER_DAMAGED)
                        .put("email", victim.getId())
                        .put("damage", dealt)
                        .put("attacker", attackerId)
                        .build());

        if (hp <= 0) {
            deaths.onDeath(victim);
        }
        return hp;
    }

    /**
     * A monster's melee hit: flat damage equal to the monster's attack.
     */
    public int monsterAttackPlayer(Monster monster, Player target) {
        if (target == null || target.isDead()) return -1;
        return damagePlayer(target, monster.getAttack(), monster.getId());
    }

    /**
     * Damage reported by a client against one of its own players, attributed
     * to {@code attackerId}. Damage attributed to another player is denied
     * outside PvP maps.
     *
     * @return the victim's HP afterwards, or -1 if nothing was applied
     */
    public int clientReportedHit(Player victim, int damage, String attackerId) {
        if (victim == null || victim.isDead()) return -1;
        Player attacker = world.getPlayer(attackerId);
        GameMap map = definition.getMap(victim.getMapId());
        if (attacker != null && (map == null || !map.isPvp())) {
            aoi.sendTo(victim, Messages.error(EventType.PLAYER_HIT_DENIED,
                    "You cannot attack other players outside the PvP arena."));
            return -1;
        }
        return damagePlayer(victim, damage, attackerId);
    }

    // ===== damage to monsters =====

    /**
     * Resolve a player's hit on a monster.
     *
     * The hit is dropped silently unless the player is alive and the monster
     * exists, is alive and is on the player's map. A killing blow despawns
     * the monster, rewards the last player to hit it and schedules the respawn.
     *
     * @param player the attacking player
     * @param monsterId target monster
     * @param reportedDamage damage claimed by the client
     * @return the monster's HP afterwards, or -1 if the hit was dropped
     */
    public int hitMonster(Player player, String monsterId, int reportedDamage) {
        if (player == null || player.isDead()) return -1;
        Monster monster = world.getMonster(monsterId);
        if (monster == null || !monster.isAlive() || !monster.getMapId().equals(player.getMapId())) {
            return -1;
        }

        int damage = trustClientDamage
                ? Math.max(0, reportedDamage)
                : (int) Math.round(player.getAttack());
        int hp = monster.takeDamage(damage, player.getId());

        aoi.broadcastToMap(monster.getMapId(), OutboundMessage.builder(EventType.MONSTER_HIT)
                .put("id", monster.getId())
                .put("mapId", monster.getMapId())
                .put("hp", hp)
                .put("damage", damage)
                .build());

        if (hp <= 0) {
            onMonsterKilled(monster);
        }
        return hp;
    }

    private void onMonsterKilled(Monster monster) {
        aoi.broadcastToMap(monster.getMapId(), OutboundMessage.builder(EventType.MONSTER_DESPAWN)
                .put("id", monster.getId())
                .put("mapId", monster.getMapId())
                .build());

        Player killer = world.getPlayer(monster.getLastHitBy());
        MonsterTemplate template = definition.getMonsterTemplate(monster.getType());
        if (killer != null && template != null) {
            reward(killer, monster, template);
        }
        spawns.scheduleRespawn(monster);
    }

    private void reward(Player killer, Monster monster, MonsterTemplate template) {
        experience.giveXp(killer, template.getExperienceValue());

        int bcoins = loot.rollBcoins();
        String item = loot.rollItem(template);
        killer.addBcoins(bcoins);
        killer.addToInventory(item);

        Drop drop = loot.createDrop(monster, bcoins, item);
        world.addDrop(drop);
        aoi.broadcastToMap(monster.getMapId(), OutboundMessage.builder(EventType.DROP_SPAWN)
                .put("id", drop.getId())
                .put("mapId", drop.getMapId())
                .put("x", drop.getX())
                .put("y", drop.getY())
                .put("type", drop.getKind().getKey())
                .put("amount", drop.getAmount())
                .put("itemName", drop.getItemName())
                .build());

        Map<String, Object> lootView = null;
        if (item != null) {
            lootView = new LinkedHashMap<>();
            lootView.put("id", item);
            lootView.put("name", item);
        }
        aoi.sendTo(killer, OutboundMessage.builder(EventType.MONSTER_KILLED)
                .put("monsterId", monster.getId())
                .put("xp", template.getExperienceValue())
                .put("currentXp", killer.getXp())
                .put("level", killer.getLevel())
                .put("bcoins", bcoins)
                .put("loot", lootView)
                .build());
        logger.debug("[combat] {} killed {} (+{}xp, {} bcoins, {})",
                killer.getId(), monster.getId(), template.getExperienceValue(), bcoins, item);
    }

    // ===== player versus player =====

    /**
     * Resolve a PvP attack. Rejections change nothing and send nothing.
     *
     * Accepted attacks deal {@code round(attack * (crit ? 2 : 1))} where the
     * critical chance is {@code LUCK * critChancePerLuck}, send
     * {@code player:attackResult} to the attacker and {@code player:pvpHit}
     * to the attacker's area of interest, on top of the normal damage events.
     */
    public PvpResult pvpAttack(Player attacker, String targetId) {
        GameMap map = definition.getMap(attacker.getMapId());
        if (map == null || !map.isPvp()) {
            return PvpResult.rejected(PvpResult.ResultType.NOT_PVP_MAP);
        }
        if (attacker.isDead()) {
            return PvpResult.rejected(PvpResult.ResultType.ATTACKER_DEAD);
        }
        Player target = world.getPlayer(targetId);
        if (target == null || target == attacker || !target.isOnline()
                || !attacker.getMapId().equals(target.getMapId())) {
            return PvpResult.rejected(PvpResult.ResultType.INVALID_TARGET);
        }
        if (target.isDead()) {
            return PvpResult.rejected(PvpResult.ResultType.TARGET_DEAD);
        }
        long now = scheduler.now();
        if (!attacker.isPvpAttackReady(now, pvpCooldownMs)) {
            return PvpResult.rejected(PvpResult.ResultType.ON_COOLDOWN);
        }
        attacker.markPvpAttack(now);

        double critChance = attacker.getAttribute(Attribute.LUCK) * critChancePerLuck;
        boolean crit = random.nextDouble() < critChance;
        int damage = (int) Math.round(attacker.getAttack() * (crit ? 2 : 1));

        int targetHp = damagePlayer(target, damage, attacker.getId());

        aoi.sendTo(attacker, OutboundMessage.builder(EventType.PLAYER_ATTACK_RESULT)
                .put("target", target.getId())
                .put("damage", damage)
                .put("targetHp", targetHp)
                .put("critical", crit)
                .build());
        aoi.broadcastToAOI(attacker.getId(), attacker.getX(), attacker.getY(), attacker.getMapId(),
                OutboundMessage.builder(EventType.PLAYER_PVP_HIT)
                        .put("attacker", attacker.getId())
                        .put("target", target.getId())
                        .put("damage", damage)
                        .build());

        return crit ? PvpResult.criticalHit(damage, targetHp) : PvpResult.hit(damage, targetHp);
    }
}
