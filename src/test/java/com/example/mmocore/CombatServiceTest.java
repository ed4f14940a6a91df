package com.example.mmocore;

import com.example.mmocore.combat.PvpResult;
import com.example.mmocore.event.SpawnManager;
import com.example.mmocore.model.Attribute;
import com.example.mmocore.model.Drop;
import com.example.mmocore.model.Monster;
import com.example.mmocore.model.Player;
import com.example.mmocore.net.EventType;
import com.example.mmocore.net.OutboundMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CombatService Tests")
class CombatServiceTest {

    private static final String PORING = "monster_field_1_poring_1";

    private GameFixture game;

    @BeforeEach
    void setUp() {
        game = new GameFixture();
    }

    private void hit(GameFixture.Client client, String monsterId, int damage) {
        client.send("monster:hit", GameFixture.payload("monsterId", monsterId, "damage", damage));
    }

    // ==================== Monster Kill Tests ====================

    @Test
    @DisplayName("Two 30-damage hits kill a poring and pay out XP, bcoins and loot")
    void killPoring() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        a.connection.clear();
        game.random.queueInts(3, 0).queueDoubles(0.5);   // bcoins 10+3, item index 0, drop shows bcoins

        hit(a, PORING, 30);
        Monster poring = game.services.world.getMonster(PORING);
        assertEquals(20, poring.getHp());

        hit(a, PORING, 30);
        assertEquals(0, poring.getHp());
        assertFalse(poring.isAlive());

        assertEquals(2, a.connection.count(EventType.MONSTER_HIT));
        assertEquals(1, a.connection.count(EventType.MONSTER_DESPAWN));

        OutboundMessage killed = a.connection.last(EventType.MONSTER_KILLED);
        assertNotNull(killed);
        assertEquals(PORING, killed.get("monsterId"));
        assertEquals(5, killed.get("xp"));
        assertEquals(5, killed.get("currentXp"));
        assertEquals(1, killed.get("level"));
        assertEquals(13, killed.get("bcoins"));
        assertEquals(Map.of("id", "potion", "name", "potion"), killed.get("loot"));

        Player p = a.player();
        assertEquals(5, p.getXp());
        assertEquals(13, p.getBcoins());
        assertEquals(List.of("potion"), p.getInventory());

        List<Drop> drops = game.services.world.dropsInMap("monster_field_1");
        assertEquals(1, drops.size());
        assertEquals(Drop.Kind.BCOINS, drops.get(0).getKind());
        assertEquals(13, drops.get(0).getAmount());
        OutboundMessage dropSpawn = a.connection.last(EventType.DROP_SPAWN);
        assertEquals(drops.get(0).getId(), dropSpawn.get("id"));
        assertEquals("bcoins", dropSpawn.get("type"));
    }

    @Test
    @DisplayName("Drop shows the item when the bcoins roll misses")
    void itemDrop() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        game.random.queueInts(0, 0).queueDoubles(0.9);

        hit(a, PORING, 50);

        Drop drop = game.services.world.dropsInMap("monster_field_1").get(0);
        assertEquals(Drop.Kind.ITEM, drop.getKind());
        assertEquals("potion", drop.getItemName());
        assertTrue(drop.getId().startsWith("drop_monster_field_1_"));
    }

    @Test
    @DisplayName("Killed monster respawns at its origin after 5 seconds")
    void respawnAfterDelay() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        Monster poring = game.services.world.getMonster(PORING);
        double spawnX = poring.getSpawnX();
        double spawnY = poring.getSpawnY();

        hit(a, PORING, 100);
        assertTrue(game.scheduler.isScheduled(SpawnManager.respawnKey(PORING)));
        a.connection.clear();

        game.scheduler.advance(4999);
        assertFalse(poring.isAlive());
        assertEquals(0, a.connection.count(EventType.MONSTER_SPAWN));

        game.scheduler.advance(1);
        assertTrue(poring.isAlive());
        assertEquals(poring.getMaxHp(), poring.getHp());
        assertEquals(spawnX, poring.getX(), 0.0001);
        assertEquals(spawnY, poring.getY(), 0.0001);
        assertNull(poring.getLastHitBy());
        assertEquals(PORING, a.connection.last(EventType.MONSTER_SPAWN).get("id"));
    }

    @Test
    @DisplayName("Respawn is cancelled when the map empties first")
    void respawnCancelledByCleanup() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        hit(a, PORING, 100);

        a.send("player:changeMap", GameFixture.payload("map", "town_1"));
        assertFalse(game.scheduler.isScheduled(SpawnManager.respawnKey(PORING)));
        assertNull(game.services.world.getMonster(PORING));
        assertTrue(game.services.world.dropsInMap("monster_field_1").isEmpty());

        game.scheduler.advance(10_000);
        assertEquals(0, game.services.world.monsterCount("monster_field_1"));
    }

    @Test
    @DisplayName("Hits on dead, unknown or other-map monsters are ignored")
    void invalidMonsterHitsIgnored() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        GameFixture.Client b = game.join("b@test", "town_1", 1200, 900);

        hit(a, PORING, 100);
        a.connection.clear();
        hit(a, PORING, 10);
        hit(a, "no_such_monster", 10);
        assertEquals(0, a.connection.count(EventType.MONSTER_HIT));

        Monster other = game.services.world.getMonster("monster_field_1_poring_2");
        assertEquals(-1, game.services.combat.hitMonster(b.player(), other.getId(), 10));
        assertEquals(other.getMaxHp(), other.getHp());
    }

    @Test
    @DisplayName("Last hitter gets the kill")
    void lastHitterRewarded() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);
        GameFixture.Client b = game.join("b@test", "monster_field_1", 410, 400);

        hit(a, PORING, 40);
        hit(b, PORING, 40);

        assertEquals(0, a.player().getXp());
        assertEquals(5, b.player().getXp());
        assertNotNull(b.connection.last(EventType.MONSTER_KILLED));
        assertNull(a.connection.last(EventType.MONSTER_KILLED));
    }

    @Test
    @DisplayName("Untrusted client damage uses the attacker's attack stat")
    void untrustedDamage() {
        game = new GameFixture(Map.of("combat", Map.of("trustClientDamage", false)));
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);

        hit(a, PORING, 9999);
        assertEquals(50 - 15, game.services.world.getMonster(PORING).getHp());
        assertEquals(15, a.connection.last(EventType.MONSTER_HIT).get("damage"));
    }

    // ==================== Player Damage Tests ====================

    @Test
    @DisplayName("Damage notifies the victim and its surroundings")
    void damageNotifications() {
        GameFixture.Client a = game.join("a@test", "town_1", 1200, 900);
        GameFixture.Client b = game.join("b@test", "town_1", 1250, 900);
        a.connection.clear();
        b.connection.clear();

        int hp = game.services.combat.damagePlayer(a.player(), 20, "monster_x");

        assertEquals(100, hp);
        OutboundMessage changed = a.connection.last(EventType.PLAYER_HP_CHANGED);
        assertEquals(100, changed.get("hp"));
        assertEquals(120, changed.get("maxHp"));
        assertEquals("monster_x", changed.get("attacker"));
        assertEquals("a@test", b.connection.last(EventType.PLAYER_DAMAGED).get("email"));
        assertEquals(0, a.connection.count(EventType.PLAYER_DAMAGED));
    }

    @Test
    @DisplayName("Damage to a dead player is ignored")
    void deadPlayerIgnoresDamage() {
        Player a = game.join("a@test", "town_1", 1200, 900).player();
        game.services.combat.damagePlayer(a, 500, "m");
        assertEquals(-1, game.services.combat.damagePlayer(a, 10, "m"));
    }

    @Test
    @DisplayName("Client-reported hit from another player is denied outside PvP")
    void hitFromPlayerDenied() {
        GameFixture.Client a = game.join("a@test", "town_1", 1200, 900);
        game.join("b@test", "town_1", 1210, 900);

        a.send("player:hit", GameFixture.payload("damage", 30, "attackerEmail", "b@test"));

        assertEquals(120, a.player().getHp());
        assertNotNull(a.connection.last(EventType.PLAYER_HIT_DENIED));
    }

    @Test
    @DisplayName("Client-reported hit from a monster is applied")
    void hitFromMonsterApplied() {
        GameFixture.Client a = game.join("a@test", "monster_field_1", 400, 400);

        a.send("player:hit", GameFixture.payload("damage", 30, "attackerEmail", PORING));

        assertEquals(90, a.player().getHp());
        assertEquals(0, a.connection.count(EventType.PLAYER_HIT_DENIED));
    }

    // ==================== PvP Tests ====================

    private GameFixture.Client[] arenaPair() {
        GameFixture.Client a = game.join("a@test", "pvp_arena", 500, 500, 10);
        GameFixture.Client b = game.join("b@test", "pvp_arena", 520, 500, 10);
        a.connection.clear();
        b.connection.clear();
        return new GameFixture.Client[] {a, b};
    }

    @Test
    @DisplayName("Accepted PvP attack deals the attack stat and notifies both sides")
    void pvpHit() {
        GameFixture.Client[] pair = arenaPair();
        Player a = pair[0].player();
        Player b = pair[1].player();

        PvpResult result = game.services.combat.pvpAttack(a, "b@test");

        assertEquals(PvpResult.ResultType.HIT, result.getType());
        assertEquals(51, result.getDamage());
        assertEquals(345 - 51, b.getHp());
        assertEquals(b.getHp(), result.getTargetHp());

        OutboundMessage attackResult = pair[0].connection.last(EventType.PLAYER_ATTACK_RESULT);
        assertEquals("b@test", attackResult.get("target"));
        assertEquals(51, attackResult.get("damage"));
        assertEquals(false, attackResult.get("critical"));
        assertNotNull(pair[1].connection.last(EventType.PLAYER_PVP_HIT));
        assertNotNull(pair[1].connection.last(EventType.PLAYER_HP_CHANGED));
    }

    @Test
    @DisplayName("Critical PvP hit doubles the damage")
    void pvpCritical() {
        GameFixture.Client[] pair = arenaPair();
        game.random.queueDoubles(0.01);   // LUCK 1 gives a 5% chance

        PvpResult result = game.services.combat.pvpAttack(pair[0].player(), "b@test");

        assertTrue(result.isCritical());
        assertEquals(102, result.getDamage());
        assertEquals(true, pair[0].connection.last(EventType.PLAYER_ATTACK_RESULT).get("critical"));
    }

    @Test
    @DisplayName("Crit chance grows with LUCK")
    void luckRaisesCritChance() {
        GameFixture.Client[] pair = arenaPair();
        Player a = pair[0].player();
        a.grantStatPoints(10);
        a.allocate(Attribute.LUCK, 5);       // LUCK 6 gives 30%
        game.random.queueDoubles(0.29);

        assertTrue(game.services.combat.pvpAttack(a, "b@test").isCritical());
    }

    @Test
    @DisplayName("Second attack inside the cooldown is rejected")
    void pvpCooldown() {
        GameFixture.Client[] pair = arenaPair();
        Player a = pair[0].player();
        Player b = pair[1].player();

        assertTrue(game.services.combat.pvpAttack(a, "b@test").isAccepted());
        int hpAfterFirst = b.getHp();
        pair[1].connection.clear();

        game.scheduler.advance(999);
        PvpResult second = game.services.combat.pvpAttack(a, "b@test");
        assertEquals(PvpResult.ResultType.ON_COOLDOWN, second.getType());
        assertEquals(hpAfterFirst, b.getHp());
        assertEquals(0, pair[1].connection.all().size());

        game.scheduler.advance(1);
        assertTrue(game.services.combat.pvpAttack(a, "b@test").isAccepted());
    }

    @Test
    @DisplayName("Rejected attacks do not start the cooldown")
    void rejectionKeepsCooldown() {
        GameFixture.Client[] pair = arenaPair();
        Player a = pair[0].player();

        assertEquals(PvpResult.ResultType.INVALID_TARGET, game.services.combat.pvpAttack(a, "a@test").getType());
        assertTrue(game.services.combat.pvpAttack(a, "b@test").isAccepted());
    }

    @Test
    @DisplayName("PvP outside an arena is rejected")
    void pvpOutsideArena() {
        GameFixture.Client a = game.join("a@test", "town_1", 1200, 900);
        GameFixture.Client b = game.join("b@test", "town_1", 1210, 900);
        b.connection.clear();

        PvpResult result = game.services.combat.pvpAttack(a.player(), "b@test");

        assertEquals(PvpResult.ResultType.NOT_PVP_MAP, result.getType());
        assertEquals(-1, result.getTargetHp());
        assertEquals(120, b.player().getHp());
        assertTrue(b.connection.all().isEmpty());
    }

    @Test
    @DisplayName("Unknown, offline and dead targets are rejected")
    void pvpTargetChecks() {
        GameFixture.Client[] pair = arenaPair();
        Player a = pair[0].player();
        Player b = pair[1].player();

        assertEquals(PvpResult.ResultType.INVALID_TARGET, game.services.combat.pvpAttack(a, "nobody@test").getType());

        game.services.combat.damagePlayer(b, 10_000, "x");
        assertEquals(PvpResult.ResultType.TARGET_DEAD, game.services.combat.pvpAttack(a, "b@test").getType());

        GameFixture.Client c = game.join("c@test", "pvp_arena", 530, 500, 10);
        c.disconnect();
        assertEquals(PvpResult.ResultType.INVALID_TARGET, game.services.combat.pvpAttack(a, "c@test").getType());
    }

    @Test
    @DisplayName("Dead attacker cannot attack")
    void pvpDeadAttacker() {
        GameFixture.Client[] pair = arenaPair();
        Player a = pair[0].player();
        game.services.combat.damagePlayer(a, 10_000, "x");

        assertEquals(PvpResult.ResultType.ATTACKER_DEAD, game.services.combat.pvpAttack(a, "b@test").getType());
    }

    @Test
    @DisplayName("pvp:attack event routes through the combat handler")
    void pvpAttackEvent() {
        GameFixture.Client[] pair = arenaPair();
        pair[0].send("player:pvpAttack", GameFixture.payload("targetEmail", "b@test"));
        assertEquals(345 - 51, pair[1].player().getHp());
    }
}
